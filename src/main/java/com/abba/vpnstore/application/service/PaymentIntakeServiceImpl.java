package com.abba.vpnstore.application.service;

import com.abba.vpnstore.application.catalog.PlanCatalog;
import com.abba.vpnstore.application.dto.GatewayCompletion;
import com.abba.vpnstore.application.dto.InvoiceRequest;
import com.abba.vpnstore.application.dto.PurchaseResult;
import com.abba.vpnstore.application.dto.PurchaseSelection;
import com.abba.vpnstore.application.i18n.LocalizationProvider;
import com.abba.vpnstore.application.i18n.MessageKey;
import com.abba.vpnstore.domain.exception.InvalidSelectionException;
import com.abba.vpnstore.domain.exception.PaymentIntegrityException;
import com.abba.vpnstore.domain.model.CatalogEntry;
import com.abba.vpnstore.domain.model.PaymentMethod;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.EntitlementService;
import com.abba.vpnstore.domain.service.PaymentIntakeService;
import com.abba.vpnstore.infrastructure.config.BillingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentIntakeServiceImpl implements PaymentIntakeService {

    private final EntitlementService entitlementService;
    private final PlanCatalog planCatalog;
    private final LocalizationProvider localizationProvider;
    private final BillingProperties billingProperties;

    @Override
    public PurchaseResult completeDemoPayment(long userId, PurchaseSelection selection, PaymentMethod method) {
        if (method.isGateway()) {
            throw new InvalidSelectionException("Payment method " + method + " completes through the gateway");
        }
        return entitlementService.purchase(userId, selection, method);
    }

    @Override
    public InvoiceRequest prepareInvoice(User user, PurchaseSelection selection) {
        CatalogEntry plan = planCatalog.plan(selection.planIndex());
        BigDecimal price = planCatalog.price(selection.planIndex(), selection.durationDays());
        Map<String, Object> params = Map.of(
                "plan", plan.planName(),
                "duration", selection.durationDays(),
                "devices", plan.devices()
        );
        long amount = price.multiply(BigDecimal.valueOf(billingProperties.minorUnits())).longValueExact();
        return new InvoiceRequest(
                localizationProvider.text(user.getLanguage(), MessageKey.INVOICE_TITLE, params),
                localizationProvider.text(user.getLanguage(), MessageKey.INVOICE_DESCRIPTION, params),
                selection.toPayload(),
                billingProperties.gatewayCurrency(),
                amount
        );
    }

    /**
     * Always accepts. Business validation of the checkout belongs to the gateway.
     */
    @Override
    public boolean acknowledgePreCheckout(long userId, String payload) {
        log.info("Pre-checkout accepted userId={} payload={}", userId, payload);
        return true;
    }

    @Override
    public GatewayCompletion completeGatewayPayment(long userId, String payload, String currency,
                                                    String externalReference) {
        if (!StringUtils.hasText(externalReference)) {
            log.error("Paid invoice arrived without a charge id userId={} payload={}", userId, payload);
            throw new PaymentIntegrityException("Gateway completion for userId=" + userId + " has no payment reference");
        }
        PurchaseSelection selection;
        try {
            selection = PurchaseSelection.fromPayload(payload);
            planCatalog.price(selection.planIndex(), selection.durationDays());
        } catch (InvalidSelectionException e) {
            log.error("Paid invoice could not be matched to the catalog userId={} payload={} externalReference={}",
                    userId, payload, externalReference);
            throw e;
        }
        return entitlementService.purchaseWithPayment(userId, selection, PaymentMethod.STARS, currency, externalReference)
                .map(GatewayCompletion::recorded)
                .orElseGet(GatewayCompletion::alreadyRecorded);
    }
}
