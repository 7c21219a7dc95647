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
import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.domain.model.PaymentMethod;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.EntitlementService;
import com.abba.vpnstore.infrastructure.config.BillingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentIntakeServiceImplTest {

    @Mock
    private EntitlementService entitlementService;

    @Mock
    private LocalizationProvider localizationProvider;

    private final PlanCatalog planCatalog = new PlanCatalog();
    private PaymentIntakeServiceImpl intake;

    @BeforeEach
    void setUp() {
        intake = new PaymentIntakeServiceImpl(entitlementService, planCatalog, localizationProvider,
                new BillingProperties("XTR", "USD", 100, "0 0 3 * * *"));
    }

    @Test
    void demoPathDelegatesToPurchase() {
        PurchaseSelection selection = new PurchaseSelection(0, 30);
        PurchaseResult result = result(0, 30);
        when(entitlementService.purchase(1L, selection, PaymentMethod.CARD)).thenReturn(result);

        assertThat(intake.completeDemoPayment(1L, selection, PaymentMethod.CARD)).isSameAs(result);
    }

    @Test
    void demoPathRefusesGatewayMethod() {
        assertThatThrownBy(() -> intake.completeDemoPayment(1L, new PurchaseSelection(0, 30), PaymentMethod.STARS))
                .isInstanceOf(InvalidSelectionException.class);
        verifyNoInteractions(entitlementService);
    }

    @Test
    void invoiceCarriesPayloadAndMinorUnitAmount() {
        User user = new User();
        user.setLanguage(Language.RU);
        when(localizationProvider.text(eq(Language.RU), eq(MessageKey.INVOICE_TITLE), anyMap())).thenReturn("title");
        when(localizationProvider.text(eq(Language.RU), eq(MessageKey.INVOICE_DESCRIPTION), anyMap())).thenReturn("desc");

        InvoiceRequest invoice = intake.prepareInvoice(user, new PurchaseSelection(1, 365));

        assertThat(invoice).isEqualTo(new InvoiceRequest("title", "desc", "plan_1_dur_365", "XTR", 9000L));
    }

    @Test
    void preCheckoutIsAlwaysAccepted() {
        assertThat(intake.acknowledgePreCheckout(1L, "anything")).isTrue();
        assertThat(intake.acknowledgePreCheckout(1L, null)).isTrue();
    }

    @Test
    void gatewayCompletionRecordsPurchase() {
        PurchaseResult result = result(2, 180);
        when(entitlementService.purchaseWithPayment(1L, new PurchaseSelection(2, 180), PaymentMethod.STARS, "XTR", "ch-1"))
                .thenReturn(Optional.of(result));

        GatewayCompletion completion = intake.completeGatewayPayment(1L, "plan_2_dur_180", "XTR", "ch-1");

        assertThat(completion.duplicate()).isFalse();
        assertThat(completion.purchase()).isSameAs(result);
    }

    @Test
    void repeatedGatewayCompletionIsReportedAsDuplicate() {
        when(entitlementService.purchaseWithPayment(anyLong(), any(), any(), anyString(), anyString()))
                .thenReturn(Optional.empty());

        GatewayCompletion completion = intake.completeGatewayPayment(1L, "plan_0_dur_30", "XTR", "ch-1");

        assertThat(completion.duplicate()).isTrue();
        assertThat(completion.purchase()).isNull();
    }

    @Test
    void gatewayPayloadOutsideCatalogIsRejected() {
        assertThatThrownBy(() -> intake.completeGatewayPayment(1L, "plan_7_dur_30", "XTR", "ch-1"))
                .isInstanceOf(InvalidSelectionException.class);
        assertThatThrownBy(() -> intake.completeGatewayPayment(1L, "garbage", "XTR", "ch-2"))
                .isInstanceOf(InvalidSelectionException.class);
        verifyNoInteractions(entitlementService);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  "})
    void gatewayCompletionWithoutChargeIdIsRejected(String chargeId) {
        assertThatThrownBy(() -> intake.completeGatewayPayment(1L, "plan_0_dur_30", "XTR", chargeId))
                .isInstanceOf(PaymentIntegrityException.class);
        verifyNoInteractions(entitlementService);
    }

    @Test
    void purchaseSelectionPayloadFormat() {
        assertThat(new PurchaseSelection(2, 365).toPayload()).isEqualTo("plan_2_dur_365");
        assertThat(PurchaseSelection.fromPayload("plan_2_dur_365")).isEqualTo(new PurchaseSelection(2, 365));
        assertThatThrownBy(() -> PurchaseSelection.fromPayload("plan_99999999999_dur_30"))
                .isInstanceOf(InvalidSelectionException.class);
    }

    private PurchaseResult result(int plan, int days) {
        return new PurchaseResult(planCatalog.plan(plan), days, planCatalog.price(plan, days), PaymentMethod.CARD,
                Instant.EPOCH, "vless://sub-1@demo.server:443");
    }
}
