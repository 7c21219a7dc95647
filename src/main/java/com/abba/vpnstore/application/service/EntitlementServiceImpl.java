package com.abba.vpnstore.application.service;

import com.abba.vpnstore.application.catalog.PlanCatalog;
import com.abba.vpnstore.application.dto.PurchaseResult;
import com.abba.vpnstore.application.dto.PurchaseSelection;
import com.abba.vpnstore.domain.exception.PaymentIntegrityException;
import com.abba.vpnstore.domain.model.CatalogEntry;
import com.abba.vpnstore.domain.model.EntitlementExtension;
import com.abba.vpnstore.domain.model.EntitlementStatus;
import com.abba.vpnstore.domain.model.Payment;
import com.abba.vpnstore.domain.model.PaymentMethod;
import com.abba.vpnstore.domain.model.PaymentStatus;
import com.abba.vpnstore.domain.model.PurchaseClass;
import com.abba.vpnstore.domain.model.Subscription;
import com.abba.vpnstore.domain.model.TrialGrant;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.EntitlementEngine;
import com.abba.vpnstore.domain.service.EntitlementService;
import com.abba.vpnstore.domain.service.LedgerStore;
import com.abba.vpnstore.infrastructure.config.BillingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class EntitlementServiceImpl implements EntitlementService {

    private static final String TRIAL_PLAN = "Trial";

    private final LedgerStore ledgerStore;
    private final EntitlementEngine entitlementEngine;
    private final PlanCatalog planCatalog;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    public TrialGrant grantTrial(long userId) {
        Instant now = clock.instant();
        TrialGrant grant = ledgerStore.updateUser(userId, user -> {
            entitlementEngine.requireTrialEligible(user);
            TrialGrant granted = entitlementEngine.grantTrial(user, now);
            ledgerStore.appendSubscription(trialRecord(user, granted, now));
            return granted;
        });
        log.info("Trial granted userId={} days={} expiresAt={}", userId, grant.days(), grant.expiresAt());
        return grant;
    }

    @Override
    public PurchaseResult purchase(long userId, PurchaseSelection selection, PaymentMethod method) {
        PurchaseResult result = extend(userId, selection, method, billingProperties.demoCurrency(), null);
        log.info("Demo purchase recorded userId={} plan={} days={} method={} expiresAt={}",
                userId, result.plan().planName(), result.durationDays(), method, result.expiresAt());
        return result;
    }

    @Override
    public Optional<PurchaseResult> purchaseWithPayment(long userId, PurchaseSelection selection, PaymentMethod method,
                                                        String currency, String externalReference) {
        Optional<PurchaseResult> result = Optional.ofNullable(
                extend(userId, selection, method, currency, externalReference));
        result.ifPresentOrElse(
                purchase -> log.info("Gateway purchase recorded userId={} plan={} days={} externalReference={} expiresAt={}",
                        userId, purchase.plan().planName(), purchase.durationDays(), externalReference, purchase.expiresAt()),
                () -> log.info("Ignoring already recorded payment userId={} externalReference={}", userId, externalReference));
        return result;
    }

    @Override
    public EntitlementStatus statusOf(User user) {
        return entitlementEngine.statusOf(user, clock.instant());
    }

    /**
     * Single read-modify-write used by both payment paths. A gateway method also appends a
     * completed payment in the same unit, and returns {@code null} if its reference is already on
     * the ledger.
     */
    private PurchaseResult extend(long userId, PurchaseSelection selection, PaymentMethod method,
                                  String currency, String externalReference) {
        boolean gateway = method.isGateway();
        if (gateway && !StringUtils.hasText(externalReference)) {
            throw new PaymentIntegrityException("Gateway purchase for userId=" + userId + " has no payment reference");
        }
        CatalogEntry plan = planCatalog.plan(selection.planIndex());
        BigDecimal price = planCatalog.price(selection.planIndex(), selection.durationDays());
        PurchaseClass purchaseClass = gateway ? PurchaseClass.PAID : PurchaseClass.DEMO;
        Instant now = clock.instant();

        return ledgerStore.updateUser(userId, user -> {
            if (gateway && ledgerStore.isPaymentRecorded(externalReference)) {
                return null;
            }
            EntitlementExtension extension = entitlementEngine.extend(
                    user, selection.durationDays(), price, purchaseClass, now);
            Subscription record = purchaseRecord(user, plan, selection.durationDays(), price, currency, method,
                    purchaseClass, now, extension);
            if (!gateway) {
                ledgerStore.appendSubscription(record);
            } else {
                ledgerStore.appendSubscriptionAndPayment(record,
                        completedPayment(user, price, currency, method, externalReference, now));
            }
            return new PurchaseResult(plan, selection.durationDays(), price, method,
                    extension.expiresAt(), extension.provisioningToken());
        });
    }

    private Subscription trialRecord(User user, TrialGrant grant, Instant now) {
        Subscription subscription = new Subscription();
        subscription.setUserId(user.getId());
        subscription.setPlanName(TRIAL_PLAN);
        subscription.setDevices(1);
        subscription.setDurationDays(grant.days());
        subscription.setPrice(BigDecimal.ZERO);
        subscription.setCurrency(billingProperties.demoCurrency());
        subscription.setPaymentMethod(PaymentMethod.TRIAL);
        subscription.setPurchaseClass(PurchaseClass.TRIAL);
        subscription.setStartedAt(now);
        subscription.setExpiresAt(grant.expiresAt());
        subscription.setProvisioningToken(grant.provisioningToken());
        return subscription;
    }

    private Subscription purchaseRecord(User user, CatalogEntry plan, int days, BigDecimal price, String currency,
                                        PaymentMethod method, PurchaseClass purchaseClass, Instant now,
                                        EntitlementExtension extension) {
        Subscription subscription = new Subscription();
        subscription.setUserId(user.getId());
        subscription.setPlanName(plan.planName());
        subscription.setDevices(plan.devices());
        subscription.setDurationDays(days);
        subscription.setPrice(price);
        subscription.setCurrency(currency);
        subscription.setPaymentMethod(method);
        subscription.setPurchaseClass(purchaseClass);
        subscription.setStartedAt(now);
        subscription.setExpiresAt(extension.expiresAt());
        subscription.setProvisioningToken(extension.provisioningToken());
        return subscription;
    }

    private Payment completedPayment(User user, BigDecimal amount, String currency, PaymentMethod method,
                                     String externalReference, Instant now) {
        Payment payment = new Payment();
        payment.setUserId(user.getId());
        payment.setAmount(amount);
        payment.setCurrency(currency);
        payment.setMethod(method);
        payment.setExternalReference(externalReference);
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setCreatedAt(now);
        return payment;
    }
}
