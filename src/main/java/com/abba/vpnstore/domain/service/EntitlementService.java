package com.abba.vpnstore.domain.service;

import com.abba.vpnstore.application.dto.PurchaseResult;
import com.abba.vpnstore.application.dto.PurchaseSelection;
import com.abba.vpnstore.domain.model.EntitlementStatus;
import com.abba.vpnstore.domain.model.PaymentMethod;
import com.abba.vpnstore.domain.model.TrialGrant;
import com.abba.vpnstore.domain.model.User;

import java.util.Optional;

public interface EntitlementService {

    TrialGrant grantTrial(long userId);

    PurchaseResult purchase(long userId, PurchaseSelection selection, PaymentMethod method);

    /**
     * Extends the entitlement and records the completed payment in the same transaction.
     *
     * @return empty when {@code externalReference} was already recorded
     */
    Optional<PurchaseResult> purchaseWithPayment(long userId, PurchaseSelection selection, PaymentMethod method,
                                                 String currency, String externalReference);

    EntitlementStatus statusOf(User user);
}
