package com.abba.vpnstore.domain.service;

import com.abba.vpnstore.domain.exception.AlreadyGrantedException;
import com.abba.vpnstore.domain.model.EntitlementExtension;
import com.abba.vpnstore.domain.model.EntitlementStatus;
import com.abba.vpnstore.domain.model.PurchaseClass;
import com.abba.vpnstore.domain.model.TrialGrant;
import com.abba.vpnstore.domain.model.User;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Entitlement arithmetic. Every method works on the values it is given and never touches storage,
 * so callers must run {@link #grantTrial} and {@link #extend} inside the per-identity critical
 * section of {@link LedgerStore#updateUser}.
 */
public class EntitlementEngine {

    private final int trialDays;
    private final int referredTrialDays;
    private final ProvisioningTokenFactory tokenFactory;

    public EntitlementEngine(int trialDays, int referredTrialDays, ProvisioningTokenFactory tokenFactory) {
        this.trialDays = trialDays;
        this.referredTrialDays = referredTrialDays;
        this.tokenFactory = tokenFactory;
    }

    public boolean isTrialEligible(User user) {
        return !user.isTrialUsed();
    }

    public void requireTrialEligible(User user) {
        if (!isTrialEligible(user)) {
            throw new AlreadyGrantedException("Trial already used by user " + user.getId());
        }
    }

    public int trialDaysFor(User user) {
        return user.hasReferrer() ? referredTrialDays : trialDays;
    }

    /**
     * Commits the trial unconditionally. Eligibility is the caller's check.
     */
    public TrialGrant grantTrial(User user, Instant now) {
        int days = trialDaysFor(user);
        Instant expiresAt = now.plus(Duration.ofDays(days));
        user.markTrialUsed();
        user.setSubscriptionEnd(expiresAt);
        return new TrialGrant(days, expiresAt, tokenFactory.issue(user.getId(), PurchaseClass.TRIAL));
    }

    /**
     * Adds {@code durationDays} to the user's window. A window still open at {@code now} is
     * extended from its end; a lapsed or missing one restarts at {@code now}.
     */
    public EntitlementExtension extend(User user, int durationDays, BigDecimal price,
                                       PurchaseClass purchaseClass, Instant now) {
        Instant currentEnd = user.getSubscriptionEnd();
        Instant base = currentEnd != null && !currentEnd.isBefore(now) ? currentEnd : now;
        Instant expiresAt = base.plus(Duration.ofDays(durationDays));
        user.setSubscriptionEnd(expiresAt);
        user.addPaid(price);
        return new EntitlementExtension(expiresAt, tokenFactory.issue(user.getId(), purchaseClass));
    }

    public EntitlementStatus statusOf(Instant expiresAt, Instant now) {
        if (expiresAt == null) {
            return EntitlementStatus.noSubscription();
        }
        if (expiresAt.isBefore(now)) {
            return EntitlementStatus.expired();
        }
        return EntitlementStatus.active(Duration.between(now, expiresAt).toDays());
    }

    public EntitlementStatus statusOf(User user, Instant now) {
        return statusOf(user.getSubscriptionEnd(), now);
    }
}
