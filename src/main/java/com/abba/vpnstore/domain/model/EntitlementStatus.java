package com.abba.vpnstore.domain.model;

/**
 * Classification of an entitlement window at a point in time.
 *
 * @param kind     which of the three classes applies
 * @param daysLeft whole days remaining, zero unless {@link Kind#ACTIVE}
 */
public record EntitlementStatus(Kind kind, long daysLeft) {

    public enum Kind {
        NO_SUBSCRIPTION,
        EXPIRED,
        ACTIVE
    }

    public static EntitlementStatus noSubscription() {
        return new EntitlementStatus(Kind.NO_SUBSCRIPTION, 0);
    }

    public static EntitlementStatus expired() {
        return new EntitlementStatus(Kind.EXPIRED, 0);
    }

    public static EntitlementStatus active(long daysLeft) {
        return new EntitlementStatus(Kind.ACTIVE, daysLeft);
    }

    public boolean isActive() {
        return kind == Kind.ACTIVE;
    }
}
