package com.abba.vpnstore.domain.model;

/**
 * Tag carried by a provisioning token telling how the entitlement was obtained.
 */
public enum PurchaseClass {
    TRIAL("trial"),
    DEMO("sub"),
    PAID("paid");

    private final String tag;

    PurchaseClass(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
