package com.abba.vpnstore.domain.service;

import com.abba.vpnstore.domain.model.PurchaseClass;

/**
 * Builds the configuration string handed to the user after a grant or purchase.
 * <p>
 * The token is a placeholder identifier derived only from the user id and the purchase class.
 * It is not a credential, carries no entropy and is not unique across records of the same class.
 */
public class ProvisioningTokenFactory {

    private final String host;

    public ProvisioningTokenFactory(String host) {
        this.host = host;
    }

    public String issue(long userId, PurchaseClass purchaseClass) {
        return "vless://" + purchaseClass.tag() + "-" + userId + "@" + host;
    }
}
