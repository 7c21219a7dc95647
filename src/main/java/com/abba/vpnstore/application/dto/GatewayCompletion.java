package com.abba.vpnstore.application.dto;

/**
 * Outcome of a gateway confirmation.
 *
 * @param purchase  the recorded purchase, {@code null} when the charge was already recorded earlier
 * @param duplicate whether this confirmation repeated one that was already recorded
 */
public record GatewayCompletion(PurchaseResult purchase, boolean duplicate) {

    public static GatewayCompletion recorded(PurchaseResult purchase) {
        return new GatewayCompletion(purchase, false);
    }

    public static GatewayCompletion alreadyRecorded() {
        return new GatewayCompletion(null, true);
    }
}
