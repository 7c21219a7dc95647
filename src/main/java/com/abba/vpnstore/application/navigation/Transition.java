package com.abba.vpnstore.application.navigation;

import com.abba.vpnstore.application.dto.InvoiceRequest;

/**
 * Result of one navigation step.
 *
 * @param pendingRegistration registration context the transport keeps for the next turn, or {@code null}
 * @param invoice             invoice to open on the gateway path, or {@code null}
 */
public record Transition(RenderedScreen screen, PendingRegistration pendingRegistration, InvoiceRequest invoice) {

    public static Transition to(RenderedScreen screen) {
        return new Transition(screen, null, null);
    }

    public Screen target() {
        return screen.screen();
    }
}
