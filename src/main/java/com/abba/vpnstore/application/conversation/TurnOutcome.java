package com.abba.vpnstore.application.conversation;

import com.abba.vpnstore.application.dto.InvoiceRequest;
import com.abba.vpnstore.application.navigation.PendingRegistration;
import com.abba.vpnstore.application.navigation.RenderedScreen;
import com.abba.vpnstore.application.navigation.Transition;

/**
 * What the transport should do at the end of a turn.
 *
 * @param screen              screen to display, {@code null} keeps the current one
 * @param notice              short notice for the acknowledgement, may be {@code null}
 * @param invoice             invoice to send after the screen, may be {@code null}
 * @param pendingRegistration registration context to keep for the chat, {@code null} clears it
 */
public record TurnOutcome(RenderedScreen screen, String notice, InvoiceRequest invoice,
                          PendingRegistration pendingRegistration) {

    public static TurnOutcome of(Transition transition) {
        return new TurnOutcome(transition.screen(), null, transition.invoice(), transition.pendingRegistration());
    }

    public static TurnOutcome screen(RenderedScreen screen, PendingRegistration pendingRegistration) {
        return new TurnOutcome(screen, null, null, pendingRegistration);
    }

    public static TurnOutcome notice(String notice, PendingRegistration pendingRegistration) {
        return new TurnOutcome(null, notice, null, pendingRegistration);
    }

    public static TurnOutcome ignored(PendingRegistration pendingRegistration) {
        return new TurnOutcome(null, null, null, pendingRegistration);
    }

    public boolean rendersScreen() {
        return screen != null;
    }
}
