package com.abba.vpnstore.application.navigation;

/**
 * Context captured by the entry action of an unknown identity and consumed when the identity is
 * created on language choice. Held by the transport for that chat between the two turns.
 *
 * @param referrerId identity that shared the entry link, or {@code null}
 */
public record PendingRegistration(Long referrerId) {
}
