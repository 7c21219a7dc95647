package com.abba.vpnstore.application.navigation;

/**
 * One navigation input delivered by the transport.
 *
 * @param languageHint client language code, used only before the user picks a language
 */
public record InboundAction(long identity, String token, String displayName, String username, String languageHint) {
}
