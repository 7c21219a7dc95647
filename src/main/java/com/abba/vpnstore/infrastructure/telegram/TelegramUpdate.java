package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.application.navigation.InboundAction;

/**
 * The parts of a Bot API update the storefront reacts to.
 *
 * @param messageId message carrying the pressed button, {@code null} for typed commands
 * @param queryId   callback or pre-checkout query id to answer, may be {@code null}
 */
public record TelegramUpdate(Kind kind,
                             long updateId,
                             long chatId,
                             long identity,
                             Long messageId,
                             String queryId,
                             InboundAction action,
                             String payload,
                             String currency,
                             String externalReference) {

    public enum Kind {
        ACTION,
        PRE_CHECKOUT,
        PAYMENT_COMPLETED
    }

    public static TelegramUpdate action(long updateId, long chatId, Long messageId, String callbackQueryId,
                                        InboundAction action) {
        return new TelegramUpdate(Kind.ACTION, updateId, chatId, action.identity(), messageId, callbackQueryId,
                action, null, null, null);
    }

    public static TelegramUpdate preCheckout(long updateId, long identity, String queryId, String payload) {
        return new TelegramUpdate(Kind.PRE_CHECKOUT, updateId, identity, identity, null, queryId,
                null, payload, null, null);
    }

    public static TelegramUpdate paymentCompleted(long updateId, long chatId, long identity, String payload,
                                                  String currency, String chargeId) {
        return new TelegramUpdate(Kind.PAYMENT_COMPLETED, updateId, chatId, identity, null, null,
                null, payload, currency, chargeId);
    }
}
