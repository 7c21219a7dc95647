package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.application.navigation.Actions;
import com.abba.vpnstore.application.navigation.InboundAction;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class TelegramUpdateParser {

    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateParser.class);
    private static final String START_COMMAND = "/start";

    public Optional<TelegramUpdate> parse(JsonNode update) {
        long updateId = update.path("update_id").asLong();

        JsonNode callback = update.path("callback_query");
        if (!callback.isMissingNode()) {
            JsonNode message = callback.path("message");
            if (!message.has("chat")) {
                log.debug("Skipping callback without message update_id={}", updateId);
                return Optional.empty();
            }
            return Optional.of(TelegramUpdate.action(updateId,
                    message.path("chat").path("id").asLong(),
                    message.path("message_id").asLong(),
                    text(callback, "id"),
                    inbound(callback.path("from"), text(callback, "data"))));
        }

        JsonNode preCheckout = update.path("pre_checkout_query");
        if (!preCheckout.isMissingNode()) {
            return Optional.of(TelegramUpdate.preCheckout(updateId,
                    preCheckout.path("from").path("id").asLong(),
                    text(preCheckout, "id"),
                    text(preCheckout, "invoice_payload")));
        }

        JsonNode message = update.path("message");
        if (message.isMissingNode()) {
            return Optional.empty();
        }
        long chatId = message.path("chat").path("id").asLong();
        JsonNode payment = message.path("successful_payment");
        if (!payment.isMissingNode()) {
            return Optional.of(TelegramUpdate.paymentCompleted(updateId, chatId,
                    message.path("from").path("id").asLong(),
                    text(payment, "invoice_payload"),
                    text(payment, "currency"),
                    text(payment, "telegram_payment_charge_id")));
        }

        String token = startToken(text(message, "text"));
        if (token == null) {
            log.debug("Skipping non-command message update_id={}", updateId);
            return Optional.empty();
        }
        return Optional.of(TelegramUpdate.action(updateId, chatId, null, null, inbound(message.path("from"), token)));
    }

    /**
     * {@code /start} becomes {@code start}, {@code /start ref42} becomes {@code start:ref42}.
     */
    String startToken(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String[] parts = text.trim().split("\\s+", 2);
        String command = parts[0];
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        if (!START_COMMAND.equals(command)) {
            return null;
        }
        return parts.length > 1 ? Actions.START + ":" + parts[1].trim() : Actions.START;
    }

    private InboundAction inbound(JsonNode from, String token) {
        return new InboundAction(
                from.path("id").asLong(),
                token,
                text(from, "first_name"),
                text(from, "username"),
                languageHint(text(from, "language_code")));
    }

    private String languageHint(String languageCode) {
        if (languageCode == null) {
            return null;
        }
        int dash = languageCode.indexOf('-');
        return dash > 0 ? languageCode.substring(0, dash) : languageCode;
    }

    private String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && !v.isNull() ? v.asText() : null;
    }
}
