package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.application.conversation.ConversationService;
import com.abba.vpnstore.application.conversation.TurnOutcome;
import com.abba.vpnstore.application.navigation.PendingRegistration;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Runs one conversation turn per update and writes the outcome back to the chat. Pending
 * registrations are kept per chat between the entry action and the language choice, and
 * expire if the language is never picked.
 */
@Component
public class TelegramUpdateDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateDispatcher.class);

    static final Duration PENDING_REGISTRATION_TTL = Duration.ofMinutes(30);
    static final long PENDING_REGISTRATION_LIMIT = 5_000;

    private final TelegramUpdateParser parser;
    private final ConversationService conversationService;
    private final TelegramBotClient botClient;
    private final Cache<Long, PendingRegistration> pendingRegistrations;

    @Autowired
    public TelegramUpdateDispatcher(TelegramUpdateParser parser,
                                    ConversationService conversationService,
                                    TelegramBotClient botClient) {
        this(parser, conversationService, botClient, Ticker.systemTicker());
    }

    TelegramUpdateDispatcher(TelegramUpdateParser parser,
                             ConversationService conversationService,
                             TelegramBotClient botClient,
                             Ticker ticker) {
        this.parser = parser;
        this.conversationService = conversationService;
        this.botClient = botClient;
        this.pendingRegistrations = Caffeine.newBuilder()
                .expireAfterWrite(PENDING_REGISTRATION_TTL)
                .maximumSize(PENDING_REGISTRATION_LIMIT)
                .executor(Runnable::run)
                .ticker(ticker)
                .build();
    }

    public void dispatch(JsonNode rawUpdate) {
        parser.parse(rawUpdate).ifPresent(this::dispatch);
    }

    void dispatch(TelegramUpdate update) {
        try {
            switch (update.kind()) {
                case ACTION -> onAction(update);
                case PRE_CHECKOUT -> botClient.answerPreCheckoutQuery(update.queryId(),
                        conversationService.onPreCheckout(update.identity(), update.payload()));
                case PAYMENT_COMPLETED -> deliver(update, conversationService.onPaymentCompleted(
                        update.identity(), update.payload(), update.currency(), update.externalReference()));
            }
        } catch (TelegramApiException e) {
            log.error("Failed to deliver update_id={} chat={}: {}", update.updateId(), mask(update.chatId()), e.getMessage());
        }
    }

    Map<Long, PendingRegistration> pendingRegistrations() {
        return pendingRegistrations.asMap();
    }

    long pendingRegistrationCount() {
        pendingRegistrations.cleanUp();
        return pendingRegistrations.estimatedSize();
    }

    private void onAction(TelegramUpdate update) {
        PendingRegistration pending = pendingRegistrations.asMap().remove(update.chatId());
        TurnOutcome outcome = conversationService.onAction(update.action(), pending);
        if (outcome.pendingRegistration() != null) {
            pendingRegistrations.put(update.chatId(), outcome.pendingRegistration());
        }
        if (update.queryId() != null) {
            botClient.answerCallbackQuery(update.queryId(), outcome.notice());
        }
        deliver(update, outcome);
    }

    private void deliver(TelegramUpdate update, TurnOutcome outcome) {
        if (outcome.rendersScreen()) {
            botClient.render(update.chatId(), update.messageId(), outcome.screen());
        }
        if (outcome.invoice() != null) {
            botClient.sendInvoice(update.chatId(), outcome.invoice());
        }
        log.info("Handled update_id={} kind={} chat={} screen={}", update.updateId(), update.kind(),
                mask(update.chatId()), outcome.rendersScreen() ? outcome.screen().screen() : "unchanged");
    }

    private String mask(long id) {
        String v = Long.toString(id);
        if (v.length() <= 6) return "***";
        return v.substring(0, 3) + "***" + v.substring(v.length() - 3);
    }
}
