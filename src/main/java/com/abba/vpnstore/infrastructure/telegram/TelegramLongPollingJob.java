package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.infrastructure.config.TelegramProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pulls updates with {@code getUpdates} when no webhook URL is configured.
 */
@Component
@ConditionalOnProperty(prefix = "vpnstore.telegram", name = "enabled", havingValue = "true")
public class TelegramLongPollingJob {

    private static final Logger log = LoggerFactory.getLogger(TelegramLongPollingJob.class);

    private final TelegramProperties properties;
    private final TelegramBotClient botClient;
    private final TelegramUpdateDispatcher dispatcher;
    private long offset;

    public TelegramLongPollingJob(TelegramProperties properties,
                                  TelegramBotClient botClient,
                                  TelegramUpdateDispatcher dispatcher) {
        this.properties = properties;
        this.botClient = botClient;
        this.dispatcher = dispatcher;
    }

    @Scheduled(fixedDelayString = "${vpnstore.telegram.poll-delay-ms:500}")
    public void poll() {
        if (properties.isWebhookMode()) {
            return;
        }
        JsonNode updates;
        try {
            updates = botClient.getUpdates(offset);
        } catch (TelegramApiException e) {
            log.warn("Polling failed: {}", e.getMessage());
            return;
        }
        for (JsonNode update : updates) {
            offset = Math.max(offset, update.path("update_id").asLong() + 1);
            try {
                dispatcher.dispatch(update);
            } catch (RuntimeException e) {
                log.error("Failed to process polled update_id={}", update.path("update_id").asLong(), e);
            }
        }
    }

    long offset() {
        return offset;
    }
}
