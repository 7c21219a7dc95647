package com.abba.vpnstore.infrastructure.telegram;

import com.abba.vpnstore.infrastructure.config.TelegramProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Points the bot at the webhook endpoint, or clears the webhook so long polling can receive updates.
 */
@Component
@ConditionalOnProperty(prefix = "vpnstore.telegram", name = "enabled", havingValue = "true")
public class TelegramWebhookRegistrar {

    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookRegistrar.class);
    static final String WEBHOOK_PATH = "/webhooks/telegram/";

    private final TelegramProperties properties;
    private final TelegramBotClient botClient;

    public TelegramWebhookRegistrar(TelegramProperties properties, TelegramBotClient botClient) {
        this.properties = properties;
        this.botClient = botClient;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void register() {
        try {
            if (properties.isWebhookMode()) {
                botClient.setWebhook(webhookEndpoint());
                log.info("Telegram webhook registered at {}{}***", stripSlash(properties.webhookUrl()), WEBHOOK_PATH);
            } else {
                botClient.deleteWebhook();
                log.info("Telegram long polling enabled");
            }
        } catch (TelegramApiException e) {
            log.error("Failed to configure Telegram delivery mode: {}", e.getMessage(), e);
        }
    }

    String webhookEndpoint() {
        return stripSlash(properties.webhookUrl()) + WEBHOOK_PATH + properties.webhookSecret();
    }

    private String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
