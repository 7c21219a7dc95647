package com.abba.vpnstore.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Bot API credentials. A blank {@code webhookUrl} switches the transport to long polling.
 */
@ConfigurationProperties(prefix = "vpnstore.telegram")
public record TelegramProperties(
        @DefaultValue("false") boolean enabled,
        String botToken,
        @DefaultValue("https://api.telegram.org") String apiBaseUrl,
        @DefaultValue("") String webhookUrl,
        @DefaultValue("hook") String webhookSecret,
        @DefaultValue("") String paymentProviderToken,
        @DefaultValue("30") int pollTimeoutSeconds
) {

    public boolean isWebhookMode() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public String botApiUrl(String method) {
        return apiBaseUrl + "/bot" + botToken + "/" + method;
    }
}
