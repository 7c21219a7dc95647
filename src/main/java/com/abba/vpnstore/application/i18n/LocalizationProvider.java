package com.abba.vpnstore.application.i18n;

import com.abba.vpnstore.domain.model.Language;

import java.util.Map;

public interface LocalizationProvider {

    /**
     * Resolves the template for {@code key}, trying the requested language, then the default
     * language, then returning the raw bundle key, and fills its {@code {name}} placeholders.
     */
    String text(Language language, MessageKey key, Map<String, ?> parameters);

    default String text(Language language, MessageKey key) {
        return text(language, key, Map.of());
    }
}
