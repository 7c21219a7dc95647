package com.abba.vpnstore.application.i18n;

import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.infrastructure.config.StorefrontProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * Loads {@code i18n/messages_<code>.properties} (UTF-8) once per language at startup.
 */
@Component
@Slf4j
public class PropertiesLocalizationProvider implements LocalizationProvider {

    // price templates carry a literal '$' before the placeholder
    private static final char ESCAPE = '\\';

    private final Map<Language, Properties> bundles = new EnumMap<>(Language.class);
    private final Language defaultLanguage;

    public PropertiesLocalizationProvider(StorefrontProperties properties) {
        this(properties.fallbackLanguage(), "i18n/messages");
    }

    PropertiesLocalizationProvider(Language defaultLanguage, String basename) {
        this.defaultLanguage = defaultLanguage;
        for (Language language : Language.values()) {
            bundles.put(language, load(basename + "_" + language.code() + ".properties"));
        }
    }

    @Override
    public String text(Language language, MessageKey key, Map<String, ?> parameters) {
        String template = template(language, key);
        return parameters.isEmpty() ? template : fill(template, parameters);
    }

    private String template(Language language, MessageKey key) {
        String bundleKey = key.bundleKey();
        String value = bundles.get(language).getProperty(bundleKey);
        if (value == null && language != defaultLanguage) {
            value = bundles.get(defaultLanguage).getProperty(bundleKey);
        }
        return value != null ? value : bundleKey;
    }

    private String fill(String template, Map<String, ?> parameters) {
        return new StringSubstitutor(parameters, "{", "}", ESCAPE)
                .setDisableSubstitutionInValues(true)
                .replace(template);
    }

    private Properties load(String location) {
        Resource resource = new ClassPathResource(location);
        Properties properties = new Properties();
        if (!resource.exists()) {
            log.warn("Missing message bundle {}", location);
            return properties;
        }
        try {
            PropertiesLoaderUtils.fillProperties(properties, new EncodedResource(resource, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load message bundle " + location, e);
        }
        return properties;
    }
}
