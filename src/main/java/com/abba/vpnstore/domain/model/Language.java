package com.abba.vpnstore.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Language {
    EN("en", "🇬🇧", "English"),
    RU("ru", "🇷🇺", "Русский"),
    HI("hi", "🇮🇳", "हिंदी"),
    AR("ar", "🇸🇦", "العربية");

    private final String code;
    private final String flag;
    private final String nativeName;

    Language(String code, String flag, String nativeName) {
        this.code = code;
        this.flag = flag;
        this.nativeName = nativeName;
    }

    public String code() {
        return code;
    }

    public String flag() {
        return flag;
    }

    public String nativeName() {
        return nativeName;
    }

    public static Optional<Language> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(language -> language.code.equals(normalized))
                .findFirst();
    }
}
