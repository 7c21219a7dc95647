package com.abba.vpnstore.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum PaymentMethod {
    TRIAL("trial", false),
    STARS("stars", true),
    CARD("card", false),
    CRYPTO("crypto", false);

    private final String code;
    private final boolean gateway;

    PaymentMethod(String code, boolean gateway) {
        this.code = code;
        this.gateway = gateway;
    }

    public String code() {
        return code;
    }

    /**
     * Whether completion arrives asynchronously from the payment gateway.
     */
    public boolean isGateway() {
        return gateway;
    }

    public static Optional<PaymentMethod> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method != TRIAL)
                .filter(method -> method.code.equals(normalized))
                .findFirst();
    }
}
