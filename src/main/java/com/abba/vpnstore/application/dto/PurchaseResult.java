package com.abba.vpnstore.application.dto;

import com.abba.vpnstore.domain.model.CatalogEntry;
import com.abba.vpnstore.domain.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.Instant;

public record PurchaseResult(
        CatalogEntry plan,
        int durationDays,
        BigDecimal price,
        PaymentMethod method,
        Instant expiresAt,
        String provisioningToken
) {
}
