package com.abba.vpnstore.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One plan of the catalog with its price per supported duration.
 */
public record CatalogEntry(String planName, int devices, Map<Integer, BigDecimal> pricesByDays) {

    public CatalogEntry {
        pricesByDays = Collections.unmodifiableMap(new LinkedHashMap<>(pricesByDays));
    }

    public Optional<BigDecimal> priceFor(int durationDays) {
        return Optional.ofNullable(pricesByDays.get(durationDays));
    }
}
