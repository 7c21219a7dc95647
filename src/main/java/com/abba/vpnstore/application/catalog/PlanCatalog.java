package com.abba.vpnstore.application.catalog;

import com.abba.vpnstore.domain.exception.InvalidSelectionException;
import com.abba.vpnstore.domain.model.CatalogEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plans, supported durations and prices. Fixed for the lifetime of the process.
 */
@Component
public class PlanCatalog {

    public static final List<Integer> DURATIONS = List.of(30, 60, 180, 365);
    public static final int BASE_DURATION = 30;

    private final List<CatalogEntry> entries;

    public PlanCatalog() {
        this(List.of(
                entry("Basic", 1, "5", "9", "25", "45"),
                entry("Standard", 3, "10", "18", "50", "90"),
                entry("Premium", 5, "15", "27", "75", "135")
        ));
    }

    public PlanCatalog(List<CatalogEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    public List<Integer> durations() {
        return DURATIONS;
    }

    public CatalogEntry plan(int index) {
        if (index < 0 || index >= entries.size()) {
            throw new InvalidSelectionException("Plan index " + index + " outside catalog of " + entries.size());
        }
        return entries.get(index);
    }

    public BigDecimal price(int planIndex, int durationDays) {
        CatalogEntry plan = plan(planIndex);
        return plan.priceFor(durationDays)
                .orElseThrow(() -> new InvalidSelectionException(
                        "Duration " + durationDays + " not offered for plan " + plan.planName()));
    }

    private static CatalogEntry entry(String name, int devices, String... prices) {
        Map<Integer, BigDecimal> byDays = new LinkedHashMap<>();
        for (int i = 0; i < DURATIONS.size(); i++) {
            byDays.put(DURATIONS.get(i), new BigDecimal(prices[i]));
        }
        return new CatalogEntry(name, devices, byDays);
    }
}
