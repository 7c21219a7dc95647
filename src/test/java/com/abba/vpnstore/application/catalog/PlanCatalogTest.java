package com.abba.vpnstore.application.catalog;

import com.abba.vpnstore.domain.exception.InvalidSelectionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanCatalogTest {

    private final PlanCatalog catalog = new PlanCatalog();

    @Test
    void defaultCatalogOffersThreePlans() {
        assertThat(catalog.entries())
                .extracting(entry -> entry.planName() + "/" + entry.devices())
                .containsExactly("Basic/1", "Standard/3", "Premium/5");
        assertThat(catalog.durations()).containsExactly(30, 60, 180, 365);
    }

    @Test
    void looksUpPriceByPlanAndDuration() {
        assertThat(catalog.price(0, 30)).isEqualByComparingTo("5");
        assertThat(catalog.price(1, 180)).isEqualByComparingTo("50");
        assertThat(catalog.price(2, 365)).isEqualByComparingTo("135");
    }

    @Test
    void rejectsPlanIndexOutsideCatalog() {
        assertThatThrownBy(() -> catalog.plan(9)).isInstanceOf(InvalidSelectionException.class);
        assertThatThrownBy(() -> catalog.plan(-1)).isInstanceOf(InvalidSelectionException.class);
    }

    @Test
    void rejectsDurationNotOffered() {
        assertThatThrownBy(() -> catalog.price(0, 90))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("90");
    }
}
