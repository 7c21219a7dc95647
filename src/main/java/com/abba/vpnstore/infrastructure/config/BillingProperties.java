package com.abba.vpnstore.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "vpnstore.billing")
public record BillingProperties(
        @DefaultValue("XTR") String gatewayCurrency,
        @DefaultValue("USD") String demoCurrency,
        @DefaultValue("100") int minorUnits,
        @DefaultValue("0 0 3 * * *") String expiryCron
) {
}
