package com.abba.vpnstore.infrastructure.config;

import com.abba.vpnstore.domain.service.EntitlementEngine;
import com.abba.vpnstore.domain.service.ProvisioningTokenFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StorefrontConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EntitlementEngine entitlementEngine(StorefrontProperties properties) {
        return new EntitlementEngine(
                properties.trialDays(),
                properties.referredTrialDays(),
                new ProvisioningTokenFactory(properties.provisioningHost())
        );
    }
}
