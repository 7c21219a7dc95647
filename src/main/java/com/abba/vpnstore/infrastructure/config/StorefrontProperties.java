package com.abba.vpnstore.infrastructure.config;

import com.abba.vpnstore.domain.model.Language;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Set;

/**
 * Storefront settings, bound once at startup and shared read-only.
 *
 * @param adminIds        identities that see the admin entry
 * @param supportUsername handle shown on the support screen
 * @param provisioningHost host:port placed into provisioning tokens
 * @param referralLinkBase prefix the referral code is appended to
 * @param ledgerStore     {@code mongo} or {@code memory}
 */
@ConfigurationProperties(prefix = "vpnstore")
public record StorefrontProperties(
        Set<Long> adminIds,
        @DefaultValue("@Support") String supportUsername,
        @DefaultValue("3") int trialDays,
        @DefaultValue("7") int referredTrialDays,
        @DefaultValue("en") String defaultLanguage,
        @DefaultValue("demo.server:443") String provisioningHost,
        @DefaultValue("https://t.me/VpnStoreBot?start=") String referralLinkBase,
        @DefaultValue("mongo") String ledgerStore
) {

    public StorefrontProperties {
        adminIds = adminIds == null ? Set.of() : Set.copyOf(adminIds);
    }

    public boolean isAdmin(long identity) {
        return adminIds.contains(identity);
    }

    public String referralLink(long identity) {
        return referralLinkBase + "ref" + identity;
    }

    public Language fallbackLanguage() {
        return Language.fromCode(defaultLanguage).orElse(Language.EN);
    }
}
