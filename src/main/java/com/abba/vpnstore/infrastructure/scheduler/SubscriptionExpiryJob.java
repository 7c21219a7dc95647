package com.abba.vpnstore.infrastructure.scheduler;

import com.abba.vpnstore.domain.service.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Clears the active flag of subscription records whose window has passed.
 */
@Component
@ConditionalOnProperty(prefix = "vpnstore.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SubscriptionExpiryJob {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionExpiryJob.class);

    private final LedgerStore ledgerStore;
    private final Clock clock;

    public SubscriptionExpiryJob(LedgerStore ledgerStore, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.clock = clock;
    }

    @Scheduled(cron = "${vpnstore.billing.expiry-cron:0 0 3 * * *}")
    public void deactivateExpiredDaily() {
        int deactivated = ledgerStore.deactivateExpired(clock.instant());
        log.info("Expired subscription records deactivated count={}", deactivated);
    }
}
