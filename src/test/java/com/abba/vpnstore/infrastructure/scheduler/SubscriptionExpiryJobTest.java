package com.abba.vpnstore.infrastructure.scheduler;

import com.abba.vpnstore.domain.service.LedgerStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SubscriptionExpiryJobTest {

    @Mock
    private LedgerStore ledgerStore;

    @Test
    void deactivatesAsOfClockInstant() {
        Instant now = Instant.parse("2025-03-01T03:00:00Z");
        SubscriptionExpiryJob job = new SubscriptionExpiryJob(ledgerStore, Clock.fixed(now, ZoneOffset.UTC));

        job.deactivateExpiredDaily();

        verify(ledgerStore).deactivateExpired(now);
    }
}
