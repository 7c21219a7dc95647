package com.abba.vpnstore.domain.model;

import java.time.Instant;

public record TrialGrant(int days, Instant expiresAt, String provisioningToken) {
}
