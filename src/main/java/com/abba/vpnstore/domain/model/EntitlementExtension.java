package com.abba.vpnstore.domain.model;

import java.time.Instant;

public record EntitlementExtension(Instant expiresAt, String provisioningToken) {
}
