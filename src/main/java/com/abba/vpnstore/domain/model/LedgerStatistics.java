package com.abba.vpnstore.domain.model;

public record LedgerStatistics(long totalUsers, long activeUsers, long completedPayments) {
}
