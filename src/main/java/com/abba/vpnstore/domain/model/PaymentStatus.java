package com.abba.vpnstore.domain.model;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED
}
