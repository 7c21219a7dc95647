package com.abba.vpnstore.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

@Document(collection = "subscriptions")
@CompoundIndex(name = "active_expiry_idx", def = "{'active': 1, 'expiresAt': 1}")
@Data
public class Subscription {

    @Id
    private String id;

    @Indexed
    private Long userId;

    private String planName;
    private int devices;
    private int durationDays;
    private BigDecimal price = BigDecimal.ZERO;
    private String currency;
    private PaymentMethod paymentMethod;
    private PurchaseClass purchaseClass;
    private Instant startedAt;
    private Instant expiresAt;
    private String provisioningToken;
    private boolean active = true;

    public Subscription copy() {
        Subscription copy = new Subscription();
        copy.setId(id);
        copy.setUserId(userId);
        copy.setPlanName(planName);
        copy.setDevices(devices);
        copy.setDurationDays(durationDays);
        copy.setPrice(price);
        copy.setCurrency(currency);
        copy.setPaymentMethod(paymentMethod);
        copy.setPurchaseClass(purchaseClass);
        copy.setStartedAt(startedAt);
        copy.setExpiresAt(expiresAt);
        copy.setProvisioningToken(provisioningToken);
        copy.setActive(active);
        return copy;
    }
}
