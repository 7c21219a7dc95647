package com.abba.vpnstore.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

@Document(collection = "payments")
@Data
public class Payment {

    @Id
    private String id;

    @Indexed
    private Long userId;

    private BigDecimal amount;
    private String currency;
    private PaymentMethod method;
    @Indexed(unique = true, sparse = true)
    private String externalReference;
    private PaymentStatus status = PaymentStatus.PENDING;
    private Instant createdAt;

    public Payment copy() {
        Payment copy = new Payment();
        copy.setId(id);
        copy.setUserId(userId);
        copy.setAmount(amount);
        copy.setCurrency(currency);
        copy.setMethod(method);
        copy.setExternalReference(externalReference);
        copy.setStatus(status);
        copy.setCreatedAt(createdAt);
        return copy;
    }
}
