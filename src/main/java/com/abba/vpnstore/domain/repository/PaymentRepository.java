package com.abba.vpnstore.domain.repository;

import com.abba.vpnstore.domain.model.Payment;
import com.abba.vpnstore.domain.model.PaymentStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface PaymentRepository extends MongoRepository<Payment, String> {

    boolean existsByExternalReference(String externalReference);

    long countByStatus(PaymentStatus status);
}
