package com.abba.vpnstore.domain.repository;

import com.abba.vpnstore.domain.model.Subscription;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface SubscriptionRepository extends MongoRepository<Subscription, String> {

    List<Subscription> findByUserIdOrderByStartedAtDesc(Long userId);

    List<Subscription> findByActiveTrueAndExpiresAtBefore(Instant instant);
}
