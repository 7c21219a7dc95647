package com.abba.vpnstore.domain.repository;

import com.abba.vpnstore.domain.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;

public interface UserRepository extends MongoRepository<User, Long> {

    long countByReferrerId(Long referrerId);

    long countBySubscriptionEndAfter(Instant instant);
}
