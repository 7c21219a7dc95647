package com.abba.vpnstore.infrastructure.persistence;

import com.abba.vpnstore.domain.exception.PaymentIntegrityException;
import com.abba.vpnstore.domain.exception.PersistenceFailureException;
import com.abba.vpnstore.domain.exception.UserNotFoundException;
import com.abba.vpnstore.domain.model.LedgerStatistics;
import com.abba.vpnstore.domain.model.Payment;
import com.abba.vpnstore.domain.model.PaymentStatus;
import com.abba.vpnstore.domain.model.Subscription;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.repository.PaymentRepository;
import com.abba.vpnstore.domain.repository.SubscriptionRepository;
import com.abba.vpnstore.domain.repository.UserRepository;
import com.abba.vpnstore.domain.service.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

@Component
@ConditionalOnProperty(prefix = "vpnstore", name = "ledger-store", havingValue = "mongo", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MongoLedgerStore implements LedgerStore {

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final PaymentRepository paymentRepository;
    private final TransactionTemplate ledgerTransactionTemplate;
    private final IdentityLocks identityLocks;

    @Override
    public Optional<User> getUser(long id) {
        return translate("load user " + id, () -> userRepository.findById(id));
    }

    @Override
    public User createUser(long id, Consumer<User> initializer) {
        return identityLocks.withLock(id, () -> translate("create user " + id, () ->
                userRepository.findById(id).orElseGet(() -> insertUser(id, initializer))));
    }

    @Override
    public <T> T updateUser(long id, Function<User, T> mutator) {
        return identityLocks.withLock(id, () -> inTransaction("update user " + id, () -> {
            User user = userRepository.findById(id)
                    .orElseThrow(() -> new UserNotFoundException("User " + id + " not registered"));
            T result = mutator.apply(user);
            userRepository.save(user);
            return result;
        }));
    }

    @Override
    public Subscription appendSubscription(Subscription subscription) {
        return translate("append subscription for user " + subscription.getUserId(),
                () -> subscriptionRepository.insert(subscription));
    }

    @Override
    public Payment appendPayment(Payment payment) {
        return translate("append payment for user " + payment.getUserId(),
                () -> paymentRepository.insert(payment));
    }

    @Override
    public void appendSubscriptionAndPayment(Subscription subscription, Payment payment) {
        try {
            ledgerTransactionTemplate.executeWithoutResult(status -> {
                subscriptionRepository.insert(subscription);
                paymentRepository.insert(payment);
            });
        } catch (RuntimeException e) {
            log.error("Rolled back subscription and payment userId={} externalReference={} reason={}",
                    payment.getUserId(), payment.getExternalReference(), e.getMessage(), e);
            throw new PaymentIntegrityException(
                    "Could not record payment " + payment.getExternalReference() + " with its subscription", e);
        }
    }

    @Override
    public boolean isPaymentRecorded(String externalReference) {
        return translate("check payment " + externalReference,
                () -> paymentRepository.existsByExternalReference(externalReference));
    }

    @Override
    public List<Subscription> findSubscriptions(long userId) {
        return translate("list subscriptions of user " + userId,
                () -> subscriptionRepository.findByUserIdOrderByStartedAtDesc(userId));
    }

    @Override
    public long countReferrals(long userId) {
        return translate("count referrals of user " + userId, () -> userRepository.countByReferrerId(userId));
    }

    @Override
    public LedgerStatistics statistics(Instant now) {
        return translate("compute statistics", () -> new LedgerStatistics(
                userRepository.count(),
                userRepository.countBySubscriptionEndAfter(now),
                paymentRepository.countByStatus(PaymentStatus.COMPLETED)
        ));
    }

    @Override
    public int deactivateExpired(Instant now) {
        return translate("deactivate expired subscriptions", () -> {
            List<Subscription> expired = subscriptionRepository.findByActiveTrueAndExpiresAtBefore(now);
            expired.forEach(subscription -> subscription.setActive(false));
            subscriptionRepository.saveAll(expired);
            return expired.size();
        });
    }

    private User insertUser(long id, Consumer<User> initializer) {
        User user = new User();
        user.setId(id);
        initializer.accept(user);
        try {
            return userRepository.insert(user);
        } catch (DuplicateKeyException e) {
            log.debug("User {} created concurrently, reloading", id);
            return userRepository.findById(id).orElseThrow(() -> e);
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        return translate(operation, () -> ledgerTransactionTemplate.execute(status -> work.get()));
    }

    private <T> T translate(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Ledger operation failed: {} reason={}", operation, e.getMessage());
            throw new PersistenceFailureException("Failed to " + operation, e);
        }
    }
}
