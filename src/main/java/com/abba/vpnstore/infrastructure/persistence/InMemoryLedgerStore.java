package com.abba.vpnstore.infrastructure.persistence;

import com.abba.vpnstore.domain.exception.PaymentIntegrityException;
import com.abba.vpnstore.domain.exception.UserNotFoundException;
import com.abba.vpnstore.domain.model.LedgerStatistics;
import com.abba.vpnstore.domain.model.Payment;
import com.abba.vpnstore.domain.model.PaymentStatus;
import com.abba.vpnstore.domain.model.Subscription;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.service.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Process-local ledger for development runs and tests.
 * <p>
 * Writes made during one {@link #updateUser} call are staged and applied only when the mutator
 * returns, which gives the same all-or-nothing behaviour as the MongoDB store.
 */
@Component
@ConditionalOnProperty(prefix = "vpnstore", name = "ledger-store", havingValue = "memory")
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final List<Payment> payments = new ArrayList<>();
    private final ThreadLocal<UnitOfWork> currentUnit = new ThreadLocal<>();
    private final IdentityLocks identityLocks;

    public InMemoryLedgerStore(IdentityLocks identityLocks) {
        this.identityLocks = identityLocks;
    }

    @Override
    public Optional<User> getUser(long id) {
        return Optional.ofNullable(users.get(id)).map(User::copy);
    }

    @Override
    public User createUser(long id, Consumer<User> initializer) {
        return identityLocks.withLock(id, () -> users.computeIfAbsent(id, key -> {
            User user = new User();
            user.setId(key);
            initializer.accept(user);
            return user;
        }).copy());
    }

    @Override
    public <T> T updateUser(long id, Function<User, T> mutator) {
        return identityLocks.withLock(id, () -> inUnit(unit -> {
            User stored = users.get(id);
            if (stored == null) {
                throw new UserNotFoundException("User " + id + " not registered");
            }
            User working = stored.copy();
            T result = mutator.apply(working);
            unit.stage(() -> users.put(id, working));
            return result;
        }));
    }

    @Override
    public Subscription appendSubscription(Subscription subscription) {
        return inUnit(unit -> stageSubscription(unit, subscription));
    }

    @Override
    public Payment appendPayment(Payment payment) {
        return inUnit(unit -> stagePayment(unit, payment));
    }

    @Override
    public void appendSubscriptionAndPayment(Subscription subscription, Payment payment) {
        inUnit(unit -> {
            int mark = unit.size();
            stageSubscription(unit, subscription);
            try {
                stagePayment(unit, payment);
            } catch (RuntimeException e) {
                unit.discardFrom(mark);
                log.error("Rolled back subscription and payment userId={} externalReference={} reason={}",
                        payment.getUserId(), payment.getExternalReference(), e.getMessage(), e);
                throw new PaymentIntegrityException(
                        "Could not record payment " + payment.getExternalReference() + " with its subscription", e);
            }
            return null;
        });
    }

    @Override
    public boolean isPaymentRecorded(String externalReference) {
        synchronized (payments) {
            return payments.stream().anyMatch(payment -> Objects.equals(externalReference, payment.getExternalReference()));
        }
    }

    @Override
    public List<Subscription> findSubscriptions(long userId) {
        synchronized (subscriptions) {
            return subscriptions.stream()
                    .filter(subscription -> subscription.getUserId() == userId)
                    .sorted(Comparator.comparing(Subscription::getStartedAt).reversed())
                    .map(Subscription::copy)
                    .toList();
        }
    }

    public List<Payment> findPayments(long userId) {
        synchronized (payments) {
            return payments.stream()
                    .filter(payment -> payment.getUserId() == userId)
                    .map(Payment::copy)
                    .toList();
        }
    }

    @Override
    public long countReferrals(long userId) {
        return users.values().stream()
                .filter(user -> Objects.equals(user.getReferrerId(), userId))
                .count();
    }

    @Override
    public LedgerStatistics statistics(Instant now) {
        long active = users.values().stream()
                .filter(user -> user.getSubscriptionEnd() != null && user.getSubscriptionEnd().isAfter(now))
                .count();
        long completed;
        synchronized (payments) {
            completed = payments.stream().filter(payment -> payment.getStatus() == PaymentStatus.COMPLETED).count();
        }
        return new LedgerStatistics(users.size(), active, completed);
    }

    @Override
    public int deactivateExpired(Instant now) {
        synchronized (subscriptions) {
            int changed = 0;
            for (Subscription subscription : subscriptions) {
                if (subscription.isActive() && subscription.getExpiresAt().isBefore(now)) {
                    subscription.setActive(false);
                    changed++;
                }
            }
            return changed;
        }
    }

    /**
     * Called after the subscription of a combined append is staged and before its payment is.
     */
    protected void beforePaymentWrite(Payment payment) {
    }

    private Subscription stageSubscription(UnitOfWork unit, Subscription subscription) {
        if (subscription.getId() == null) {
            subscription.setId(UUID.randomUUID().toString());
        }
        Subscription stored = subscription.copy();
        unit.stage(() -> {
            synchronized (subscriptions) {
                subscriptions.add(stored);
            }
        });
        return subscription;
    }

    private Payment stagePayment(UnitOfWork unit, Payment payment) {
        beforePaymentWrite(payment);
        if (payment.getExternalReference() != null && isPaymentRecorded(payment.getExternalReference())) {
            throw new DuplicateKeyException("Payment " + payment.getExternalReference() + " already recorded");
        }
        if (payment.getId() == null) {
            payment.setId(UUID.randomUUID().toString());
        }
        Payment stored = payment.copy();
        unit.stage(() -> {
            synchronized (payments) {
                payments.add(stored);
            }
        });
        return payment;
    }

    private <T> T inUnit(Function<UnitOfWork, T> work) {
        UnitOfWork joined = currentUnit.get();
        if (joined != null) {
            return work.apply(joined);
        }
        UnitOfWork unit = new UnitOfWork();
        currentUnit.set(unit);
        try {
            T result = work.apply(unit);
            unit.commit();
            return result;
        } finally {
            currentUnit.remove();
        }
    }

    private static final class UnitOfWork {

        private final List<Runnable> staged = new ArrayList<>();

        void stage(Runnable write) {
            staged.add(write);
        }

        int size() {
            return staged.size();
        }

        void discardFrom(int mark) {
            staged.subList(mark, staged.size()).clear();
        }

        void commit() {
            staged.forEach(Runnable::run);
        }
    }
}
