package com.abba.vpnstore.infrastructure.persistence;

import com.abba.vpnstore.domain.exception.PaymentIntegrityException;
import com.abba.vpnstore.domain.exception.PersistenceFailureException;
import com.abba.vpnstore.domain.exception.UserNotFoundException;
import com.abba.vpnstore.domain.model.Language;
import com.abba.vpnstore.domain.model.Payment;
import com.abba.vpnstore.domain.model.Subscription;
import com.abba.vpnstore.domain.model.User;
import com.abba.vpnstore.domain.repository.PaymentRepository;
import com.abba.vpnstore.domain.repository.SubscriptionRepository;
import com.abba.vpnstore.domain.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoLedgerStoreTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final SimpleTransactionStatus status = new SimpleTransactionStatus();
    private MongoLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new MongoLedgerStore(userRepository, subscriptionRepository, paymentRepository,
                new TransactionTemplate(transactionManager), new IdentityLocks());
    }

    @Test
    void updateUserSavesMutatedUserInsideTransaction() {
        User user = user(1L);
        when(transactionManager.getTransaction(any())).thenReturn(status);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));

        Language result = store.updateUser(1L, stored -> {
            stored.setLanguage(Language.RU);
            return stored.getLanguage();
        });

        assertThat(result).isEqualTo(Language.RU);
        verify(userRepository).save(user);
        verify(transactionManager).commit(status);
    }

    @Test
    void updateUserOfUnknownIdentityRollsBack() {
        when(transactionManager.getTransaction(any())).thenReturn(status);
        when(userRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.updateUser(5L, stored -> null)).isInstanceOf(UserNotFoundException.class);

        verify(transactionManager).rollback(status);
        verify(userRepository, never()).save(any(User.class));
    }

    @Test
    @DisplayName("Failed payment insert rolls back the subscription insert")
    void combinedAppendRollsBackOnFailure() {
        Subscription subscription = new Subscription();
        Payment payment = new Payment();
        payment.setExternalReference("charge-1");
        when(transactionManager.getTransaction(any())).thenReturn(status);
        when(paymentRepository.insert(any(Payment.class))).thenThrow(new DuplicateKeyException("duplicate charge"));

        assertThatThrownBy(() -> store.appendSubscriptionAndPayment(subscription, payment))
                .isInstanceOf(PaymentIntegrityException.class)
                .hasCauseInstanceOf(DuplicateKeyException.class);

        verify(subscriptionRepository).insert(subscription);
        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(status);
    }

    @Test
    void storeOutageBecomesPersistenceFailure() {
        when(userRepository.findById(1L)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.getUser(1L)).isInstanceOf(PersistenceFailureException.class);
    }

    @Test
    void concurrentCreateReloadsExistingUser() {
        User existing = user(1L);
        when(userRepository.findById(1L)).thenReturn(Optional.empty(), Optional.of(existing));
        when(userRepository.insert(any(User.class))).thenThrow(new DuplicateKeyException("exists"));

        User created = store.createUser(1L, user -> user.setDisplayName("late"));

        assertThat(created).isSameAs(existing);
    }

    @Test
    void deactivatesExpiredRecords() {
        Instant now = Instant.parse("2025-03-01T00:00:00Z");
        Subscription lapsed = new Subscription();
        when(subscriptionRepository.findByActiveTrueAndExpiresAtBefore(now)).thenReturn(List.of(lapsed));

        assertThat(store.deactivateExpired(now)).isEqualTo(1);

        assertThat(lapsed.isActive()).isFalse();
        verify(subscriptionRepository).saveAll(List.of(lapsed));
    }

    private static User user(long id) {
        User user = new User();
        user.setId(id);
        return user;
    }
}
