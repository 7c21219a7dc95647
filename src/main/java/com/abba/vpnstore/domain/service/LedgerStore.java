package com.abba.vpnstore.domain.service;

import com.abba.vpnstore.domain.model.LedgerStatistics;
import com.abba.vpnstore.domain.model.Payment;
import com.abba.vpnstore.domain.model.Subscription;
import com.abba.vpnstore.domain.model.User;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Persistence of users and their append-only subscription and payment history.
 * <p>
 * Implementations translate storage errors into
 * {@link com.abba.vpnstore.domain.exception.PersistenceFailureException}.
 */
public interface LedgerStore {

    Optional<User> getUser(long id);

    /**
     * Creates the user unless it already exists.
     *
     * @param initializer fills the fields of a brand-new user, not called for an existing one
     * @return the stored user, new or existing
     */
    User createUser(long id, Consumer<User> initializer);

    /**
     * Runs a read-modify-write of one user. Calls for the same identity never interleave, and
     * records appended from inside the mutator are committed together with the user change.
     * If the mutator throws, nothing is persisted.
     *
     * @throws com.abba.vpnstore.domain.exception.UserNotFoundException if the user does not exist
     */
    <T> T updateUser(long id, Function<User, T> mutator);

    Subscription appendSubscription(Subscription subscription);

    Payment appendPayment(Payment payment);

    /**
     * Appends both records in a single transaction.
     *
     * @throws com.abba.vpnstore.domain.exception.PaymentIntegrityException if either write fails,
     *                                                                      after rolling both back
     */
    void appendSubscriptionAndPayment(Subscription subscription, Payment payment);

    boolean isPaymentRecorded(String externalReference);

    List<Subscription> findSubscriptions(long userId);

    long countReferrals(long userId);

    LedgerStatistics statistics(Instant now);

    /**
     * Clears the active flag of subscription records that expired before {@code now}.
     *
     * @return number of records changed
     */
    int deactivateExpired(Instant now);
}
