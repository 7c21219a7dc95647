package com.abba.vpnstore.infrastructure.persistence;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutual-exclusion scope per user identity. Different identities never wait on each other.
 * Locks are weakly held, so an identity's lock is dropped once no thread holds or waits on it.
 */
@Component
public class IdentityLocks {

    private final Cache<Long, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public <T> T withLock(long identity, Supplier<T> action) {
        ReentrantLock lock = locks.get(identity, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
