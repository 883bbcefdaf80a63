package com.ai.trialmatch.component;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per user id so requests for the same user run one at a time, in arrival order,
 * while different users never contend. Entries are reference counted and dropped once no request
 * holds or waits on them.
 */
@Component
public class SessionLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionLockRegistry.class);

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration acquireTimeout;

    public SessionLockRegistry(@Value("${trialmatch.session.lock-timeout:30s}") Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Waits up to the configured timeout for the user's lock.
     *
     * @return a handle to close when done, or empty if the lock could not be taken in time
     */
    public Optional<Handle> acquire(String userId) {
        LockEntry entry = locks.compute(userId, (key, current) -> {
            LockEntry e = current != null ? current : new LockEntry();
            e.users++;
            return e;
        });
        boolean locked = false;
        try {
            locked = entry.lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!locked) {
            release(userId, entry);
            log.warn("[{}] Timed out after {} waiting for session lock", userId, acquireTimeout);
            return Optional.empty();
        }
        return Optional.of(new Handle(userId, entry));
    }

    int activeKeys() {
        return locks.size();
    }

    private void release(String userId, LockEntry entry) {
        locks.computeIfPresent(userId, (key, current) -> {
            if (current != entry) return current;
            current.users--;
            return current.users <= 0 ? null : current;
        });
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    public final class Handle implements AutoCloseable {

        private final String userId;
        private final LockEntry entry;
        private boolean closed;

        private Handle(String userId, LockEntry entry) {
            this.userId = userId;
            this.entry = entry;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            entry.lock.unlock();
            release(userId, entry);
        }
    }
}
