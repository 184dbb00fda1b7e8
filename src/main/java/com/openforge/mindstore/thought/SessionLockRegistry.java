package com.openforge.mindstore.thought;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keyed mutex: one lock per session id. Writes to the same session
 * serialize, different sessions proceed in parallel.
 *
 * The thought store owns one registry and lends it to the relation and
 * result stores, so a session clear and any write to that session never
 * interleave. Locks are reentrant and never evicted (one small object per
 * session seen).
 */
public class SessionLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String sessionId, Runnable action) {
        withLock(sessionId, () -> {
            action.run();
            return null;
        });
    }

    ReentrantLock lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
    }

    int size() {
        return locks.size();
    }
}
