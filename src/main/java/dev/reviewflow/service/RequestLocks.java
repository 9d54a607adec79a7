package dev.reviewflow.service;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped in-process locks keyed by review request id. Serializes engine
 * operations on one request inside a single JVM; across JVMs the row lock
 * taken by {@code findByIdForUpdate} does the same job.
 */
@Component
public class RequestLocks {
    private static final int STRIPES = 64;

    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public RequestLocks() {
        for (int i = 0; i < STRIPES; i++) stripes[i] = new ReentrantLock();
    }

    public <T> T withLock(UUID requestId, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(requestId.hashCode(), STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
