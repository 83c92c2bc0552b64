package com.creditintel.backend.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-issuer single-writer locks, created on demand and dropped once no thread holds or waits on
 * them. Work for different issuers never contends.
 */
public final class IssuerLocks {

    private final ConcurrentHashMap<String, Slot> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String issuerId, Supplier<T> action) {
        Slot slot = locks.compute(issuerId, (id, existing) -> {
            Slot claimed = existing == null ? new Slot() : existing;
            claimed.users++;
            return claimed;
        });
        slot.lock.lock();
        try {
            return action.get();
        } finally {
            slot.lock.unlock();
            locks.computeIfPresent(issuerId, (id, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    public boolean isHeldByCurrentThread(String issuerId) {
        Slot slot = locks.get(issuerId);
        return slot != null && slot.lock.isHeldByCurrentThread();
    }

    /**
     * Issuers with a lock currently held or awaited.
     */
    public int activeIssuers() {
        return locks.size();
    }

    private static final class Slot {

        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
