package com.marketplace.conversation.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per buyer. Work for the same buyer runs one at a time in arrival order,
 * work for different buyers does not contend. A buyer's lock is dropped once nobody holds
 * or waits for it.
 */
@Component
public class BuyerLockRegistry {

    private static final class BuyerLock {
        final ReentrantLock lock = new ReentrantLock(true);
        int users;                      // guarded by the map's per-key compute
    }

    private final ConcurrentHashMap<String, BuyerLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String buyerId, Supplier<T> work) {
        BuyerLock entry = locks.compute(buyerId, (id, existing) -> {
            BuyerLock lock = existing != null ? existing : new BuyerLock();
            lock.users++;
            return lock;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(buyerId, (id, lock) -> --lock.users == 0 ? null : lock);
        }
    }

    int trackedBuyers() {
        return locks.size();
    }
}
