package com.skyport.panel.api.repository;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per store key. Locks are taken in natural key order so that two
 * callers asking for overlapping key sets cannot deadlock. A key's lock is dropped from the
 * registry once no caller holds or waits for it.
 */
@Component
public class KeyLockRegistry {

    private final Map<String, KeyLock> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        Deque<String> held = new ArrayDeque<>();
        try {
            for (String key : new TreeSet<>(keys)) {
                KeyLock keyLock = locks.compute(key, (ignored, existing) -> {
                    KeyLock acquired = existing == null ? new KeyLock() : existing;
                    acquired.users++;
                    return acquired;
                });
                held.push(key);
                keyLock.lock.lock();
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) {
                release(held.pop());
            }
        }
    }

    int trackedKeys() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (ignored, keyLock) -> {
            if (keyLock.lock.isHeldByCurrentThread()) {
                keyLock.lock.unlock();
            }
            return --keyLock.users == 0 ? null : keyLock;
        });
    }

    // users is only touched inside map compute calls for its key
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
