package com.calmtable.restaurant.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of striped locks addressed by string key. Two keys may share a stripe, which only
 * serializes more than strictly needed; the same key always maps to the same lock.
 */
@Component
public class KeyedLockRegistry {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public KeyedLockRegistry() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock(true);
        }
    }

    public ReentrantLock lockFor(String key) {
        return locks[Math.floorMod(key.hashCode(), STRIPES)];
    }
}
