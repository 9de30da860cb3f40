package com.calmtable.restaurant.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs a unit of work in one transaction while holding the in-process lock for a key.
 * The lock is taken before the transaction begins and released after it has committed or
 * rolled back. Attempts that fail because SQLite reports the database as locked are retried
 * with exponential backoff.
 */
@Component
public class LockedTransactionRunner {

    private static final Logger logger = LoggerFactory.getLogger(LockedTransactionRunner.class);

    private final KeyedLockRegistry lockRegistry;
    private final TransactionTemplate txTemplate;
    private final int maxRetries;
    private final long baseDelayMillis;

    public LockedTransactionRunner(KeyedLockRegistry lockRegistry,
                                   PlatformTransactionManager transactionManager,
                                   @Value("${calmtable.lock.max-retries:5}") int maxRetries,
                                   @Value("${calmtable.lock.base-delay-ms:100}") long baseDelayMillis) {
        this.lockRegistry = lockRegistry;
        this.txTemplate = new TransactionTemplate(transactionManager);
        this.maxRetries = Math.max(1, maxRetries);
        this.baseDelayMillis = baseDelayMillis;
    }

    public <T> T execute(String lockKey, Supplier<T> work) {
        int retryCount = 0;
        while (true) {
            try {
                return runOnce(lockKey, work);
            } catch (RuntimeException e) {
                if (!isDatabaseLocked(e)) {
                    throw e;
                }
                if (retryCount >= maxRetries - 1) {
                    throw new IllegalStateException(
                            "Gave up on '" + lockKey + "' after " + maxRetries + " attempts due to database lock", e);
                }
                retryCount++;
                long delay = baseDelayMillis * (1L << (retryCount - 1));
                logger.warn("[LockedTransactionRunner] Database locked for '{}', retry {}/{} in {}ms",
                        lockKey, retryCount, maxRetries, delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting to retry '" + lockKey + "'", ie);
                }
            }
        }
    }

    private <T> T runOnce(String lockKey, Supplier<T> work) {
        ReentrantLock lock = lockRegistry.lockFor(lockKey);
        lock.lock();
        try {
            return txTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    static boolean isDatabaseLocked(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            String message = current.getMessage() != null ? current.getMessage().toLowerCase() : "";
            if (message.contains("database is locked") || message.contains("sqlite_busy")) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
