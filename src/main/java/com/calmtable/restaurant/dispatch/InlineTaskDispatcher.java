package com.calmtable.restaurant.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each task on the calling thread. Used by tests and when no worker pool is wanted.
 */
public class InlineTaskDispatcher implements TaskDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(InlineTaskDispatcher.class);

    @Override
    public void dispatch(String description, Runnable task) {
        runSafely(description, task);
    }

    static void runSafely(String description, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.error("[TaskDispatcher] Task '{}' failed: {}", description, e.getMessage(), e);
        }
    }
}
