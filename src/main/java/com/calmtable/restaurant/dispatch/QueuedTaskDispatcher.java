package com.calmtable.restaurant.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

/**
 * Hands tasks to a bounded executor. When the queue is full or the executor is shutting down the
 * task runs on the caller's thread instead of being dropped.
 */
public class QueuedTaskDispatcher implements TaskDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(QueuedTaskDispatcher.class);

    private final TaskExecutor executor;

    public QueuedTaskDispatcher(TaskExecutor executor) {
        this.executor = executor;
    }

    @Override
    public void dispatch(String description, Runnable task) {
        try {
            executor.execute(() -> InlineTaskDispatcher.runSafely(description, task));
        } catch (TaskRejectedException e) {
            logger.warn("[QueuedTaskDispatcher] Queue rejected '{}', running inline: {}", description, e.getMessage());
            InlineTaskDispatcher.runSafely(description, task);
        }
    }
}
