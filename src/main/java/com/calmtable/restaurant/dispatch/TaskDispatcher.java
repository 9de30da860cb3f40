package com.calmtable.restaurant.dispatch;

/**
 * Runs side-effect work (e-mail delivery) outside the request that triggered it.
 */
public interface TaskDispatcher {

    /**
     * @param description short label used in logs
     * @param task        work to run; exceptions are logged by the dispatcher and not rethrown
     */
    void dispatch(String description, Runnable task);
}
