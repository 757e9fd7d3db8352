package com.warden.core.events;

/**
 * Callback for a per-job subscription. Invocations for one subscription never overlap.
 */
public interface JobEventListener {

    void onEvent(JobEvent event);

    /**
     * Called once after the job reached a terminal state and every buffered event
     * has been delivered.
     */
    default void onComplete() {
    }
}
