package io.github.fikiri.workflow.schedulers;

import java.util.UUID;

/**
 * Observer of workflow job attempts, called on the scheduler thread around each callback run.
 * An exception thrown here is logged and does not affect the job's schedule.
 */
public interface JobEventListener {
    /**
     * The attempt has been recorded as started and the callback is about to run.
     */
    default void onStart(UUID jobId) {
    }

    default void onComplete(UUID jobId) {
    }

    /**
     * The callback threw; the job stays enabled and runs again after its interval.
     */
    default void onError(UUID jobId, Throwable error) {
    }
}
