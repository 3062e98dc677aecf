package in.candlevault.application.service;

import in.candlevault.domain.data.FetchTask;

/**
 * Callbacks from {@link TaskScheduler}, invoked on worker threads outside
 * the scheduler's lock.
 */
public interface TaskListener {

    TaskListener NONE = new TaskListener() {
    };

    /**
     * Checked before every attempt; returning false drops the task.
     */
    default boolean isWanted(FetchTask task) {
        return true;
    }

    default void onSuccess(FetchTask task, int attempt, TaskOutcome outcome) {
    }

    /**
     * An attempt failed; {@code willRetry} tells whether another attempt is scheduled.
     */
    default void onFailure(FetchTask task, int attempt, Throwable failure, boolean willRetry) {
    }

    /**
     * The task will not be attempted again.
     */
    default void onAbandoned(FetchTask task, int attempt, Throwable failure) {
    }
}
