package com.nayem.tether.scheduler;

/**
 * Observes task outcomes. Callbacks run on scheduler worker threads and must not
 * block.
 */
public interface TaskListener {

    default void onTaskCompleted(TaskRequest request) {
    }

    default void onTaskRetry(TaskRequest request, long backoffMs) {
    }

    void onTaskFailed(TaskRequest request);
}
