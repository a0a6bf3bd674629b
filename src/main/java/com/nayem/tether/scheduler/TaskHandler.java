package com.nayem.tether.scheduler;

import com.nayem.tether.client.CancellationToken;

/**
 * Runs one attempt of a task type. Must honour the cancellation token and may
 * throw; a thrown exception counts as {@link TaskResult#RETRY}.
 */
@FunctionalInterface
public interface TaskHandler {

    TaskResult run(TaskRequest request, CancellationToken cancellation) throws Exception;
}
