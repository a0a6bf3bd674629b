package com.nayem.tether.client;

import com.nayem.tether.core.CollapsedMutation;

/**
 * Applies a collapsed mutation to the backend.
 * <p>
 * Implementations never throw for network or HTTP problems; every failure is
 * classified into a {@link SyncOutcome}. A cancelled token aborts the in-flight
 * request and yields a retryable outcome.
 * </p>
 */
public interface MutationApiClient {

    SyncOutcome send(String identifier, CollapsedMutation mutation, CancellationToken cancellation);
}
