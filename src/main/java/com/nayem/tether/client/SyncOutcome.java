package com.nayem.tether.client;

/**
 * Classified result of one attempt to apply a mutation remotely.
 * <ul>
 * <li>{@link Success}: the backend accepted the mutation</li>
 * <li>{@link RetryableFailure}: worth trying again later (transport error, timeout, 429, 5xx)</li>
 * <li>{@link UnrecoverableFailure}: the backend rejected the mutation itself; retrying cannot help</li>
 * </ul>
 */
public sealed interface SyncOutcome
        permits SyncOutcome.Success, SyncOutcome.RetryableFailure, SyncOutcome.UnrecoverableFailure {

    enum Kind {
        SUCCESS,
        RETRYABLE,
        UNRECOVERABLE
    }

    Kind kind();

    static SyncOutcome success(int status) {
        return new Success(status);
    }

    static SyncOutcome retryable(String reason, Integer status) {
        return new RetryableFailure(reason, status);
    }

    static SyncOutcome unrecoverable(String reason, int status) {
        return new UnrecoverableFailure(reason, status);
    }

    record Success(int status) implements SyncOutcome {
        @Override
        public Kind kind() {
            return Kind.SUCCESS;
        }
    }

    /**
     * @param status HTTP status, or {@code null} when no response was received
     */
    record RetryableFailure(String reason, Integer status) implements SyncOutcome {
        @Override
        public Kind kind() {
            return Kind.RETRYABLE;
        }
    }

    record UnrecoverableFailure(String reason, int status) implements SyncOutcome {
        @Override
        public Kind kind() {
            return Kind.UNRECOVERABLE;
        }
    }
}
