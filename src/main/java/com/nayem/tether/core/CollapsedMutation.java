package com.nayem.tether.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The folded form of every edit pending for one identifier.
 *
 * @param operations the fewest operations with the same end state
 * @param sequence   store sequence of the persisted row, 0 when nothing is pending
 * @param createdAt  when the oldest edit folded into this mutation was recorded
 */
public record CollapsedMutation(List<MutationOperation> operations, long sequence, Instant createdAt) {

    private static final CollapsedMutation EMPTY = new CollapsedMutation(List.of(), 0, Instant.EPOCH);

    public CollapsedMutation {
        Objects.requireNonNull(createdAt, "createdAt");
        operations = List.copyOf(operations);
    }

    public static CollapsedMutation empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Token that stays the same for every retry of this exact row so the backend
     * can drop duplicate deliveries.
     */
    public String idempotencyToken(String identifier) {
        return identifier + ":" + sequence;
    }
}
