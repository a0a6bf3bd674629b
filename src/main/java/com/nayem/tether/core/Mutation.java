package com.nayem.tether.core;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An ordered batch of edits recorded for one identifier.
 * <p>
 * Mutations are immutable. The {@link com.nayem.tether.sync.MutationStore} folds
 * every mutation appended for an identifier into a single
 * {@link CollapsedMutation} before anything is sent over the network.
 * </p>
 *
 * @param operations edits in the order they were made
 * @param createdAt  when the batch was recorded
 */
public record Mutation(List<MutationOperation> operations, Instant createdAt) {

    public Mutation {
        Objects.requireNonNull(operations, "operations");
        Objects.requireNonNull(createdAt, "createdAt");
        operations = List.copyOf(operations);
    }

    public static Mutation of(MutationOperation... operations) {
        return new Mutation(List.of(operations), Instant.now());
    }

    public static MutationEditor editor() {
        return new MutationEditor(Clock.systemUTC());
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
