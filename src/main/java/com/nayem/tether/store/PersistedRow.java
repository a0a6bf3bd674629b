package com.nayem.tether.store;

import com.nayem.tether.core.CollapsedMutation;
import com.nayem.tether.core.MutationOperation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Durable form of the single pending mutation kept for an identifier.
 *
 * @param identifier channel or named-user id owning the row
 * @param operations collapsed operation list
 * @param sequence   value of the store-wide counter when the row was written
 * @param createdAt  when the oldest edit in the row was recorded
 * @param attempted  whether the row has been handed to the network at least once
 * @param unsent     edits appended after the row was last handed to the network,
 *                   collapsed on their own; always empty for a row never attempted
 */
public record PersistedRow(String identifier, List<MutationOperation> operations, long sequence,
        Instant createdAt, boolean attempted, List<MutationOperation> unsent) {

    public PersistedRow {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(createdAt, "createdAt");
        operations = List.copyOf(operations);
        unsent = List.copyOf(unsent);
    }

    public PersistedRow(String identifier, List<MutationOperation> operations, long sequence,
            Instant createdAt, boolean attempted) {
        this(identifier, operations, sequence, createdAt, attempted, List.of());
    }

    public CollapsedMutation toCollapsedMutation() {
        return new CollapsedMutation(operations, sequence, createdAt);
    }
}
