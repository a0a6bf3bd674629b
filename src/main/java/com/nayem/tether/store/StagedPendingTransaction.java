package com.nayem.tether.store;

import com.nayem.tether.core.MutationOperation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Collects the writes of one transaction so the owning repository can commit
 * them in a single step.
 */
class StagedPendingTransaction implements PendingTransaction {

    private final String identifier;
    private final LongSupplier nextSequence;
    private Optional<PersistedRow> row;
    private boolean dirty;

    StagedPendingTransaction(String identifier, Optional<PersistedRow> committed, LongSupplier nextSequence) {
        this.identifier = identifier;
        this.row = committed;
        this.nextSequence = nextSequence;
    }

    @Override
    public String identifier() {
        return identifier;
    }

    @Override
    public Optional<PersistedRow> current() {
        return row;
    }

    @Override
    public PersistedRow write(List<MutationOperation> operations, Instant createdAt, boolean attempted,
            List<MutationOperation> unsent) {
        PersistedRow written = new PersistedRow(identifier, operations, nextSequence.getAsLong(), createdAt,
                attempted, unsent);
        row = Optional.of(written);
        dirty = true;
        return written;
    }

    @Override
    public void delete() {
        row = Optional.empty();
        dirty = true;
    }

    boolean isDirty() {
        return dirty;
    }

    Optional<PersistedRow> staged() {
        return row;
    }
}
