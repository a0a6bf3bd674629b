package com.nayem.tether.store;

import com.nayem.tether.core.MutationOperation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * View of one identifier's row inside a
 * {@link PendingMutationRepository#transaction transaction}. Writes are staged
 * and only become visible when the transaction commits.
 */
public interface PendingTransaction {

    String identifier();

    /**
     * The row as of the start of the transaction, with staged writes applied.
     */
    Optional<PersistedRow> current();

    /**
     * Replaces the row, assigning it the next sequence number.
     */
    PersistedRow write(List<MutationOperation> operations, Instant createdAt, boolean attempted,
            List<MutationOperation> unsent);

    default PersistedRow write(List<MutationOperation> operations, Instant createdAt, boolean attempted) {
        return write(operations, createdAt, attempted, List.of());
    }

    void delete();
}
