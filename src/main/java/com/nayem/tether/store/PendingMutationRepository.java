package com.nayem.tether.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Durable mapping from identifier to its single pending row.
 * <p>
 * Implementations:
 * - In-memory (tests, development)
 * - SQLite over JDBC (the on-device store)
 * - Redis (shared deployments)
 * </p>
 * <p>
 * Every write happens inside {@link #transaction}. Reads outside a transaction
 * observe the last committed state, and a crash at any point leaves either the
 * previous row or the new one.
 * </p>
 */
public interface PendingMutationRepository extends AutoCloseable {

    Optional<PersistedRow> find(String identifier);

    /**
     * All pending rows ordered by sequence.
     */
    List<PersistedRow> findAll();

    /**
     * Runs {@code work} against the identifier's row. Writes staged through the
     * {@link PendingTransaction} are committed atomically when {@code work}
     * returns and discarded when it throws.
     *
     * @throws StorageException if the transaction cannot be committed
     */
    <R> R transaction(String identifier, Function<PendingTransaction, R> work);

    @Override
    default void close() {
    }
}
