package com.nayem.tether.sync;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nayem.tether.core.CollapsedMutation;
import com.nayem.tether.core.Mutation;
import com.nayem.tether.core.MutationCollapser;
import com.nayem.tether.core.MutationOperation;
import com.nayem.tether.store.PendingMutationRepository;
import com.nayem.tether.store.PersistedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the single pending row per identifier.
 * <p>
 * Every write folds the stored operations with the new ones and replaces the
 * row inside one repository transaction, so the row on disk is always the
 * collapsed form of everything not yet confirmed. Writers of the same identifier
 * are serialized by a per-identifier lock; different identifiers never block
 * each other.
 * </p>
 * <p>
 * While a row has never been handed to the network, opposite tag edits cancel.
 * {@link #markAttempted} flags the row before its first send; from then on the
 * later tag edit wins, because the remote side may already hold part of the row.
 * </p>
 */
public class MutationStore {

    private static final Logger log = LoggerFactory.getLogger(MutationStore.class);

    private final PendingMutationRepository repository;
    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();

    public MutationStore(PendingMutationRepository repository) {
        this.repository = repository;
    }

    /**
     * Folds {@code mutation} into the identifier's pending row.
     *
     * @return the collapsed pending state after the append, empty when the edits
     *         cancelled everything out
     * @throws com.nayem.tether.store.StorageException if the row cannot be written;
     *         the previous row is left as it was
     */
    public CollapsedMutation append(String identifier, Mutation mutation) {
        requireIdentifier(identifier);
        if (mutation.isEmpty()) {
            return peek(identifier).orElse(CollapsedMutation.empty());
        }
        return locked(identifier, () -> repository.transaction(identifier, tx -> {
            Optional<PersistedRow> current = tx.current();
            boolean attempted = current.map(PersistedRow::attempted).orElse(false);
            List<MutationOperation> pending = current.map(PersistedRow::operations).orElse(List.of());
            List<MutationOperation> collapsed = MutationCollapser.collapse(pending, mutation.operations(),
                    attempted ? MutationCollapser.Mode.NET_EFFECT : MutationCollapser.Mode.ANNIHILATE);

            if (collapsed.isEmpty()) {
                if (current.isPresent()) {
                    tx.delete();
                }
                log.debug("Pending edits for {} cancelled out", identifier);
                return CollapsedMutation.empty();
            }
            List<MutationOperation> unsent = attempted
                    ? MutationCollapser.collapse(current.get().unsent(), mutation.operations(),
                            MutationCollapser.Mode.NET_EFFECT)
                    : List.of();
            PersistedRow row = tx.write(collapsed,
                    current.map(PersistedRow::createdAt).orElse(mutation.createdAt()), attempted, unsent);
            log.debug("Appended {} operation(s) for {}, pending row now {} operation(s) at sequence {}",
                    mutation.operations().size(), identifier, collapsed.size(), row.sequence());
            return row.toCollapsedMutation();
        }));
    }

    public Optional<CollapsedMutation> peek(String identifier) {
        requireIdentifier(identifier);
        return repository.find(identifier)
                .filter(row -> !row.operations().isEmpty())
                .map(PersistedRow::toCollapsedMutation);
    }

    /**
     * Durably flags the pending row as handed to the network and returns the
     * exact row to send.
     * <p>
     * The first call for a row rewrites it with the flag set, which assigns a new
     * sequence. Later calls for the same row return it unchanged, so every retry
     * of one row carries the same idempotency token. A row holding edits appended
     * since its last hand-off is rewritten again, which folds those edits into
     * the row being sent.
     * </p>
     *
     * @return the row to send, empty when nothing is pending
     */
    public CollapsedMutation markAttempted(String identifier) {
        requireIdentifier(identifier);
        return locked(identifier, () -> repository.transaction(identifier, tx -> {
            Optional<PersistedRow> current = tx.current();
            if (current.isEmpty() || current.get().operations().isEmpty()) {
                return CollapsedMutation.empty();
            }
            PersistedRow row = current.get();
            if (row.attempted() && row.unsent().isEmpty()) {
                return row.toCollapsedMutation();
            }
            return tx.write(row.operations(), row.createdAt(), true).toCollapsedMutation();
        }));
    }

    /**
     * Removes the row if it is still the one that was sent.
     */
    public ConfirmResult confirmSent(String identifier, CollapsedMutation sent) {
        requireIdentifier(identifier);
        return locked(identifier, () -> repository.transaction(identifier, tx -> {
            Optional<PersistedRow> current = tx.current();
            if (current.isEmpty()) {
                return ConfirmResult.CONFIRMED;
            }
            if (current.get().sequence() != sent.sequence()) {
                log.debug("Row for {} moved from sequence {} to {} while sending",
                        identifier, sent.sequence(), current.get().sequence());
                return ConfirmResult.SUPERSEDED;
            }
            tx.delete();
            return ConfirmResult.CONFIRMED;
        }));
    }

    /**
     * Drops a row the backend rejected.
     * <p>
     * When the row is still the one that was sent it is deleted. When edits were
     * appended while it was in flight, only those edits are kept, as a row that
     * has never been attempted, and {@link ConfirmResult#SUPERSEDED} is returned.
     * </p>
     */
    public ConfirmResult rejectSent(String identifier, CollapsedMutation sent) {
        requireIdentifier(identifier);
        return locked(identifier, () -> repository.transaction(identifier, tx -> {
            Optional<PersistedRow> current = tx.current();
            if (current.isEmpty()) {
                return ConfirmResult.CONFIRMED;
            }
            PersistedRow row = current.get();
            if (row.sequence() == sent.sequence()) {
                tx.delete();
                return ConfirmResult.CONFIRMED;
            }
            if (!row.attempted()) {
                // cleared and refilled while sending, nothing of the rejected row is left
                return ConfirmResult.SUPERSEDED;
            }
            if (row.unsent().isEmpty()) {
                tx.delete();
                return ConfirmResult.CONFIRMED;
            }
            PersistedRow kept = tx.write(row.unsent(), row.createdAt(), false);
            log.debug("Dropped rejected operations for {}, keeping {} later operation(s) at sequence {}",
                    identifier, kept.operations().size(), kept.sequence());
            return ConfirmResult.SUPERSEDED;
        }));
    }

    /**
     * Every pending row ordered by sequence, oldest write first.
     */
    public List<PendingMutation> loadAllPending() {
        return repository.findAll().stream()
                .filter(row -> !row.operations().isEmpty())
                .map(row -> new PendingMutation(row.identifier(), row.toCollapsedMutation()))
                .toList();
    }

    /**
     * Drops whatever is pending for the identifier.
     */
    public void clear(String identifier) {
        requireIdentifier(identifier);
        locked(identifier, () -> repository.transaction(identifier, tx -> {
            if (tx.current().isPresent()) {
                tx.delete();
            }
            return null;
        }));
    }

    private <R> R locked(String identifier, Supplier<R> work) {
        ReentrantLock lock = locks.get(identifier, k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
    }
}
