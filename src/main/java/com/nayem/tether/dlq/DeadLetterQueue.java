package com.nayem.tether.dlq;

import com.nayem.tether.core.MutationOperation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keeps mutations the backend rejected as unrecoverable, so they can be
 * inspected or replayed by an operator after they were dropped from the
 * pending store.
 */
public interface DeadLetterQueue {

    void send(DlqEntry entry);

    /**
     * @return the oldest entry without removing it
     */
    Optional<DlqEntry> peek();

    /**
     * Retrieves and removes the oldest entry.
     */
    Optional<DlqEntry> poll();

    /**
     * Removes the entry with the given id, if still queued.
     */
    void acknowledge(String entryId);

    long size();

    /**
     * Lists up to {@code limit} entries, oldest first.
     */
    List<DlqEntry> list(int limit);

    /**
     * @param identifier channel or named-user id the mutation belonged to
     * @param operations the collapsed operations that were rejected
     * @param sequence   sequence of the rejected row
     * @param reason     classified failure reason
     * @param status     HTTP status returned by the backend
     */
    record DlqEntry(
            String id,
            String identifier,
            List<MutationOperation> operations,
            long sequence,
            String reason,
            int status,
            Instant timestamp) {

        public DlqEntry {
            operations = List.copyOf(operations);
        }
    }
}
