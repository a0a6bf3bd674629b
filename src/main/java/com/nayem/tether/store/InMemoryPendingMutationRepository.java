package com.nayem.tether.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Keeps pending rows in process memory. Rows do not survive a restart, so this
 * is meant for tests and for hosts that opt out of durability.
 */
public class InMemoryPendingMutationRepository implements PendingMutationRepository {

    private final Map<String, PersistedRow> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock writeLock = new ReentrantLock();

    @Override
    public Optional<PersistedRow> find(String identifier) {
        return Optional.ofNullable(rows.get(identifier));
    }

    @Override
    public List<PersistedRow> findAll() {
        List<PersistedRow> all = new ArrayList<>(rows.values());
        all.sort(Comparator.comparingLong(PersistedRow::sequence));
        return all;
    }

    @Override
    public <R> R transaction(String identifier, Function<PendingTransaction, R> work) {
        writeLock.lock();
        try {
            StagedPendingTransaction tx = new StagedPendingTransaction(identifier, find(identifier),
                    sequence::incrementAndGet);
            R result = work.apply(tx);
            if (tx.isDirty()) {
                tx.staged().ifPresentOrElse(row -> rows.put(identifier, row), () -> rows.remove(identifier));
            }
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        return rows.size();
    }
}
