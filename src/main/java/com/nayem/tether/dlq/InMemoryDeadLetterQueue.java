package com.nayem.tether.dlq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory {@link DeadLetterQueue}. Entries are lost on restart.
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterQueue.class);

    private final Queue<DlqEntry> queue = new ConcurrentLinkedQueue<>();
    private final Map<String, DlqEntry> entriesById = new ConcurrentHashMap<>();

    @Override
    public void send(DlqEntry entry) {
        queue.offer(entry);
        entriesById.put(entry.id(), entry);
        log.warn("Mutation dead-lettered: identifier={}, status={}, reason={}",
                entry.identifier(), entry.status(), entry.reason());
    }

    @Override
    public Optional<DlqEntry> peek() {
        return Optional.ofNullable(queue.peek());
    }

    @Override
    public Optional<DlqEntry> poll() {
        DlqEntry entry = queue.poll();
        if (entry != null) {
            entriesById.remove(entry.id());
        }
        return Optional.ofNullable(entry);
    }

    @Override
    public void acknowledge(String entryId) {
        DlqEntry removed = entriesById.remove(entryId);
        if (removed != null) {
            queue.remove(removed);
            log.info("DLQ entry acknowledged: id={}", entryId);
        }
    }

    @Override
    public long size() {
        return queue.size();
    }

    @Override
    public List<DlqEntry> list(int limit) {
        return queue.stream().limit(limit).toList();
    }

    public void clear() {
        queue.clear();
        entriesById.clear();
    }
}
