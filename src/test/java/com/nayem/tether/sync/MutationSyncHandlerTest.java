package com.nayem.tether.sync;

import com.nayem.tether.client.CancellationToken;
import com.nayem.tether.client.MutationApiClient;
import com.nayem.tether.client.SyncOutcome;
import com.nayem.tether.core.CollapsedMutation;
import com.nayem.tether.core.Mutation;
import com.nayem.tether.dlq.DeadLetterQueue;
import com.nayem.tether.dlq.InMemoryDeadLetterQueue;
import com.nayem.tether.metrics.SyncMetrics;
import com.nayem.tether.scheduler.ConflictPolicy;
import com.nayem.tether.scheduler.DefaultNetworkMonitor;
import com.nayem.tether.scheduler.TaskRequest;
import com.nayem.tether.scheduler.TaskResult;
import com.nayem.tether.store.InMemoryPendingMutationRepository;
import com.nayem.tether.store.StorageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class MutationSyncHandlerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

    private MutationStore store;
    private InMemoryDeadLetterQueue dlq;
    private SimpleMeterRegistry registry;
    private List<TaskRequest> requeued;

    @BeforeEach
    void setUp() {
        store = new MutationStore(new InMemoryPendingMutationRepository());
        dlq = new InMemoryDeadLetterQueue();
        registry = new SimpleMeterRegistry();
        requeued = new ArrayList<>();
    }

    private MutationSyncHandler handler(MutationApiClient client) {
        MutationSyncHandler handler = new MutationSyncHandler(store, client, dlq, new SyncMetrics(registry), null,
                Clock.fixed(NOW, ZoneOffset.UTC));
        handler.setRequeue(requeued::add);
        return handler;
    }

    private static TaskRequest request(String identifier) {
        return TaskRequest.of(MutationSyncHandler.TASK_TYPE, identifier, ConflictPolicy.KEEP);
    }

    private double count(String name) {
        return registry.counter(name).count();
    }

    @Test
    void successConfirmsAndDeletesRow() {
        store.append("ch-1", Mutation.editor().addTags("loyalty", "vip").build());
        MutationSyncHandler handler = handler((id, mutation, token) -> SyncOutcome.success(200));

        assertEquals(TaskResult.SUCCESS, handler.run(request("ch-1"), CancellationToken.none()));

        assertTrue(store.peek("ch-1").isEmpty());
        assertEquals(1.0, count("tether.sync.success"));
        assertEquals(1, registry.timer("tether.sync.send").count());
        assertTrue(requeued.isEmpty());
    }

    @Test
    void sendIsTimedWhenTheClientThrows() {
        store.append("ch-1", Mutation.editor().addTags("loyalty", "vip").build());
        MutationSyncHandler handler = handler((id, mutation, token) -> {
            throw new IllegalStateException("client bug");
        });

        assertThrows(IllegalStateException.class, () -> handler.run(request("ch-1"), CancellationToken.none()));
        assertEquals(1, registry.timer("tether.sync.send").count());
        assertTrue(store.peek("ch-1").isPresent());
    }

    @Test
    void nothingPendingSkipsTheNetwork() {
        MutationApiClient client = mock(MutationApiClient.class);

        assertEquals(TaskResult.SUCCESS, handler(client).run(request("ch-1"), CancellationToken.none()));

        verify(client, never()).send(anyString(), any(), any());
    }

    @Test
    void retryableKeepsRowAndToken() {
        store.append("ch-1", Mutation.editor().addTags("loyalty", "vip").build());
        List<String> tokens = new ArrayList<>();
        MutationSyncHandler handler = handler((id, mutation, token) -> {
            tokens.add(mutation.idempotencyToken(id));
            return SyncOutcome.retryable("server error", 503);
        });

        assertEquals(TaskResult.RETRY, handler.run(request("ch-1"), CancellationToken.none()));
        assertEquals(TaskResult.RETRY, handler.run(request("ch-1"), CancellationToken.none()));

        assertEquals(2, tokens.size());
        assertEquals(tokens.get(0), tokens.get(1));
        assertTrue(store.peek("ch-1").isPresent());
        assertEquals(2.0, count("tether.sync.retry"));
    }

    @Test
    void unrecoverableDropsRowAndDeadLetters() {
        store.append("ch-1", Mutation.editor().setAttribute("age", -1).build());
        List<SyncFailure> failures = new ArrayList<>();
        MutationSyncHandler handler = handler((id, mutation, token) -> SyncOutcome.unrecoverable("client error", 400));
        handler.addErrorListener(failures::add);

        assertEquals(TaskResult.FAILURE, handler.run(request("ch-1"), CancellationToken.none()));

        assertTrue(store.peek("ch-1").isEmpty());
        assertEquals(1, failures.size());
        assertEquals(400, failures.get(0).status());
        assertEquals(NOW, failures.get(0).occurredAt());
        DeadLetterQueue.DlqEntry entry = dlq.poll().orElseThrow();
        assertEquals("ch-1", entry.identifier());
        assertEquals(400, entry.status());
        assertEquals(failures.get(0).mutation().operations(), entry.operations());
        assertEquals(1.0, count("tether.sync.failed"));
        assertTrue(requeued.isEmpty());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        store.append("ch-1", Mutation.editor().setAttribute("age", -1).build());
        AtomicInteger notified = new AtomicInteger();
        MutationSyncHandler handler = handler((id, mutation, token) -> SyncOutcome.unrecoverable("client error", 422));
        handler.addErrorListener(failure -> {
            throw new IllegalStateException("listener bug");
        });
        handler.addErrorListener(failure -> notified.incrementAndGet());

        assertEquals(TaskResult.FAILURE, handler.run(request("ch-1"), CancellationToken.none()));
        assertEquals(1, notified.get());
    }

    @Test
    void appendDuringSendRequeuesNewerRow() {
        store.append("ch-1", Mutation.editor().addTags("loyalty", "vip").build());
        MutationSyncHandler handler = handler((id, mutation, token) -> {
            store.append(id, Mutation.editor().setAttribute("color", "red").build());
            return SyncOutcome.success(200);
        });

        assertEquals(TaskResult.SUCCESS, handler.run(request("ch-1"), CancellationToken.none()));

        CollapsedMutation remaining = store.peek("ch-1").orElseThrow();
        assertEquals(2, remaining.operations().size());
        assertEquals(1, requeued.size());
        assertEquals("ch-1", requeued.get(0).key());
        assertEquals(ConflictPolicy.KEEP, requeued.get(0).policy());
        assertEquals(Duration.ZERO, requeued.get(0).initialDelay());
        assertEquals(1.0, count("tether.sync.superseded"));
    }

    @Test
    void rejectionDuringAppendKeepsOnlyLaterEdits() {
        store.append("ch-1", Mutation.editor().setAttribute("age", -5).build());
        List<CollapsedMutation> delivered = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        List<SyncFailure> failures = new ArrayList<>();
        MutationSyncHandler handler = handler((id, mutation, token) -> {
            if (calls.incrementAndGet() == 1) {
                store.append(id, Mutation.editor().setAttribute("color", "red").build());
            }
            if (mutation.operations().stream().anyMatch(op -> op.target().equals("age"))) {
                return SyncOutcome.unrecoverable("invalid age", 400);
            }
            delivered.add(mutation);
            return SyncOutcome.success(200);
        });
        handler.addErrorListener(failures::add);

        assertEquals(TaskResult.FAILURE, handler.run(request("ch-1"), CancellationToken.none()));
        CollapsedMutation remaining = store.peek("ch-1").orElseThrow();
        assertEquals(1, remaining.operations().size());
        assertEquals("color", remaining.operations().get(0).target());
        assertEquals(1, requeued.size());

        assertEquals(TaskResult.SUCCESS, handler.run(requeued.get(0), CancellationToken.none()));

        assertEquals(2, calls.get());
        assertEquals(1, failures.size());
        assertEquals(1, dlq.size());
        assertEquals(1, delivered.size());
        assertEquals("color", delivered.get(0).operations().get(0).target());
        assertTrue(store.peek("ch-1").isEmpty());
    }

    @Test
    void storageFailureIsRetried() {
        MutationStore broken = mock(MutationStore.class);
        when(broken.markAttempted("ch-1")).thenThrow(new StorageException("locked"));
        MutationApiClient client = mock(MutationApiClient.class);
        MutationSyncHandler handler = new MutationSyncHandler(broken, client, null, null, null, Clock.systemUTC());

        assertEquals(TaskResult.RETRY, handler.run(request("ch-1"), CancellationToken.none()));
        verify(client, never()).send(anyString(), any(), any());
    }

    @Test
    void requestsWaitForNetworkWhenMonitored() {
        DefaultNetworkMonitor monitor = new DefaultNetworkMonitor(false);
        MutationSyncHandler handler = new MutationSyncHandler(store, (id, m, t) -> SyncOutcome.success(200), null,
                null, monitor, Clock.systemUTC());

        TaskRequest request = handler.requestFor("ch-1", Duration.ofSeconds(2));

        assertEquals(MutationSyncHandler.TASK_TYPE, request.type());
        assertEquals(Duration.ofSeconds(2), request.initialDelay());
        assertEquals(1, request.preconditions().size());
        assertFalse(request.preconditions().get(0).isSatisfied());
        monitor.setConnected(true);
        assertTrue(request.preconditions().get(0).isSatisfied());
    }
}
