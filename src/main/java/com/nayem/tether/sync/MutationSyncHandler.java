package com.nayem.tether.sync;

import com.nayem.tether.client.CancellationToken;
import com.nayem.tether.client.MutationApiClient;
import com.nayem.tether.client.SyncOutcome;
import com.nayem.tether.core.CollapsedMutation;
import com.nayem.tether.dlq.DeadLetterQueue;
import com.nayem.tether.metrics.SyncMetrics;
import com.nayem.tether.scheduler.ConflictPolicy;
import com.nayem.tether.scheduler.NetworkMonitor;
import com.nayem.tether.scheduler.Precondition;
import com.nayem.tether.scheduler.TaskHandler;
import com.nayem.tether.scheduler.TaskRequest;
import com.nayem.tether.scheduler.TaskResult;
import com.nayem.tether.store.StorageException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Task handler that pushes one identifier's pending row to the backend.
 * <p>
 * Flow per run: flag the row as attempted and take it, send it, then confirm.
 * If edits were appended while the request was in flight, the confirmation
 * reports the row as superseded and the sync re-enqueues itself for the newer
 * row. A rejected row is dropped on its own: edits appended while it was in
 * flight stay pending and get a request of their own.
 * </p>
 */
public class MutationSyncHandler implements TaskHandler {

    public static final String TASK_TYPE = "mutation-sync";

    private static final Logger log = LoggerFactory.getLogger(MutationSyncHandler.class);

    private final MutationStore store;
    private final MutationApiClient apiClient;
    private final DeadLetterQueue deadLetterQueue;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final List<SyncErrorListener> errorListeners = new CopyOnWriteArrayList<>();
    private final List<Precondition> preconditions;
    private volatile Consumer<TaskRequest> requeue = request -> {
    };

    public MutationSyncHandler(MutationStore store, MutationApiClient apiClient, DeadLetterQueue deadLetterQueue,
            SyncMetrics metrics, NetworkMonitor networkMonitor, Clock clock) {
        this.store = store;
        this.apiClient = apiClient;
        this.deadLetterQueue = deadLetterQueue;
        this.metrics = metrics != null ? metrics : SyncMetrics.noOp();
        this.clock = clock;
        this.preconditions = networkMonitor != null
                ? List.of(Precondition.networkAvailable(networkMonitor))
                : List.of();
    }

    /**
     * Where follow-up syncs go, normally {@code TaskScheduler::enqueue}.
     */
    public void setRequeue(Consumer<TaskRequest> requeue) {
        this.requeue = requeue;
    }

    public void addErrorListener(SyncErrorListener listener) {
        errorListeners.add(listener);
    }

    public void removeErrorListener(SyncErrorListener listener) {
        errorListeners.remove(listener);
    }

    /**
     * The request that syncs {@code identifier}. Appends use {@link ConflictPolicy#KEEP}
     * so a burst of edits coalesces into the run already queued.
     */
    public TaskRequest requestFor(String identifier, Duration initialDelay) {
        return new TaskRequest(TASK_TYPE, identifier, ConflictPolicy.KEEP, initialDelay, preconditions);
    }

    @Override
    public TaskResult run(TaskRequest request, CancellationToken cancellation) {
        String identifier = request.key();

        CollapsedMutation toSend;
        try {
            toSend = store.markAttempted(identifier);
        } catch (StorageException e) {
            log.warn("Could not read pending row for {}, will retry", identifier, e);
            metrics.recordRetry();
            return TaskResult.RETRY;
        }
        if (toSend.isEmpty()) {
            log.debug("Nothing pending for {}", identifier);
            return TaskResult.SUCCESS;
        }

        Timer.Sample sample = metrics.startSend();
        SyncOutcome outcome;
        try {
            outcome = apiClient.send(identifier, toSend, cancellation);
        } finally {
            metrics.stopSend(sample);
        }

        try {
            return switch (outcome.kind()) {
                case SUCCESS -> onSuccess(identifier, toSend);
                case RETRYABLE -> {
                    SyncOutcome.RetryableFailure retryable = (SyncOutcome.RetryableFailure) outcome;
                    log.debug("Sync of {} failed ({}), will retry", identifier, retryable.reason());
                    metrics.recordRetry();
                    yield TaskResult.RETRY;
                }
                case UNRECOVERABLE -> onRejected(identifier, toSend, (SyncOutcome.UnrecoverableFailure) outcome);
            };
        } catch (StorageException e) {
            log.warn("Could not confirm sync of {}, will retry", identifier, e);
            metrics.recordRetry();
            return TaskResult.RETRY;
        }
    }

    private TaskResult onSuccess(String identifier, CollapsedMutation sent) {
        ConfirmResult confirm = store.confirmSent(identifier, sent);
        metrics.recordSuccess();
        if (confirm == ConfirmResult.SUPERSEDED) {
            log.debug("Row for {} changed while sending, syncing again", identifier);
            metrics.recordSuperseded();
            requeue.accept(requestFor(identifier, Duration.ZERO));
        } else {
            log.debug("Synced {} operation(s) for {}", sent.operations().size(), identifier);
        }
        return TaskResult.SUCCESS;
    }

    private TaskResult onRejected(String identifier, CollapsedMutation sent, SyncOutcome.UnrecoverableFailure failure) {
        ConfirmResult confirm = store.rejectSent(identifier, sent);
        metrics.recordFailure();
        log.warn("Backend rejected mutation for {} with {}: dropping {} operation(s)",
                identifier, failure.status(), sent.operations().size());

        SyncFailure syncFailure = new SyncFailure(identifier, sent, failure.status(), failure.reason(), clock.instant());
        if (deadLetterQueue != null) {
            try {
                deadLetterQueue.send(new DeadLetterQueue.DlqEntry(UUID.randomUUID().toString(), identifier,
                        sent.operations(), sent.sequence(), failure.reason(), failure.status(), syncFailure.occurredAt()));
            } catch (RuntimeException e) {
                log.error("Failed to dead-letter mutation for {}", identifier, e);
            }
        }
        for (SyncErrorListener listener : errorListeners) {
            try {
                listener.onSyncFailure(syncFailure);
            } catch (RuntimeException e) {
                log.warn("Sync error listener failed", e);
            }
        }
        if (confirm == ConfirmResult.SUPERSEDED) {
            // only the edits appended during the send are left
            metrics.recordSuperseded();
            requeue.accept(requestFor(identifier, Duration.ZERO));
        }
        return TaskResult.FAILURE;
    }
}
