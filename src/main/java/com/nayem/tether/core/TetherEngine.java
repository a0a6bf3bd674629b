package com.nayem.tether.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.nayem.tether.client.MutationApiClient;
import com.nayem.tether.dlq.DeadLetterQueue;
import com.nayem.tether.metrics.SyncMetrics;
import com.nayem.tether.predicate.JsonPredicate;
import com.nayem.tether.predicate.PredicateEngine;
import com.nayem.tether.scheduler.NetworkMonitor;
import com.nayem.tether.scheduler.TaskListener;
import com.nayem.tether.scheduler.TaskScheduler;
import com.nayem.tether.store.PendingMutationRepository;
import com.nayem.tether.sync.MutationStore;
import com.nayem.tether.sync.MutationSyncHandler;
import com.nayem.tether.sync.PendingMutation;
import com.nayem.tether.sync.SyncErrorListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for hosts: evaluates rule predicates and records audience
 * mutations, which are persisted, collapsed and synced in the background.
 *
 * <pre>
 * TetherEngine engine = TetherEngine.builder()
 *         .repository(repository)
 *         .apiClient(apiClient)
 *         .networkMonitor(networkMonitor)
 *         .build();
 * engine.start();
 *
 * if (engine.evaluate(predicate, event)) {
 *     engine.recordMutation("channel-1", Mutation.editor().addTags("loyalty", "vip").build());
 * }
 * </pre>
 */
public class TetherEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TetherEngine.class);

    private final PredicateEngine predicateEngine;
    private final MutationStore store;
    private final MutationSyncHandler syncHandler;
    private final TaskScheduler scheduler;
    private final SyncMetrics metrics;
    private final Duration syncDelay;
    private final AtomicBoolean started = new AtomicBoolean();

    public TetherEngine(PredicateEngine predicateEngine, MutationStore store, MutationSyncHandler syncHandler,
            TaskScheduler scheduler, SyncMetrics metrics, Duration syncDelay) {
        this.predicateEngine = predicateEngine;
        this.store = store;
        this.syncHandler = syncHandler;
        this.scheduler = scheduler;
        this.metrics = metrics != null ? metrics : SyncMetrics.noOp();
        this.syncDelay = syncDelay;

        scheduler.registerHandler(MutationSyncHandler.TASK_TYPE, syncHandler);
        syncHandler.setRequeue(scheduler::enqueue);
        this.metrics.registerParkedGauge(scheduler::parkedCount);
    }

    public boolean evaluate(JsonPredicate predicate, JsonNode event) {
        return predicateEngine.matches(predicate, event);
    }

    /**
     * Evaluates a predicate in its JSON form. A predicate that does not parse
     * never matches.
     */
    public boolean evaluate(JsonNode predicateJson, JsonNode event) {
        return predicateEngine.evaluate(predicateJson, event);
    }

    /**
     * Persists the mutation for the identifier and schedules a sync when
     * anything remains pending.
     *
     * @return the identifier's pending state after collapsing
     * @throws com.nayem.tether.store.StorageException if the mutation could not be persisted
     * @throws java.util.concurrent.RejectedExecutionException after {@link #close()}
     */
    public CollapsedMutation recordMutation(String identifier, Mutation mutation) {
        CollapsedMutation collapsed = store.append(identifier, mutation);
        metrics.recordAppend();
        if (!collapsed.isEmpty()) {
            scheduler.enqueue(syncHandler.requestFor(identifier, syncDelay));
        }
        return collapsed;
    }

    public Optional<CollapsedMutation> pending(String identifier) {
        return store.peek(identifier);
    }

    /**
     * Forgets everything pending for the identifier, e.g. after an identity reset.
     */
    public void clearPending(String identifier) {
        store.clear(identifier);
    }

    /**
     * Schedules a sync for every row left pending by a previous run. Calling it
     * again has no effect.
     *
     * @return how many identifiers were scheduled
     */
    public int start() {
        if (!started.compareAndSet(false, true)) {
            return 0;
        }
        List<PendingMutation> pending = store.loadAllPending();
        for (PendingMutation mutation : pending) {
            scheduler.enqueue(syncHandler.requestFor(mutation.identifier(), Duration.ZERO));
        }
        log.info("TetherEngine started, resuming {} pending identifier(s)", pending.size());
        return pending.size();
    }

    public void addSyncErrorListener(SyncErrorListener listener) {
        syncHandler.addErrorListener(listener);
    }

    public void removeSyncErrorListener(SyncErrorListener listener) {
        syncHandler.removeErrorListener(listener);
    }

    public void addTaskListener(TaskListener listener) {
        scheduler.addListener(listener);
    }

    public MutationStore store() {
        return store;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        log.info("TetherEngine shutting down");
        scheduler.shutdown();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for a {@link TetherEngine} used without Spring.
     */
    public static class Builder {
        private PendingMutationRepository repository;
        private MutationApiClient apiClient;
        private NetworkMonitor networkMonitor;
        private DeadLetterQueue deadLetterQueue;
        private MeterRegistry registry;
        private Clock clock = Clock.systemUTC();
        private Duration syncDelay = Duration.ZERO;
        private long predicateCacheSize = 512;
        private final TaskScheduler.Builder schedulerBuilder = TaskScheduler.builder();

        /**
         * Durable store for pending rows. Required.
         */
        public Builder repository(PendingMutationRepository repository) {
            this.repository = repository;
            return this;
        }

        /**
         * Client that applies mutations remotely. Required.
         */
        public Builder apiClient(MutationApiClient apiClient) {
            this.apiClient = apiClient;
            return this;
        }

        /**
         * Reachability source. Without one, syncs never wait for the network.
         */
        public Builder networkMonitor(NetworkMonitor networkMonitor) {
            this.networkMonitor = networkMonitor;
            this.schedulerBuilder.networkMonitor(networkMonitor);
            return this;
        }

        public Builder deadLetterQueue(DeadLetterQueue deadLetterQueue) {
            this.deadLetterQueue = deadLetterQueue;
            return this;
        }

        public Builder metrics(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Delay between recording a mutation and its first sync attempt, which lets
         * a burst of edits collapse into one request. Default is zero.
         */
        public Builder syncDelay(Duration syncDelay) {
            this.syncDelay = syncDelay;
            return this;
        }

        public Builder predicateCacheSize(long predicateCacheSize) {
            this.predicateCacheSize = predicateCacheSize;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            schedulerBuilder.workerThreads(workerThreads);
            return this;
        }

        public Builder minBackoff(Duration minBackoff) {
            schedulerBuilder.minBackoff(minBackoff);
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            schedulerBuilder.maxBackoff(maxBackoff);
            return this;
        }

        public Builder jitterPercent(double jitterPercent) {
            schedulerBuilder.jitterPercent(jitterPercent);
            return this;
        }

        public Builder parkedPollInterval(Duration parkedPollInterval) {
            schedulerBuilder.parkedPollInterval(parkedPollInterval);
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            schedulerBuilder.shutdownTimeout(shutdownTimeout);
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            schedulerBuilder.threadNamePrefix(threadNamePrefix);
            return this;
        }

        /**
         * @throws IllegalStateException if the repository or API client is missing
         */
        public TetherEngine build() {
            if (repository == null || apiClient == null) {
                throw new IllegalStateException("Repository and API client are required.");
            }
            SyncMetrics syncMetrics = new SyncMetrics(registry);
            MutationStore store = new MutationStore(repository);
            MutationSyncHandler handler = new MutationSyncHandler(store, apiClient, deadLetterQueue, syncMetrics,
                    networkMonitor, clock);
            return new TetherEngine(new PredicateEngine(predicateCacheSize), store, handler,
                    schedulerBuilder.build(), syncMetrics, syncDelay);
        }
    }
}
