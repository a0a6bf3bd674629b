package com.nayem.tether.scheduler;

import com.nayem.tether.client.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Runs background tasks one identity at a time, with retries, backoff and
 * preconditions.
 * <p>
 * Each identity ({@code type/key}) moves through
 * {@code IDLE -> QUEUED -> RUNNING -> IDLE | QUEUED (retry) | FAILED}. Its slot is
 * guarded by its own lock, so at most one attempt per identity is ever running
 * while different identities share the worker pool freely.
 * </p>
 * <p>
 * Delays (initial delay, backoff, parked polling) run on a single timer thread
 * which only hands work to the pool. Handlers never run on the timer.
 * </p>
 * <p>
 * A slot is only kept while its identity has work. It is removed once it settles
 * back to IDLE, so the number of tracked identities follows the live workload.
 * </p>
 */
public class TaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, TaskSlot> slots = new ConcurrentHashMap<>();
    private final List<TaskListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger parked = new AtomicInteger();

    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final BackoffStrategy backoffStrategy;
    private final long minBackoffMs;
    private final long maxBackoffMs;
    private final Duration parkedPollInterval;
    private final Duration shutdownTimeout;

    private volatile boolean shutdown;

    private TaskScheduler(Builder builder) {
        this.workers = Executors.newFixedThreadPool(builder.workerThreads,
                namedThreads(builder.threadNamePrefix + "worker-"));
        this.timer = Executors.newSingleThreadScheduledExecutor(namedThreads(builder.threadNamePrefix + "timer-"));
        this.backoffStrategy = new BackoffStrategy(builder.jitterPercent);
        this.minBackoffMs = builder.minBackoff.toMillis();
        this.maxBackoffMs = builder.maxBackoff.toMillis();
        this.parkedPollInterval = builder.parkedPollInterval;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.handlers.putAll(builder.handlers);
        this.listeners.addAll(builder.listeners);

        if (builder.networkMonitor != null) {
            builder.networkMonitor.addListener(connected -> {
                if (connected) {
                    wakeParked();
                }
            });
        }
    }

    public void registerHandler(String type, TaskHandler handler) {
        handlers.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(handler, "handler"));
    }

    public void addListener(TaskListener listener) {
        listeners.add(listener);
    }

    /**
     * Schedules work for the request's identity according to its
     * {@link ConflictPolicy}.
     *
     * @return {@code false} only when a {@link ConflictPolicy#KEEP} request was
     *         ignored because a run is already queued
     * @throws RejectedExecutionException after {@link #shutdown()}
     * @throws IllegalArgumentException   when no handler is registered for the type
     */
    public boolean enqueue(TaskRequest request) {
        Objects.requireNonNull(request, "request");
        if (shutdown) {
            throw new RejectedExecutionException("TaskScheduler is shut down");
        }
        if (!handlers.containsKey(request.type())) {
            throw new IllegalArgumentException("No handler registered for task type: " + request.type());
        }

        TaskSlot slot = lockSlot(request.identity());
        try {
            return switch (slot.state) {
                case IDLE, FAILED -> {
                    slot.request = request;
                    slot.state = TaskState.QUEUED;
                    schedule(slot, request.initialDelay());
                    log.debug("Task {} queued (delay {}ms)", slot.identity, request.initialDelay().toMillis());
                    yield true;
                }
                case QUEUED -> {
                    if (request.policy() == ConflictPolicy.KEEP) {
                        yield false;
                    }
                    slot.request = request;
                    unpark(slot);
                    schedule(slot, request.initialDelay());
                    log.debug("Task {} rescheduled by replacement", slot.identity);
                    yield true;
                }
                case RUNNING -> {
                    slot.rerun = true;
                    if (request.policy() == ConflictPolicy.REPLACE) {
                        slot.request = request;
                        slot.replaced = true;
                        if (slot.token != null) {
                            slot.token.cancel();
                        }
                        log.debug("Task {} replaced while running, cancelling current attempt", slot.identity);
                    }
                    yield true;
                }
            };
        } finally {
            slot.lock.unlock();
        }
    }

    // returns the live slot for the identity with its lock held
    private TaskSlot lockSlot(String identity) {
        while (true) {
            TaskSlot slot = slots.computeIfAbsent(identity, TaskSlot::new);
            slot.lock.lock();
            if (!slot.retired) {
                return slot;
            }
            slot.lock.unlock();
        }
    }

    public TaskState state(String identity) {
        TaskSlot slot = slots.get(identity);
        if (slot == null) {
            return TaskState.IDLE;
        }
        slot.lock.lock();
        try {
            return slot.state;
        } finally {
            slot.lock.unlock();
        }
    }

    public TaskState state(String type, String key) {
        return state(TaskRequest.identity(type, key));
    }

    /**
     * Delay applied before the identity's pending retry, zero when it is not
     * backing off.
     */
    public Duration currentBackoff(String identity) {
        TaskSlot slot = slots.get(identity);
        if (slot == null) {
            return Duration.ZERO;
        }
        slot.lock.lock();
        try {
            return Duration.ofMillis(slot.backoffMs);
        } finally {
            slot.lock.unlock();
        }
    }

    public int parkedCount() {
        return parked.get();
    }

    /**
     * Number of identities that currently hold a slot: queued, parked, running
     * or about to be retired.
     */
    public int trackedCount() {
        return slots.size();
    }

    /**
     * Re-checks every parked task now instead of waiting for its next poll.
     */
    public void wakeParked() {
        for (TaskSlot slot : slots.values()) {
            slot.lock.lock();
            try {
                if (slot.parked && slot.state == TaskState.QUEUED && !shutdown) {
                    schedule(slot, Duration.ZERO);
                }
            } finally {
                slot.lock.unlock();
            }
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Stops accepting work, cancels in-flight attempts and waits up to the
     * shutdown timeout for them to return. Queued tasks are dropped; their
     * durable state is expected to be resumed by the owner on the next start.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("TaskScheduler shutting down, {} identities tracked", slots.size());

        for (TaskSlot slot : slots.values()) {
            slot.lock.lock();
            try {
                cancelScheduled(slot);
                if (slot.token != null) {
                    slot.token.cancel();
                }
            } finally {
                slot.lock.unlock();
            }
        }

        timer.shutdownNow();
        workers.shutdown();
        long start = System.currentTimeMillis();
        try {
            if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Shutdown timeout ({}ms) exceeded, interrupting remaining task attempts",
                        shutdownTimeout.toMillis());
                workers.shutdownNow();
            } else {
                log.info("All task workers drained in {}ms", System.currentTimeMillis() - start);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Shutdown interrupted while draining task workers");
            workers.shutdownNow();
        }
        log.info("TaskScheduler shutdown complete.");
    }

    // slot lock held
    private void schedule(TaskSlot slot, Duration delay) {
        cancelScheduled(slot);
        long generation = ++slot.generation;
        if (delay.isZero()) {
            dispatch(slot, generation);
            return;
        }
        try {
            slot.scheduled = timer.schedule(() -> dispatch(slot, generation), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer rejected {} during shutdown", slot.identity);
        }
    }

    private void cancelScheduled(TaskSlot slot) {
        if (slot.scheduled != null) {
            slot.scheduled.cancel(false);
            slot.scheduled = null;
        }
    }

    private void dispatch(TaskSlot slot, long generation) {
        try {
            workers.execute(() -> runSlot(slot, generation));
        } catch (RejectedExecutionException e) {
            log.debug("Worker pool rejected {} during shutdown", slot.identity);
        }
    }

    private void runSlot(TaskSlot slot, long generation) {
        TaskRequest request;
        CancellationToken token;

        slot.lock.lock();
        try {
            if (shutdown || slot.generation != generation || slot.state != TaskState.QUEUED) {
                return;
            }
            request = slot.request;
            Precondition unmet = firstUnmet(request);
            if (unmet != null) {
                park(slot, unmet);
                return;
            }
            unpark(slot);
            slot.scheduled = null;
            slot.state = TaskState.RUNNING;
            slot.rerun = false;
            slot.replaced = false;
            token = new CancellationToken();
            slot.token = token;
        } finally {
            slot.lock.unlock();
        }

        TaskResult result = execute(slot.identity, request, token);
        complete(slot, result);
    }

    private TaskResult execute(String identity, TaskRequest request, CancellationToken token) {
        TaskHandler handler = handlers.get(request.type());
        try {
            TaskResult result = handler.run(request, token);
            if (result == null) {
                log.warn("Task {} returned no result, treating as retry", identity);
                return TaskResult.RETRY;
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted", identity);
            return TaskResult.RETRY;
        } catch (Exception e) {
            log.error("Task {} threw, will retry", identity, e);
            return TaskResult.RETRY;
        }
    }

    private void complete(TaskSlot slot, TaskResult result) {
        TaskRequest request;
        boolean rerun;
        long retryDelay = -1;

        slot.lock.lock();
        try {
            slot.token = null;
            request = slot.request;
            rerun = slot.rerun;
            boolean replaced = slot.replaced;
            slot.rerun = false;
            slot.replaced = false;

            if (shutdown) {
                slot.state = TaskState.IDLE;
                return;
            }

            switch (result) {
                case SUCCESS -> {
                    slot.attempt = 0;
                    slot.backoffMs = 0;
                    if (rerun) {
                        requeue(slot, Duration.ZERO);
                    } else {
                        settle(slot);
                    }
                }
                case RETRY -> {
                    if (replaced) {
                        // the attempt was cut short by a newer request, no penalty
                        requeue(slot, request.initialDelay());
                    } else {
                        retryDelay = backoffStrategy.calculateBackoff(slot.attempt++, minBackoffMs, maxBackoffMs);
                        slot.backoffMs = retryDelay;
                        requeue(slot, Duration.ofMillis(retryDelay));
                        log.warn("Task {} will retry in {}ms (attempt {})", slot.identity, retryDelay, slot.attempt);
                    }
                }
                case FAILURE -> {
                    slot.attempt = 0;
                    slot.backoffMs = 0;
                    slot.state = TaskState.FAILED;
                }
            }
        } finally {
            slot.lock.unlock();
        }

        switch (result) {
            case SUCCESS -> notifyListeners(l -> l.onTaskCompleted(request));
            case RETRY -> {
                if (retryDelay >= 0) {
                    long delay = retryDelay;
                    notifyListeners(l -> l.onTaskRetry(request, delay));
                }
            }
            case FAILURE -> {
                log.warn("Task {} failed permanently", slot.identity);
                notifyListeners(l -> l.onTaskFailed(request));
                slot.lock.lock();
                try {
                    if (slot.state == TaskState.FAILED) {
                        if (rerun && !shutdown) {
                            requeue(slot, Duration.ZERO);
                        } else {
                            settle(slot);
                        }
                    }
                } finally {
                    slot.lock.unlock();
                }
            }
        }
    }

    // slot lock held
    private void settle(TaskSlot slot) {
        slot.state = TaskState.IDLE;
        if (!slot.rerun && slot.scheduled == null && slot.token == null && !slot.parked) {
            slot.retired = true;
            slots.remove(slot.identity, slot);
        }
    }

    private void requeue(TaskSlot slot, Duration delay) {
        slot.state = TaskState.QUEUED;
        schedule(slot, delay);
    }

    private Precondition firstUnmet(TaskRequest request) {
        for (Precondition precondition : request.preconditions()) {
            try {
                if (!precondition.isSatisfied()) {
                    return precondition;
                }
            } catch (RuntimeException e) {
                log.warn("Precondition {} threw, treating as unmet", precondition.describe(), e);
                return precondition;
            }
        }
        return null;
    }

    private void park(TaskSlot slot, Precondition unmet) {
        if (!slot.parked) {
            slot.parked = true;
            parked.incrementAndGet();
            log.debug("Task {} parked on {}", slot.identity, unmet.describe());
        }
        schedule(slot, parkedPollInterval);
    }

    private void unpark(TaskSlot slot) {
        if (slot.parked) {
            slot.parked = false;
            parked.decrementAndGet();
        }
    }

    private void notifyListeners(Consumer<TaskListener> callback) {
        for (TaskListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Task listener failed", e);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class TaskSlot {
        private final String identity;
        private final ReentrantLock lock = new ReentrantLock();
        private TaskState state = TaskState.IDLE;
        private TaskRequest request;
        private ScheduledFuture<?> scheduled;
        private long generation;
        private CancellationToken token;
        private boolean rerun;
        private boolean replaced;
        private boolean parked;
        private boolean retired;
        private int attempt;
        private long backoffMs;

        private TaskSlot(String identity) {
            this.identity = identity;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for a {@link TaskScheduler}.
     */
    public static class Builder {
        private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();
        private final List<TaskListener> listeners = new CopyOnWriteArrayList<>();
        private int workerThreads = 4;
        private Duration minBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofSeconds(120);
        private double jitterPercent = 0.2;
        private Duration parkedPollInterval = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private String threadNamePrefix = "tether-task-";
        private NetworkMonitor networkMonitor;

        public Builder handler(String type, TaskHandler handler) {
            this.handlers.put(type, handler);
            return this;
        }

        public Builder listener(TaskListener listener) {
            this.listeners.add(listener);
            return this;
        }

        /**
         * Size of the worker pool shared by all identities. Default is 4.
         */
        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        /**
         * Delay before the first retry. Default is 30 seconds.
         */
        public Builder minBackoff(Duration minBackoff) {
            this.minBackoff = minBackoff;
            return this;
        }

        /**
         * Ceiling for retry delays. Default is 120 seconds.
         */
        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        /**
         * Fraction by which a delay below the ceiling may be shortened at random.
         * Capped at 0.45. Default is 0.2.
         */
        public Builder jitterPercent(double jitterPercent) {
            this.jitterPercent = jitterPercent;
            return this;
        }

        /**
         * How often parked tasks re-check their preconditions without a network
         * signal. Default is 60 seconds.
         */
        public Builder parkedPollInterval(Duration parkedPollInterval) {
            this.parkedPollInterval = parkedPollInterval;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        /**
         * Reachability source. Parked tasks are re-checked as soon as it reports a
         * connection.
         */
        public Builder networkMonitor(NetworkMonitor networkMonitor) {
            this.networkMonitor = networkMonitor;
            return this;
        }

        /**
         * @throws IllegalStateException if the pool size or delays are invalid
         */
        public TaskScheduler build() {
            if (workerThreads < 1) {
                throw new IllegalStateException("workerThreads must be at least 1");
            }
            if (minBackoff == null || minBackoff.toMillis() < 1) {
                throw new IllegalStateException("minBackoff must be at least 1ms");
            }
            if (maxBackoff == null || maxBackoff.compareTo(minBackoff) < 0) {
                throw new IllegalStateException("maxBackoff must not be shorter than minBackoff");
            }
            if (parkedPollInterval == null || parkedPollInterval.toMillis() < 1) {
                throw new IllegalStateException("parkedPollInterval must be at least 1ms");
            }
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalStateException("shutdownTimeout must not be negative");
            }
            return new TaskScheduler(this);
        }
    }
}
