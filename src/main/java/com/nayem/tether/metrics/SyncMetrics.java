package com.nayem.tether.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Micrometer meters for mutation sync health. A {@code null} registry turns
 * every method into a no-op.
 */
public class SyncMetrics {

    private final MeterRegistry registry;
    private final Counter successCounter;
    private final Counter retryCounter;
    private final Counter failureCounter;
    private final Counter supersededCounter;
    private final Counter appendCounter;
    private final Timer sendTimer;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
        if (registry != null) {
            this.successCounter = Counter.builder("tether.sync.success")
                    .description("Mutations confirmed by the backend")
                    .register(registry);

            this.retryCounter = Counter.builder("tether.sync.retry")
                    .description("Sync attempts that will be retried with backoff")
                    .register(registry);

            this.failureCounter = Counter.builder("tether.sync.failed")
                    .description("Mutations dropped after an unrecoverable rejection")
                    .register(registry);

            this.supersededCounter = Counter.builder("tether.sync.superseded")
                    .description("Sends whose row changed while in flight")
                    .register(registry);

            this.appendCounter = Counter.builder("tether.mutations.appended")
                    .description("Mutations recorded into the pending store")
                    .register(registry);

            this.sendTimer = Timer.builder("tether.sync.send")
                    .description("Duration of a single mutation send")
                    .register(registry);
        } else {
            this.successCounter = null;
            this.retryCounter = null;
            this.failureCounter = null;
            this.supersededCounter = null;
            this.appendCounter = null;
            this.sendTimer = null;
        }
    }

    /**
     * Registers a gauge reporting how many tasks wait on unmet preconditions.
     */
    public void registerParkedGauge(Supplier<Number> parkedCount) {
        if (registry != null) {
            Gauge.builder("tether.scheduler.parked", parkedCount)
                    .description("Tasks waiting for their preconditions")
                    .register(registry);
        }
    }

    public void recordSuccess() {
        if (successCounter != null) {
            successCounter.increment();
        }
    }

    public void recordRetry() {
        if (retryCounter != null) {
            retryCounter.increment();
        }
    }

    public void recordFailure() {
        if (failureCounter != null) {
            failureCounter.increment();
        }
    }

    public void recordSuperseded() {
        if (supersededCounter != null) {
            supersededCounter.increment();
        }
    }

    public void recordAppend() {
        if (appendCounter != null) {
            appendCounter.increment();
        }
    }

    /**
     * Starts timing a send. Pass the result to {@link #stopSend}.
     */
    public Timer.Sample startSend() {
        return registry != null ? Timer.start(registry) : null;
    }

    public void stopSend(Timer.Sample sample) {
        if (sample != null) {
            sample.stop(sendTimer);
        }
    }

    public static SyncMetrics noOp() {
        return new SyncMetrics(null);
    }
}
