package com.nayem.tether.spring;

import com.nayem.tether.client.AudienceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the Tether automation and sync core.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code tether} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "tether")
@Validated
public class TetherProperties {

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Store store = new Store();

    @Valid
    private Api api = new Api();

    @Valid
    private Dlq dlq = new Dlq();

    @Valid
    private Sync sync = new Sync();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Dlq getDlq() {
        return dlq;
    }

    public void setDlq(Dlq dlq) {
        this.dlq = dlq;
    }

    public Sync getSync() {
        return sync;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }

    /**
     * Background task execution: worker pool, retry backoff and parking.
     */
    public static class Scheduler {
        /**
         * Threads shared by all task identities.
         */
        @Min(1)
        @Max(64)
        private int workerThreads = 4;

        /**
         * Delay before the first retry of a failed sync.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration minBackoff = Duration.ofSeconds(30);

        /**
         * Ceiling for retry delays.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxBackoff = Duration.ofSeconds(120);

        /**
         * Random shortening applied to delays below the ceiling. Kept under 0.5 so
         * successive delays still grow.
         */
        @DecimalMin("0.0")
        @DecimalMax("0.45")
        private double jitterPercent = 0.2;

        /**
         * How often a task waiting on the network re-checks without a signal.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration parkedPollInterval = Duration.ofSeconds(60);

        /**
         * Maximum time to wait for in-flight syncs during application shutdown.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        private String threadNamePrefix = "tether-task-";

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public Duration getMinBackoff() {
            return minBackoff;
        }

        public void setMinBackoff(Duration minBackoff) {
            this.minBackoff = minBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getJitterPercent() {
            return jitterPercent;
        }

        public void setJitterPercent(double jitterPercent) {
            this.jitterPercent = jitterPercent;
        }

        public Duration getParkedPollInterval() {
            return parkedPollInterval;
        }

        public void setParkedPollInterval(Duration parkedPollInterval) {
            this.parkedPollInterval = parkedPollInterval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Where pending mutations are persisted.
     */
    public static class Store {
        /**
         * Backend: 'memory' (development), 'sqlite' (local file) or 'redis' (shared).
         */
        private String type = "memory";

        /**
         * Database file used by the 'sqlite' backend.
         */
        private String sqlitePath = "tether/pending-mutations.db";

        /**
         * How long a SQLite writer waits for a competing lock.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration busyTimeout = Duration.ofMillis(5000);

        /**
         * Prefix for every key written by the 'redis' backend.
         */
        @NotBlank
        private String redisKeyPrefix = "tether:pending:";

        /**
         * Optimistic transaction attempts before a Redis write gives up.
         */
        @Min(1)
        @Max(100)
        private int redisMaxAttempts = 10;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getSqlitePath() {
            return sqlitePath;
        }

        public void setSqlitePath(String sqlitePath) {
            this.sqlitePath = sqlitePath;
        }

        public Duration getBusyTimeout() {
            return busyTimeout;
        }

        public void setBusyTimeout(Duration busyTimeout) {
            this.busyTimeout = busyTimeout;
        }

        public String getRedisKeyPrefix() {
            return redisKeyPrefix;
        }

        public void setRedisKeyPrefix(String redisKeyPrefix) {
            this.redisKeyPrefix = redisKeyPrefix;
        }

        public int getRedisMaxAttempts() {
            return redisMaxAttempts;
        }

        public void setRedisMaxAttempts(int redisMaxAttempts) {
            this.redisMaxAttempts = redisMaxAttempts;
        }
    }

    /**
     * Remote endpoint receiving collapsed mutations.
     */
    public static class Api {
        /**
         * Base URL of the backend. Required unless the application provides its own
         * {@code MutationApiClient} bean.
         */
        private String baseUrl;

        @NotNull
        private AudienceType audienceType = AudienceType.CHANNEL;

        /**
         * Sent as {@code X-App-Key} when set.
         */
        private String appKey;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration connectTimeout = Duration.ofSeconds(10);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration readTimeout = Duration.ofSeconds(30);

        /**
         * Upper bound for a whole request, connect to last byte.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration callTimeout = Duration.ofSeconds(60);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public AudienceType getAudienceType() {
            return audienceType;
        }

        public void setAudienceType(AudienceType audienceType) {
            this.audienceType = audienceType;
        }

        public String getAppKey() {
            return appKey;
        }

        public void setAppKey(String appKey) {
            this.appKey = appKey;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }
    }

    /**
     * Configuration for the dead-letter queue receiving rejected mutations.
     */
    public static class Dlq {
        private boolean enabled = true;

        /**
         * Storage backend: 'memory' (development) or 'redis' (production).
         */
        private String store = "memory";

        /**
         * Prefix for the Redis list and index keys.
         */
        @NotBlank
        private String redisKeyPrefix = "tether:";

        /**
         * How long Redis DLQ index entries are retained.
         */
        @DurationUnit(ChronoUnit.DAYS)
        private Duration ttl = Duration.ofDays(7);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getRedisKeyPrefix() {
            return redisKeyPrefix;
        }

        public void setRedisKeyPrefix(String redisKeyPrefix) {
            this.redisKeyPrefix = redisKeyPrefix;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    /**
     * Sync behaviour of the engine.
     */
    public static class Sync {
        /**
         * Delay between recording a mutation and its first sync attempt.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration delay = Duration.ZERO;

        /**
         * Whether rows left pending by a previous run are synced on startup.
         */
        private boolean resumeOnStart = true;

        /**
         * Parsed predicates kept in the evaluation cache.
         */
        @Min(1)
        private long predicateCacheSize = 512;

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public boolean isResumeOnStart() {
            return resumeOnStart;
        }

        public void setResumeOnStart(boolean resumeOnStart) {
            this.resumeOnStart = resumeOnStart;
        }

        public long getPredicateCacheSize() {
            return predicateCacheSize;
        }

        public void setPredicateCacheSize(long predicateCacheSize) {
            this.predicateCacheSize = predicateCacheSize;
        }
    }
}
