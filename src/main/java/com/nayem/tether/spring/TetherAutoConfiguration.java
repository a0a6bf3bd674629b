package com.nayem.tether.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.tether.client.HttpMutationApiClient;
import com.nayem.tether.client.MutationApiClient;
import com.nayem.tether.core.MutationOperationCodec;
import com.nayem.tether.core.TetherEngine;
import com.nayem.tether.dlq.DeadLetterQueue;
import com.nayem.tether.dlq.InMemoryDeadLetterQueue;
import com.nayem.tether.dlq.RedisDeadLetterQueue;
import com.nayem.tether.scheduler.DefaultNetworkMonitor;
import com.nayem.tether.scheduler.NetworkMonitor;
import com.nayem.tether.store.InMemoryPendingMutationRepository;
import com.nayem.tether.store.JdbcPendingMutationRepository;
import com.nayem.tether.store.PendingMutationRepository;
import com.nayem.tether.store.RedisPendingMutationRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;

@AutoConfiguration
@EnableConfigurationProperties(TetherProperties.class)
@ConditionalOnProperty(name = "tether.enabled", havingValue = "true", matchIfMissing = true)
public class TetherAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TetherAutoConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public PendingMutationRepository pendingMutationRepository(
            TetherProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider) {

        TetherProperties.Store store = properties.getStore();
        MutationOperationCodec codec = new MutationOperationCodec(objectMapper(objectMapperProvider));
        return switch (store.getType().toLowerCase()) {
            case "memory" -> new InMemoryPendingMutationRepository();
            case "sqlite" -> {
                JdbcPendingMutationRepository repository = new JdbcPendingMutationRepository(
                        Path.of(store.getSqlitePath()), codec, (int) store.getBusyTimeout().toMillis());
                repository.init();
                yield repository;
            }
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("StringRedisTemplate is required for the Redis mutation store");
                }
                yield new RedisPendingMutationRepository(redis, codec, store.getRedisKeyPrefix(),
                        store.getRedisMaxAttempts());
            }
            default -> {
                log.warn("Unknown mutation store '{}', falling back to memory", store.getType());
                yield new InMemoryPendingMutationRepository();
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "tether.dlq.enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterQueue tetherDeadLetterQueue(
            TetherProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider) {

        TetherProperties.Dlq dlq = properties.getDlq();
        if ("redis".equalsIgnoreCase(dlq.getStore())) {
            StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
            if (redis == null) {
                throw new IllegalStateException("StringRedisTemplate is required for the Redis DLQ");
            }
            return new RedisDeadLetterQueue(redis, objectMapper(objectMapperProvider), dlq.getRedisKeyPrefix(),
                    dlq.getTtl());
        }
        if (!"memory".equalsIgnoreCase(dlq.getStore())) {
            log.warn("Unknown DLQ store '{}', falling back to memory", dlq.getStore());
        }
        return new InMemoryDeadLetterQueue();
    }

    @Bean
    @ConditionalOnMissingBean
    public NetworkMonitor tetherNetworkMonitor() {
        return new DefaultNetworkMonitor();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "tether.api.base-url")
    public MutationApiClient mutationApiClient(TetherProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        TetherProperties.Api api = properties.getApi();
        return new HttpMutationApiClient(
                HttpMutationApiClient.defaultClient(api.getConnectTimeout(), api.getReadTimeout(),
                        api.getCallTimeout()),
                objectMapper(objectMapperProvider),
                api.getBaseUrl(),
                api.getAudienceType(),
                api.getAppKey());
    }

    @Bean(destroyMethod = "close")
    public TetherEngine tetherEngine(
            TetherProperties properties,
            PendingMutationRepository repository,
            ObjectProvider<MutationApiClient> apiClientProvider,
            NetworkMonitor networkMonitor,
            ObjectProvider<DeadLetterQueue> deadLetterQueueProvider,
            ObjectProvider<MeterRegistry> registryProvider) {

        MutationApiClient apiClient = apiClientProvider.getIfAvailable();
        if (apiClient == null) {
            throw new IllegalStateException(
                    "Set tether.api.base-url or provide a MutationApiClient bean to enable mutation sync");
        }
        TetherProperties.Scheduler scheduler = properties.getScheduler();
        TetherEngine engine = TetherEngine.builder()
                .repository(repository)
                .apiClient(apiClient)
                .networkMonitor(networkMonitor)
                .deadLetterQueue(deadLetterQueueProvider.getIfAvailable())
                .metrics(registryProvider.getIfAvailable())
                .syncDelay(properties.getSync().getDelay())
                .predicateCacheSize(properties.getSync().getPredicateCacheSize())
                .workerThreads(scheduler.getWorkerThreads())
                .minBackoff(scheduler.getMinBackoff())
                .maxBackoff(scheduler.getMaxBackoff())
                .jitterPercent(scheduler.getJitterPercent())
                .parkedPollInterval(scheduler.getParkedPollInterval())
                .shutdownTimeout(scheduler.getShutdownTimeout())
                .threadNamePrefix(scheduler.getThreadNamePrefix())
                .build();

        if (properties.getSync().isResumeOnStart()) {
            engine.start();
        }
        return engine;
    }

    private static ObjectMapper objectMapper(ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        return mapper != null ? mapper : new ObjectMapper();
    }
}
