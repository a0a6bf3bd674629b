package com.nayem.tether.spring;

import com.nayem.tether.client.HttpMutationApiClient;
import com.nayem.tether.client.MutationApiClient;
import com.nayem.tether.client.SyncOutcome;
import com.nayem.tether.core.TetherEngine;
import com.nayem.tether.dlq.DeadLetterQueue;
import com.nayem.tether.dlq.InMemoryDeadLetterQueue;
import com.nayem.tether.store.InMemoryPendingMutationRepository;
import com.nayem.tether.store.JdbcPendingMutationRepository;
import com.nayem.tether.store.PendingMutationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TetherConfigValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TetherAutoConfiguration.class))
            .withPropertyValues("tether.api.base-url=http://localhost:8080/");

    private static MutationApiClient acceptingClient() {
        return (identifier, mutation, cancellation) -> SyncOutcome.success(200);
    }

    @Test
    void shouldCreateDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(TetherEngine.class);
            assertThat(context).getBean(PendingMutationRepository.class)
                    .isInstanceOf(InMemoryPendingMutationRepository.class);
            assertThat(context).getBean(DeadLetterQueue.class).isInstanceOf(InMemoryDeadLetterQueue.class);
            assertThat(context).getBean(MutationApiClient.class).isInstanceOf(HttpMutationApiClient.class);
        });
    }

    @Test
    void shouldBindDurationsInTheirDefaultUnits() {
        contextRunner.withPropertyValues("tether.scheduler.min-backoff=5", "tether.scheduler.max-backoff=90",
                        "tether.sync.delay=250", "tether.api.audience-type=named-user")
                .run(context -> {
                    TetherProperties properties = context.getBean(TetherProperties.class);
                    assertThat(properties.getScheduler().getMinBackoff()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getScheduler().getMaxBackoff()).isEqualTo(Duration.ofSeconds(90));
                    assertThat(properties.getSync().getDelay()).isEqualTo(Duration.ofMillis(250));
                    assertThat(properties.getApi().getAudienceType().name()).isEqualTo("NAMED_USER");
                });
    }

    @Test
    void shouldFailWithoutApiClient() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(TetherAutoConfiguration.class))
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessageContaining("tether.api.base-url");
                });
    }

    @Test
    void shouldUseProvidedApiClient() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(TetherAutoConfiguration.class))
                .withBean(MutationApiClient.class, TetherConfigValidationTest::acceptingClient)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(MutationApiClient.class);
                    assertThat(context).doesNotHaveBean(HttpMutationApiClient.class);
                    assertThat(context).hasSingleBean(TetherEngine.class);
                });
    }

    @Test
    void shouldFailOnInvalidWorkerThreads() {
        contextRunner.withPropertyValues("tether.scheduler.worker-threads=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(BindValidationException.class);
                });
    }

    @Test
    void shouldFailOnExcessiveJitter() {
        contextRunner.withPropertyValues("tether.scheduler.jitter-percent=0.9")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(BindValidationException.class);
                });
    }

    @Test
    void shouldFailWhenMaxBackoffIsBelowMin() {
        contextRunner.withPropertyValues("tether.scheduler.min-backoff=60", "tether.scheduler.max-backoff=10")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessageContaining("maxBackoff");
                });
    }

    @Test
    void shouldCreateSqliteStore(@TempDir Path tempDir) {
        Path db = tempDir.resolve("store/pending.db");
        contextRunner.withPropertyValues("tether.store.type=sqlite", "tether.store.sqlite-path=" + db)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).getBean(PendingMutationRepository.class)
                            .isInstanceOf(JdbcPendingMutationRepository.class);
                    assertThat(Files.exists(db)).isTrue();
                });
    }

    @Test
    void shouldFallBackToMemoryForUnknownStore() {
        contextRunner.withPropertyValues("tether.store.type=cassandra", "tether.dlq.store=kafka")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).getBean(PendingMutationRepository.class)
                            .isInstanceOf(InMemoryPendingMutationRepository.class);
                    assertThat(context).getBean(DeadLetterQueue.class).isInstanceOf(InMemoryDeadLetterQueue.class);
                });
    }

    @Test
    void shouldSkipDeadLetterQueueWhenDisabled() {
        contextRunner.withPropertyValues("tether.dlq.enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean(DeadLetterQueue.class);
                    assertThat(context).hasSingleBean(TetherEngine.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("tether.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(TetherEngine.class));
    }
}
