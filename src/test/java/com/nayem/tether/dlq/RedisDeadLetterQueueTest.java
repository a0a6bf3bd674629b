package com.nayem.tether.dlq;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;

import static com.nayem.tether.dlq.InMemoryDeadLetterQueueTest.entry;
import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
public class RedisDeadLetterQueueTest {

    @Container
    @SuppressWarnings("resource")
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private LettuceConnectionFactory factory;
    private StringRedisTemplate redisTemplate;
    private RedisDeadLetterQueue dlq;

    @BeforeEach
    void setUp() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(
                redis.getHost(), redis.getMappedPort(6379));
        factory = new LettuceConnectionFactory(config);
        factory.afterPropertiesSet();
        redisTemplate = new StringRedisTemplate(factory);
        redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        dlq = new RedisDeadLetterQueue(redisTemplate, new ObjectMapper(), "test:", Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        factory.destroy();
    }

    @Test
    void testEntrySurvivesStorage() {
        DeadLetterQueue.DlqEntry sent = entry("e1", "ch-1");

        dlq.send(sent);

        assertEquals(1, dlq.size());
        assertEquals(sent, dlq.peek().orElseThrow());
        Long ttl = redisTemplate.getExpire("test:dlq:index:e1");
        assertNotNull(ttl);
        assertTrue(ttl > 0);
    }

    @Test
    void testPollAndAcknowledge() {
        dlq.send(entry("e1", "ch-1"));
        dlq.send(entry("e2", "ch-2"));
        dlq.send(entry("e3", "ch-3"));

        dlq.acknowledge("e2");

        assertEquals(2, dlq.list(10).size());
        assertEquals("e1", dlq.poll().orElseThrow().id());
        assertEquals("e3", dlq.poll().orElseThrow().id());
        assertTrue(dlq.poll().isEmpty());
        assertFalse(Boolean.TRUE.equals(redisTemplate.hasKey("test:dlq:index:e1")));
    }

    @Test
    void testCorruptEntryIsSkipped() {
        redisTemplate.opsForList().rightPush("test:dlq", "{broken");
        dlq.send(entry("e1", "ch-1"));

        assertEquals(1, dlq.list(10).size());
        assertEquals(2, dlq.size());
    }
}
