package com.nayem.tether.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.tether.core.MutationOperationCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed {@link DeadLetterQueue}. Entries are JSON envelopes in a list,
 * with a per-entry index key (expiring after {@code entryTtl}) used for
 * acknowledgement.
 */
public class RedisDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisDeadLetterQueue.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MutationOperationCodec codec;
    private final String queueKey;
    private final String indexKeyPrefix;
    private final Duration entryTtl;

    public RedisDeadLetterQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            String keyPrefix, Duration entryTtl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.codec = new MutationOperationCodec(objectMapper);
        this.queueKey = keyPrefix + "dlq";
        this.indexKeyPrefix = keyPrefix + "dlq:index:";
        this.entryTtl = entryTtl;
    }

    private String indexKey(String entryId) {
        return indexKeyPrefix + entryId;
    }

    @Override
    public void send(DlqEntry entry) {
        try {
            String json = objectMapper.writeValueAsString(toEnvelope(entry));
            redisTemplate.opsForList().rightPush(queueKey, json);
            redisTemplate.opsForValue().set(indexKey(entry.id()), json, entryTtl);
            log.warn("Mutation dead-lettered to Redis: identifier={}, status={}, reason={}",
                    entry.identifier(), entry.status(), entry.reason());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize DLQ entry: {}", entry.id(), e);
        }
    }

    @Override
    public Optional<DlqEntry> peek() {
        return deserialize(redisTemplate.opsForList().index(queueKey, 0));
    }

    @Override
    public Optional<DlqEntry> poll() {
        Optional<DlqEntry> entry = deserialize(redisTemplate.opsForList().leftPop(queueKey));
        entry.ifPresent(e -> redisTemplate.delete(indexKey(e.id())));
        return entry;
    }

    @Override
    public void acknowledge(String entryId) {
        String json = redisTemplate.opsForValue().get(indexKey(entryId));
        if (json != null) {
            redisTemplate.opsForList().remove(queueKey, 1, json);
            redisTemplate.delete(indexKey(entryId));
            log.info("Redis DLQ entry acknowledged: id={}", entryId);
        }
    }

    @Override
    public long size() {
        Long size = redisTemplate.opsForList().size(queueKey);
        return size != null ? size : 0;
    }

    @Override
    public List<DlqEntry> list(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> entries = redisTemplate.opsForList().range(queueKey, 0, limit - 1);
        if (entries == null) {
            return List.of();
        }
        return entries.stream()
                .map(this::deserialize)
                .flatMap(Optional::stream)
                .toList();
    }

    private Optional<DlqEntry> deserialize(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            DlqEnvelope envelope = objectMapper.readValue(json, DlqEnvelope.class);
            return Optional.of(new DlqEntry(
                    envelope.id(),
                    envelope.identifier(),
                    codec.read(envelope.operations()),
                    envelope.sequence(),
                    envelope.reason(),
                    envelope.status(),
                    Instant.ofEpochMilli(envelope.timestamp())));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to deserialize DLQ entry", e);
            return Optional.empty();
        }
    }

    private DlqEnvelope toEnvelope(DlqEntry entry) {
        return new DlqEnvelope(
                entry.id(),
                entry.identifier(),
                codec.write(entry.operations()),
                entry.sequence(),
                entry.reason(),
                entry.status(),
                entry.timestamp().toEpochMilli());
    }

    /**
     * Stored form of an entry. Operations are kept as their JSON text.
     */
    record DlqEnvelope(
            String id,
            String identifier,
            String operations,
            long sequence,
            String reason,
            int status,
            long timestamp) {
    }
}
