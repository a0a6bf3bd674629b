package com.nayem.tether.store;

import com.nayem.tether.core.MutationOperationCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Redis-backed repository. A row is a hash under {@code <prefix>row:<identifier>},
 * the sequence is a counter advanced with INCR and a sorted set scored by
 * sequence indexes the pending identifiers.
 * <p>
 * Transactions use WATCH/MULTI/EXEC on the row key. When another client touches
 * the row first the work is re-run against the fresh row, up to
 * {@code maxAttempts} times.
 * </p>
 */
public class RedisPendingMutationRepository implements PendingMutationRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisPendingMutationRepository.class);

    private static final String FIELD_OPERATIONS = "operations";
    private static final String FIELD_SEQUENCE = "sequence";
    private static final String FIELD_CREATED_AT = "createdAt";
    private static final String FIELD_ATTEMPTED = "attempted";
    private static final String FIELD_UNSENT = "unsent";

    private final StringRedisTemplate redisTemplate;
    private final MutationOperationCodec codec;
    private final String rowPrefix;
    private final String indexKey;
    private final String sequenceKey;
    private final int maxAttempts;

    public RedisPendingMutationRepository(StringRedisTemplate redisTemplate, MutationOperationCodec codec,
            String keyPrefix, int maxAttempts) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.rowPrefix = keyPrefix + "row:";
        this.indexKey = keyPrefix + "index";
        this.sequenceKey = keyPrefix + "sequence";
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public Optional<PersistedRow> find(String identifier) {
        return toRow(identifier, redisTemplate.<String, String>opsForHash().entries(rowPrefix + identifier));
    }

    @Override
    public List<PersistedRow> findAll() {
        Set<String> identifiers = redisTemplate.opsForZSet().range(indexKey, 0, -1);
        if (identifiers == null || identifiers.isEmpty()) {
            return List.of();
        }
        List<PersistedRow> rows = new ArrayList<>(identifiers.size());
        for (String identifier : identifiers) {
            find(identifier).ifPresent(rows::add);
        }
        return rows;
    }

    @Override
    public <R> R transaction(String identifier, Function<PendingTransaction, R> work) {
        String rowKey = rowPrefix + identifier;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Attempt<R> outcome;
            try {
                outcome = redisTemplate.execute(new SessionCallback<Attempt<R>>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> Attempt<R> execute(RedisOperations<K, V> operations) throws DataAccessException {
                        return runAttempt((RedisOperations<String, String>) operations, identifier, rowKey, work);
                    }
                });
            } catch (DataAccessException e) {
                throw new StorageException("Transaction failed for " + identifier, e);
            }
            if (outcome != null && outcome.committed()) {
                return outcome.result();
            }
            log.debug("Row {} changed during transaction, retrying (attempt {}/{})", identifier, attempt, maxAttempts);
        }
        throw new StorageException("Gave up on " + identifier + " after " + maxAttempts + " conflicting attempts");
    }

    private <R> Attempt<R> runAttempt(RedisOperations<String, String> ops, String identifier, String rowKey,
            Function<PendingTransaction, R> work) {
        ops.watch(rowKey);
        Map<String, String> entries = ops.<String, String>opsForHash().entries(rowKey);
        StagedPendingTransaction tx = new StagedPendingTransaction(identifier, toRow(identifier, entries),
                () -> nextSequence(ops));
        R result;
        try {
            result = work.apply(tx);
        } catch (RuntimeException e) {
            ops.unwatch();
            throw e;
        }
        if (!tx.isDirty()) {
            ops.unwatch();
            return new Attempt<>(true, result);
        }

        ops.multi();
        ops.delete(rowKey);
        Optional<PersistedRow> staged = tx.staged();
        if (staged.isPresent()) {
            PersistedRow row = staged.get();
            ops.<String, String>opsForHash().putAll(rowKey, toHash(row));
            ops.opsForZSet().add(indexKey, identifier, row.sequence());
        } else {
            ops.opsForZSet().remove(indexKey, identifier);
        }
        List<Object> executed = ops.exec();
        return new Attempt<>(executed != null && !executed.isEmpty(), result);
    }

    private long nextSequence(RedisOperations<String, String> ops) {
        Long value = ops.opsForValue().increment(sequenceKey);
        if (value == null) {
            throw new StorageException("INCR on " + sequenceKey + " returned no value");
        }
        return value;
    }

    private Map<String, String> toHash(PersistedRow row) {
        Map<String, String> hash = new HashMap<>();
        hash.put(FIELD_OPERATIONS, codec.write(row.operations()));
        hash.put(FIELD_SEQUENCE, Long.toString(row.sequence()));
        hash.put(FIELD_CREATED_AT, row.createdAt().toString());
        hash.put(FIELD_ATTEMPTED, Boolean.toString(row.attempted()));
        hash.put(FIELD_UNSENT, codec.write(row.unsent()));
        return hash;
    }

    private Optional<PersistedRow> toRow(String identifier, Map<String, String> hash) {
        if (hash == null || hash.isEmpty()) {
            return Optional.empty();
        }
        if (!hash.keySet().containsAll(List.of(FIELD_OPERATIONS, FIELD_SEQUENCE, FIELD_CREATED_AT))) {
            log.error("Skipping incomplete pending row for {}: {}", identifier, hash.keySet());
            return Optional.empty();
        }
        try {
            return Optional.of(new PersistedRow(identifier,
                    codec.read(hash.get(FIELD_OPERATIONS)),
                    Long.parseLong(hash.get(FIELD_SEQUENCE)),
                    Instant.parse(hash.get(FIELD_CREATED_AT)),
                    Boolean.parseBoolean(hash.get(FIELD_ATTEMPTED)),
                    codec.read(hash.getOrDefault(FIELD_UNSENT, "[]"))));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.error("Skipping unreadable pending row for {}", identifier, e);
            return Optional.empty();
        }
    }

    private record Attempt<R>(boolean committed, R result) {
    }
}
