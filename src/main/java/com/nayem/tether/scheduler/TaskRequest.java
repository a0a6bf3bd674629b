package com.nayem.tether.scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A unit of background work. Requests with the same {@link #identity()} are
 * never run concurrently.
 *
 * @param type          selects the registered {@link TaskHandler}
 * @param key           distinguishes tasks of one type, e.g. the identifier to sync
 * @param policy        what to do when the identity already has work
 * @param initialDelay  delay before the first run
 * @param preconditions checked before every run
 */
public record TaskRequest(String type, String key, ConflictPolicy policy, Duration initialDelay,
        List<Precondition> preconditions) {

    public TaskRequest {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
        policy = policy == null ? ConflictPolicy.REPLACE : policy;
        initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
    }

    public static TaskRequest of(String type, String key, ConflictPolicy policy, Precondition... preconditions) {
        return new TaskRequest(type, key, policy, Duration.ZERO, List.of(preconditions));
    }

    public String identity() {
        return identity(type, key);
    }

    public static String identity(String type, String key) {
        return type + "/" + key;
    }
}
