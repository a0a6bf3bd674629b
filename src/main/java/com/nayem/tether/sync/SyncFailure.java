package com.nayem.tether.sync;

import com.nayem.tether.core.CollapsedMutation;

import java.time.Instant;

/**
 * A mutation the backend rejected for good. It has already been removed from
 * the pending store when this is delivered.
 */
public record SyncFailure(String identifier, CollapsedMutation mutation, int status, String reason,
        Instant occurredAt) {
}
