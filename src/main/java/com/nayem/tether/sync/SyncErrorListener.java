package com.nayem.tether.sync;

/**
 * Receives every unrecoverable sync failure exactly once.
 */
@FunctionalInterface
public interface SyncErrorListener {

    void onSyncFailure(SyncFailure failure);
}
