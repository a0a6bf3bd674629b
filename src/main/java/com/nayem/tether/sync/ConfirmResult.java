package com.nayem.tether.sync;

public enum ConfirmResult {
    /**
     * The sent row was still current and has been removed.
     */
    CONFIRMED,

    /**
     * Edits were appended after the snapshot was taken. The newer row stays
     * pending and needs another sync.
     */
    SUPERSEDED
}
