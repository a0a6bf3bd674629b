package com.nayem.tether.scheduler;

/**
 * What {@link TaskScheduler#enqueue} does when the identity already has work.
 */
public enum ConflictPolicy {
    /**
     * A queued run is rescheduled with the new request. A running attempt is
     * cancelled and runs again once it has stopped.
     */
    REPLACE,

    /**
     * A queued run is left alone. A running attempt finishes and then runs once
     * more.
     */
    KEEP
}
