package com.nayem.tether.scheduler;

/**
 * Checked right before every run. A task whose preconditions are not met is
 * parked until a network signal or the next poll.
 */
@FunctionalInterface
public interface Precondition {

    boolean isSatisfied();

    default String describe() {
        return getClass().getSimpleName();
    }

    static Precondition networkAvailable(NetworkMonitor monitor) {
        return new Precondition() {
            @Override
            public boolean isSatisfied() {
                return monitor.isConnected();
            }

            @Override
            public String describe() {
                return "network-available";
            }
        };
    }
}
