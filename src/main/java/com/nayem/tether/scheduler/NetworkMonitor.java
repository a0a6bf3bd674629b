package com.nayem.tether.scheduler;

/**
 * Source of reachability information for the scheduler.
 */
public interface NetworkMonitor {

    boolean isConnected();

    /**
     * Registers a callback invoked with the new reachability whenever it changes.
     */
    void addListener(Listener listener);

    @FunctionalInterface
    interface Listener {
        void onConnectivityChanged(boolean connected);
    }
}
