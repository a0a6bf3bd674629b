package com.nayem.tether.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Network monitor driven by the host, which reports reachability through
 * {@link #setConnected(boolean)}.
 */
public class DefaultNetworkMonitor implements NetworkMonitor {

    private static final Logger log = LoggerFactory.getLogger(DefaultNetworkMonitor.class);

    private final AtomicBoolean connected;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public DefaultNetworkMonitor() {
        this(true);
    }

    public DefaultNetworkMonitor(boolean initiallyConnected) {
        this.connected = new AtomicBoolean(initiallyConnected);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    public void setConnected(boolean value) {
        if (connected.getAndSet(value) == value) {
            return;
        }
        log.info("Network {}", value ? "available" : "unavailable");
        for (Listener listener : listeners) {
            try {
                listener.onConnectivityChanged(value);
            } catch (RuntimeException e) {
                log.warn("Network listener failed", e);
            }
        }
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
    }
}
