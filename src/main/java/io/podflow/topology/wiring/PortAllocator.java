package io.podflow.topology.wiring;

import io.podflow.error.ConfigurationException;
import io.podflow.error.WiringException;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out ports from {@code [start, end)} in ascending order, skipping ports that
 * were reserved explicitly. Never returns the same port twice.
 */
public final class PortAllocator {
    private final int start;
    private final int end;
    private final Set<Integer> taken = new HashSet<>();
    private int next;

    public PortAllocator(final int start, final int end) {
        if (start <= 0 || end <= start) {
            throw new IllegalArgumentException("invalid port range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.next = start;
    }

    /**
     * Claims a port chosen by the caller.
     *
     * @throws ConfigurationException if the port was already claimed
     */
    public void reserve(final int port) {
        if (port <= 0 || port > 65_535) {
            throw new ConfigurationException("port " + port + " is not a valid port number");
        }
        if (!taken.add(port)) {
            throw new ConfigurationException("port " + port + " is claimed twice");
        }
    }

    public int allocate() {
        while (next < end) {
            final int candidate = next++;
            if (taken.add(candidate)) {
                return candidate;
            }
        }
        throw new WiringException("port range [" + start + ", " + end + ") exhausted");
    }
}
