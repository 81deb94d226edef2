package io.podflow.topology.wiring;

/**
 * The two ports a routable unit exposes. Ports are channels: a unit receives on
 * {@code portIn} and emits on {@code portOut}, and every unit whose {@code portIn}
 * equals that {@code portOut} is downstream of it.
 */
public record Endpoint(int portIn, int portOut) {
    public Endpoint {
        if (portIn <= 0 || portOut <= 0) {
            throw new IllegalArgumentException("ports must be > 0, got in=" + portIn + " out=" + portOut);
        }
    }

    @Override
    public String toString() {
        return portIn + "->" + portOut;
    }
}
