package io.podflow.topology.routing;

import io.netty.channel.EventLoop;
import io.podflow.core.concurrent.EventLoops;
import io.podflow.topology.wiring.Endpoint;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Fan-out or fan-in stage of a group with more than one member. Its external port
 * (in-port of a head, out-port of a tail) is the group's advertised port; its internal
 * port is shared by all members.
 */
@Getter
@ToString(exclude = "loop")
public final class RoutingUnit {
    private final String name;
    private final RoutingRole role;
    private final Endpoint endpoint;
    private final List<Endpoint> members;
    private volatile EventLoop loop;

    public RoutingUnit(final String name,
                       final RoutingRole role,
                       final Endpoint endpoint,
                       final List<Endpoint> members) {
        this.name = name;
        this.role = role;
        this.endpoint = endpoint;
        this.members = List.copyOf(members);
    }

    public int externalPort() {
        return role == RoutingRole.HEAD ? endpoint.portIn() : endpoint.portOut();
    }

    public int internalPort() {
        return role == RoutingRole.HEAD ? endpoint.portOut() : endpoint.portIn();
    }

    /**
     * The external port and the member endpoints reachable through it.
     */
    public Map<Integer, List<Endpoint>> routes() {
        return Map.of(externalPort(), members);
    }

    public CompletableFuture<Void> start() {
        loop = EventLoops.newLoop(name);
        return CompletableFuture.completedFuture(null);
    }

    public void stop(final long timeoutMillis) {
        final EventLoop l = loop;
        loop = null;
        EventLoops.shutdown(l, timeoutMillis);
    }

    public boolean isRunning() {
        final EventLoop l = loop;
        return l != null && !l.isShuttingDown();
    }

    public <T> CompletableFuture<T> submit(final Callable<T> task) {
        return EventLoops.submit(requireLoop(), task);
    }

    public Executor executor() {
        return requireLoop();
    }

    public void schedule(final Runnable task, final long delayMillis) {
        requireLoop().schedule(task, delayMillis, TimeUnit.MILLISECONDS);
    }

    private EventLoop requireLoop() {
        final EventLoop l = loop;
        if (l == null) {
            throw new IllegalStateException("routing unit " + name + " is not running");
        }
        return l;
    }
}
