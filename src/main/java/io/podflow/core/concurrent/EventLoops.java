package io.podflow.core.concurrent;

import io.netty.channel.DefaultEventLoop;
import io.netty.channel.EventLoop;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Each worker and routing unit runs on its own single-threaded Netty event loop.
 * These helpers create and stop those loops and bridge Netty futures into
 * {@link CompletableFuture}s.
 */
@Slf4j
@UtilityClass
public class EventLoops {

    public EventLoop newLoop(final String name) {
        return new DefaultEventLoop(new DefaultThreadFactory(name, true));
    }

    /**
     * Runs {@code task} on {@code loop}. A loop that is shutting down yields a failed future
     * instead of throwing.
     */
    public <T> CompletableFuture<T> submit(final EventLoop loop, final Callable<T> task) {
        try {
            return toCompletable(loop.submit(task));
        } catch (final RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public <T> CompletableFuture<T> toCompletable(final Future<T> future) {
        final CompletableFuture<T> cf = new CompletableFuture<>();
        future.addListener(done -> {
            if (future.isSuccess()) {
                cf.complete(future.getNow());
            } else {
                cf.completeExceptionally(future.cause());
            }
        });
        return cf;
    }

    /**
     * Stops the loop after the tasks already queued on it have run, waiting at most
     * {@code timeoutMillis}.
     */
    public void shutdown(final EventLoop loop, final long timeoutMillis) {
        if (loop == null) return;
        final Future<?> terminated = loop.shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS);
        if (!terminated.awaitUninterruptibly(timeoutMillis + 100)) {
            log.warn("Event loop {} did not terminate within {} ms", loop, timeoutMillis);
        }
    }
}
