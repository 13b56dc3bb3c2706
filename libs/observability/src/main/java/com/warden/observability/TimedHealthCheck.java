package com.warden.observability;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for probes that run a blocking round-trip on an executor and classify it.
 * <p>
 * Elapsed time is measured from the moment the probe body starts. Any exception thrown by
 * {@link #probe(long)} is captured as an {@link HealthStatus#UNHEALTHY} result carrying the
 * exception message; it is never re-thrown to the caller.
 * <p>
 * At most one round-trip per check is in flight. While one is still running, {@link #check()}
 * hands out another view of it instead of occupying a second executor thread, so a dependency
 * that hangs holds a single thread no matter how many cycles time out on it. Each caller gets
 * its own copy of the future; completing or timing out a copy leaves the round-trip untouched.
 */
public abstract class TimedHealthCheck implements HealthCheck {

    private final String name;
    private final Executor executor;
    private final AtomicReference<CompletableFuture<ComponentHealth>> inFlight = new AtomicReference<>();

    protected TimedHealthCheck(String name, Executor executor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.name = name;
        this.executor = executor;
    }

    @Override
    public final CompletableFuture<ComponentHealth> check() {
        while (true) {
            CompletableFuture<ComponentHealth> current = inFlight.get();
            if (current != null && !current.isDone()) {
                return current.copy();
            }
            CompletableFuture<ComponentHealth> next = new CompletableFuture<>();
            if (inFlight.compareAndSet(current, next)) {
                try {
                    executor.execute(() -> next.complete(run()));
                } catch (RejectedExecutionException e) {
                    next.complete(ComponentHealth.unhealthy(name, "Probe executor rejected the check", 0));
                }
                return next.copy();
            }
        }
    }

    /**
     * Returns true while a round-trip started by {@link #check()} has not finished.
     */
    public boolean isInFlight() {
        CompletableFuture<ComponentHealth> current = inFlight.get();
        return current != null && !current.isDone();
    }

    /**
     * Runs the probe synchronously on the calling thread.
     */
    public final ComponentHealth run() {
        long start = System.nanoTime();
        try {
            ComponentHealth result = probe(start);
            if (result == null) {
                return ComponentHealth.unhealthy(name, "Probe returned no result", elapsedMs(start));
            }
            return result;
        } catch (Exception e) {
            return ComponentHealth.unhealthy(name, describe(e), elapsedMs(start));
        }
    }

    /**
     * Performs the round-trip and classifies it.
     *
     * @param startNanos {@link System#nanoTime()} at probe start, for {@link #elapsedMs(long)}
     * @return the classified component health
     * @throws Exception any failure of the underlying dependency
     */
    protected abstract ComponentHealth probe(long startNanos) throws Exception;

    /**
     * Returns the component name this check reports under.
     */
    public String name() {
        return name;
    }

    /**
     * Milliseconds elapsed since {@code startNanos}.
     */
    public static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
