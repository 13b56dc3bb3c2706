package com.warden.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Probe for one monitored component of the engine: the database, the shared cache, object
 * storage, the job queues or the host's resources.
 * <p>
 * {@link HealthCheckRegistry} starts every registered probe before waiting on any of them,
 * so {@link #check()} must hand the round-trip to an executor instead of blocking the caller.
 * Blocking probes usually extend {@link TimedHealthCheck}, which does exactly that. The
 * registry reports a probe as {@link HealthStatus#UNHEALTHY} when its future fails, times
 * out or yields {@code null}.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
