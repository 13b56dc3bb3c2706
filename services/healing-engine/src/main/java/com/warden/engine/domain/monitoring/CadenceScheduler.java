package com.warden.engine.domain.monitoring;

/**
 * Runs a lane repeatedly at the rhythm of its {@link Cadence}. An execution of a lane never
 * overlaps a previous execution of the same lane.
 */
public interface CadenceScheduler {

    Cancellable schedule(Cadence cadence, Runnable lane);
}
