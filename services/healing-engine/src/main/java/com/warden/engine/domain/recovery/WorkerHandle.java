package com.warden.engine.domain.recovery;

/**
 * A restartable background worker.
 */
public interface WorkerHandle {

    String id();

    long memoryUsageBytes();

    void restart();
}
