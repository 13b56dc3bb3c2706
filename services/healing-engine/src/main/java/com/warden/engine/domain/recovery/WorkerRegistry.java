package com.warden.engine.domain.recovery;

import java.util.List;

/**
 * Live background workers.
 */
public interface WorkerRegistry {

    List<WorkerHandle> workers();
}
