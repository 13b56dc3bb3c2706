package com.warden.engine.domain.recovery;

/**
 * Cache shared by the application's workers, cleared under memory pressure.
 */
public interface SharedCache {

    /**
     * Removes every cached entry.
     *
     * @return number of entries removed
     */
    long clear();
}
