package com.delta.factengine.facts.service;

/**
 * Mutual exclusion between runs of the engine against the same store.
 */
public interface RunLease {
    /**
     * @throws ActiveRunException when another live run holds the lease
     */
    void acquire();

    void release();

    boolean isHeld();
}
