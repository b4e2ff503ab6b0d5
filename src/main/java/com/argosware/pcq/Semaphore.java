package com.argosware.pcq;

/**
 * Counting semaphore. Interrupts never abort {@link #await()}; other failures are fatal.
 */
public interface Semaphore {
    /** Blocks until the count is positive, then decrements it. */
    void await() throws SynchronizationError;

    /** Increments the count, waking one blocked {@link #await()} caller, if any. */
    void post() throws SynchronizationError;

    /** Snapshot of the current count. Only meaningful while no other thread touches this. */
    int available();
}
