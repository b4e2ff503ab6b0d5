package com.argosware.pcq;

/**
 * A {@link Semaphore} primitive failed for a reason other than interruption. The invariants of
 * whatever is coordinated by that semaphore can no longer be trusted.
 */
public class SynchronizationError extends Error {
    public SynchronizationError(String message) {
        super(message);
    }

    public SynchronizationError(String message, Throwable cause) {
        super(message, cause);
    }
}
