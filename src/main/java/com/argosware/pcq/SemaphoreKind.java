package com.argosware.pcq;

public enum SemaphoreKind {
    /** Counter guarded by a {@link java.util.concurrent.locks.ReentrantLock} and a condition. */
    CONDITION,
    /** Wraps a {@link java.util.concurrent.Semaphore}. */
    JDK;

    public Semaphore create(int initial) {
        return switch (this) {
            case CONDITION -> new ConditionSemaphore(initial);
            case JDK       -> new JdkSemaphore(initial);
        };
    }
}
