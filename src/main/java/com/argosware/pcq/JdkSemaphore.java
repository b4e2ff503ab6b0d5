package com.argosware.pcq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkSemaphore implements Semaphore {
    private static final Logger log = LoggerFactory.getLogger(JdkSemaphore.class);

    private final java.util.concurrent.Semaphore back;

    public JdkSemaphore(int initial) {
        if (initial < 0)
            throw new IllegalArgumentException("initial count must be >= 0, got "+initial);
        this.back = new java.util.concurrent.Semaphore(initial);
    }

    @Override public void await() {
        // retries internally on interrupt and re-asserts the flag on return
        back.acquireUninterruptibly();
    }

    @Override public void post() {
        if (back.availablePermits() == Integer.MAX_VALUE) {
            log.error("Could not post to semaphore {}: count overflow", this);
            throw new SynchronizationError("Could not post to semaphore: count overflow");
        }
        back.release();
    }

    @Override public int available() {
        return back.availablePermits();
    }

    @Override public String toString() {
        return "JdkSemaphore@"+Integer.toHexString(System.identityHashCode(this));
    }
}
