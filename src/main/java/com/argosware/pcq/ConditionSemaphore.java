package com.argosware.pcq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

class ConditionSemaphore implements Semaphore {
    private static final Logger log = LoggerFactory.getLogger(ConditionSemaphore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition hasCredit = lock.newCondition();
    private int count;

    public ConditionSemaphore(int initial) {
        if (initial < 0)
            throw new IllegalArgumentException("initial count must be >= 0, got "+initial);
        this.count = initial;
    }

    @Override public void await() {
        boolean interrupted = false;
        lock.lock();
        try {
            while (count == 0) {
                try {
                    hasCredit.await();
                } catch (InterruptedException e) {
                    interrupted = true; // not a failure, wait again
                }
            }
            --count;
        } finally {
            lock.unlock();
            if (interrupted)
                Thread.currentThread().interrupt();
        }
    }

    @Override public void post() {
        lock.lock();
        try {
            if (count == Integer.MAX_VALUE) {
                log.error("Could not post to semaphore {}: count overflow", this);
                throw new SynchronizationError("Could not post to semaphore: count overflow");
            }
            ++count;
            hasCredit.signal();
        } finally { lock.unlock(); }
    }

    @Override public int available() {
        lock.lock();
        try {
            return count;
        } finally { lock.unlock(); }
    }

    @Override public String toString() {
        return "ConditionSemaphore@"+Integer.toHexString(System.identityHashCode(this));
    }
}
