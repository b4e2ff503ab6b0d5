package com.argosware.pcq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed-capacity ring buffer for any number of producers and consumers. A transfer that throws
 * refunds its credit and leaves the queue as it was.
 */
public class BoundedQueue<T> implements WorkQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(BoundedQueue.class);

    private final Semaphore empty;
    private final Semaphore used;
    private final Object[] slots;
    private final Supplier<? extends T> factory;
    private final Assigner<T> assigner;

    private final ReentrantLock produceLock = new ReentrantLock();
    private int produceAt;

    private final ReentrantLock consumeLock = new ReentrantLock();
    private int consumeAt;

    /** Slots start as {@code null} and values are stored by reference. */
    public BoundedQueue(int capacity) {
        this(capacity, () -> null, Assigner.reference());
    }

    public BoundedQueue(int capacity, Supplier<? extends T> factory, Assigner<T> assigner) {
        this(capacity, factory, assigner, SemaphoreKind.CONDITION);
    }

    public BoundedQueue(int capacity, Supplier<? extends T> factory, Assigner<T> assigner,
                        SemaphoreKind semaphoreKind) {
        if (capacity < 1)
            throw new IllegalArgumentException("capacity must be >= 1, got "+capacity);
        this.factory = Objects.requireNonNull(factory, "factory");
        this.assigner = Objects.requireNonNull(assigner, "assigner");
        this.slots = new Object[capacity];
        for (int i = 0; i < capacity; i++)
            slots[i] = factory.get();
        this.empty = semaphoreKind.create(capacity);
        this.used = semaphoreKind.create(0);
    }

    public int capacity() { return slots.length; }

    /** Snapshot of the empty-slot semaphore. */
    public int emptyCredits() { return empty.available(); }

    /** Snapshot of the used-slot semaphore. */
    public int usedCredits() { return used.available(); }

    /** Copies {@code value} into the next free slot, blocking while the queue is full. */
    @Override public void produce(T value) {
        empty.await();
        produceLock.lock();
        try {
            int at = this.produceAt;
            T stored;
            try {
                stored = assigner.assign(slot(at), value);
            } catch (Throwable t) {
                refund(empty, "produce", at, t);
                throw t;
            }
            slots[at] = stored;
            this.produceAt = next(at);
        } finally { produceLock.unlock(); }
        used.post();
    }

    /**
     * Moves {@code value} into the next free slot without copying its contents.
     *
     * @return the value the slot held before, which the queue no longer references
     */
    public T produceSwap(T value) {
        empty.await();
        T former;
        produceLock.lock();
        try {
            int at = this.produceAt;
            former = slot(at);
            slots[at] = value;
            this.produceAt = next(at);
        } finally { produceLock.unlock(); }
        used.post();
        return former;
    }

    /**
     * Copies the oldest value onto {@code out}, blocking while the queue is empty.
     *
     * @return the result of assigning the slot onto {@code out}
     */
    @Override public T consume(T out) {
        used.await();
        T result;
        consumeLock.lock();
        try {
            int at = this.consumeAt;
            T stored = slot(at);
            try {
                result = assigner.assign(out, stored);
            } catch (Throwable t) {
                refund(used, "consume", at, t);
                throw t;
            }
            if (result == stored && result != null)
                slots[at] = factory.get(); // handed out, so the slot must not keep it
            this.consumeAt = next(at);
        } finally { consumeLock.unlock(); }
        empty.post();
        return result;
    }

    /**
     * Takes the oldest value out by exchanging it with {@code out}, which stays in the slot until
     * it is overwritten by a later produce.
     */
    public T consumeSwap(T out) {
        used.await();
        T taken;
        consumeLock.lock();
        try {
            int at = this.consumeAt;
            taken = slot(at);
            slots[at] = out;
            this.consumeAt = next(at);
        } finally { consumeLock.unlock(); }
        empty.post();
        return taken;
    }

    /**
     * Convenience form of {@link #consume(Object)} onto a freshly default-constructed value.
     * Costs one extra construction and copy; prefer {@link #consume(Object)} in hot loops.
     */
    @Override public T consume() {
        return consume(factory.get());
    }

    @SuppressWarnings("unchecked") private T slot(int at) {
        return (T)slots[at];
    }

    private int next(int at) {
        return ++at == slots.length ? 0 : at;
    }

    private static void refund(Semaphore semaphore, String op, int at, Throwable cause) {
        if (log.isDebugEnabled())
            log.debug("{} failed at slot {}, refunding credit", op, at, cause);
        semaphore.post();
    }
}
