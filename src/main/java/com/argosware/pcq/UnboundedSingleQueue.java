package com.argosware.pcq;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Unbounded paged queue for exactly one producer thread and one consumer thread. No locks: the
 * semaphore's post/wait pair publishes entries and new pages to the consumer.
 */
public class UnboundedSingleQueue<T> implements WorkQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(UnboundedSingleQueue.class);
    public static final int DEFAULT_PAGE_CAPACITY = 1023;

    private static final class Page {
        final Object[] entries;
        @Nullable Page next;

        Page(int capacity, Supplier<?> factory) {
            entries = new Object[capacity];
            for (int i = 0; i < capacity; i++)
                entries[i] = factory.get();
        }
    }

    private final int pageCapacity;
    private final Supplier<? extends T> factory;
    private final Assigner<T> assigner;
    private final Semaphore valid;

    // producer side
    private Page filling;
    private int fillingAt;
    private long pagesAllocated;

    // consumer side
    private Page reading;
    private int readingAt;
    private long pagesReleased;

    public UnboundedSingleQueue() {
        this(DEFAULT_PAGE_CAPACITY);
    }

    /** Entries start as {@code null} and values are stored by reference. */
    public UnboundedSingleQueue(int pageCapacity) {
        this(pageCapacity, () -> null, Assigner.reference());
    }

    public UnboundedSingleQueue(int pageCapacity, Supplier<? extends T> factory,
                                Assigner<T> assigner) {
        this(pageCapacity, factory, assigner, SemaphoreKind.CONDITION);
    }

    public UnboundedSingleQueue(int pageCapacity, Supplier<? extends T> factory,
                                Assigner<T> assigner, SemaphoreKind semaphoreKind) {
        if (pageCapacity < 1)
            throw new IllegalArgumentException("pageCapacity must be >= 1, got "+pageCapacity);
        this.pageCapacity = pageCapacity;
        this.factory = Objects.requireNonNull(factory, "factory");
        this.assigner = Objects.requireNonNull(assigner, "assigner");
        this.valid = semaphoreKind.create(0);
        this.filling = this.reading = allocate();
    }

    public int pageCapacity() { return pageCapacity; }

    /** Pages allocated since construction, the first one included. */
    public long pagesAllocated() { return pagesAllocated; }

    /**
     * Pages not yet released by the consumer. Exact only while neither side is inside a call.
     */
    public long livePages() { return pagesAllocated - pagesReleased; }

    /** Appends a copy of {@code value}. Producer thread only. */
    @Override public void produce(T value) {
        if (fillingAt == pageCapacity) {
            Page next = allocate();
            filling.next = next;
            filling = next;
            fillingAt = 0;
        }
        Object[] entries = filling.entries;
        @SuppressWarnings("unchecked") T current = (T)entries[fillingAt];
        entries[fillingAt] = assigner.assign(current, value);
        ++fillingAt;
        valid.post();
    }

    /**
     * Copies the oldest value onto {@code out}, blocking until one was produced. Consumer thread
     * only.
     */
    @Override public T consume(T out) {
        valid.await();
        if (readingAt == pageCapacity) {
            Page done = reading, next = done.next;
            assert next != null : "credit posted without a filled entry";
            done.next = null;
            reading = next;
            readingAt = 0;
            ++pagesReleased;
            if (log.isTraceEnabled())
                log.trace("released page #{}", pagesReleased);
        }
        @SuppressWarnings("unchecked") T entry = (T)reading.entries[readingAt];
        T result;
        try {
            result = assigner.assign(out, entry);
        } catch (Throwable t) {
            if (log.isDebugEnabled())
                log.debug("consume failed at page offset {}, refunding credit", readingAt, t);
            valid.post();
            throw t;
        }
        ++readingAt;
        return result;
    }

    /** {@link #consume(Object)} onto a freshly default-constructed value. */
    @Override public T consume() {
        return consume(factory.get());
    }

    private Page allocate() {
        Page page = new Page(pageCapacity, factory);
        ++pagesAllocated;
        if (log.isTraceEnabled())
            log.trace("allocated page #{}", pagesAllocated);
        return page;
    }
}
