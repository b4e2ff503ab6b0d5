package com.argosware.pcq;

/**
 * Operations common to both queue variants. Whether several threads may call each side
 * depends on the implementation.
 */
public interface WorkQueue<T> {
    /** Adds a copy of {@code value}. */
    void produce(T value);

    /** Removes the oldest value, copying it onto {@code out}, and returns the assigned value. */
    T consume(T out);

    /** Removes the oldest value, copying it onto a default-constructed one. */
    T consume();
}
