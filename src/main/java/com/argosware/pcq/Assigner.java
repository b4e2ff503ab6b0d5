package com.argosware.pcq;

/**
 * Assignment of one element value onto another, the operation queues use to copy a value into
 * or out of a slot.
 *
 * <p>Implementations may reuse {@code target} (copying the contents of {@code source} into it)
 * or return a new instance. A thrown exception aborts the transfer; queues then leave both the
 * slot and their cursors untouched and rethrow it.</p>
 */
@FunctionalInterface
public interface Assigner<T> {
    /**
     * Copies {@code source} onto {@code target}.
     *
     * @param target the value currently held by the destination, possibly {@code null}
     * @param source the value to copy
     * @return the value that must now occupy the destination
     */
    T assign(T target, T source);

    /** Plain reference assignment: returns {@code source}, never throws. */
    static <T> Assigner<T> reference() {
        return (target, source) -> source;
    }
}
