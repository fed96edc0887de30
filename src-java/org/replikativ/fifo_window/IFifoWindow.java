package org.replikativ.fifo_window;

/**
 * A FIFO window that maintains the aggregate of its elements.
 *
 * Elements are pushed at the newest end and popped from the oldest end.
 * The aggregate is the fold of {@link IOperator#combine} over the current
 * elements, oldest to newest, starting from {@link IOperator#identity()}.
 *
 * All implementations are observably equivalent; they differ only in cost.
 * Instances are not thread-safe.
 *
 * @param <V> the type of elements and aggregates
 */
public interface IFifoWindow<V> {

    /**
     * Append {@code value} as the newest element. Never fails.
     */
    void push(V value);

    /**
     * Remove the oldest element.
     * Does nothing if the window is empty, so callers may pop speculatively.
     */
    void pop();

    /**
     * Returns the aggregate of the current elements, or the identity for an
     * empty window. Has no side effects.
     */
    V query();

    /**
     * Returns the number of elements currently in the window.
     */
    int count();

    default boolean isEmpty() {
        return count() == 0;
    }
}
