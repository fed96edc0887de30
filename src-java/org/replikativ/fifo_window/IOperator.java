package org.replikativ.fifo_window;

/**
 * Aggregation operator shared by all window algorithms.
 * Operators form a monoid with identity and associative combine operation.
 *
 * Neither commutativity nor an inverse is assumed, so windows never
 * "subtract" an evicted element from an aggregate.
 *
 * @param <V> the type of elements and aggregates
 */
public interface IOperator<V> {

    /**
     * Returns the identity element.
     * Must satisfy: combine(identity(), x) == x == combine(x, identity())
     */
    V identity();

    /**
     * Combine two aggregates, older one first.
     * This operation must be associative: combine(a, combine(b, c)) == combine(combine(a, b), c)
     */
    V combine(V older, V newer);
}
