package org.replikativ.fifo_window;

import java.util.Objects;
import java.util.function.BinaryOperator;
import clojure.lang.IFn;

/**
 * Stock {@link IOperator} implementations.
 *
 * The numeric operators work on 64-bit integers. Overflow in {@link #sum()}
 * wraps around like plain {@code long} addition.
 */
@SuppressWarnings("unchecked")
public final class Operators {

  private static final IOperator<Long> SUM = new IOperator<Long>() {
    @Override
    public Long identity() {
      return 0L;
    }

    @Override
    public Long combine(Long older, Long newer) {
      return older + newer;
    }

    @Override
    public String toString() {
      return "Sum";
    }
  };

  private static final IOperator<Long> MAX = new IOperator<Long>() {
    @Override
    public Long identity() {
      return Long.MIN_VALUE;
    }

    @Override
    public Long combine(Long older, Long newer) {
      return older >= newer ? older : newer;
    }

    @Override
    public String toString() {
      return "Max";
    }
  };

  private static final IOperator<Long> MIN = new IOperator<Long>() {
    @Override
    public Long identity() {
      return Long.MAX_VALUE;
    }

    @Override
    public Long combine(Long older, Long newer) {
      return older <= newer ? older : newer;
    }

    @Override
    public String toString() {
      return "Min";
    }
  };

  private Operators() {
  }

  /**
   * Addition, identity {@code 0}.
   */
  public static IOperator<Long> sum() {
    return SUM;
  }

  /**
   * Maximum, identity {@link Long#MIN_VALUE}.
   */
  public static IOperator<Long> max() {
    return MAX;
  }

  /**
   * Minimum, identity {@link Long#MAX_VALUE}.
   */
  public static IOperator<Long> min() {
    return MIN;
  }

  /**
   * Operator from an identity element and a pure combine function.
   * The function must be associative and {@code identity} must be its identity;
   * neither is checked.
   */
  public static <V> IOperator<V> of(V identity, BinaryOperator<V> combine) {
    Objects.requireNonNull(combine, "combine");
    return new IOperator<V>() {
      @Override
      public V identity() {
        return identity;
      }

      @Override
      public V combine(V older, V newer) {
        return combine.apply(older, newer);
      }
    };
  }

  /**
   * Operator backed by a two-argument Clojure function, e.g. {@code (fn [a b] (max a b))}.
   */
  public static <V> IOperator<V> fromFn(V identity, IFn fn) {
    Objects.requireNonNull(fn, "fn");
    return new IOperator<V>() {
      @Override
      public V identity() {
        return identity;
      }

      @Override
      public V combine(V older, V newer) {
        return (V) fn.invoke(older, newer);
      }

      @Override
      public String toString() {
        return "Fn[" + fn + "]";
      }
    };
  }
}
