package org.replikativ.fifo_window;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Window algorithms, for callers that choose one at runtime.
 */
public enum Algorithm {
  /** Recomputes the fold on every query, O(n). */
  RECALC,
  /** Two stacks, O(1) amortized. */
  TWO_STACKS,
  /** De-amortized two stacks, O(1) worst case. */
  DABA,
  /** Aggregate-tagged blocks, O(1) amortized. */
  SOE,
  /** Forest of combining trees, O(1) amortized. */
  REACTIVE;

  private static final Logger log = LoggerFactory.getLogger(Algorithm.class);

  public <V> AWindow<V> create(IOperator<V> op) {
    return create(op, Settings.DEFAULT);
  }

  public <V> AWindow<V> create(IOperator<V> op, Settings settings) {
    Objects.requireNonNull(settings, "settings");
    log.debug("Creating {} window for operator {} with {}", this, op, settings);
    switch (this) {
    case RECALC:
      return new ReCalc<>(op);
    case TWO_STACKS:
      return new TwoStacks<>(op);
    case DABA:
      return new DABA<>(op);
    case SOE:
      return new SoE<>(op, settings);
    case REACTIVE:
      return new Reactive<>(op);
    default:
      throw new RuntimeException("Unexpected algorithm: " + this);
    }
  }
}
