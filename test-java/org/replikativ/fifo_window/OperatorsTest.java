package org.replikativ.fifo_window;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import clojure.lang.AFn;
import clojure.lang.IFn;
import java.util.function.BinaryOperator;
import org.junit.Test;

public class OperatorsTest {

  @Test
  public void testSum() {
    IOperator<Long> sum = Operators.sum();
    assertThat(sum.identity(), is(0L));
    assertThat(sum.combine(3L, 4L), is(7L));
    assertThat(sum.combine(sum.identity(), 9L), is(9L));
    assertThat(sum.combine(Long.MAX_VALUE, 1L), is(Long.MIN_VALUE));
  }

  @Test
  public void testMax() {
    IOperator<Long> max = Operators.max();
    assertThat(max.identity(), is(Long.MIN_VALUE));
    assertThat(max.combine(3L, 4L), is(4L));
    assertThat(max.combine(4L, 3L), is(4L));
    assertThat(max.combine(max.identity(), -9L), is(-9L));
    assertThat(max.combine(-9L, max.identity()), is(-9L));
  }

  @Test
  public void testMin() {
    IOperator<Long> min = Operators.min();
    assertThat(min.identity(), is(Long.MAX_VALUE));
    assertThat(min.combine(3L, 4L), is(3L));
    assertThat(min.combine(min.identity(), 9L), is(9L));
  }

  @Test
  public void testOfKeepsArgumentOrder() {
    IOperator<String> concat = Operators.of("", String::concat);
    assertThat(concat.identity(), is(""));
    assertThat(concat.combine("ab", "cd"), is("abcd"));
  }

  @Test
  public void testOfRejectsMissingFunction() {
    assertThrows(NullPointerException.class, () -> Operators.of(0L, (BinaryOperator<Long>) null));
  }

  @Test
  public void testFromFn() {
    IFn times = new AFn() {
      @Override
      public Object invoke(Object a, Object b) {
        return (Long) a * (Long) b;
      }
    };
    IOperator<Long> product = Operators.fromFn(1L, times);
    assertThat(product.identity(), is(1L));
    assertThat(product.combine(6L, 7L), is(42L));

    AWindow<Long> window = Algorithm.TWO_STACKS.create(product);
    window.push(2L);
    window.push(3L);
    window.push(4L);
    assertThat(window.query(), is(24L));
    window.pop();
    assertThat(window.query(), is(12L));
  }

  @Test
  public void testFromFnRejectsMissingFunction() {
    assertThrows(NullPointerException.class, () -> Operators.fromFn(0L, null));
  }
}
