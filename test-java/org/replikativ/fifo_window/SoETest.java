package org.replikativ.fifo_window;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertEquals;

import java.util.Random;
import org.junit.Test;

public class SoETest {

  @Test
  public void testDefaultSettings() {
    SoE<Long> window = new SoE<>(Operators.sum());
    assertEquals(Settings.DEFAULT_BLOCK_SIZE, window._settings.blockSize());
  }

  @Test
  public void testBlocksFillUpToBlockSize() {
    SoE<Long> window = new SoE<>(Operators.sum(), new Settings(4));
    for (long v = 0; v < 100; v++) {
      window.push(v);
    }
    assertEquals(25, window.blockCount());
    assertEquals(0, window._frontCount);

    window.pop();
    assertEquals(25, window.blockCount());
    assertEquals(25, window._frontCount);
    assertThat(window._blocks.peekFirst().len(), is(3));

    // the newest block is sealed in the front run, so a new one is opened
    window.push(100L);
    assertEquals(26, window.blockCount());
    assertThat(window._blocks.peekLast().len(), is(1));

    for (int i = 0; i < 3; i++) {
      window.pop();
    }
    assertEquals(25, window.blockCount());
    assertEquals(24, window._frontCount);
    // 4 + ... + 100
    assertThat(window.query(), is(100L * 101L / 2 - 6L));
  }

  @Test
  public void testBlockCountStaysBounded() {
    Random random = new Random(13);
    int blockSize = 8;
    SoE<Long> window = new SoE<>(Operators.max(), new Settings(blockSize));
    for (int i = 0; i < 20_000; i++) {
      if (random.nextInt(10) < 6) {
        window.push((long) random.nextInt(1_000));
      } else {
        window.pop();
      }
      // only the two ends of the front run and the newest block may be partial
      int bound = window.count() / blockSize + 3;
      assertThat(window.blockCount(), lessThanOrEqualTo(bound));
    }
  }

  @Test
  public void testEvictedElementsAreReleased() {
    SoE<Object> window = new SoE<>(Operators.of(null, (a, b) -> b == null ? a : b), new Settings(4));
    for (int i = 0; i < 4; i++) {
      window.push(new Object());
    }
    window.pop();
    window.pop();
    SoE.Block<Object> block = window._blocks.peekFirst();
    assertThat(block._values[0] == null && block._values[1] == null, is(true));
  }
}
