package org.replikativ.fifo_window;

public class Settings {
  public static final int DEFAULT_BLOCK_SIZE = 64;

  public static final Settings DEFAULT = new Settings();

  // Max number of elements per SoE block
  public final int _blockSize;

  public Settings() {
    this(0);
  }

  public Settings(int blockSize) {
    if (blockSize <= 0) {
      blockSize = DEFAULT_BLOCK_SIZE;
    }
    _blockSize = blockSize;
  }

  public int blockSize() {
    return _blockSize;
  }

  public Settings blockSize(int blockSize) {
    return new Settings(blockSize);
  }

  @Override
  public String toString() {
    return "Settings{blockSize=" + _blockSize + "}";
  }
}
