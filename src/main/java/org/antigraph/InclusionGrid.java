package org.antigraph;

import java.util.Arrays;

/**
 * Which pixels of one consecutive frame pair changed enough to count. Recomputed for every pair.
 */
public class InclusionGrid {
  private final int width;
  private final int height;
  private final boolean[] included;

  /**
   * A grid where every pixel starts {@code initial}.
   */
  public InclusionGrid(int width, int height, boolean initial) {
    this.width = width;
    this.height = height;
    this.included = new boolean[width * height];
    if (initial) {
      Arrays.fill(included, true);
    }
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public boolean isIncluded(int x, int y) {
    return included[y * width + x];
  }

  public void setIncluded(int x, int y, boolean value) {
    included[y * width + x] = value;
  }

  public boolean inBounds(int x, int y) {
    return x >= 0 && y >= 0 && x < width && y < height;
  }

  public int countIncluded() {
    int count = 0;
    for (boolean b : included) {
      if (b) ++count;
    }
    return count;
  }
}
