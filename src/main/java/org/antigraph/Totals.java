package org.antigraph;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Per-pixel, per-channel sums of the color values that passed change detection. Each worker
 * fills a private instance; the instances are merged once every worker is done.
 */
public class Totals implements Serializable {
  private static final long serialVersionUID = 1L;

  private final int width;
  private final int height;

  // Indexed (y * width + x) * 3 + channel.
  private final long[] sums;

  public Totals(int width, int height) {
    this.width = width;
    this.height = height;
    this.sums = new long[3 * width * height];
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public long get(int x, int y, int channel) {
    return sums[(y * width + x) * 3 + channel];
  }

  /**
   * Adds the color of {@code cur} at every pixel {@code included} marks.
   */
  public void addIncluded(Frame cur, InclusionGrid included) {
    for (int y = 0; y < height; ++y) {
      for (int x = 0; x < width; ++x) {
        if (!included.isIncluded(x, y)) continue;
        int rgb = cur.getRGB(x, y);
        int base = (y * width + x) * 3;
        sums[base] += (rgb >> 16) & 0xff;
        sums[base + 1] += (rgb >> 8) & 0xff;
        sums[base + 2] += rgb & 0xff;
      }
    }
  }

  /**
   * Sum of the absolute channel totals at {@code (x, y)}.
   */
  public long magnitude(int x, int y) {
    int base = (y * width + x) * 3;
    return Math.abs(sums[base]) + Math.abs(sums[base + 1]) + Math.abs(sums[base + 2]);
  }

  /**
   * Adds {@code other} into this instance element by element and returns this instance.
   */
  public Totals merge(Totals other) {
    if (other.width != width || other.height != height) {
      throw new IllegalArgumentException(
          "Cannot merge " + other.width + "x" + other.height + " totals into "
          + width + "x" + height);
    }
    for (int i = 0; i < sums.length; ++i) {
      sums[i] += other.sums[i];
    }
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Totals)) return false;
    Totals other = (Totals) o;
    return width == other.width && height == other.height && Arrays.equals(sums, other.sums);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(sums);
  }
}
