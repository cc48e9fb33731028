package org.antigraph;

import java.io.Serializable;

/**
 * A disk of offsets around a center pixel. Used both for the camera-shift tolerance and for
 * alias suppression; built once per run and only read afterwards.
 */
public final class ToleranceMask implements Serializable {
  private static final long serialVersionUID = 1L;

  private final int radius;

  // Only one quadrant is stored; the disk is symmetric in both axes.
  private final boolean[][] quadrant;

  private ToleranceMask(int radius) {
    this.radius = radius;
    this.quadrant = new boolean[radius + 1][radius + 1];
    for (int dx = 0; dx <= radius; ++dx) {
      for (int dy = 0; dy <= radius; ++dy) {
        quadrant[dx][dy] = (long) dx * dx + (long) dy * dy <= (long) radius * radius;
      }
    }
  }

  /**
   * Builds the disk of {@code radius}: offset (dx, dy) is in it iff {@code dx^2 + dy^2 <= r^2}.
   */
  public static ToleranceMask disk(int radius) throws ConfigurationException {
    if (radius < 0) {
      throw new ConfigurationException("Mask radius must be >= 0, got " + radius);
    }
    return new ToleranceMask(radius);
  }

  /**
   * Like {@link #disk}, but never wider than a {@code width} x {@code height} canvas needs: any
   * in-canvas offset is at most {@code width + height} away, so larger radii select the same
   * offsets.
   */
  public static ToleranceMask diskWithin(int radius, int width, int height)
      throws ConfigurationException {
    if (radius < 0) {
      throw new ConfigurationException("Mask radius must be >= 0, got " + radius);
    }
    return new ToleranceMask((int) Math.min((long) radius, (long) width + height));
  }

  public int getRadius() {
    return radius;
  }

  /**
   * Side of the square the disk is inscribed in, {@code 2 * radius + 1}.
   */
  public int getSize() {
    return 2 * radius + 1;
  }

  public boolean contains(int dx, int dy) {
    int ax = Math.abs(dx);
    int ay = Math.abs(dy);
    if (ax > radius || ay > radius) return false;
    return quadrant[ax][ay];
  }

  /**
   * The full (2r+1) x (2r+1) grid, indexed {@code [dx + r][dy + r]}.
   */
  public boolean[][] toGrid() {
    int size = getSize();
    boolean[][] grid = new boolean[size][size];
    for (int dx = -radius; dx <= radius; ++dx) {
      for (int dy = -radius; dy <= radius; ++dy) {
        grid[dx + radius][dy + radius] = contains(dx, dy);
      }
    }
    return grid;
  }

  /**
   * Number of offsets inside the disk, center included.
   */
  public int countOffsets() {
    int count = 0;
    for (int dx = -radius; dx <= radius; ++dx) {
      for (int dy = -radius; dy <= radius; ++dy) {
        if (contains(dx, dy)) ++count;
      }
    }
    return count;
  }
}
