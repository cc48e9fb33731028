package org.antigraph;

/**
 * Per-pair change detection: the shift-tolerant difference test and the alias filter that runs
 * on its output.
 */
public class ChangeDetector {

  /**
   * Marks every pixel of {@code cur} that differs from {@code prev} by at least
   * {@code cutoffSquared}. A pixel is dropped as soon as any previous-frame pixel within
   * {@code shiftMask} of it is closer than the cutoff, which absorbs small camera shake.
   */
  public static InclusionGrid evaluateInclusion(
      Frame prev, Frame cur, ToleranceMask shiftMask, long cutoffSquared) {
    if (prev.getWidth() != cur.getWidth() || prev.getHeight() != cur.getHeight()) {
      throw new IllegalArgumentException(
          "Frame size mismatch: " + prev.getWidth() + "x" + prev.getHeight()
          + " vs " + cur.getWidth() + "x" + cur.getHeight());
    }
    int width = cur.getWidth();
    int height = cur.getHeight();
    InclusionGrid grid = new InclusionGrid(width, height, true);

    // Offsets go in the outer loops so each pass over the image is a plain scan.
    int radius = shiftMask.getRadius();
    for (int dx = -radius; dx <= radius; ++dx) {
      for (int dy = -radius; dy <= radius; ++dy) {
        if (!shiftMask.contains(dx, dy)) continue;
        int xFrom = Math.max(0, -dx);
        int xTo = Math.min(width, width - dx);
        int yFrom = Math.max(0, -dy);
        int yTo = Math.min(height, height - dy);
        for (int y = yFrom; y < yTo; ++y) {
          for (int x = xFrom; x < xTo; ++x) {
            if (!grid.isIncluded(x, y)) continue;
            if (cur.squaredDistance(x, y, prev, x + dx, y + dy) < cutoffSquared) {
              grid.setIncluded(x, y, false);
            }
          }
        }
      }
    }
    return grid;
  }

  /**
   * Drops included pixels whose neighborhood within {@code aliasMask} does not back them up. The
   * neighborhood is always read from {@code grid} as given, never from the partially filtered
   * result.
   */
  public static InclusionGrid suppressAliases(
      InclusionGrid grid, ToleranceMask aliasMask, AliasMode mode) {
    int width = grid.getWidth();
    int height = grid.getHeight();
    InclusionGrid ret = new InclusionGrid(width, height, false);
    int radius = aliasMask.getRadius();
    for (int y = 0; y < height; ++y) {
      for (int x = 0; x < width; ++x) {
        // Skip non-active pixels.
        if (!grid.isIncluded(x, y)) continue;
        boolean keep = radius == 0 || isCorroborated(grid, aliasMask, mode, x, y);
        ret.setIncluded(x, y, keep);
      }
    }
    return ret;
  }

  public static InclusionGrid suppressAliases(InclusionGrid grid, ToleranceMask aliasMask) {
    return suppressAliases(grid, aliasMask, AliasMode.CORROBORATE);
  }

  private static boolean isCorroborated(
      InclusionGrid grid, ToleranceMask aliasMask, AliasMode mode, int x, int y) {
    int radius = aliasMask.getRadius();
    for (int dx = -radius; dx <= radius; ++dx) {
      for (int dy = -radius; dy <= radius; ++dy) {
        if (dx == 0 && dy == 0) continue;
        if (!aliasMask.contains(dx, dy)) continue;
        int nx = x + dx;
        int ny = y + dy;
        if (!grid.inBounds(nx, ny)) continue;
        boolean neighbor = grid.isIncluded(nx, ny);
        if (mode == AliasMode.CORROBORATE && neighbor) {
          return true;
        }
        if (mode == AliasMode.STRICT && !neighbor) {
          return false;
        }
      }
    }
    return mode == AliasMode.STRICT;
  }
}
