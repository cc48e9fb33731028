package org.antigraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Scales accumulated totals into an 8-bit image. Rather than dividing by the single brightest
 * pixel, the divisor is taken at a percentile of the per-pixel magnitudes so that a few outliers
 * can be clipped to white in exchange for a brighter image.
 */
public class PercentileNormalizer {
  private static final Logger logger = LogManager.getLogger(PercentileNormalizer.class);

  /**
   * Per-pixel {@link Totals#magnitude} values, sorted ascending.
   */
  public static long[] sortedMagnitudes(Totals totals) {
    int width = totals.getWidth();
    int height = totals.getHeight();
    long[] ret = new long[width * height];
    for (int y = 0; y < height; ++y) {
      for (int x = 0; x < width; ++x) {
        ret[y * width + x] = totals.magnitude(x, y);
      }
    }
    Arrays.sort(ret);
    return ret;
  }

  /**
   * The magnitude at rank {@code floor((count - 1) * (100 - brighten) / 100)}, never less than 1.
   * {@code brighten = 0} picks the maximum, {@code brighten = 100} the minimum.
   */
  public static long divisor(Totals totals, double brighten) throws ConfigurationException {
    if (Double.isNaN(brighten) || brighten < 0 || brighten > 100) {
      throw new ConfigurationException("brighten must be within [0, 100], got " + brighten);
    }
    long[] magnitudes = sortedMagnitudes(totals);
    if (magnitudes.length == 0) return 1;
    int rank = (int) Math.floor((magnitudes.length - 1) * (100.0 - brighten) / 100.0);
    return Math.max(magnitudes[rank], 1);
  }

  public static Frame normalize(Totals totals, double brighten) throws ConfigurationException {
    long divisor = divisor(totals, brighten);
    logger.info("Renormalizing with divisor {} (brighten {})", divisor, brighten);
    return normalize(totals, divisor);
  }

  /**
   * Each channel becomes {@code min(255, floor(256 * total / divisor))}.
   */
  public static Frame normalize(Totals totals, long divisor) {
    int width = totals.getWidth();
    int height = totals.getHeight();
    int[] pixels = new int[width * height];
    for (int y = 0; y < height; ++y) {
      for (int x = 0; x < width; ++x) {
        pixels[y * width + x] = Frame.pack(
            scale(totals.get(x, y, 0), divisor),
            scale(totals.get(x, y, 1), divisor),
            scale(totals.get(x, y, 2), divisor));
      }
    }
    return new Frame(width, height, pixels);
  }

  static int scale(long total, long divisor) {
    long value = Math.floorDiv(256L * total, divisor);
    if (value > 255) return 255;
    if (value < 0) return 0;
    return (int) value;
  }
}
