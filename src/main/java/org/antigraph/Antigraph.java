package org.antigraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Whole local run: size the canvas, accumulate, renormalize, write.
 */
public class Antigraph {
  private static final Logger logger = LogManager.getLogger(Antigraph.class);

  /**
   * Result summary of one run.
   */
  public static class Result {
    public int frameCount;
    public int width;
    public int height;
    public long divisor;
    public Frame image;
  }

  /**
   * Builds the antigraph of {@code paths}, in the given order, and writes it to {@code output}.
   */
  public static Result run(List<String> paths, String output, AntigraphConfig config)
      throws AntigraphException {
    config.validate();
    if (paths.size() < 2) {
      throw new ConfigurationException("Need at least 2 frames, got " + paths.size());
    }
    // Fail on an unwritable format before spending time on the frames.
    FrameIO.formatFor(output);

    int[] dims = FrameIO.maxDimensions(paths);
    Result result = compute(FrameSource.ofPaths(paths, dims[0], dims[1]), dims[0], dims[1], config);
    FrameIO.saveImage(result.image, output);
    return result;
  }

  /**
   * Accumulates and renormalizes {@code frames}; nothing is written.
   */
  public static Result compute(FrameSource frames, int width, int height, AntigraphConfig config)
      throws AntigraphException {
    Totals totals = AntigraphAccumulator.accumulate(frames, width, height, config);
    Result result = new Result();
    result.frameCount = frames.size();
    result.width = width;
    result.height = height;
    result.divisor = PercentileNormalizer.divisor(totals, config.brighten);
    result.image = PercentileNormalizer.normalize(totals, result.divisor);
    logger.info("Antigraph of {} frames done, divisor {}", result.frameCount, result.divisor);
    return result;
  }
}
