package org.antigraph;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * A half-open range {@code [start, end)} of frame indices handled by one worker.
 */
public class FramePartition implements Serializable {
  private static final long serialVersionUID = 1L;

  public final int index;
  public final int start;
  public final int end;

  public FramePartition(int index, int start, int end) {
    this.index = index;
    this.start = start;
    this.end = end;
  }

  public int size() {
    return Math.max(0, end - start);
  }

  /**
   * Number of consecutive pairs this partition evaluates.
   */
  public int pairCount() {
    return Math.max(0, size() - 1);
  }

  /**
   * Number of workers actually used for {@code frameCount} frames: at most one per pair.
   */
  public static int clampThreads(int frameCount, int threads) {
    return Math.max(1, Math.min(threads, frameCount - 1));
  }

  /**
   * Splits {@code frameCount} frames across {@code threads} workers. Each range also takes the
   * first frame of the next one, so the pair straddling the boundary is evaluated by the earlier
   * worker; the later worker treats that frame as having no predecessor.
   */
  public static List<FramePartition> split(int frameCount, int threads)
      throws ConfigurationException {
    if (frameCount < 2) {
      throw new ConfigurationException("Need at least 2 frames, got " + frameCount);
    }
    if (threads < 1) {
      throw new ConfigurationException("Need at least 1 thread, got " + threads);
    }
    int workers = clampThreads(frameCount, threads);
    int perWorker = (frameCount + workers - 1) / workers;
    List<FramePartition> ret = new ArrayList<FramePartition>();
    for (int t = 0; t < workers; ++t) {
      int start = Math.min(t * perWorker, frameCount);
      int end = Math.min((t + 1) * perWorker + 1, frameCount);
      ret.add(new FramePartition(t, start, end));
    }
    return ret;
  }

  @Override
  public String toString() {
    return "partition " + index + " [" + start + ", " + end + ")";
  }
}
