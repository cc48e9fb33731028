package org.antigraph;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered frames of one time-lapse. Workers call {@link #load} themselves, so a frame only
 * lives in the worker that needs it.
 */
public interface FrameSource {
  int size();

  Frame load(int index) throws DecodeException;

  /**
   * Frames that are already decoded.
   */
  static FrameSource ofFrames(List<Frame> frames) {
    final List<Frame> copy = new ArrayList<Frame>(frames);
    return new FrameSource() {
      @Override
      public int size() {
        return copy.size();
      }

      @Override
      public Frame load(int index) {
        return copy.get(index);
      }
    };
  }

  /**
   * Frames on the local file system, decoded onto a {@code width} x {@code height} canvas.
   */
  static FrameSource ofPaths(List<String> paths, final int width, final int height) {
    final List<String> copy = new ArrayList<String>(paths);
    return new FrameSource() {
      @Override
      public int size() {
        return copy.size();
      }

      @Override
      public Frame load(int index) throws DecodeException {
        return FrameIO.loadFrame(copy.get(index), width, height);
      }
    };
  }
}
