package org.antigraph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.antigraph.TestFrames.BLACK;
import static org.antigraph.TestFrames.WHITE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AntigraphAccumulatorTest {

  private static AntigraphConfig config(int cutoff, int unshift, int unalias, int threads) {
    AntigraphConfig config = new AntigraphConfig();
    config.cutoff = cutoff;
    config.unshift = unshift;
    config.unalias = unalias;
    config.threads = threads;
    return config;
  }

  /**
   * Straight single-pass sum over every pair, for comparison.
   */
  private static Totals sequentialTotals(List<Frame> frames, AntigraphConfig config)
      throws Exception {
    Frame first = frames.get(0);
    Totals totals = new Totals(first.getWidth(), first.getHeight());
    ToleranceMask shift = ToleranceMask.disk(config.unshift);
    ToleranceMask alias = ToleranceMask.disk(config.unalias);
    for (int i = 1; i < frames.size(); ++i) {
      InclusionGrid grid = ChangeDetector.evaluateInclusion(
          frames.get(i - 1), frames.get(i), shift, config.cutoffSquared());
      totals.addIncluded(frames.get(i), ChangeDetector.suppressAliases(grid, alias));
    }
    return totals;
  }

  @Test
  void testTotalsIndependentOfThreadCount() throws Exception {
    List<Frame> frames = TestFrames.randomSequence(42L, 13, 9, 7);
    FrameSource source = FrameSource.ofFrames(frames);

    Totals expected = AntigraphAccumulator.accumulate(source, 9, 7, config(40, 1, 1, 1));
    for (int threads = 2; threads <= 15; ++threads) {
      Totals actual = AntigraphAccumulator.accumulate(source, 9, 7, config(40, 1, 1, threads));
      assertThat(actual).as("%d threads", threads).isEqualTo(expected);
    }
  }

  @Test
  void testMatchesSequentialSum() throws Exception {
    List<Frame> frames = TestFrames.randomSequence(7L, 10, 6, 5);
    AntigraphConfig config = config(100, 1, 2, 4);

    Totals totals = AntigraphAccumulator.accumulate(FrameSource.ofFrames(frames), 6, 5, config);

    assertThat(totals).isEqualTo(sequentialTotals(frames, config));
  }

  @Test
  void testThreeFramesOnTwoWorkersMatchSingleWorker() throws Exception {
    Frame black = TestFrames.solid(2, 2, BLACK);
    List<Frame> frames = Arrays.asList(
        black, TestFrames.with(black, 0, 0, WHITE), TestFrames.with(black, 1, 1, 0x204080));
    FrameSource source = FrameSource.ofFrames(frames);

    Totals single = AntigraphAccumulator.accumulate(source, 2, 2, config(1, 0, 0, 1));
    Totals split = AntigraphAccumulator.accumulate(source, 2, 2, config(1, 0, 0, 2));

    assertThat(split).isEqualTo(single);
    // Pair (0, 1) adds white at (0, 0); pair (1, 2) adds black there and the new color at (1, 1).
    assertThat(single.get(0, 0, 0)).isEqualTo(255);
    assertThat(single.get(1, 1, 0)).isEqualTo(0x20);
    assertThat(single.get(1, 1, 1)).isEqualTo(0x40);
    assertThat(single.get(1, 1, 2)).isEqualTo(0x80);
    assertThat(single.get(1, 0, 0)).isZero();
  }

  @Test
  void testPlainThresholdingWithoutRadii() throws Exception {
    List<Frame> frames = TestFrames.randomSequence(99L, 6, 5, 4);
    AntigraphConfig config = config(60, 0, 0, 3);

    Totals totals = AntigraphAccumulator.accumulate(FrameSource.ofFrames(frames), 5, 4, config);

    for (int y = 0; y < 4; ++y) {
      for (int x = 0; x < 5; ++x) {
        long[] expected = new long[3];
        for (int i = 1; i < frames.size(); ++i) {
          Frame cur = frames.get(i);
          if (cur.squaredDistance(x, y, frames.get(i - 1), x, y) >= 60 * 60) {
            for (int c = 0; c < 3; ++c) {
              expected[c] += cur.getChannel(x, y, c);
            }
          }
        }
        for (int c = 0; c < 3; ++c) {
          assertThat(totals.get(x, y, c)).isEqualTo(expected[c]);
        }
      }
    }
  }

  @Test
  void testIsolatedChangeSuppressedByAliasRadius() throws Exception {
    Frame black = TestFrames.solid(2, 2, BLACK);
    FrameSource source = FrameSource.ofFrames(
        Arrays.asList(black, TestFrames.with(black, 0, 0, WHITE)));

    Totals kept = AntigraphAccumulator.accumulate(source, 2, 2, config(1, 0, 0, 1));
    assertThat(kept.magnitude(0, 0)).isEqualTo(765);

    Totals suppressed = AntigraphAccumulator.accumulate(source, 2, 2, config(1, 0, 1, 1));
    assertThat(suppressed.magnitude(0, 0)).isZero();
  }

  @Test
  void testCutoffBeyondColorRangeIncludesNothing() throws Exception {
    Frame black = TestFrames.solid(2, 2, BLACK);
    FrameSource source = FrameSource.ofFrames(
        Arrays.asList(black, TestFrames.solid(2, 2, WHITE), black));

    // 442^2 already exceeds the largest squared RGB distance, 3 * 255^2.
    for (int cutoff : new int[] {442, 46341, 65536, Integer.MAX_VALUE}) {
      Totals totals = AntigraphAccumulator.accumulate(source, 2, 2, config(cutoff, 0, 0, 2));
      for (int y = 0; y < 2; ++y) {
        for (int x = 0; x < 2; ++x) {
          assertThat(totals.magnitude(x, y)).as("cutoff %d", cutoff).isZero();
        }
      }
    }
  }

  @Test
  void testRadiiLargerThanCanvas() throws Exception {
    List<Frame> frames = TestFrames.randomSequence(11L, 5, 3, 2);
    FrameSource source = FrameSource.ofFrames(frames);

    Totals huge = AntigraphAccumulator.accumulate(
        source, 3, 2, config(80, Integer.MAX_VALUE, 100000, 2));

    assertThat(huge).isEqualTo(AntigraphAccumulator.accumulate(source, 3, 2, config(80, 5, 5, 1)));
  }

  @Test
  void testDecodeFailureAbortsRun() {
    final List<Frame> frames = TestFrames.randomSequence(1L, 8, 3, 3);
    FrameSource failing = new FrameSource() {
      @Override
      public int size() {
        return frames.size();
      }

      @Override
      public Frame load(int index) throws DecodeException {
        if (index == 5) {
          throw new DecodeException("corrupt frame 5");
        }
        return frames.get(index);
      }
    };

    assertThatThrownBy(() -> AntigraphAccumulator.accumulate(failing, 3, 3, config(10, 0, 0, 3)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("corrupt frame 5");
  }

  @Test
  void testUncheckedWorkerFailureIsWrapped() {
    final List<Frame> frames = new ArrayList<Frame>(TestFrames.randomSequence(1L, 4, 3, 3));
    // Wrong size: the pair evaluation refuses it.
    frames.set(2, TestFrames.solid(4, 3, BLACK));

    assertThatThrownBy(() -> AntigraphAccumulator.accumulate(
        FrameSource.ofFrames(frames), 3, 3, config(10, 0, 0, 2)))
        .isInstanceOf(AntigraphException.class)
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testSingleFrameRejected() {
    FrameSource one = FrameSource.ofFrames(Arrays.asList(TestFrames.solid(2, 2, BLACK)));

    assertThatThrownBy(() -> AntigraphAccumulator.accumulate(one, 2, 2, config(10, 0, 0, 1)))
        .isInstanceOf(ConfigurationException.class);
  }
}
