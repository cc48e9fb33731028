package org.antigraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs change detection over every consecutive frame pair and sums the colors of the changed
 * pixels. The frame sequence is split into one partition per worker thread; each worker sums into
 * its own {@link Totals} and the results are merged after all workers have joined, so no state is
 * shared while they run.
 */
public class AntigraphAccumulator {
  private static final Logger logger = LogManager.getLogger(AntigraphAccumulator.class);

  /**
   * Accumulates all of {@code frames} on {@code config.threads} threads.
   */
  public static Totals accumulate(
      final FrameSource frames, final int width, final int height, final AntigraphConfig config)
      throws AntigraphException {
    config.validate();
    final List<FramePartition> partitions = FramePartition.split(frames.size(), config.threads);
    final ToleranceMask shiftMask = ToleranceMask.diskWithin(config.unshift, width, height);
    final ToleranceMask aliasMask = ToleranceMask.diskWithin(config.unalias, width, height);
    logger.info("Accumulating {} frames of {}x{} on {} threads ({})",
        frames.size(), width, height, partitions.size(), config);

    final Totals[] results = new Totals[partitions.size()];
    final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
    Thread[] threads = newThreadArray(partitions.size());
    for (int ithread = 0; ithread < threads.length; ++ithread) {
      final FramePartition partition = partitions.get(ithread);
      threads[ithread] = new Thread("antigraph-" + partition.index) {
        @Override
        public void run() {
          try {
            results[partition.index] = accumulatePartition(
                frames, partition, width, height, shiftMask, aliasMask, config);
          } catch (Throwable t) {
            failure.compareAndSet(null, t);
          }
        }
      };
    }
    startAndJoin(threads);

    Throwable t = failure.get();
    if (t instanceof AntigraphException) {
      throw (AntigraphException) t;
    }
    if (t instanceof Error) {
      throw (Error) t;
    }
    if (t != null) {
      throw new AntigraphException("Worker failed: " + t.getMessage(), t);
    }

    Totals ret = new Totals(width, height);
    for (Totals partial : results) {
      ret.merge(partial);
    }
    return ret;
  }

  /**
   * Walks one partition pair by pair. The first frame of the partition has no predecessor and
   * contributes nothing by itself; the pair ending on it belongs to the previous partition.
   */
  public static Totals accumulatePartition(
      FrameSource frames, FramePartition partition, int width, int height,
      ToleranceMask shiftMask, ToleranceMask aliasMask, AntigraphConfig config)
      throws DecodeException {
    Totals totals = new Totals(width, height);
    long cutoffSquared = config.cutoffSquared();
    Frame prev = null;
    for (int i = partition.start; i < partition.end; ++i) {
      Frame cur = frames.load(i);
      if (prev != null) {
        InclusionGrid changed = ChangeDetector.evaluateInclusion(prev, cur, shiftMask, cutoffSquared);
        InclusionGrid kept = ChangeDetector.suppressAliases(changed, aliasMask, config.aliasMode);
        totals.addIncluded(cur, kept);
        if (logger.isDebugEnabled()) {
          logger.debug("Pair ({}, {}): {} changed, {} kept after alias suppression",
              i - 1, i, changed.countIncluded(), kept.countIncluded());
        }
      }
      prev = cur;
    }
    logger.debug("Finished {}", partition);
    return totals;
  }

  static Thread[] newThreadArray(int count) {
    return new Thread[count];
  }

  /**
   * Starts every thread and waits for all of them; this is the only point where workers block.
   */
  static void startAndJoin(Thread[] threads) {
    for (int ithread = 0; ithread < threads.length; ++ithread) {
      threads[ithread].setPriority(Thread.NORM_PRIORITY);
      threads[ithread].start();
    }

    try {
      for (int ithread = 0; ithread < threads.length; ++ithread) {
        threads[ithread].join();
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(ie);
    }
  }
}
