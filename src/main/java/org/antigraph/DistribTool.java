package org.antigraph;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.api.java.function.Function;
import org.apache.spark.api.java.function.Function2;

import scala.Tuple2;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Spark job which takes a directory of time-lapse frames (sorted by file name) and writes their
 * antigraph. Each frame partition becomes one Spark task that sums into its own {@link Totals};
 * the driver reduces the partial totals and renormalizes.
 *
 * <p>Run parameters come from the Spark configuration under {@code spark.antigraph.}, e.g.
 * {@code --conf spark.antigraph.cutoff=64}.
 */
public class DistribTool {
  private static final Logger logger = LogManager.getLogger(DistribTool.class);

  public static final String CONF_PREFIX = "spark.antigraph.";

  /**
   * Frames read through the Hadoop file system of each path.
   */
  public static class HadoopFrameSource implements FrameSource, Serializable {
    private static final long serialVersionUID = 1L;

    private final List<String> paths;
    private final int width;
    private final int height;

    public HadoopFrameSource(List<String> paths, int width, int height) {
      this.paths = new ArrayList<String>(paths);
      this.width = width;
      this.height = height;
    }

    @Override
    public int size() {
      return paths.size();
    }

    @Override
    public Frame load(int index) throws DecodeException {
      Path path = new Path(paths.get(index));
      try (InputStream in = openFrame(path)) {
        return FrameIO.decode(in, path.getName(), width, height);
      } catch (IOException e) {
        throw new DecodeException("Failed to read frame " + path, e);
      }
    }
  }

  static InputStream openFrame(Path path) throws IOException {
    FileSystem fs = path.getFileSystem(new Configuration());
    return new BufferedInputStream(fs.open(path));
  }

  /**
   * Lists the decodable frames directly inside {@code dir}, sorted by name.
   */
  public static List<String> listFrames(String dir) throws IOException {
    Path basePath = new Path(dir);
    FileStatus[] list = basePath.getFileSystem(new Configuration()).listStatus(basePath);
    List<String> framePaths = new ArrayList<String>();
    for (FileStatus stat : list) {
      if (stat.isFile() && FrameIO.isSupportedFrame(stat.getPath().getName())) {
        framePaths.add(stat.getPath().toString());
      }
    }
    Collections.sort(framePaths);
    return framePaths;
  }

  /**
   * Largest width and height over {@code paths}, computed as a Spark job.
   */
  public static int[] maxDimensions(JavaSparkContext sc, List<String> paths)
      throws AntigraphException {
    JavaRDD<String> pathsRdd = sc.parallelize(
        paths, Math.max(1, Math.min(paths.size(), sc.defaultParallelism())));
    Tuple2<Integer, Integer> dims;
    try {
      dims = pathsRdd.map(new Function<String, Tuple2<Integer, Integer>>() {
        @Override
        public Tuple2<Integer, Integer> call(String framePath) throws Exception {
          Path path = new Path(framePath);
          try (InputStream in = openFrame(path)) {
            BufferedImage image = FrameIO.decodeImage(in, path.getName());
            return new Tuple2<Integer, Integer>(image.getWidth(), image.getHeight());
          } catch (IOException e) {
            throw new DecodeException("Failed to read frame " + path, e);
          }
        }
      }).reduce(new Function2<Tuple2<Integer, Integer>, Tuple2<Integer, Integer>,
          Tuple2<Integer, Integer>>() {
        @Override
        public Tuple2<Integer, Integer> call(
            Tuple2<Integer, Integer> a, Tuple2<Integer, Integer> b) {
          return new Tuple2<Integer, Integer>(
              Math.max(a._1(), b._1()), Math.max(a._2(), b._2()));
        }
      });
    } catch (Exception e) {
      // Task failures reach the driver wrapped in a SparkException.
      throw new DecodeException("Failed to size frames: " + e.getMessage(), e);
    }
    return new int[] {dims._1(), dims._2()};
  }

  /**
   * Sums the changed pixels of {@code paths} with one Spark task per frame partition.
   * {@code config.threads} is the number of partitions.
   */
  public static Totals computeTotals(JavaSparkContext sc, List<String> paths,
      final AntigraphConfig config, final int width, final int height) throws AntigraphException {
    config.validate();
    List<FramePartition> partitions = FramePartition.split(paths.size(), config.threads);
    final ToleranceMask shiftMask = ToleranceMask.diskWithin(config.unshift, width, height);
    final ToleranceMask aliasMask = ToleranceMask.diskWithin(config.unalias, width, height);
    final HadoopFrameSource frames = new HadoopFrameSource(paths, width, height);
    logger.info("Accumulating {} frames of {}x{} in {} partitions ({})",
        paths.size(), width, height, partitions.size(), config);

    JavaRDD<FramePartition> partitionsRdd = sc.parallelize(partitions, partitions.size());
    try {
      return partitionsRdd.map(new Function<FramePartition, Totals>() {
        @Override
        public Totals call(FramePartition partition) throws Exception {
          return AntigraphAccumulator.accumulatePartition(
              frames, partition, width, height, shiftMask, aliasMask, config);
        }
      }).reduce(new Function2<Totals, Totals, Totals>() {
        @Override
        public Totals call(Totals a, Totals b) {
          return a.merge(b);
        }
      });
    } catch (Exception e) {
      throw new AntigraphException("Spark job failed: " + e.getMessage(), e);
    }
  }

  /**
   * Renormalizes {@code totals} and writes the image to {@code output} on its file system.
   */
  public static long writeAntigraph(Totals totals, double brighten, String output)
      throws AntigraphException {
    long divisor = PercentileNormalizer.divisor(totals, brighten);
    Frame image = PercentileNormalizer.normalize(totals, divisor);
    Path outputPath = new Path(output);
    String format = FrameIO.formatFor(outputPath.getName());
    try {
      FileSystem fs = outputPath.getFileSystem(new Configuration());
      try (FSDataOutputStream out = fs.create(outputPath, true)) {
        FrameIO.encode(image, format, out);
      }
    } catch (IOException e) {
      throw new EncodeException("Failed to write " + output, e);
    }
    logger.info("Wrote antigraph to {} (divisor {})", output, divisor);
    return divisor;
  }

  static AntigraphConfig configFrom(SparkConf conf) throws ConfigurationException {
    Map<String, String> props = new HashMap<String, String>();
    for (Tuple2<String, String> entry : conf.getAllWithPrefix(CONF_PREFIX)) {
      props.put(entry._1(), entry._2());
    }
    return AntigraphConfig.fromProperties(props, "");
  }

  public static void main(String[] args) throws Exception {
    if (args.length < 2) {
      System.err.println(
          "Usage: spark-submit antigraph-1.0.jar <frames dir> <output file> [partitions]");
      System.exit(1);
    }

    // Master should come from the environment.
    SparkConf conf = new SparkConf()
        .setAppName("org.antigraph.DistribTool");
    JavaSparkContext sc = new JavaSparkContext(conf);
    try {
      AntigraphConfig config = configFrom(conf);
      if (args.length > 2) {
        config.threads = Integer.parseInt(args[2]);
      } else if (!conf.contains(CONF_PREFIX + "threads")) {
        config.threads = sc.defaultParallelism();
      }

      System.out.println("Looking for frames in " + args[0] + "...");
      List<String> framePaths = listFrames(args[0]);
      System.out.println("Found " + framePaths.size() + " frames inside " + args[0] + ".");
      if (framePaths.size() < 2) {
        throw new ConfigurationException(
            "Need at least 2 frames, found " + framePaths.size() + " in " + args[0]);
      }

      int[] dims = maxDimensions(sc, framePaths);
      Totals totals = computeTotals(sc, framePaths, config, dims[0], dims[1]);
      long divisor = writeAntigraph(totals, config.brighten, args[1]);
      System.out.println("Saved " + dims[0] + "x" + dims[1] + " antigraph (divisor " + divisor
          + ") to " + args[1]);
    } finally {
      sc.stop();
    }
  }
}
