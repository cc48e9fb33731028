package org.antigraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end: sums the differences between consecutive photos, subject to a cutoff,
 * using local threads.
 */
@CommandLine.Command(name = "antigraph",
    mixinStandardHelpOptions = true,
    description = "Sums the differences between consecutive photos, subject to a cutoff.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: antigraph written",
        "1: a frame could not be read, the output could not be written, or bad parameters",
        "2: usage error"
    })
public class LocalTool implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(LocalTool.class);

  @CommandLine.Parameters(arity = "2..*", paramLabel = "FRAME",
      description = "Images to combine into an antigraph, in order.")
  private List<String> frames;

  @CommandLine.Option(names = {"-o", "--output"}, required = true,
      description = "Output file for the completed antigraph.")
  private String output;

  @CommandLine.Option(names = {"--cutoff"}, defaultValue = "128",
      description = "Threshold difference in order to be integrated. 256 is the least sensitive "
          + "value, rarely including any pixels. 0 is the most sensitive value, which will make "
          + "a solargraph including all pixels. Default: ${DEFAULT-VALUE}")
  private int cutoff;

  @CommandLine.Option(names = {"--brighten"}, defaultValue = "0.1",
      description = "Brighten the image by adjusting the norm downward. This is a percentile "
          + "between 0 and 100. Default: ${DEFAULT-VALUE}")
  private double brighten;

  @CommandLine.Option(names = {"--unshift"}, defaultValue = "0",
      description = "Radius in pixels searched in the previous frame for a matching color, to "
          + "absorb slight camera movement. Somewhat blurs the antigraph. Default: ${DEFAULT-VALUE}")
  private int unshift;

  @CommandLine.Option(names = {"--unalias"}, defaultValue = "0",
      description = "Do not count a changed pixel unless another pixel within this radius also "
          + "changed. Default: ${DEFAULT-VALUE}")
  private int unalias;

  @CommandLine.Option(names = {"--strict-unalias"},
      description = "Require every pixel within the --unalias radius to have changed.")
  private boolean strictUnalias;

  @CommandLine.Option(names = {"--threads"}, defaultValue = "1",
      description = "The number of parallel threads to use during processing. "
          + "Default: ${DEFAULT-VALUE}")
  private int threads;

  AntigraphConfig toConfig() {
    AntigraphConfig config = new AntigraphConfig();
    config.cutoff = cutoff;
    config.brighten = brighten;
    config.unshift = unshift;
    config.unalias = unalias;
    config.aliasMode = strictUnalias ? AliasMode.STRICT : AliasMode.CORROBORATE;
    config.threads = threads;
    return config;
  }

  @Override
  public Integer call() {
    try {
      Antigraph.Result result = Antigraph.run(frames, output, toConfig());
      System.out.println("Combined " + result.frameCount + " frames of " + result.width + "x"
          + result.height + " (divisor " + result.divisor + ") into " + output);
      return 0;
    } catch (AntigraphException e) {
      logger.error("Antigraph failed: {}", e.getMessage(), e);
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  /**
   * Parses and runs {@code args}, returning the exit code.
   */
  public static int execute(String... args) {
    return new CommandLine(new LocalTool()).execute(args);
  }

  public static void main(String[] args) {
    System.exit(execute(args));
  }
}
