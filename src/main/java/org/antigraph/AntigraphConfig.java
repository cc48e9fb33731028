package org.antigraph;

import java.io.Serializable;
import java.util.Locale;
import java.util.Map;

/**
 * Run parameters. Defaults match the command-line tool's defaults.
 */
public class AntigraphConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final int DEFAULT_CUTOFF = 128;
  public static final double DEFAULT_BRIGHTEN = 0.1;

  // Change-detection threshold; squared before use.
  public int cutoff = DEFAULT_CUTOFF;

  // Percentile (0-100) of the totals' magnitudes that maps to full brightness, counted from the top.
  public double brighten = DEFAULT_BRIGHTEN;

  // Radius in pixels searched in the previous frame for a close-enough color.
  public int unshift = 0;

  // Radius in pixels that must corroborate a changed pixel.
  public int unalias = 0;
  public AliasMode aliasMode = AliasMode.CORROBORATE;

  public int threads = 1;

  public long cutoffSquared() {
    return (long) cutoff * cutoff;
  }

  public void validate() throws ConfigurationException {
    if (cutoff < 0) {
      throw new ConfigurationException("cutoff must be >= 0, got " + cutoff);
    }
    if (Double.isNaN(brighten) || brighten < 0 || brighten > 100) {
      throw new ConfigurationException("brighten must be within [0, 100], got " + brighten);
    }
    if (unshift < 0) {
      throw new ConfigurationException("unshift must be >= 0, got " + unshift);
    }
    if (unalias < 0) {
      throw new ConfigurationException("unalias must be >= 0, got " + unalias);
    }
    if (threads < 1) {
      throw new ConfigurationException("threads must be >= 1, got " + threads);
    }
    if (aliasMode == null) {
      throw new ConfigurationException("aliasMode must be set");
    }
  }

  /**
   * Reads {@code <prefix>cutoff}, {@code <prefix>brighten}, etc. from {@code props}; absent keys
   * keep their defaults.
   */
  public static AntigraphConfig fromProperties(Map<String, String> props, String prefix)
      throws ConfigurationException {
    AntigraphConfig ret = new AntigraphConfig();
    ret.cutoff = parseInt(props, prefix + "cutoff", ret.cutoff);
    ret.brighten = parseDouble(props, prefix + "brighten", ret.brighten);
    ret.unshift = parseInt(props, prefix + "unshift", ret.unshift);
    ret.unalias = parseInt(props, prefix + "unalias", ret.unalias);
    ret.threads = parseInt(props, prefix + "threads", ret.threads);
    String mode = props.get(prefix + "aliasMode");
    if (mode != null) {
      try {
        ret.aliasMode = AliasMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Unknown " + prefix + "aliasMode: " + mode);
      }
    }
    ret.validate();
    return ret;
  }

  private static int parseInt(Map<String, String> props, String key, int fallback)
      throws ConfigurationException {
    String value = props.get(key);
    if (value == null) return fallback;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Not an integer for " + key + ": " + value);
    }
  }

  private static double parseDouble(Map<String, String> props, String key, double fallback)
      throws ConfigurationException {
    String value = props.get(key);
    if (value == null) return fallback;
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Not a number for " + key + ": " + value);
    }
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT,
        "cutoff=%d brighten=%s unshift=%d unalias=%d aliasMode=%s threads=%d",
        cutoff, brighten, unshift, unalias, aliasMode, threads);
  }
}
