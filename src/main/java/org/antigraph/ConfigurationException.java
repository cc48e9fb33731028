package org.antigraph;

/**
 * Invalid run parameters, detected before any worker starts.
 */
public class ConfigurationException extends AntigraphException {
  public ConfigurationException(String message) {
    super(message);
  }
}
