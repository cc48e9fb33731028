package org.antigraph;

/**
 * The output image could not be written.
 */
public class EncodeException extends AntigraphException {
  public EncodeException(String message) {
    super(message);
  }

  public EncodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
