package org.antigraph;

/**
 * An input frame could not be read or is not a recognized image format.
 */
public class DecodeException extends AntigraphException {
  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
