package org.antigraph;

/**
 * Base of every failure that aborts an antigraph run. There is no partial output; callers either
 * get a complete image or one of these.
 */
public class AntigraphException extends Exception {
  public AntigraphException(String message) {
    super(message);
  }

  public AntigraphException(String message, Throwable cause) {
    super(message, cause);
  }
}
