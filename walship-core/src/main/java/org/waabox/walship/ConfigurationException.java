package org.waabox.walship;

/**
 * Thrown when the store configuration is malformed.
 *
 * <p>Configuration errors are fatal at startup and are never retried.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ConfigurationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception describing the invalid configuration.
   *
   * @param message the detail message, never null
   */
  public ConfigurationException(final String message) {
    super(message);
  }
}
