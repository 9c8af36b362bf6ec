package de.uni_passau.fluxbench.tsdb;

/**
 * A general exception that can occur when talking to the administrative API of a TSDB.
 */
public class TsdbException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   */
  public TsdbException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   * @param cause The cause.
   */
  public TsdbException(String message, Throwable cause) {
    super(message, cause);
  }
}
