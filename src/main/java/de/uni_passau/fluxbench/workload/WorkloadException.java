package de.uni_passau.fluxbench.workload;

/**
 * Exception that occurs when query parameters cannot be satisfied, e.g., more hosts are
 * requested than the configured scale provides. The message is the exact text reported to the
 * harness.
 */
public class WorkloadException extends Exception {
  private static final long serialVersionUID = -3215874024486619051L;

  /**
   * Creates a new instance.
   *
   * @param message Error message.
   */
  public WorkloadException(String message) {
    super(message);
  }
}
