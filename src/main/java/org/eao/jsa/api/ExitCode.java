package org.eao.jsa.api;

/**
 * <strong>What:</strong> Process exit codes of the ingestion command-line tools.
 * <p><strong>Why:</strong> Lets batch schedulers tell a rejected batch apart from an I/O fault or a
 * partially written batch.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Headers, store or output could not be read or written. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** One or more files failed validation. */
  VALIDATION_FAILED(5),
  /** The batch ran but some observations could not be written. */
  PARTIAL_FAILURE(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
