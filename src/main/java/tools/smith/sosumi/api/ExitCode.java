package tools.smith.sosumi.api;

import tools.smith.sosumi.application.bundle.SearchFailure;

/**
 * <strong>What:</strong> Canonical exit codes shared by the sosumi commands.
 * <p><strong>Why:</strong> Scripts and agents calling sosumi branch on the status; every failure class gets its own
 * value and {@link #BUNDLE_MISSING} is reserved for the missing-bundle report.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 1.2.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** No bundle exists at any searched location. */
  BUNDLE_MISSING(5),
  /** The bundle could not be decompressed or parsed. */
  DATA_ERROR(6),
  /** Content could not be decrypted or failed its integrity check. */
  DECRYPTION_FAILED(7),
  /** The query produced no results from real data. */
  NO_RESULTS(8),
  /** The requested session does not exist. */
  NOT_FOUND(9),
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

  /**
   * Maps a bundle failure to its exit code.
   *
   * @param failure failure category
   * @return exit code
   */
  public static ExitCode forFailure(SearchFailure failure) {
    return switch (failure) {
      case DATA_NOT_AVAILABLE -> IO_ERROR;
      case INVALID_DATA_FORMAT, COMPRESSION_NOT_SUPPORTED -> DATA_ERROR;
      case DECRYPTION_FAILED, INTEGRITY_CHECK_FAILED -> DECRYPTION_FAILED;
      case REAL_DATA_FAILED -> NO_RESULTS;
    };
  }
}
