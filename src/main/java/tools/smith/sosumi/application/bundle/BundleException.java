package tools.smith.sosumi.application.bundle;

import java.util.Objects;

/**
 * Checked exception raised when a bundle cannot be loaded, opened, or searched.
 *
 * @since 1.2.0
 */
public final class BundleException extends Exception {
  private final SearchFailure failure;

  /**
   * Creates an exception with a failure category and description.
   *
   * @param failure failure category; never {@code null}
   * @param message human-readable description
   */
  public BundleException(SearchFailure failure, String message) {
    super(message);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  /**
   * Creates an exception with a failure category, description, and cause.
   *
   * @param failure failure category; never {@code null}
   * @param message human-readable description
   * @param cause underlying I/O, codec, or crypto failure
   */
  public BundleException(SearchFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  /**
   * Returns the failure category.
   *
   * @return failure category
   */
  public SearchFailure failure() {
    return failure;
  }
}
