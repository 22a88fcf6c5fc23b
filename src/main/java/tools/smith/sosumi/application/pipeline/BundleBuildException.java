package tools.smith.sosumi.application.pipeline;

/**
 * Raised when a bundle build must abort before anything is written.
 *
 * @since 1.2.0
 */
public final class BundleBuildException extends Exception {
  private static final long serialVersionUID = 1L;

  public BundleBuildException(String message) {
    super(message);
  }

  public BundleBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
