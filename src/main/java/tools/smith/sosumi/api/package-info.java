/**
 * Command-line adapters for sosumi.
 *
 * <p>Each command parses {@code key=value} options plus positional words, merges them with the YAML config file and
 * embedded defaults, locates the bundle, and maps {@link tools.smith.sosumi.application.bundle.BundleException}
 * failures to {@link tools.smith.sosumi.api.ExitCode} values. A missing bundle always exits with
 * {@link tools.smith.sosumi.api.ExitCode#BUNDLE_MISSING}.</p>
 */
package tools.smith.sosumi.api;
