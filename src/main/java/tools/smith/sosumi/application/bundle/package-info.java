/**
 * Loading a bundle into memory and opening its record content.
 * <p><strong>Role:</strong> Classifies failures into {@link tools.smith.sosumi.application.bundle.SearchFailure} values.</p>
 * <p><strong>Concurrency:</strong> A {@link tools.smith.sosumi.application.bundle.LoadedBundle} may be shared by scan workers.</p>
 */
package tools.smith.sosumi.application.bundle;
