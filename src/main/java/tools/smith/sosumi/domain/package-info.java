/**
 * <strong>Purpose:</strong> Immutable value types shared by the bundle build, load, search, and render stages.
 * <p><strong>Pipeline role:</strong> Records flow from the build pipeline into the archive envelope and back out of
 * the decode pipeline into the search engine and renderers.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across scan workers.</p>
 *
 * @since 1.2.0
 */
package tools.smith.sosumi.domain;
