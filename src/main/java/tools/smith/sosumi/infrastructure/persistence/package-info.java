/**
 * File helpers for bundle artifacts.
 * <p><strong>Role:</strong> Atomic replacement of build output so readers never observe a partial bundle.</p>
 */
package tools.smith.sosumi.infrastructure.persistence;
