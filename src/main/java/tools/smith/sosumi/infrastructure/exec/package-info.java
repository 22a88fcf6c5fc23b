/**
 * Executor factories for the parallel transcript scan.
 * <p><strong>Concurrency:</strong> Returned pools use daemon threads with descriptive names.</p>
 */
package tools.smith.sosumi.infrastructure.exec;
