/**
 * Logging helpers: runtime level control and message truncation or redaction.
 */
package tools.smith.sosumi.logging;
