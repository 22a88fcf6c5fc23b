/**
 * Argument validation helpers shared by the CLI and configuration layers.
 * <p>All helpers throw {@link java.lang.IllegalArgumentException} with a message naming the offending option.</p>
 */
package tools.smith.sosumi.validation;
