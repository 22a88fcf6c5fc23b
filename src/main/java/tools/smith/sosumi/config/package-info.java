/**
 * Configuration loading for sosumi commands.
 * <p><strong>Role:</strong> Merges embedded defaults, the optional YAML file, and CLI options into {@link tools.smith.sosumi.config.SosumiConfig},
 * resolves the shared key, and wires adapters in {@link tools.smith.sosumi.config.CompositionRoot}.</p>
 * <p><strong>Security:</strong> Key material is resolved from the environment only and never logged.</p>
 */
package tools.smith.sosumi.config;
