/**
 * Ports the application layer depends on; infrastructure adapters implement them.
 * <p>Adapters are wired in {@code tools.smith.sosumi.config.CompositionRoot}. Tests substitute small in-memory
 * implementations where a real cipher or compressor would obscure the behaviour under test.</p>
 *
 * @since 1.2.0
 */
package tools.smith.sosumi.application.port;
