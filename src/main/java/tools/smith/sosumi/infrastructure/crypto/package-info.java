/**
 * AES-256-GCM content protection.
 * <p><strong>Role:</strong> Implements {@link tools.smith.sosumi.application.port.ContentCipher}.</p>
 * <p><strong>Concurrency:</strong> Cipher instances are created per call; adapters are thread-safe.</p>
 * <p><strong>Security:</strong> Keys are never logged; {@code toString} is redacted.</p>
 */
package tools.smith.sosumi.infrastructure.crypto;
