/**
 * Adapters that implement the application ports against the JDK and third-party libraries.
 * <p><strong>Role:</strong> Codec, compression, cryptography, bundle discovery, persistence, and rendering.</p>
 */
package tools.smith.sosumi.infrastructure;
