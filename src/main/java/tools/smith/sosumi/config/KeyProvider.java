package tools.smith.sosumi.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.infrastructure.crypto.SharedKey;
import tools.smith.sosumi.logging.Logs;

/**
 * Reads the shared content key from the environment.
 * <p>A value whose UTF-8 encoding is not exactly 32 bytes is always rejected. An unset or blank variable is an error
 * only when the caller requires a key; otherwise it means content is unavailable. There is no fallback key.</p>
 *
 * @since 1.2.0
 */
public final class KeyProvider {
  private static final Logger log = LoggerFactory.getLogger(KeyProvider.class);

  private KeyProvider() {}

  /**
   * Resolves the key.
   *
   * @param env environment variables
   * @param variable name of the variable holding the key
   * @param required whether an absent key is an error
   * @return key, or empty when absent and not required
   * @throws IllegalArgumentException when the key is malformed, or absent while required
   */
  public static Optional<SharedKey> resolve(Map<String, String> env, String variable, boolean required) {
    Objects.requireNonNull(env, "env");
    Objects.requireNonNull(variable, "variable");
    String value = env.get(variable);
    if (value == null || value.isEmpty()) {
      if (required) {
        throw new IllegalArgumentException("Environment variable " + variable + " must hold the encryption key");
      }
      log.debug("No encryption key in {}; encrypted content unavailable", variable);
      return Optional.empty();
    }
    try {
      SharedKey key = SharedKey.fromText(value);
      log.debug("Encryption key loaded from {} ({})", variable, Logs.redact(value));
      return Optional.of(key);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(variable + ": " + ex.getMessage(), ex);
    }
  }
}
