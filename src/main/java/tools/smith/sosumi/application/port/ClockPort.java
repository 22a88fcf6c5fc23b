package tools.smith.sosumi.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Wall-clock source for build timestamps and year validation.
 * <p><strong>Why:</strong> Lets tests pin {@code metadata.created_at} and the current year.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 1.2.0
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current time
   */
  Instant now();

  /** Default clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
