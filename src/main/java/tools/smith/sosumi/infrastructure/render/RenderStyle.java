package tools.smith.sosumi.infrastructure.render;

import java.util.Locale;

/**
 * Output contract for rendered results.
 *
 * @since 1.2.0
 */
public enum RenderStyle {
  /** One line per result. */
  COMPACT("compact"),
  /** Snippet plus canonical link. */
  USER("user"),
  /** Score, matched excerpts, time segments, full transcript, and link. */
  AGENT("agent");

  private final String label;

  RenderStyle(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Maps the {@code verbosity} option ({@code compact|detailed|full}) to a style.
   *
   * @param verbosity option value
   * @return style
   * @throws IllegalArgumentException for unknown values
   */
  public static RenderStyle fromVerbosity(String verbosity) {
    String normalized = verbosity == null ? "" : verbosity.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "compact" -> COMPACT;
      case "detailed" -> USER;
      case "full" -> AGENT;
      default -> throw new IllegalArgumentException(
          "verbosity must be compact, detailed, or full (was " + verbosity + ")");
    };
  }

  /**
   * Maps the {@code mode} option ({@code user|agent}) to a style.
   *
   * @param mode option value
   * @return style
   * @throws IllegalArgumentException for unknown values
   */
  public static RenderStyle fromMode(String mode) {
    String normalized = mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "user" -> USER;
      case "agent" -> AGENT;
      default -> throw new IllegalArgumentException("mode must be user or agent (was " + mode + ")");
    };
  }
}
