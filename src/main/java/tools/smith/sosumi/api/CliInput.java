package tools.smith.sosumi.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command line split into the three shapes sosumi accepts: {@code --flags}, {@code key=value} options, and bare
 * words (the query, session id, or year).
 * <p>Immutable once parsed.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  /** Shape of a single argument. */
  enum Kind {
    BLANK,
    HELP,
    VERBOSE,
    FLAG,
    OPTION,
    WORD
  }

  private final String[] options;
  private final List<String> words;
  private final Set<String> flags;
  private final Set<Kind> seen;

  private CliInput(String[] options, List<String> words, Set<String> flags, Set<Kind> seen) {
    this.options = options;
    this.words = words;
    this.flags = flags;
    this.seen = seen;
  }

  /**
   * Classifies one raw argument. An argument containing {@code '='} is always an option, even when it starts with
   * {@code --}, so {@code --limit=5} and {@code limit=5} are equivalent.
   *
   * @param raw raw argument, may be {@code null}
   * @return argument shape
   */
  static Kind classify(String raw) {
    if (raw == null || raw.isBlank()) {
      return Kind.BLANK;
    }
    String arg = raw.trim().toLowerCase(Locale.ROOT);
    if (HELP_FLAGS.contains(arg)) {
      return Kind.HELP;
    }
    if (VERBOSE_FLAGS.contains(arg)) {
      return Kind.VERBOSE;
    }
    if (arg.contains("=")) {
      return Kind.OPTION;
    }
    return arg.startsWith("-") ? Kind.FLAG : Kind.WORD;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> options = new ArrayList<>();
    List<String> words = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    Set<Kind> seen = EnumSet.noneOf(Kind.class);
    for (String raw : args == null ? new String[0] : args) {
      Kind kind = classify(raw);
      seen.add(kind);
      switch (kind) {
        case BLANK -> { }
        case HELP -> flags.add("--help");
        case VERBOSE -> flags.add("--verbose");
        case FLAG -> flags.add(raw.trim().toLowerCase(Locale.ROOT));
        case OPTION -> {
          String arg = raw.trim();
          options.add(arg.startsWith("--") ? arg.substring(2) : arg);
        }
        case WORD -> words.add(raw.trim());
        default -> throw new IllegalStateException("Unhandled argument kind " + kind);
      }
    }
    return new CliInput(options.toArray(String[]::new), List.copyOf(words), Set.copyOf(flags), seen);
  }

  /**
   * Returns a copy of the {@code key=value} options, leading {@code --} removed.
   *
   * @return options for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(options, options.length);
  }

  /**
   * Returns the bare words in order.
   *
   * @return positional arguments
   */
  public List<String> positionals() {
    return words;
  }

  public boolean help() {
    return seen.contains(Kind.HELP);
  }

  public boolean verbose() {
    return seen.contains(Kind.VERBOSE);
  }

  /**
   * Checks whether a flag such as {@code --allow-placeholder} was given.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
