package tools.smith.sosumi.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Minimal console output helper for command results and diagnostics.
 *
 * <p>Uses native file descriptors in order to avoid direct {@code System.out} references while
 * preserving simple writes that play nicely with logging configurations.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final PrintWriter STDERR = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.err), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;
  private static volatile PrintWriter errorOverride;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints zero or more lines to stdout using the shared CLI writer.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints zero or more lines to stderr.
   *
   * @param lines lines to emit
   */
  public static void printErrorLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = errorWriter();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void setErrorWriterForTesting(PrintWriter writer) {
    errorOverride = writer;
  }

  /** Clears any test writer overrides. */
  static void clearTestWriter() {
    override = null;
    errorOverride = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }

  private static PrintWriter errorWriter() {
    return errorOverride != null ? errorOverride : STDERR;
  }
}
