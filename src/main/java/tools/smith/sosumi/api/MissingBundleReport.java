package tools.smith.sosumi.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic printed to stderr when no bundle exists at any searched location.
 */
final class MissingBundleReport {
  static final String RELEASE_URL =
      "https://github.com/Smith-Tools/sosumi/releases/download/v1.2.0/wwdc_bundle.encrypted";

  private MissingBundleReport() {}

  static List<String> lines(String command, List<Path> checked) {
    List<String> lines = new ArrayList<>();
    lines.add("ERROR: WWDC transcript bundle not found.");
    lines.add("");
    lines.add("The encrypted WWDC transcript bundle (wwdc_bundle.encrypted) is required for search.");
    lines.add("Placeholder data is disabled so results are never mistaken for real sessions.");
    lines.add("");
    lines.add("HOW TO FIX (choose one option):");
    lines.add("");
    lines.add("OPTION 1: Install the bundle into your sosumi home (recommended)");
    lines.add("  $ curl -LO " + RELEASE_URL);
    lines.add("  $ mkdir -p ~/.sosumi");
    lines.add("  $ mv wwdc_bundle.encrypted ~/.sosumi/");
    lines.add("");
    lines.add("OPTION 2: Place the bundle in the current directory");
    lines.add("  $ curl -LO " + RELEASE_URL);
    lines.add("  $ sosumi " + command + " \"SwiftUI\"");
    lines.add("");
    lines.add("OPTION 3: Point sosumi at a bundle explicitly");
    lines.add("  $ sosumi " + command + " \"SwiftUI\" bundle=/path/to/wwdc_bundle.encrypted");
    lines.add("");
    lines.add("BUNDLE LOCATIONS CHECKED:");
    for (Path path : checked) {
      lines.add("  - " + path);
    }
    return lines;
  }

  static void print(String command, List<Path> checked) {
    CliPrinter.printErrorLines(lines(command, checked).toArray(String[]::new));
  }
}
