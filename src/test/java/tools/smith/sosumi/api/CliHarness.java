package tools.smith.sosumi.api;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Map;

/** Captures CLI output and supplies an isolated process environment. */
final class CliHarness {
  final StringWriter out = new StringWriter();
  final StringWriter err = new StringWriter();
  final Path userHome;
  final Path workingDir;
  final Path appDir;

  CliHarness(Path root) {
    this.userHome = root.resolve("user");
    this.workingDir = root.resolve("cwd");
    this.appDir = root.resolve("app");
    CliPrinter.setWriterForTesting(new PrintWriter(out));
    CliPrinter.setErrorWriterForTesting(new PrintWriter(err));
  }

  Path sosumiHome() {
    return userHome.resolve(".sosumi");
  }

  CommandContext context(Map<String, String> env) {
    return new CommandContext(env, workingDir, appDir, userHome);
  }

  CommandContext context() {
    return context(Map.of());
  }

  String stdout() {
    return out.toString();
  }

  String stderr() {
    return err.toString();
  }
}
