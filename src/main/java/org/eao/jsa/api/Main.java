package org.eao.jsa.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.eao.jsa.config.IngestMode;
import org.eao.jsa.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for {@code jsa-ingest}.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: jsa-ingest <ingest|check> [options]";
  private static final String HELP_TEXT = """
      JCMT science archive ingestion

      Usage:
        jsa-ingest <command> [options]

      Commands:
        ingest      Aggregate a batch of headers and write observations to the store
        check       Validate a batch and report what would be written (dry run by default)

      Global flags:
        --help      Show this message (use <command> --help for command options)
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);
    return switch (command) {
      case "ingest" -> IngestCli.run(IngestMode.INGEST, delegateArgs);
      case "check" -> IngestCli.run(IngestMode.CHECK, delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags are passed on to the command along with its key=value arguments.
  private static String[] delegateArgs(String[] args, String command) {
    List<String> delegate = new ArrayList<>(Arrays.asList(args));
    for (int i = 0; i < delegate.size(); i++) {
      String arg = delegate.get(i);
      if (arg != null && arg.trim().equals(command)) {
        delegate.remove(i);
        break;
      }
    }
    return delegate.toArray(String[]::new);
  }
}
