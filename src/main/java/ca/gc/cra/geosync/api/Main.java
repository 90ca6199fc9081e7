package ca.gc.cra.geosync.api;

import ca.gc.cra.geosync.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * geosync command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: geosync <sync> [options]";
  private static final String HELP_TEXT = """
      geosync command dispatcher

      Usage:
        geosync <command> [options]

      Commands:
        sync        Fold published source files into the record store (sync --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int commandIndex = firstCommand(safe);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safe);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    // Flags before the command apply to the dispatcher; everything after belongs to the command.
    CliInput global = CliInput.parse(Arrays.copyOfRange(safe, 0, commandIndex));
    if (global.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = safe[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safe, commandIndex + 1, safe.length);
    if (command.equals("sync")) {
      return SyncCli.run(delegateArgs);
    }
    log.error("Unknown command: {}", command);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }

  private static int firstCommand(String[] args) {
    List<String> tokens = Arrays.asList(args);
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i) == null ? "" : tokens.get(i).trim();
      if (!token.isEmpty() && !token.startsWith("-") && !token.contains("=") && !token.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
