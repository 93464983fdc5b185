package cfg.cli;

import cfg.grammar.GrammarValidationException;
import cfg.notation.GrammarParseException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code cnf <grammar-file> [--json]}
 *   <li>{@code eval <grammar-file> --input <s> [--input <s>] [--inputs a,b] [--max-depth N]
 *       [--json]}
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 usage or I/O error, 2 invalid grammar, 3 some input rejected.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args, System.out);
    if (exit != 0) {
      System.exit(exit);
    }
  }

  static int run(String[] args, PrintStream out) {
    if (args == null || args.length == 0) {
      printUsage(out);
      return 1;
    }
    try {
      return switch (args[0].toLowerCase(Locale.ROOT)) {
        case "cnf" -> new CnfCommand(out).execute(args);
        case "eval", "evaluate" -> new EvaluateCommand(out).execute(args);
        default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
      };
    } catch (GrammarParseException | GrammarValidationException ex) {
      LOG.error("Invalid grammar: {}", ex.getMessage());
      return 2;
    } catch (IllegalArgumentException ex) {
      LOG.error(ex.getMessage());
      printUsage(out);
      return 1;
    } catch (IOException ex) {
      LOG.error("Unable to read grammar", ex);
      return 1;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage:");
    out.println("  cnf  <grammar-file> [--json]");
    out.println(
        "  eval <grammar-file> --input <s> [--input <s>] [--inputs a,b] [--max-depth N] [--json]");
  }
}
