package cfg.cli;

import cfg.grammar.Grammar;
import cfg.notation.GrammarReader;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Shared helpers for CLI argument parsing and grammar loading. */
final class CliParsers {

  private CliParsers() {}

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static int parseInt(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  /** Comma separated inputs; blanks are kept so that {@code a,,b} includes the empty string. */
  static List<String> parseInputs(String raw) {
    if (raw == null) {
      return List.of();
    }
    return Splitter.on(',').trimResults().splitToList(raw);
  }

  static Grammar loadGrammar(Path grammarFile) throws IOException {
    if (!Files.exists(grammarFile)) {
      throw new IllegalArgumentException("Grammar file not found: " + grammarFile);
    }
    return GrammarReader.read(grammarFile);
  }
}
