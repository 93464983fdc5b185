package cfg.cli;

import cfg.eval.DerivationEngine;
import cfg.eval.EvaluationResult;
import cfg.grammar.Grammar;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `eval` command: membership tests with derivation replay. */
final class EvaluateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(EvaluateCommand.class);

  private final PrintStream out;

  EvaluateCommand(PrintStream out) {
    this.out = out;
  }

  /** Returns 0 when every input is accepted and 3 when at least one is rejected. */
  int execute(String[] args) throws IOException {
    CliOptions options = ParsedArgs.parse(args, true);
    if (options.inputs().isEmpty()) {
      throw new IllegalArgumentException("Provide at least one --input or --inputs");
    }
    Grammar grammar = CliParsers.loadGrammar(options.grammarFile());
    if (options.hasMaxDepth()) {
      grammar.setMaxDepth(options.maxDepth());
    }
    LOG.info(
        "Evaluating {} input(s) against {} (max depth {})",
        options.inputs().size(),
        options.grammarFile(),
        grammar.maxDepth());

    Map<String, EvaluationResult> results = new LinkedHashMap<>();
    for (String input : options.inputs()) {
      results.put(input, DerivationEngine.evaluate(grammar, input));
    }

    if (options.json()) {
      out.println(new JsonReportBuilder().evaluation(grammar, results));
    } else {
      results.forEach(this::print);
    }
    boolean allAccepted = results.values().stream().allMatch(EvaluationResult::accepted);
    return allAccepted ? 0 : 3;
  }

  private void print(String input, EvaluationResult result) {
    if (result.accepted()) {
      out.printf("\"%s\": accepted%n", input);
      out.printf("  %s%n", result.path().replay());
    } else {
      out.printf("\"%s\": rejected%n", input);
    }
  }
}
