package cfg.cli;

import cfg.cnf.CnfNormalizer;
import cfg.grammar.Grammar;
import cfg.model.Production;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `cnf` command: prints the Chomsky Normal Form of a grammar file. */
final class CnfCommand {
  private static final Logger LOG = LoggerFactory.getLogger(CnfCommand.class);

  private final PrintStream out;

  CnfCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = ParsedArgs.parse(args, false);
    Grammar grammar = CliParsers.loadGrammar(options.grammarFile());
    LOG.info("Converting {} ({} rules) to CNF", options.grammarFile(), grammar.rules().size());

    List<Production> rules = new ArrayList<>(CnfNormalizer.normalize(grammar));
    rules.sort(Production.CANONICAL_ORDER);

    if (options.json()) {
      out.println(new JsonReportBuilder().cnf(grammar, rules));
      return 0;
    }
    out.println(grammar);
    out.println("-".repeat(40));
    rules.forEach(out::println);
    return 0;
  }
}
