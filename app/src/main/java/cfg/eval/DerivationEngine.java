package cfg.eval;

import cfg.grammar.Grammar;
import cfg.model.Production;
import cfg.model.Symbol;
import cfg.model.Terminal;
import cfg.model.Variable;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Membership test by depth-first backtracking over leftmost derivations.
 *
 * <p>Alternatives are tried in rule-index order and the first complete derivation wins. Every
 * variable expansion and every consumed epsilon costs one unit of depth; an attempt that reaches
 * the grammar's depth bound simply fails and the search backtracks. Rejection is therefore
 * ambiguous between "not derivable" and "bound too low".
 */
public final class DerivationEngine {
  private static final Logger LOG = LoggerFactory.getLogger(DerivationEngine.class);

  private DerivationEngine() {}

  public static EvaluationResult evaluate(Grammar grammar, String input) {
    Objects.requireNonNull(grammar, "grammar");
    Objects.requireNonNull(input, "input");

    Search search = new Search(grammar, input);
    for (Production production : grammar.rulesFor(grammar.start())) {
      search.path.add(production);
      if (search.derive(0, production.body(), 0)) {
        DerivationPath path = DerivationPath.of(search.path);
        LOG.debug("Accepted '{}' with {} productions", input, path.size());
        return EvaluationResult.found(path);
      }
      search.path.clear();
    }
    LOG.debug("Rejected '{}' within depth {}", input, search.maxDepth);
    return EvaluationResult.notFound();
  }

  /** Mutable state of one evaluation; the grammar itself is only read. */
  private static final class Search {
    private final Grammar grammar;
    private final String input;
    private final int maxDepth;
    private final List<Production> path = new ArrayList<>();

    Search(Grammar grammar, String input) {
      this.grammar = grammar;
      this.input = input;
      this.maxDepth = grammar.maxDepth();
    }

    /**
     * Tries to derive {@code input[offset..]} from {@code body}. Terminals are matched in a loop,
     * so the recursion depth never exceeds the depth bound.
     */
    boolean derive(int offset, List<Symbol> body, int depth) {
      if (depth >= maxDepth) {
        return false;
      }
      int position = offset;
      for (int i = 0; i < body.size(); i++) {
        Symbol symbol = body.get(i);
        List<Symbol> rest = body.subList(i + 1, body.size());
        if (symbol instanceof Terminal terminal) {
          if (terminal.isEpsilon()) {
            return derive(position, rest, depth + 1);
          }
          if (!input.startsWith(terminal.name(), position)) {
            return false;
          }
          position += terminal.name().length();
          continue;
        }

        Variable variable = (Variable) symbol;
        for (Production alternative : grammar.rulesFor(variable)) {
          path.add(alternative);
          if (derive(position, splice(alternative.body(), rest), depth + 1)) {
            return true;
          }
          path.remove(path.size() - 1);
        }
        return false;
      }
      return position == input.length();
    }

    private static List<Symbol> splice(List<Symbol> replacement, List<Symbol> rest) {
      return ImmutableList.<Symbol>builderWithExpectedSize(replacement.size() + rest.size())
          .addAll(replacement)
          .addAll(rest)
          .build();
    }
  }
}
