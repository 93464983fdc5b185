package cfg.cnf;

import cfg.grammar.Grammar;
import cfg.model.Production;
import cfg.model.Symbol;
import cfg.model.Terminal;
import cfg.model.Variable;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a grammar into Chomsky Normal Form: every body is either a single terminal or exactly
 * two variables.
 *
 * <p>The conversion runs four phases in order, each producing a new rule list:
 *
 * <ol>
 *   <li>nullable elimination (epsilon productions are removed),
 *   <li>unit elimination, ending with a canonical sort by head and body text,
 *   <li>binarization of long bodies with auxiliaries {@code V0, V1, ...},
 *   <li>terminal isolation with dedicated variables {@code T0, T1, ...} in alphabet order.
 * </ol>
 *
 * <p>Only the grammar's alphabet and rules are read. Naming state lives in each call, so one
 * grammar can be normalized from several threads.
 *
 * <p>The empty string is not part of the converted language, even when the start variable is
 * nullable.
 */
public final class CnfNormalizer {
  private static final Logger LOG = LoggerFactory.getLogger(CnfNormalizer.class);

  private static final String AUXILIARY_PREFIX = "V";
  private static final String TERMINAL_PREFIX = "T";

  private CnfNormalizer() {}

  public static ImmutableList<Production> normalize(Grammar grammar) {
    Objects.requireNonNull(grammar, "grammar");
    Set<String> usedNames = usedNames(grammar);

    List<Production> withoutEpsilon = NullableElimination.apply(grammar.rules());
    LOG.debug("Nullable elimination: {} -> {} rules", grammar.rules().size(), withoutEpsilon.size());

    List<Production> withoutUnits = UnitElimination.apply(withoutEpsilon);
    LOG.debug("Unit elimination: {} rules", withoutUnits.size());

    Binarization binarization =
        new Binarization(new FreshVariables(AUXILIARY_PREFIX, usedNames));
    List<Production> binary = binarization.apply(withoutUnits);
    LOG.debug(
        "Binarization: {} rules, {} auxiliary variables",
        binary.size(),
        binarization.auxiliaryCount());

    List<Production> cnf =
        TerminalIsolation.apply(
            binary, grammar.alphabet(), new FreshVariables(TERMINAL_PREFIX, usedNames));
    LOG.debug("Terminal isolation: {} rules", cnf.size());
    return ImmutableList.copyOf(cnf);
  }

  /**
   * Normalizes {@code grammar} and wraps the result as a grammar with the same start variable and
   * alphabet. The depth bound starts at the configured default.
   */
  public static Grammar toGrammar(Grammar grammar) {
    return Grammar.inferred(grammar.start(), grammar.alphabet(), normalize(grammar));
  }

  /** True when every body is one non-epsilon terminal or exactly two variables. */
  public static boolean isChomskyNormalForm(List<Production> rules) {
    for (Production rule : rules) {
      List<Symbol> body = rule.body();
      boolean terminal =
          body.size() == 1 && body.get(0) instanceof Terminal t && !t.isEpsilon();
      boolean binary =
          body.size() == 2 && body.get(0) instanceof Variable && body.get(1) instanceof Variable;
      if (!terminal && !binary) {
        return false;
      }
    }
    return true;
  }

  private static Set<String> usedNames(Grammar grammar) {
    Set<String> names = new HashSet<>();
    grammar.variables().forEach(v -> names.add(v.name()));
    grammar.alphabet().forEach(t -> names.add(t.name()));
    for (Production rule : grammar.rules()) {
      names.add(rule.head().name());
      rule.body().forEach(symbol -> names.add(symbol.name()));
    }
    return names;
  }
}
