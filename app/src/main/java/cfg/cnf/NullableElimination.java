package cfg.cnf;

import cfg.model.Production;
import cfg.model.Symbol;
import cfg.model.Variable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Phase 1: removes epsilon productions while keeping the language of non-empty strings. */
final class NullableElimination {

  private NullableElimination() {}

  static List<Production> apply(List<Production> rules) {
    List<Production> cleaned = new ArrayList<>(rules.size());
    for (Production rule : rules) {
      cleaned.add(dropInnerEpsilons(rule));
    }

    Set<Variable> nullable = nullableVariables(cleaned);
    List<Production> out = new ArrayList<>();
    for (Production rule : cleaned) {
      if (rule.isEpsilon()) {
        continue;
      }
      out.add(rule);
      out.addAll(alternatives(rule, nullable));
    }
    return out;
  }

  /** Variables that derive the empty string, computed to a fixed point. */
  static Set<Variable> nullableVariables(List<Production> rules) {
    Set<Variable> nullable = new LinkedHashSet<>();
    for (Production rule : rules) {
      if (rule.isEpsilon()) {
        nullable.add(rule.head());
      }
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Production rule : rules) {
        if (!nullable.contains(rule.head()) && onlyNullable(rule.body(), nullable)) {
          nullable.add(rule.head());
          changed = true;
        }
      }
    }
    return nullable;
  }

  private static boolean onlyNullable(List<Symbol> body, Set<Variable> nullable) {
    for (Symbol symbol : body) {
      if (!(symbol instanceof Variable variable) || !nullable.contains(variable)) {
        return false;
      }
    }
    return true;
  }

  /**
   * One alternative per non-empty subset of nullable occurrences, with those occurrences removed.
   * Empty results are skipped; duplicates are suppressed within this rule only.
   */
  private static List<Production> alternatives(Production rule, Set<Variable> nullable) {
    ImmutableList<Symbol> body = rule.body();
    ImmutableSet.Builder<Integer> positions = ImmutableSet.builder();
    for (int i = 0; i < body.size(); i++) {
      if (body.get(i) instanceof Variable variable && nullable.contains(variable)) {
        positions.add(i);
      }
    }

    Set<ImmutableList<Symbol>> seen = new LinkedHashSet<>();
    for (Set<Integer> removed : Sets.powerSet(positions.build())) {
      if (removed.isEmpty()) {
        continue;
      }
      ImmutableList.Builder<Symbol> kept = ImmutableList.builder();
      for (int i = 0; i < body.size(); i++) {
        if (!removed.contains(i)) {
          kept.add(body.get(i));
        }
      }
      ImmutableList<Symbol> candidate = kept.build();
      if (!candidate.isEmpty()) {
        seen.add(candidate);
      }
    }

    List<Production> out = new ArrayList<>(seen.size());
    for (ImmutableList<Symbol> candidate : seen) {
      out.add(new Production(rule.head(), candidate));
    }
    return out;
  }

  // ε inside a longer body derives nothing; a body of only ε collapses to the empty production.
  private static Production dropInnerEpsilons(Production rule) {
    if (rule.body().size() < 2 || rule.body().stream().noneMatch(Symbol::isEpsilon)) {
      return rule;
    }
    List<Symbol> kept = rule.body().stream().filter(symbol -> !symbol.isEpsilon()).toList();
    return kept.isEmpty() ? Production.epsilon(rule.head()) : new Production(rule.head(), kept);
  }
}
