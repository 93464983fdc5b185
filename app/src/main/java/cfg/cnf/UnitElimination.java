package cfg.cnf;

import cfg.model.Production;
import cfg.model.Variable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase 2: replaces every unit rule {@code A → B} by copies of the non-unit productions of each
 * variable reachable from {@code A} through unit rules. The result is sorted canonically.
 */
final class UnitElimination {

  private UnitElimination() {}

  static List<Production> apply(List<Production> rules) {
    Map<Variable, List<Production>> nonUnitByHead = new LinkedHashMap<>();
    Set<Production> working = new LinkedHashSet<>();
    for (Production rule : rules) {
      if (!rule.isUnit()) {
        working.add(rule);
        nonUnitByHead.computeIfAbsent(rule.head(), k -> new ArrayList<>()).add(rule);
      }
    }

    for (Map.Entry<Variable, Set<Variable>> entry : unitClosure(rules).entrySet()) {
      Variable head = entry.getKey();
      for (Variable target : entry.getValue()) {
        for (Production production : nonUnitByHead.getOrDefault(target, List.of())) {
          working.add(new Production(head, production.body()));
        }
      }
    }

    List<Production> sorted = new ArrayList<>(working);
    sorted.sort(Production.CANONICAL_ORDER);
    return sorted;
  }

  /** For every head, the variables it reaches through one or more unit rules, excluding itself. */
  static Map<Variable, Set<Variable>> unitClosure(List<Production> rules) {
    Map<Variable, Set<Variable>> reach = new LinkedHashMap<>();
    for (Production rule : rules) {
      if (rule.isUnit() && !rule.body().get(0).equals(rule.head())) {
        reach
            .computeIfAbsent(rule.head(), k -> new LinkedHashSet<>())
            .add((Variable) rule.body().get(0));
      }
    }

    boolean changed = true;
    while (changed) {
      changed = false;
      for (Map.Entry<Variable, Set<Variable>> entry : reach.entrySet()) {
        for (Variable via : List.copyOf(entry.getValue())) {
          for (Variable next : reach.getOrDefault(via, Set.of())) {
            if (!next.equals(entry.getKey()) && entry.getValue().add(next)) {
              changed = true;
            }
          }
        }
      }
    }
    return reach;
  }
}
