package cfg.cnf;

import cfg.model.Production;
import cfg.model.Symbol;
import cfg.model.Variable;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase 3: rewrites bodies longer than two symbols into right-branching chains.
 *
 * <pre>
 * A → s1 s2 s3 s4   becomes   A → s1 V0,  V0 → s2 V1,  V1 → s3 s4
 * </pre>
 *
 * <p>Every auxiliary derives exactly one tail sequence. A tail seen before reuses its auxiliary
 * and ends the chain, so links are always two symbols long and no unit rule is introduced.
 * Instances hold per-normalization state and are not shared.
 */
final class Binarization {
  private final FreshVariables names;
  private final Map<ImmutableList<Symbol>, Variable> auxiliaries = new HashMap<>();

  Binarization(FreshVariables names) {
    this.names = names;
  }

  List<Production> apply(List<Production> rules) {
    List<Production> out = new ArrayList<>(rules.size());
    for (Production rule : rules) {
      if (rule.body().size() <= 2) {
        out.add(rule);
      } else {
        out.addAll(chain(rule));
      }
    }
    return out;
  }

  private List<Production> chain(Production rule) {
    List<Production> links = new ArrayList<>();
    Variable current = rule.head();
    ImmutableList<Symbol> rest = rule.body();
    while (rest.size() > 2) {
      ImmutableList<Symbol> tail = rest.subList(1, rest.size());
      Variable known = auxiliaries.get(tail);
      if (known != null) {
        links.add(Production.of(current, rest.get(0), known));
        return links;
      }
      Variable auxiliary = names.next();
      auxiliaries.put(tail, auxiliary);
      links.add(Production.of(current, rest.get(0), auxiliary));
      current = auxiliary;
      rest = tail;
    }
    links.add(new Production(current, rest));
    return links;
  }

  int auxiliaryCount() {
    return auxiliaries.size();
  }
}
