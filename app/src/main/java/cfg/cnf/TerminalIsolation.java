package cfg.cnf;

import cfg.model.Production;
import cfg.model.Symbol;
import cfg.model.Terminal;
import cfg.model.Variable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase 4: gives each terminal a dedicated variable and substitutes it wherever the terminal
 * appears in a body of two or more symbols.
 */
final class TerminalIsolation {

  private TerminalIsolation() {}

  static List<Production> apply(
      List<Production> rules, Collection<Terminal> alphabet, FreshVariables names) {
    Map<Terminal, Variable> dedicated = new LinkedHashMap<>();
    for (Terminal terminal : alphabet) {
      dedicated.put(terminal, names.next());
    }

    List<Production> out = new ArrayList<>(rules.size() + dedicated.size());
    for (Production rule : rules) {
      if (rule.body().size() < 2) {
        out.add(rule);
        continue;
      }
      List<Symbol> body = new ArrayList<>(rule.body().size());
      for (Symbol symbol : rule.body()) {
        if (symbol instanceof Terminal terminal) {
          body.add(dedicated.computeIfAbsent(terminal, k -> names.next()));
        } else {
          body.add(symbol);
        }
      }
      out.add(new Production(rule.head(), body));
    }
    for (Map.Entry<Terminal, Variable> entry : dedicated.entrySet()) {
      out.add(Production.of(entry.getValue(), entry.getKey()));
    }
    return out;
  }
}
