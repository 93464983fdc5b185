package cfg.eval;

import cfg.model.Production;
import java.util.ArrayList;
import java.util.List;

/** Renders a derivation as its chain of sentential forms, e.g. {@code S → aSa → aa}. */
public final class DerivationReplay {
  static final String ARROW = " → ";

  private DerivationReplay() {}

  /**
   * Starts from {@code head0 → body0}; every further production {@code A → B} replaces the first
   * textual occurrence of {@code A} in the previous form by {@code B}, or removes it when {@code
   * B} is the empty production.
   *
   * @return the joined forms, or an empty string for an empty path
   * @throws IllegalArgumentException if a production's head does not occur in the previous form
   */
  public static String replay(DerivationPath path) {
    List<Production> productions = path.productions();
    if (productions.isEmpty()) {
      return "";
    }

    Production first = productions.get(0);
    List<String> forms = new ArrayList<>(productions.size() + 1);
    forms.add(first.head().name());
    forms.add(first.bodyText());
    for (Production production : productions.subList(1, productions.size())) {
      String previous = forms.get(forms.size() - 1);
      String head = production.head().name();
      int at = previous.indexOf(head);
      if (at < 0) {
        throw new IllegalArgumentException(
            "production " + production + " does not apply to " + previous);
      }
      String replacement = production.isEpsilon() ? "" : production.bodyText();
      forms.add(previous.substring(0, at) + replacement + previous.substring(at + head.length()));
    }
    return String.join(ARROW, forms);
  }
}
