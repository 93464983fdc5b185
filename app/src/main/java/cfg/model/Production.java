package cfg.model;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A rewrite rule {@code head → body}. The body is never empty; the empty production is written
 * with a body of exactly {@code [ε]}.
 *
 * <p>Equality is structural: same head and pairwise equal body symbols.
 */
public record Production(Variable head, ImmutableList<Symbol> body) {

  /** Canonical rule order: head name, then body text. */
  public static final Comparator<Production> CANONICAL_ORDER =
      Comparator.comparing((Production p) -> p.head().name()).thenComparing(Production::bodyText);

  public Production {
    Objects.requireNonNull(head, "head");
    Objects.requireNonNull(body, "body");
    if (body.isEmpty()) {
      throw new IllegalArgumentException("production body must not be empty: " + head);
    }
  }

  public Production(Variable head, List<? extends Symbol> body) {
    this(head, ImmutableList.<Symbol>copyOf(body));
  }

  public static Production of(Variable head, Symbol... body) {
    return new Production(head, Arrays.asList(body));
  }

  public static Production epsilon(Variable head) {
    return of(head, Terminal.EPSILON);
  }

  /** True when the body is exactly {@code [ε]}. */
  public boolean isEpsilon() {
    return body.size() == 1 && body.get(0).isEpsilon();
  }

  /** True when the body is a single variable. */
  public boolean isUnit() {
    return body.size() == 1 && body.get(0) instanceof Variable;
  }

  public String bodyText() {
    return text(body);
  }

  /** Concatenated symbol names, without separators. */
  public static String text(List<? extends Symbol> symbols) {
    return symbols.stream().map(Symbol::name).collect(Collectors.joining());
  }

  @Override
  public String toString() {
    return head.name() + " → " + bodyText();
  }
}
