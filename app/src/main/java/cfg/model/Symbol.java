package cfg.model;

/**
 * A symbol that may appear in the body of a production: either a {@link Terminal} or a {@link
 * Variable}. The hierarchy is closed, so consumers only ever need to handle these two cases.
 */
public sealed interface Symbol permits Terminal, Variable {

  /** Token text of the symbol, as it appears in a sentential form. */
  String name();

  /** Returns {@code true} only for {@link Terminal#EPSILON}. */
  default boolean isEpsilon() {
    return false;
  }
}
