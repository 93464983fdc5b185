package cfg.grammar;

/** Raised when a grammar 4-tuple violates one of its construction invariants. */
public final class GrammarValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /** The violated invariant, in the order they are checked. */
  public enum Kind {
    START_NOT_IN_VARIABLES,
    VARIABLES_ALPHABET_OVERLAP,
    TERMINAL_NOT_IN_ALPHABET,
    VARIABLE_NOT_DECLARED
  }

  private final Kind kind;
  private final String symbol;

  GrammarValidationException(Kind kind, String symbol, String message) {
    super(message);
    this.kind = kind;
    this.symbol = symbol;
  }

  public Kind kind() {
    return kind;
  }

  /** Name of the offending symbol. */
  public String symbol() {
    return symbol;
  }
}
