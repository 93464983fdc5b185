package cfg.grammar;

/**
 * Shared limits for grammar evaluation. The default derivation depth can be overridden through the
 * system property {@code cfg.maxDepth} or the environment variable {@code CFG_MAX_DEPTH}.
 */
public final class GrammarDefaults {
  private static final String MAX_DEPTH_PROPERTY = "cfg.maxDepth";
  private static final String MAX_DEPTH_ENV = "CFG_MAX_DEPTH";

  /** Depth bound used when nothing else is configured. */
  public static final int DEFAULT_MAX_DEPTH = 10;

  /** Largest accepted depth bound; keeps the search within the native call stack. */
  public static final int MAX_DEPTH_CEILING = 1_000;

  private GrammarDefaults() {}

  /** Returns the configured default depth bound for newly constructed grammars. */
  public static int maxDepth() {
    String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
    if (propertyValue != null && !propertyValue.isBlank()) {
      return checkMaxDepth(parse(propertyValue, MAX_DEPTH_PROPERTY));
    }
    String envValue = System.getenv(MAX_DEPTH_ENV);
    if (envValue != null && !envValue.isBlank()) {
      return checkMaxDepth(parse(envValue, MAX_DEPTH_ENV));
    }
    return DEFAULT_MAX_DEPTH;
  }

  /**
   * @return {@code maxDepth} unchanged
   * @throws IllegalArgumentException if {@code maxDepth} is outside {@code [0,
   *     MAX_DEPTH_CEILING]}
   */
  public static int checkMaxDepth(int maxDepth) {
    if (maxDepth < 0 || maxDepth > MAX_DEPTH_CEILING) {
      throw new IllegalArgumentException(
          "maxDepth must be between 0 and " + MAX_DEPTH_CEILING + ": " + maxDepth);
    }
    return maxDepth;
  }

  private static int parse(String raw, String source) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + source + ": " + raw, ex);
    }
  }
}
