package cfg.eval;

import java.util.Objects;

/**
 * Outcome of a membership test. A rejected input carries an empty path; rejection means no
 * derivation was found within the grammar's depth bound.
 */
public record EvaluationResult(boolean accepted, DerivationPath path) {

  public EvaluationResult {
    Objects.requireNonNull(path, "path");
    if (!accepted && !path.isEmpty()) {
      throw new IllegalArgumentException("rejected result must not carry a path");
    }
  }

  static EvaluationResult found(DerivationPath path) {
    return new EvaluationResult(true, path);
  }

  static EvaluationResult notFound() {
    return new EvaluationResult(false, DerivationPath.empty());
  }
}
