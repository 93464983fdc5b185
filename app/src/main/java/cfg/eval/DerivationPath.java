package cfg.eval;

import cfg.model.Production;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Productions of one successful leftmost derivation, in the order they were applied. */
public record DerivationPath(ImmutableList<Production> productions) {

  private static final DerivationPath EMPTY = new DerivationPath(ImmutableList.of());

  public DerivationPath {
    Objects.requireNonNull(productions, "productions");
  }

  public static DerivationPath empty() {
    return EMPTY;
  }

  public static DerivationPath of(List<Production> productions) {
    return new DerivationPath(ImmutableList.copyOf(productions));
  }

  public boolean isEmpty() {
    return productions.isEmpty();
  }

  public int size() {
    return productions.size();
  }

  /** Sentential forms of this derivation; see {@link DerivationReplay#replay(DerivationPath)}. */
  public String replay() {
    return DerivationReplay.replay(this);
  }

  @Override
  public String toString() {
    return "[ "
        + productions.stream().map(Production::toString).collect(Collectors.joining(", "))
        + " ]";
  }
}
