package cfg.cnf;

import static cfg.testing.TestGrammars.A;
import static cfg.testing.TestGrammars.B;
import static cfg.testing.TestGrammars.S;
import static cfg.testing.TestGrammars.X;
import static cfg.testing.TestGrammars.Y;
import static org.junit.jupiter.api.Assertions.assertEquals;

import cfg.model.Production;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class UnitEliminationTest {

  @Test
  void closureFollowsChainsAndIgnoresSelfLoops() {
    List<Production> rules =
        List.of(
            Production.of(S, X),
            Production.of(X, Y),
            Production.of(Y, Y),
            Production.of(Y, A));

    assertEquals(
        Map.of(S, Set.of(X, Y), X, Set.of(Y)), UnitElimination.unitClosure(rules));
  }

  @Test
  void copiesTargetsAndSortsCanonically() {
    List<Production> rules =
        List.of(
            Production.of(X, B),
            Production.of(S, X),
            Production.of(S, A, S),
            Production.of(X, A),
            Production.of(S, A));

    assertEquals(
        List.of(
            Production.of(S, A),
            Production.of(S, A, S),
            Production.of(S, B),
            Production.of(X, A),
            Production.of(X, B)),
        UnitElimination.apply(rules));
  }

  @Test
  void duplicateProductionsCollapse() {
    List<Production> rules =
        List.of(Production.of(S, A), Production.of(S, X), Production.of(X, A));

    assertEquals(
        List.of(Production.of(S, A), Production.of(X, A)), UnitElimination.apply(rules));
  }
}
