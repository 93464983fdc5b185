package cfg.notation;

import static cfg.testing.TestGrammars.A;
import static cfg.testing.TestGrammars.B;
import static cfg.testing.TestGrammars.S;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cfg.eval.DerivationEngine;
import cfg.grammar.Grammar;
import cfg.grammar.GrammarValidationException;
import cfg.grammar.GrammarValidationException.Kind;
import cfg.model.Production;
import cfg.model.Variable;
import cfg.testing.TestGrammars;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class GrammarReaderTest {

  @Test
  void readsSampleGrammars() {
    for (String text :
        List.of(
            "A -> a\n",
            "A -> aA\nA -> ε\n",
            "\nS → aSa\nS → bSb\nS → ε\n",
            "S → SS\nS → ()\nS → (S)\nS → []\nS → [S]\n",
            "S → T | U\nT → VaT | VaV | TaV\nU → VbU | VbV | UbV\nV → aVbV | bVaV | ε\n")) {
      assertDoesNotThrow(() -> GrammarReader.parse(text), text);
    }
  }

  @Test
  void alternativesAndRepeatedHeadsAreEquivalent() {
    Grammar oneLine = GrammarReader.parse("S → aSa | bSb | ε\n");
    Grammar threeLines = GrammarReader.parse("S -> aSa\nS -> bSb\nS -> ε\n");

    assertEquals(TestGrammars.palindromeRules(), oneLine.rules());
    assertEquals(oneLine.rules(), threeLines.rules());
    assertEquals(TestGrammars.palindromes().toString(), oneLine.toString());
  }

  @Test
  void firstHeadIsTheStartVariable() {
    Grammar grammar = GrammarReader.parse("T -> aS\nS -> b | T\n");

    assertEquals(Variable.of("T"), grammar.start());
    assertEquals(List.of(Variable.of("T"), S), grammar.variables().asList());
    assertEquals(List.of(A, B), grammar.alphabet().asList());
  }

  @Test
  void ignoresBlanksBetweenTokens() {
    Grammar grammar = GrammarReader.parse(" \n\t\nS\t->  a S a |b S b|  ε  \r\n");

    assertEquals(TestGrammars.palindromeRules(), grammar.rules());
    assertTrue(DerivationEngine.evaluate(grammar, "abba").accepted());
  }

  @Test
  void reportsBadSeparator() {
    GrammarParseException ex =
        assertThrows(GrammarParseException.class, () -> GrammarReader.parse("S => a\n"));
    assertEquals(1, ex.line());
    assertEquals(3, ex.column());
  }

  @Test
  void reportsMissingSeparatorOnLaterLine() {
    GrammarParseException ex =
        assertThrows(GrammarParseException.class, () -> GrammarReader.parse("S -> a\nX\n"));
    assertEquals(2, ex.line());
    assertEquals(2, ex.column());
  }

  @Test
  void reportsUnterminatedLine() {
    GrammarParseException ex =
        assertThrows(GrammarParseException.class, () -> GrammarReader.parse("S -> a"));
    assertEquals(1, ex.line());
    assertEquals(7, ex.column());
    assertTrue(ex.getMessage().contains("unterminated"));
  }

  @Test
  void reportsEmptyBody() {
    GrammarParseException ex =
        assertThrows(GrammarParseException.class, () -> GrammarReader.parse("S -> \n"));
    assertEquals(6, ex.column());
  }

  @Test
  void reportsUnknownSymbolClass() {
    GrammarParseException ex =
        assertThrows(GrammarParseException.class, () -> GrammarReader.parse("S -> a1\n"));
    assertEquals(7, ex.column());
  }

  @Test
  void epsilonMustStandAlone() {
    assertThrows(GrammarParseException.class, () -> GrammarReader.parse("S -> aε\n"));
    assertThrows(GrammarParseException.class, () -> GrammarReader.parse("S -> εa\n"));
  }

  @Test
  void rejectsEmptyText() {
    assertThrows(GrammarParseException.class, () -> GrammarReader.parse("\n \n"));
  }

  @Test
  void bodyOnlyVariablesAreUndeclared() {
    GrammarValidationException ex =
        assertThrows(GrammarValidationException.class, () -> GrammarReader.parse("S -> aB\n"));
    assertEquals(Kind.VARIABLE_NOT_DECLARED, ex.kind());
    assertEquals("B", ex.symbol());
  }

  @Test
  void readsFiles(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("palindromes.cfg");
    Files.writeString(file, "S → aSa | bSb | ε\n");

    Grammar grammar = GrammarReader.read(file);
    assertEquals(
        List.of(Production.of(S, A, S, A), Production.of(S, B, S, B), Production.epsilon(S)),
        grammar.rules());
  }
}
