package cfg.notation;

import cfg.grammar.Grammar;
import cfg.model.Production;
import cfg.model.Symbol;
import cfg.model.Terminal;
import cfg.model.Variable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads grammars written one rule per line:
 *
 * <pre>
 * S → aSa | bSb
 * S -> ε
 * </pre>
 *
 * <p>Heads and body variables are uppercase letters; terminals are lowercase letters or one of
 * {@code ( ) [ ]}; {@code ε} alone denotes the empty production. Spaces and tabs between tokens
 * are ignored, as are blank lines before the first rule. Every rule line must end with a line
 * break.
 *
 * <p>The first head is the start variable. Declared variables are the heads, the alphabet is the
 * set of terminals used, both in order of first appearance.
 */
public final class GrammarReader {
  private static final char EPSILON = 'ε';
  private static final char ARROW = '→';

  private final String text;
  private int position;
  private int line = 1;
  private int column = 1;

  private GrammarReader(String text) {
    this.text = text;
  }

  /**
   * @throws GrammarParseException if the text is malformed
   * @throws cfg.grammar.GrammarValidationException if the rules do not form a valid grammar, for
   *     example when a body uses a variable that never heads a rule
   */
  public static Grammar parse(String text) {
    return new GrammarReader(Objects.requireNonNull(text, "text")).grammar();
  }

  public static Grammar read(Path file) throws IOException {
    return parse(Files.readString(file));
  }

  private Grammar grammar() {
    skipBlankLines();
    if (atEnd()) {
      throw error("expected a production rule");
    }

    Set<Variable> heads = new LinkedHashSet<>();
    Set<Terminal> terminals = new LinkedHashSet<>();
    List<Production> rules = new ArrayList<>();
    do {
      rule(heads, terminals, rules);
      skipBlanks();
    } while (!atEnd());

    Variable start = rules.get(0).head();
    return new Grammar(heads, terminals, rules, start);
  }

  private void rule(Set<Variable> heads, Set<Terminal> terminals, List<Production> rules) {
    skipBlanks();
    if (atEnd() || !isVariable(peek())) {
      throw error("expected a variable (A-Z) as rule head");
    }
    Variable head = new Variable(String.valueOf(advance()));
    heads.add(head);

    skipBlanks();
    separator();
    rules.add(new Production(head, body(terminals)));
    skipBlanks();
    while (!atEnd() && peek() == '|') {
      advance();
      rules.add(new Production(head, body(terminals)));
      skipBlanks();
    }
    endOfLine();
  }

  private void separator() {
    if (!atEnd() && peek() == ARROW) {
      advance();
      return;
    }
    if (text.startsWith("->", position)) {
      advance();
      advance();
      return;
    }
    throw error("expected '→' or '->'");
  }

  private List<Symbol> body(Set<Terminal> terminals) {
    skipBlanks();
    if (!atEnd() && peek() == EPSILON) {
      advance();
      return List.of(Terminal.EPSILON);
    }

    List<Symbol> symbols = new ArrayList<>();
    while (!atEnd() && (isVariable(peek()) || isTerminal(peek()))) {
      char c = advance();
      if (isVariable(c)) {
        symbols.add(new Variable(String.valueOf(c)));
      } else {
        Terminal terminal = new Terminal(String.valueOf(c));
        terminals.add(terminal);
        symbols.add(terminal);
      }
      skipBlanks();
    }
    if (symbols.isEmpty()) {
      throw error("expected a terminal, a variable or 'ε'");
    }
    return symbols;
  }

  private void endOfLine() {
    if (atEnd()) {
      throw error("unterminated line, expected a line break");
    }
    if (!consumeLineBreak()) {
      throw error("unexpected character '" + peek() + "'");
    }
  }

  private void skipBlankLines() {
    while (true) {
      skipBlanks();
      if (!consumeLineBreak()) {
        return;
      }
    }
  }

  private boolean consumeLineBreak() {
    if (atEnd()) {
      return false;
    }
    if (peek() == '\n') {
      advance();
      return true;
    }
    if (text.startsWith("\r\n", position)) {
      advance();
      advance();
      return true;
    }
    return false;
  }

  private void skipBlanks() {
    while (!atEnd() && (peek() == ' ' || peek() == '\t')) {
      advance();
    }
  }

  private static boolean isVariable(char c) {
    return c >= 'A' && c <= 'Z';
  }

  private static boolean isTerminal(char c) {
    return (c >= 'a' && c <= 'z') || c == '(' || c == ')' || c == '[' || c == ']';
  }

  private boolean atEnd() {
    return position >= text.length();
  }

  private char peek() {
    return text.charAt(position);
  }

  private char advance() {
    char c = text.charAt(position++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private GrammarParseException error(String message) {
    return new GrammarParseException(message, line, column);
  }
}
