package cfg.grammar;

import cfg.grammar.GrammarValidationException.Kind;
import cfg.model.Production;
import cfg.model.Symbol;
import cfg.model.Terminal;
import cfg.model.Variable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Context-free grammar {@code G = (V, Σ, R, S)}.
 *
 * <p>The 4-tuple is validated on construction and never changes afterwards. Rules are indexed by
 * head in their original order, except that the epsilon alternative of a head, if any, is moved to
 * the end of its group so that the derivation search tries it last.
 *
 * <p>The derivation depth bound is the only mutable state.
 */
public final class Grammar {
  private final ImmutableSet<Variable> variables;
  private final ImmutableSet<Terminal> alphabet;
  private final ImmutableList<Production> rules;
  private final Variable start;
  private final ImmutableListMultimap<Variable, Production> ruleIndex;
  private volatile int maxDepth;

  /**
   * @throws GrammarValidationException if the start variable is undeclared, variables and
   *     alphabet share a token, or a rule uses an undeclared terminal or variable
   */
  public Grammar(
      Collection<Variable> variables,
      Collection<Terminal> alphabet,
      List<Production> rules,
      Variable start) {
    this.variables = ImmutableSet.copyOf(Objects.requireNonNull(variables, "variables"));
    this.alphabet = ImmutableSet.copyOf(Objects.requireNonNull(alphabet, "alphabet"));
    this.rules = ImmutableList.copyOf(Objects.requireNonNull(rules, "rules"));
    this.start = Objects.requireNonNull(start, "start");

    validate();
    if (this.alphabet.contains(Terminal.EPSILON)) {
      throw new IllegalArgumentException("alphabet must not contain " + Terminal.EPSILON);
    }
    this.ruleIndex = indexRules(this.rules);
    this.maxDepth = GrammarDefaults.maxDepth();
  }

  /**
   * Builds a grammar whose variables and alphabet are exactly the symbols used by {@code rules},
   * in order of first appearance. The start variable is always declared.
   */
  public static Grammar inferred(Variable start, List<Production> rules) {
    return inferred(start, List.of(), rules);
  }

  /**
   * Like {@link #inferred(Variable, List)}, but the alphabet starts with {@code alphabet} in its
   * own order, so terminals that no rule uses are kept.
   */
  public static Grammar inferred(
      Variable start, Collection<Terminal> alphabet, List<Production> rules) {
    Set<Variable> variables = new LinkedHashSet<>();
    Set<Terminal> terminals = new LinkedHashSet<>(alphabet);
    variables.add(start);
    for (Production rule : rules) {
      variables.add(rule.head());
      for (Symbol symbol : rule.body()) {
        if (symbol instanceof Variable variable) {
          variables.add(variable);
        } else if (symbol instanceof Terminal terminal && !terminal.isEpsilon()) {
          terminals.add(terminal);
        }
      }
    }
    return new Grammar(variables, terminals, rules, start);
  }

  private void validate() {
    if (!variables.contains(start)) {
      throw new GrammarValidationException(
          Kind.START_NOT_IN_VARIABLES,
          start.name(),
          "start symbol " + start + " not in variables");
    }

    Set<String> variableNames =
        variables.stream().map(Variable::name).collect(Collectors.toSet());
    for (Terminal terminal : alphabet) {
      if (variableNames.contains(terminal.name())) {
        throw new GrammarValidationException(
            Kind.VARIABLES_ALPHABET_OVERLAP,
            terminal.name(),
            "variables and alphabet are not disjoint: " + terminal);
      }
    }

    for (Production rule : rules) {
      for (Symbol symbol : rule.body()) {
        if (symbol instanceof Terminal terminal
            && !terminal.isEpsilon()
            && !alphabet.contains(terminal)) {
          throw new GrammarValidationException(
              Kind.TERMINAL_NOT_IN_ALPHABET,
              terminal.name(),
              "terminal " + terminal + " not in alphabet (rule " + rule + ")");
        }
      }
    }

    for (Production rule : rules) {
      if (!variables.contains(rule.head())) {
        throw new GrammarValidationException(
            Kind.VARIABLE_NOT_DECLARED,
            rule.head().name(),
            "variable " + rule.head() + " not in variables (head of rule " + rule + ")");
      }
      for (Symbol symbol : rule.body()) {
        if (symbol instanceof Variable variable && !variables.contains(variable)) {
          throw new GrammarValidationException(
              Kind.VARIABLE_NOT_DECLARED,
              variable.name(),
              "variable " + variable + " not in variables (body of rule " + rule + ")");
        }
      }
    }
  }

  private static ImmutableListMultimap<Variable, Production> indexRules(List<Production> rules) {
    ImmutableListMultimap.Builder<Variable, Production> index = ImmutableListMultimap.builder();
    Set<Variable> epsilonHeads = new LinkedHashSet<>();
    for (Production rule : rules) {
      if (rule.isEpsilon()) {
        epsilonHeads.add(rule.head());
        continue;
      }
      index.put(rule.head(), rule);
    }
    // One epsilon alternative per head, always tried last.
    for (Variable head : epsilonHeads) {
      index.put(head, Production.epsilon(head));
    }
    return index.build();
  }

  public ImmutableSet<Variable> variables() {
    return variables;
  }

  public ImmutableSet<Terminal> alphabet() {
    return alphabet;
  }

  /** Rules exactly as supplied, duplicates included. */
  public ImmutableList<Production> rules() {
    return rules;
  }

  public Variable start() {
    return start;
  }

  /** Alternatives for {@code head} in search order; empty if the head has no rules. */
  public ImmutableList<Production> rulesFor(Variable head) {
    return ruleIndex.get(head);
  }

  public ImmutableListMultimap<Variable, Production> ruleIndex() {
    return ruleIndex;
  }

  public int maxDepth() {
    return maxDepth;
  }

  /**
   * Sets the derivation depth bound. Too low a bound makes the search reject derivable strings.
   *
   * @throws IllegalArgumentException if {@code maxDepth} is negative or above {@link
   *     GrammarDefaults#MAX_DEPTH_CEILING}
   */
  public void setMaxDepth(int maxDepth) {
    this.maxDepth = GrammarDefaults.checkMaxDepth(maxDepth);
  }

  @Override
  public String toString() {
    return "( { "
        + join(variables)
        + " }, { "
        + join(alphabet)
        + " }, [ "
        + join(rules)
        + " ], "
        + start
        + " )";
  }

  private static String join(Collection<?> values) {
    return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
  }
}
