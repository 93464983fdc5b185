package cfg.model;

import java.util.Objects;

/** Atomic token of the input alphabet. */
public record Terminal(String name) implements Symbol {

  /** The empty string. Never part of an alphabet. */
  public static final Terminal EPSILON = new Terminal("ε");

  public Terminal {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("terminal name must not be empty");
    }
  }

  public static Terminal of(String name) {
    return new Terminal(name);
  }

  @Override
  public boolean isEpsilon() {
    return EPSILON.name.equals(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
