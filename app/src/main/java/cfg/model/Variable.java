package cfg.model;

import java.util.Objects;

/** Non-terminal grammar category. Only variables may head a production. */
public record Variable(String name) implements Symbol {

  public Variable {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("variable name must not be empty");
    }
  }

  public static Variable of(String name) {
    return new Variable(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
