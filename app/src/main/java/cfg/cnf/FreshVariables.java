package cfg.cnf;

import cfg.model.Variable;
import java.util.Set;

/**
 * Allocates auxiliary variable names {@code prefix0, prefix1, ...} from a monotonically increasing
 * counter. Names already taken are skipped, and every allocated name is recorded as taken so that
 * allocators sharing the same set never collide.
 */
final class FreshVariables {
  private final String prefix;
  private final Set<String> usedNames;
  private int counter;

  FreshVariables(String prefix, Set<String> usedNames) {
    this.prefix = prefix;
    this.usedNames = usedNames;
  }

  Variable next() {
    String name;
    do {
      name = prefix + counter++;
    } while (usedNames.contains(name));
    usedNames.add(name);
    return new Variable(name);
  }
}
