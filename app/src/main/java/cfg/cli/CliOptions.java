package cfg.cli;

import cfg.grammar.GrammarDefaults;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

record CliOptions(Path grammarFile, List<String> inputs, Integer maxDepth, boolean json) {

  CliOptions {
    Objects.requireNonNull(grammarFile, "grammarFile");
    inputs = inputs == null ? List.of() : List.copyOf(inputs);
    if (maxDepth != null) {
      GrammarDefaults.checkMaxDepth(maxDepth);
    }
  }

  boolean hasMaxDepth() {
    return maxDepth != null;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path grammarFile;
    private final List<String> inputs = new ArrayList<>();
    private Integer maxDepth;
    private boolean json;

    Builder grammarFile(Path grammarFile) {
      if (this.grammarFile != null) {
        throw new IllegalArgumentException("Provide exactly one grammar file");
      }
      this.grammarFile = grammarFile;
      return this;
    }

    Builder addInput(String input) {
      inputs.add(input);
      return this;
    }

    Builder addInputs(List<String> values) {
      inputs.addAll(values);
      return this;
    }

    Builder maxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    CliOptions build() {
      if (grammarFile == null) {
        throw new IllegalArgumentException("Missing grammar file");
      }
      return new CliOptions(grammarFile, inputs, maxDepth, json);
    }
  }
}
