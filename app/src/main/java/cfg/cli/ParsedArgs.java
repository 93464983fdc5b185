package cfg.cli;

import java.nio.file.Path;
import java.util.Arrays;

/** Option parsing shared by the commands; the first argument is the command name. */
final class ParsedArgs {

  private ParsedArgs() {}

  static CliOptions parse(String[] args, boolean allowInputs) {
    String[] effectiveArgs = args.length > 0 ? Arrays.copyOfRange(args, 1, args.length) : args;
    CliOptions.Builder builder = CliOptions.builder();

    for (int i = 0; i < effectiveArgs.length; i++) {
      String rawArg = effectiveArgs[i];
      String option = rawArg;
      String inlineValue = null;
      if (rawArg.startsWith("--")) {
        int equalsIndex = rawArg.indexOf('=');
        if (equalsIndex > 0) {
          option = rawArg.substring(0, equalsIndex);
          inlineValue = rawArg.substring(equalsIndex + 1);
        }
      } else {
        builder.grammarFile(Path.of(rawArg));
        continue;
      }

      switch (option) {
        case "--json" -> builder.json(true);
        case "--max-depth" ->
            builder.maxDepth(
                CliParsers.parseInt(
                    inlineValue != null
                        ? inlineValue
                        : CliParsers.nextValue(effectiveArgs, ++i, option),
                    option));
        case "--input" -> {
          requireInputs(allowInputs, option);
          builder.addInput(
              inlineValue != null ? inlineValue : CliParsers.nextValue(effectiveArgs, ++i, option));
        }
        case "--inputs" -> {
          requireInputs(allowInputs, option);
          builder.addInputs(
              CliParsers.parseInputs(
                  inlineValue != null
                      ? inlineValue
                      : CliParsers.nextValue(effectiveArgs, ++i, option)));
        }
        default -> throw new IllegalArgumentException("Unknown option: " + rawArg);
      }
    }
    return builder.build();
  }

  private static void requireInputs(boolean allowInputs, String option) {
    if (!allowInputs) {
      throw new IllegalArgumentException("Option not supported by this command: " + option);
    }
  }
}
