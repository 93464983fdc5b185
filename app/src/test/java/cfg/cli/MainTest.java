package cfg.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {
  @TempDir Path dir;

  private Path palindromes;
  private ByteArrayOutputStream buffer;
  private PrintStream out;

  @BeforeEach
  void setUp() throws IOException {
    palindromes = dir.resolve("palindromes.cfg");
    Files.writeString(palindromes, "S → aSa | bSb | ε\n");
    buffer = new ByteArrayOutputStream();
    out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
  }

  @Test
  void evalPrintsReplayForAcceptedInputs() {
    int exit =
        Main.run(
            new String[] {"eval", palindromes.toString(), "--input", "aabbaa", "--input=abab"},
            out);

    String output = output();
    assertEquals(3, exit);
    assertTrue(output.contains("\"aabbaa\": accepted"), output);
    assertTrue(output.contains("S → aSa → aaSaa → aabSbaa → aabbaa"), output);
    assertTrue(output.contains("\"abab\": rejected"), output);
  }

  @Test
  void evalSucceedsWhenEveryInputIsAccepted() {
    int exit = Main.run(new String[] {"eval", palindromes.toString(), "--inputs", "aa,,abba"}, out);

    assertEquals(0, exit);
    assertTrue(output().contains("\"\": accepted"));
  }

  @Test
  void evalHonoursMaxDepth() throws IOException {
    Path brackets = dir.resolve("brackets.cfg");
    Files.writeString(brackets, "S → SS | () | (S) | [] | [S]\n");
    String input = "([[[()()[][]]]([])])";

    assertEquals(3, Main.run(new String[] {"eval", brackets.toString(), "--input", input}, out));
    assertEquals(
        0,
        Main.run(
            new String[] {"eval", brackets.toString(), "--input", input, "--max-depth", "15"},
            out));
  }

  @Test
  void evalJsonReport() {
    int exit =
        Main.run(
            new String[] {"eval", palindromes.toString(), "--inputs=abba,ab", "--json"}, out);

    assertEquals(3, exit);
    JsonObject root = JsonParser.parseString(output()).getAsJsonObject();
    assertEquals(10, root.getAsJsonObject("meta").get("max_depth").getAsInt());
    JsonArray results = root.getAsJsonArray("results");
    assertEquals(2, results.size());
    JsonObject accepted = results.get(0).getAsJsonObject();
    assertTrue(accepted.get("accepted").getAsBoolean());
    assertEquals("S → aSa → abSba → abba", accepted.get("replay").getAsString());
    assertFalse(results.get(1).getAsJsonObject().get("accepted").getAsBoolean());
  }

  @Test
  void cnfJsonReport() {
    int exit = Main.run(new String[] {"cnf", palindromes.toString(), "--json"}, out);

    assertEquals(0, exit);
    JsonObject root = JsonParser.parseString(output()).getAsJsonObject();
    assertEquals(8, root.get("rule_count").getAsInt());
    assertEquals("S", root.getAsJsonObject("meta").get("start").getAsString());
    assertEquals("S → T0T0", root.getAsJsonArray("rules").get(0).getAsString());
  }

  @Test
  void cnfPrintsCanonicallySortedRules() {
    int exit = Main.run(new String[] {"cnf", palindromes.toString()}, out);

    assertEquals(0, exit);
    String output = output();
    assertTrue(output.indexOf("S → T0T0") < output.indexOf("T0 → a"), output);
    assertTrue(output.contains("V1 → ST1"), output);
  }

  @Test
  void invalidGrammarExitsWithTwo() throws IOException {
    Path broken = dir.resolve("broken.cfg");
    Files.writeString(broken, "S -> aB\n");

    assertEquals(2, Main.run(new String[] {"cnf", broken.toString()}, out));
    Files.writeString(broken, "S => a\n");
    assertEquals(2, Main.run(new String[] {"cnf", broken.toString()}, out));
  }

  @Test
  void usageErrorsExitWithOne() {
    assertEquals(1, Main.run(new String[] {}, out));
    assertEquals(1, Main.run(new String[] {"parse"}, out));
    assertEquals(1, Main.run(new String[] {"eval", palindromes.toString()}, out));
    assertEquals(1, Main.run(new String[] {"cnf", palindromes.toString(), "--input", "a"}, out));
    assertEquals(1, Main.run(new String[] {"cnf", dir.resolve("missing.cfg").toString()}, out));
    assertEquals(
        1,
        Main.run(
            new String[] {"eval", palindromes.toString(), "--input", "a", "--max-depth", "x"},
            out));
    assertEquals(
        1,
        Main.run(
            new String[] {"eval", palindromes.toString(), "--input", "a", "--max-depth=1001"},
            out));
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }
}
