package ENFA;

import ENFA.Model.EpsilonNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class ENFACommandLineTest {
  private ByteArrayOutputStream outBytes;
  private ByteArrayOutputStream errBytes;

  @BeforeEach
  void setUp() {
    outBytes = new ByteArrayOutputStream();
    errBytes = new ByteArrayOutputStream();
  }

  private int run(String... args) {
    PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    return ENFACommandLine.run(args, out, err);
  }

  private String out() {
    return outBytes.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return errBytes.toString(StandardCharsets.UTF_8);
  }

  private static String resource(String name) throws Exception {
    return JSONFormatTest.getFilePath(name).toString();
  }

  @Test
  void testRun() throws Exception {
    int status = run("run", resource("scenario1.json"), "--", "a", "ab", "");
    Assertions.assertEquals(ENFACommandLine.EXIT_OK, status, err());
    String out = out();
    Assertions.assertTrue(out.contains("3 states, 4 transitions, 1 accepting"), out);
    Assertions.assertTrue(out.contains("\"a\": accept"), out);
    Assertions.assertTrue(out.contains("\"ab\": reject"), out);
    Assertions.assertTrue(out.contains("\"\": reject"), out);
  }

  @Test
  void testConcat() throws Exception {
    int status = run("--algorithm", "backtrack", "concat", resource("scenario1.json"), resource("scenario2.json"),
        "--", "aac", "ac");
    Assertions.assertEquals(ENFACommandLine.EXIT_OK, status, err());
    Assertions.assertTrue(out().contains("concat result: 5 states"), out());
    Assertions.assertTrue(out().contains("\"aac\": accept"), out());
    Assertions.assertTrue(out().contains("\"ac\": reject"), out());
  }

  @Test
  void testUnionAndStar() throws Exception {
    Assertions.assertEquals(ENFACommandLine.EXIT_OK,
        run("union", resource("scenario1.json"), resource("scenario2.json"), "--", "accc", "ab"));
    Assertions.assertTrue(out().contains("\"accc\": accept"), out());
    Assertions.assertTrue(out().contains("\"ab\": reject"), out());

    setUp();
    Assertions.assertEquals(ENFACommandLine.EXIT_OK, run("STAR", resource("scenario1.json"), "--", "", "aaa", "b"));
    Assertions.assertTrue(out().contains("\"\": accept"), out());
    Assertions.assertTrue(out().contains("\"aaa\": accept"), out());
    Assertions.assertTrue(out().contains("\"b\": reject"), out());
  }

  @Test
  void testPruneAndWrite(@TempDir Path dir) throws Exception {
    EpsilonNFA nfa = new EpsilonNFA(List.of(0, 1, 2, 3), List.of('a'), 0, List.of(1, 3));
    nfa.addTransition(0, 'a', 1);
    nfa.addTransition(2, 'a', 3);
    Path input = dir.resolve("island.json");
    JSONFormat.writeFile(nfa, input);
    Path json = dir.resolve("out.json");
    Path dot = dir.resolve("out.dot");

    int status = run("--prune", "--writeJSON", json.toString(), "--writeDOT", dot.toString(),
        "run", input.toString(), "--", "a");
    Assertions.assertEquals(ENFACommandLine.EXIT_OK, status, err());
    Assertions.assertTrue(out().contains("Pruned to: 2 states"), out());
    Assertions.assertTrue(out().contains("\"a\": accept"), out());
    Assertions.assertTrue(out().contains("Writing JSON to file: " + json), out());

    EpsilonNFA written = JSONFormat.readFile(json);
    Assertions.assertEquals(NFATrim.prune(nfa), written);
    Assertions.assertTrue(Files.readString(dot).contains("digraph"));
  }

  @Test
  void testUsageErrors() throws Exception {
    String scenario = resource("scenario1.json");
    Assertions.assertEquals(ENFACommandLine.EXIT_USAGE, run());
    Assertions.assertEquals(ENFACommandLine.EXIT_USAGE, run("concat", scenario));
    Assertions.assertEquals(ENFACommandLine.EXIT_USAGE, run("star", scenario, scenario));
    Assertions.assertEquals(ENFACommandLine.EXIT_USAGE, run("minimize", scenario));
    Assertions.assertEquals(ENFACommandLine.EXIT_USAGE, run("--bogus", "run", scenario));
    Assertions.assertEquals(ENFACommandLine.EXIT_USAGE, run("--algorithm", "powerset", "run", scenario));
    Assertions.assertEquals(ENFACommandLine.EXIT_USAGE, run("run", scenario, "--writeJSON"));
    Assertions.assertTrue(err().contains("<operation>"), err());
    Assertions.assertTrue(out().isEmpty(), out());
  }

  @Test
  void testInvalidInput(@TempDir Path dir) throws Exception {
    Assertions.assertEquals(ENFACommandLine.EXIT_FAILURE, run("run", dir.resolve("absent.json").toString()));
    Assertions.assertEquals(ENFACommandLine.EXIT_FAILURE, run("run", resource("start_target.json")));
    Assertions.assertTrue(err().contains("Invalid automaton"), err());

    Path broken = dir.resolve("broken.json");
    Files.writeString(broken, "{\"states\": [1,");
    Assertions.assertEquals(ENFACommandLine.EXIT_FAILURE, run("run", broken.toString()));
    Assertions.assertTrue(err().contains("Cannot process automaton"), err());
  }
}
