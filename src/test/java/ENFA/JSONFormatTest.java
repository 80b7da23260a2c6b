package ENFA;

import ENFA.Exceptions.IllegalStartTargetException;
import ENFA.Exceptions.InvalidSymbolException;
import ENFA.Exceptions.UnknownStateException;
import ENFA.Model.EpsilonNFA;
import net.automatalib.exception.FormatException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class JSONFormatTest {
  static Path getFilePath(String resourcePath) throws URISyntaxException {
    return Paths.get(Objects.requireNonNull(
        JSONFormatTest.class.getClassLoader().getResource(resourcePath)).toURI());
  }

  @Test
  void testReadScenario() throws Exception {
    EpsilonNFA nfa = JSONFormat.readFile(getFilePath("scenario1.json"));
    Assertions.assertEquals(Set.of(1, 2, 3), nfa.getStates());
    Assertions.assertEquals(1, nfa.getStart());
    Assertions.assertEquals(Set.of(2), nfa.getAcceptStates());
    Assertions.assertEquals(Set.of(2, 3), nfa.getTransitions(1, 'a'));
    Assertions.assertEquals(Set.of('a', 'b', 'c'), Set.copyOf(nfa.getAlphabet()));
    Assertions.assertTrue(nfa.accepts("a"));
    Assertions.assertFalse(nfa.accepts("ab"));

    EpsilonNFA second = JSONFormat.readFile(getFilePath("scenario2.json"));
    Assertions.assertTrue(Thompson.concatenation(nfa, second).accepts("aac"));
  }

  @Test
  void testRoundTrip() throws Exception {
    EpsilonNFA nfa = Thompson.closure(Thompson.union(
        Thompson.symbol(Set.of('a', 'b'), 'a'), Thompson.symbol(Set.of(), 'b')));
    String json = JSONFormat.toJSON(nfa);
    Assertions.assertTrue(json.contains("\"transition_table\""));
    Assertions.assertTrue(json.contains("\\u0000"));
    Assertions.assertEquals(nfa, JSONFormat.fromJSON(json));

    ByteArrayOutputStream os = new ByteArrayOutputStream();
    JSONFormat.write(nfa, os);
    EpsilonNFA read = JSONFormat.read(new ByteArrayInputStream(os.toByteArray()));
    Assertions.assertEquals(nfa, read);
    Assertions.assertTrue(read.accepts("abba"));
  }

  @Test
  void testWriteFile(@TempDir Path dir) throws Exception {
    EpsilonNFA nfa = JSONFormat.readFile(getFilePath("scenario2.json"));
    Path out = dir.resolve("out.json");
    JSONFormat.writeFile(nfa, out);
    Assertions.assertEquals(nfa, JSONFormat.readFile(out));
  }

  @Test
  void testEdgeIntoStartRejected() {
    IllegalStartTargetException e = assertThrows(IllegalStartTargetException.class,
        () -> JSONFormat.readFile(getFilePath("start_target.json")));
    Assertions.assertEquals(2, e.getFrom());
    Assertions.assertEquals(1, e.getStart());
  }

  @Test
  void testInvalidModels() {
    assertThrows(UnknownStateException.class, () -> JSONFormat.fromJSON(document("[1, 2]", "[\"a\"]",
        "[{\"from_state\": 1, \"symbol\": \"a\", \"to_states\": [5]}]", 1, "[2]")));
    assertThrows(UnknownStateException.class, () -> JSONFormat.fromJSON(document("[1, 2]", "[\"a\"]",
        "[]", 3, "[2]")));
    assertThrows(InvalidSymbolException.class, () -> JSONFormat.fromJSON(document("[1, 2]", "[\"a\"]",
        "[{\"from_state\": 1, \"symbol\": \"b\", \"to_states\": [2]}]", 1, "[2]")));
  }

  @Test
  void testMalformedDocuments() {
    // multi-character symbol
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(document("[1, 2]", "[\"ab\"]",
        "[]", 1, "[2]")));
    // empty symbol
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(document("[1, 2]", "[\"a\"]",
        "[{\"from_state\": 1, \"symbol\": \"\", \"to_states\": [2]}]", 1, "[2]")));
    // missing field
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(
        "{\"states\": [1], \"alphabet\": [], \"transition_table\": [], \"accept_states\": []}"));
    // null entry
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(document("[1, null]", "[]", "[]", 1, "[]")));
    // wrong type
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(document("[1]", "[]", "[]", 1, "\"none\"")));
    // fractional identifiers are not truncated
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(document("[1.9, 2]", "[\"a\"]",
        "[]", 1, "[2]")));
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(document("[1, 2]", "[\"a\"]",
        "[{\"from_state\": 1, \"symbol\": \"a\", \"to_states\": [2.5]}]", 1, "[2]")));
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON(document("[1, 2]", "[\"a\"]",
        "[]", 1, "[2.0]")));
    // not JSON
    assertThrows(FormatException.class, () -> JSONFormat.fromJSON("{\"states\": [1,"));
    assertThrows(FormatException.class,
        () -> JSONFormat.read(new ByteArrayInputStream("garbage".getBytes(StandardCharsets.UTF_8))));
  }

  @Test
  void testMissingFile(@TempDir Path dir) {
    assertThrows(IOException.class, () -> JSONFormat.readFile(dir.resolve("absent.json")));
  }

  private static String document(String states, String alphabet, String table, int start, String accept) {
    return String.join("\n", List.of(
        "{",
        "  \"states\": " + states + ",",
        "  \"alphabet\": " + alphabet + ",",
        "  \"transition_table\": " + table + ",",
        "  \"start_state\": " + start + ",",
        "  \"accept_states\": " + accept,
        "}"));
  }
}
