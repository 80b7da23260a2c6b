package ENFA;

import ENFA.Model.EpsilonNFA;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.automatalib.exception.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * JSON exchange format:
 * <pre>
 * {
 *   "states": [1, 2, 3],
 *   "alphabet": ["a", "b"],
 *   "transition_table": [ {"from_state": 1, "symbol": "a", "to_states": [2, 3]} ],
 *   "start_state": 1,
 *   "accept_states": [2]
 * }
 * </pre>
 * Epsilon transitions use the NUL character (U+0000) as symbol, escaped by JSON writers.
 * Reading rebuilds the automaton through its mutators, so a document violating an automaton invariant
 * fails with the same exception as the equivalent API call.
 */
public class JSONFormat {
    private static final Logger LOG = LoggerFactory.getLogger(JSONFormat.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
        .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
        .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    record TransitionRecord(
        @JsonProperty(value = "from_state", required = true) int fromState,
        @JsonProperty(value = "symbol", required = true) String symbol,
        @JsonProperty(value = "to_states", required = true) List<Integer> toStates) {
    }

    record AutomatonDocument(
        @JsonProperty(value = "states", required = true) List<Integer> states,
        @JsonProperty(value = "alphabet", required = true) List<String> alphabet,
        @JsonProperty(value = "transition_table", required = true) List<TransitionRecord> transitionTable,
        @JsonProperty(value = "start_state", required = true) int startState,
        @JsonProperty(value = "accept_states", required = true) List<Integer> acceptStates) {
    }

    public static String toJSON(EpsilonNFA nfa) {
        try {
            return MAPPER.writeValueAsString(toDocument(nfa));
        } catch (JsonProcessingException e) {
            // plain records of ints and strings always serialize
            throw new IllegalStateException(e);
        }
    }

    public static void write(EpsilonNFA nfa, OutputStream os) throws IOException {
        MAPPER.writeValue(os, toDocument(nfa));
    }

    public static void writeFile(EpsilonNFA nfa, Path path) throws IOException {
        LOG.debug("Writing {} states to {}", nfa.size(), path);
        try (OutputStream os = Files.newOutputStream(path)) {
            write(nfa, os);
        }
    }

    public static EpsilonNFA fromJSON(String json) throws FormatException {
        try {
            return fromDocument(MAPPER.readValue(json, AutomatonDocument.class));
        } catch (JsonProcessingException e) {
            throw new FormatException(e);
        }
    }

    public static EpsilonNFA read(InputStream is) throws IOException, FormatException {
        final AutomatonDocument document;
        try {
            document = MAPPER.readValue(is, AutomatonDocument.class);
        } catch (JsonProcessingException e) {
            throw new FormatException(e);
        }
        return fromDocument(document);
    }

    public static EpsilonNFA readFile(Path path) throws IOException, FormatException {
        try (InputStream is = Files.newInputStream(path)) {
            final EpsilonNFA nfa = read(is);
            LOG.debug("Read {} states, {} transitions from {}", nfa.size(), nfa.transitionCount(), path);
            return nfa;
        }
    }

    static AutomatonDocument toDocument(EpsilonNFA nfa) {
        final List<Integer> states = new ArrayList<>(nfa.getStates());
        final List<String> alphabet = new ArrayList<>();
        for (char c : new TreeSet<>(nfa.getAlphabet())) {
            alphabet.add(String.valueOf(c));
        }
        final List<TransitionRecord> table = new ArrayList<>();
        for (int s : nfa.getStates()) {
            for (char symbol : nfa.getSymbols(s)) {
                table.add(new TransitionRecord(s, String.valueOf(symbol),
                    new ArrayList<>(nfa.getTransitions(s, symbol))));
            }
        }
        return new AutomatonDocument(states, alphabet, table, nfa.getStart(),
            new ArrayList<>(nfa.getAcceptStates()));
    }

    static EpsilonNFA fromDocument(AutomatonDocument document) throws FormatException {
        final Set<Character> alphabet = new LinkedHashSet<>();
        for (String symbol : requireField(document.alphabet(), "alphabet")) {
            alphabet.add(toSymbol(symbol));
        }
        final EpsilonNFA nfa = new EpsilonNFA(requireField(document.states(), "states"), alphabet,
            document.startState(), requireField(document.acceptStates(), "accept_states"));

        for (TransitionRecord t : requireField(document.transitionTable(), "transition_table")) {
            final char symbol = toSymbol(t.symbol());
            final List<Integer> targets = requireField(t.toStates(), "to_states");
            if (symbol == EpsilonNFA.EPSILON) {
                nfa.addEpsilonTransition(t.fromState(), targets);
            } else {
                nfa.addTransition(t.fromState(), symbol, targets);
            }
        }
        return nfa;
    }

    private static char toSymbol(String symbol) throws FormatException {
        if (symbol == null || symbol.length() != 1) {
            throw new FormatException("Symbols must be single characters, got: " + symbol);
        }
        return symbol.charAt(0);
    }

    private static <T> List<T> requireField(List<T> value, String field) throws FormatException {
        if (value == null) {
            throw new FormatException("Missing field: " + field);
        }
        if (value.contains(null)) {
            throw new FormatException("Null entry in field: " + field);
        }
        return value;
    }
}
