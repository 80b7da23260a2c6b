package ENFA;

import ENFA.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.serialization.dot.GraphDOT;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Graphviz rendering. The automaton is copied into an AutomataLib {@link CompactNFA} whose alphabet
 * carries an extra label for epsilon edges, and written with {@link GraphDOT}: accept states
 * are double circles and an entry marker points at the start state.
 * Epsilon edges are labelled {@link #EPSILON_GLYPH}, or the first of {@link #FALLBACK_GLYPHS}
 * that is not an input symbol.
 * States are numbered s0, s1, ... in ascending order of their identifiers.
 */
public class DOTFormat {
    public static final char EPSILON_GLYPH = 'ε';
    public static final String FALLBACK_GLYPHS = "ϵλΛ";

    public static void write(EpsilonNFA nfa, Appendable a) throws IOException {
        final CompactNFA<Character> view = toRenderable(nfa);
        GraphDOT.write(view, view.getInputAlphabet(), a);
    }

    public static String toDOT(EpsilonNFA nfa) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(nfa, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }

    public static void writeFile(EpsilonNFA nfa, Path path) throws IOException {
        try (Writer w = Files.newBufferedWriter(path)) {
            write(nfa, w);
        }
    }

    static CompactNFA<Character> toRenderable(EpsilonNFA nfa) {
        final char epsilonLabel = epsilonLabel(nfa);
        final SortedSet<Character> symbols = new TreeSet<>(nfa.getAlphabet());
        symbols.add(epsilonLabel);
        final Alphabet<Character> alphabet = Alphabets.fromCollection(symbols);
        final CompactNFA<Character> out = new CompactNFA<>(alphabet, nfa.size());

        final Int2ObjectMap<Integer> mapping = new Int2ObjectOpenHashMap<>(nfa.size());
        for (int s : nfa.getStates()) {
            final Integer so = out.addState(nfa.isAccepting(s));
            mapping.put(s, so);
        }
        out.setInitial(mapping.get(nfa.getStart()), true);

        for (int s : nfa.getStates()) {
            final Integer source = mapping.get(s);
            for (char symbol : nfa.getSymbols(s)) {
                final Character label = symbol == EpsilonNFA.EPSILON ? epsilonLabel : symbol;
                for (int t : nfa.getTransitions(s, symbol)) {
                    final Integer target = mapping.get(t);
                    if (target != null) {
                        out.addTransition(source, label, target);
                    }
                }
            }
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException if every candidate label is an input symbol
     */
    static char epsilonLabel(EpsilonNFA nfa) {
        if (!nfa.containsSymbol(EPSILON_GLYPH)) {
            return EPSILON_GLYPH;
        }
        for (int i = 0; i < FALLBACK_GLYPHS.length(); i++) {
            final char glyph = FALLBACK_GLYPHS.charAt(i);
            if (!nfa.containsSymbol(glyph)) {
                return glyph;
            }
        }
        throw new IllegalArgumentException("No free label for epsilon edges, alphabet uses "
            + EPSILON_GLYPH + FALLBACK_GLYPHS);
    }
}
