package ENFA;

import ENFA.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.chars.CharSortedSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Thompson-construction combinators.
 * Operands are never modified; every result is a fresh automaton whose states are the union of the
 * (renumbered) operand states, plus at most one new start state.
 */
public final class Thompson {
    private static final Logger LOG = LoggerFactory.getLogger(Thompson.class);

    private Thompson() {
    }

    /**
     * Automaton accepting exactly the one-symbol word c.
     * @param alphabet - alphabet of the result; c is added if missing
     */
    public static EpsilonNFA symbol(Set<Character> alphabet, char c) {
        final Set<Character> symbols = new HashSet<>(alphabet);
        symbols.add(c);
        final EpsilonNFA nfa = new EpsilonNFA(List.of(0, 1), symbols, 0, List.of(1));
        nfa.addTransition(0, c, 1);
        return nfa;
    }

    /**
     * L(first) . L(second). The second operand is renumbered above the first.
     * Start is first's start, accept states are second's, and every accept state of first
     * gets an epsilon edge to second's start.
     */
    public static EpsilonNFA concatenation(EpsilonNFA first, EpsilonNFA second) {
        final EpsilonNFA shifted = NFARenumber.withOffset(second, NFARenumber.disjointOffset(first));

        final IntSortedSet states = new IntRBTreeSet(first.getStates());
        states.addAll(shifted.getStates());
        final EpsilonNFA out = new EpsilonNFA(states, mergedAlphabet(first, shifted),
            first.getStart(), shifted.getAcceptStates());
        copyTransitions(first, out);
        copyTransitions(shifted, out);

        // shifted.start > every state of first, so it is never out's start
        for (int a : first.getAcceptStates()) {
            out.addEpsilonTransition(a, shifted.getStart());
        }
        LOG.debug("concatenation: {} + {} states -> {}", first.size(), second.size(), out.size());
        return out;
    }

    /**
     * L(first) | L(second). The second operand is renumbered above the first, and a fresh start
     * state above both branches into the two old start states.
     */
    public static EpsilonNFA union(EpsilonNFA first, EpsilonNFA second) {
        final EpsilonNFA shifted = NFARenumber.withOffset(second, NFARenumber.disjointOffset(first));
        final int newStart = NFARenumber.disjointOffset(shifted);

        final IntSortedSet states = new IntRBTreeSet(first.getStates());
        states.addAll(shifted.getStates());
        states.add(newStart);
        final IntSortedSet accept = new IntRBTreeSet(first.getAcceptStates());
        accept.addAll(shifted.getAcceptStates());

        final EpsilonNFA out = new EpsilonNFA(states, mergedAlphabet(first, shifted), newStart, accept);
        copyTransitions(first, out);
        copyTransitions(shifted, out);
        out.addEpsilonTransition(newStart, List.of(first.getStart(), shifted.getStart()));
        LOG.debug("union: {} | {} states -> {}", first.size(), second.size(), out.size());
        return out;
    }

    /**
     * L(nfa)*. A fresh accepting start state leads into the old start, and every old accept state
     * loops back to the old start.
     */
    public static EpsilonNFA closure(EpsilonNFA nfa) {
        final int newStart = NFARenumber.disjointOffset(nfa);

        final IntSortedSet states = new IntRBTreeSet(nfa.getStates());
        states.add(newStart);
        final IntSortedSet accept = new IntRBTreeSet(nfa.getAcceptStates());
        accept.add(newStart);

        final EpsilonNFA out = new EpsilonNFA(states, nfa.getAlphabet(), newStart, accept);
        copyTransitions(nfa, out);
        out.addEpsilonTransition(newStart, nfa.getStart());
        for (int a : nfa.getAcceptStates()) {
            out.addEpsilonTransition(a, nfa.getStart());
        }
        LOG.debug("closure: {} states -> {}", nfa.size(), out.size());
        return out;
    }

    /**
     * Left fold of {@link #concatenation(EpsilonNFA, EpsilonNFA)}.
     */
    public static EpsilonNFA concatenation(List<EpsilonNFA> parts) {
        requireNonEmpty(parts);
        EpsilonNFA result = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            result = concatenation(result, parts.get(i));
        }
        return result == parts.get(0) ? result.copy() : result;
    }

    /**
     * Left fold of {@link #union(EpsilonNFA, EpsilonNFA)}.
     */
    public static EpsilonNFA union(List<EpsilonNFA> alternatives) {
        requireNonEmpty(alternatives);
        EpsilonNFA result = alternatives.get(0);
        for (int i = 1; i < alternatives.size(); i++) {
            result = union(result, alternatives.get(i));
        }
        return result == alternatives.get(0) ? result.copy() : result;
    }

    private static void requireNonEmpty(List<EpsilonNFA> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("At least one automaton is required");
        }
    }

    private static Set<Character> mergedAlphabet(EpsilonNFA first, EpsilonNFA second) {
        final Set<Character> alphabet = new HashSet<>(first.getAlphabet());
        alphabet.addAll(second.getAlphabet());
        return alphabet;
    }

    // Copies every transition of from into out; out must contain from's states and alphabet
    private static void copyTransitions(EpsilonNFA from, EpsilonNFA out) {
        for (int s : from.getStates()) {
            final CharSortedSet symbols = from.getSymbols(s);
            for (char symbol : symbols) {
                if (symbol == EpsilonNFA.EPSILON) {
                    out.addEpsilonTransition(s, from.getEpsilonTransitions(s));
                } else {
                    out.addTransition(s, symbol, from.getTransitions(s, symbol));
                }
            }
        }
    }
}
