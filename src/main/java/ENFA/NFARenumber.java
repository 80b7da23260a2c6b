package ENFA;

import ENFA.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.chars.CharSortedSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Shifts state identifiers so that two automata occupy disjoint ranges before they are merged.
 */
public final class NFARenumber {
    private NFARenumber() {
    }

    /**
     * Offset that moves every state of another automaton above all states of nfa.
     */
    public static int disjointOffset(EpsilonNFA nfa) {
        return Math.addExact(nfa.maxState(), 1);
    }

    /**
     * Structurally identical automaton with every state identifier increased by offset.
     * The argument is not modified.
     * @throws IllegalArgumentException if a shifted identifier would be negative or overflow
     */
    public static EpsilonNFA withOffset(EpsilonNFA nfa, int offset) {
        final IntSortedSet states = nfa.getStates();
        final long lowest = (long) states.firstInt() + offset;
        final long highest = (long) states.lastInt() + offset;
        if (lowest < 0 || highest > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Offset " + offset + " moves states out of range ["
                + states.firstInt() + ", " + states.lastInt() + "]");
        }

        final EpsilonNFA out = new EpsilonNFA(shift(states, offset), nfa.getAlphabet(),
            nfa.getStart() + offset, shift(nfa.getAcceptStates(), offset));
        for (int s : states) {
            final CharSortedSet symbols = nfa.getSymbols(s);
            for (char symbol : symbols) {
                final IntList targets = shift(nfa.getTransitions(s, symbol), offset);
                if (symbol == EpsilonNFA.EPSILON) {
                    out.addEpsilonTransition(s + offset, targets);
                } else {
                    out.addTransition(s + offset, symbol, targets);
                }
            }
        }
        return out;
    }

    private static IntList shift(IntSortedSet states, int offset) {
        final IntList shifted = new IntArrayList(states.size());
        for (int s : states) {
            shifted.add(s + offset);
        }
        return shifted;
    }
}
