package ENFA.Model;

import ENFA.Exceptions.IllegalStartTargetException;
import ENFA.Exceptions.InvalidSymbolException;
import ENFA.Exceptions.UnknownStateException;
import ENFA.Simulation.Simulator;
import it.unimi.dsi.fastutil.chars.Char2ObjectMap;
import it.unimi.dsi.fastutil.chars.Char2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.chars.Char2ObjectSortedMap;
import it.unimi.dsi.fastutil.chars.CharSortedSet;
import it.unimi.dsi.fastutil.chars.CharSortedSets;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.GrowingAlphabet;
import net.automatalib.alphabet.impl.GrowingMapAlphabet;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Non-deterministic finite automaton with epsilon transitions.
 * <p>
 * States are non-negative integers, symbols are characters. The transition relation maps
 * (state, symbol) pairs to sets of states; {@link #EPSILON} keys the transitions that consume no input.
 * <p>
 * Invariants kept by every mutator:
 * <ul>
 *   <li>the start state and all accept states belong to the state set;</li>
 *   <li>every transition source and target belongs to the state set;</li>
 *   <li>every non-epsilon transition symbol belongs to the alphabet;</li>
 *   <li>no transition targets the start state.</li>
 * </ul>
 * A failed mutation leaves the automaton unchanged.
 */
public class EpsilonNFA {
    /**
     * Reserved meta-symbol for transitions that consume no input. Never part of the alphabet.
     */
    public static final char EPSILON = '\0';

    private final IntSortedSet states;
    private final GrowingAlphabet<Character> alphabet;
    private final int start;
    private final IntSortedSet accept;
    private final Int2ObjectSortedMap<Char2ObjectSortedMap<IntSortedSet>> transitions;

    // next identifier handed out by newState(); only ever grows
    private int nextState;

    /**
     * @param states - initial states, non-empty, all non-negative
     * @param alphabet - input symbols, must not contain {@link #EPSILON}
     * @param start - start state, member of states
     * @param accept - accept states, subset of states
     */
    public EpsilonNFA(Collection<Integer> states, Collection<Character> alphabet, int start, Collection<Integer> accept) {
        this.states = new IntRBTreeSet();
        for (int s : states) {
            if (s < 0) {
                throw new UnknownStateException(s);
            }
            this.states.add(s);
        }
        if (!this.states.contains(start)) {
            throw new UnknownStateException(start);
        }
        this.accept = new IntRBTreeSet();
        for (int s : accept) {
            requireState(s);
            this.accept.add(s);
        }
        this.alphabet = new GrowingMapAlphabet<>();
        for (char c : alphabet) {
            appendSymbol(c);
        }
        this.start = start;
        this.transitions = new Int2ObjectRBTreeMap<>();
        this.nextState = allocationBound(this.states.lastInt());
    }

    private EpsilonNFA(EpsilonNFA other) {
        this.states = new IntRBTreeSet(other.states);
        this.alphabet = new GrowingMapAlphabet<>();
        for (Character c : other.alphabet) {
            this.alphabet.addSymbol(c);
        }
        this.start = other.start;
        this.accept = new IntRBTreeSet(other.accept);
        this.transitions = new Int2ObjectRBTreeMap<>();
        for (Int2ObjectMap.Entry<Char2ObjectSortedMap<IntSortedSet>> row : other.transitions.int2ObjectEntrySet()) {
            final Char2ObjectSortedMap<IntSortedSet> copiedRow = new Char2ObjectRBTreeMap<>();
            for (Char2ObjectMap.Entry<IntSortedSet> cell : row.getValue().char2ObjectEntrySet()) {
                copiedRow.put(cell.getCharKey(), new IntRBTreeSet(cell.getValue()));
            }
            this.transitions.put(row.getIntKey(), copiedRow);
        }
        this.nextState = other.nextState;
    }

    /**
     * Add transitions from one state on a symbol of the alphabet.
     * Re-adding existing targets has no effect.
     * @throws InvalidSymbolException if symbol is not in the alphabet
     * @throws UnknownStateException if from or a target is not a state
     * @throws IllegalStartTargetException if a target is the start state
     */
    public void addTransition(int from, char symbol, Collection<Integer> to) {
        if (symbol == EPSILON || !alphabet.containsSymbol(symbol)) {
            throw new InvalidSymbolException(symbol);
        }
        putTransitions(from, symbol, to);
    }

    public void addTransition(int from, char symbol, int to) {
        addTransition(from, symbol, IntSortedSets.singleton(to));
    }

    /**
     * Add epsilon transitions. Same checks as {@link #addTransition(int, char, Collection)},
     * except alphabet membership.
     */
    public void addEpsilonTransition(int from, Collection<Integer> to) {
        putTransitions(from, EPSILON, to);
    }

    public void addEpsilonTransition(int from, int to) {
        putTransitions(from, EPSILON, IntSortedSets.singleton(to));
    }

    private void putTransitions(int from, char symbol, Collection<Integer> to) {
        requireState(from);
        for (int s : to) {
            requireState(s);
            if (s == start) {
                throw new IllegalStartTargetException(from, start);
            }
        }
        if (to.isEmpty()) {
            return;
        }
        Char2ObjectSortedMap<IntSortedSet> row = transitions.get(from);
        if (row == null) {
            row = new Char2ObjectRBTreeMap<>();
            transitions.put(from, row);
        }
        IntSortedSet targets = row.get(symbol);
        if (targets == null) {
            targets = new IntRBTreeSet();
            row.put(symbol, targets);
        }
        targets.addAll(to);
    }

    /**
     * Allocate a fresh state, greater than every identifier this automaton has held.
     * @return the new state
     */
    public int newState() {
        if (nextState < 0) {
            throw new IllegalStateException("State identifiers exhausted");
        }
        final int s = nextState;
        states.add(s);
        nextState = allocationBound(s);
        return s;
    }

    /**
     * Extend the alphabet. Existing transitions are unaffected.
     * @throws InvalidSymbolException for {@link #EPSILON}
     */
    public void addSymbol(char symbol) {
        appendSymbol(symbol);
    }

    private void appendSymbol(char symbol) {
        if (symbol == EPSILON) {
            throw new InvalidSymbolException(symbol, "Epsilon cannot be part of the automaton alphabet.");
        }
        if (!alphabet.containsSymbol(symbol)) {
            alphabet.addSymbol(symbol);
        }
    }

    public void setAccepting(int state, boolean accepting) {
        requireState(state);
        if (accepting) {
            accept.add(state);
        } else {
            accept.remove(state);
        }
    }

    /**
     * Remove states, together with their accept flags and every transition from or to them.
     * Unknown states are ignored. Identifiers stay reserved: {@link #newState()} never hands them out again.
     * @throws IllegalArgumentException if the start state is among them
     */
    public void removeStates(Collection<Integer> removed) {
        if (removed.contains(start)) {
            throw new IllegalArgumentException("Cannot remove start state S" + start);
        }
        for (int s : removed) {
            states.remove(s);
            accept.remove(s);
            transitions.remove(s);
        }
        for (Char2ObjectSortedMap<IntSortedSet> row : transitions.values()) {
            row.values().removeIf(targets -> {
                targets.removeAll(removed);
                return targets.isEmpty();
            });
        }
        transitions.values().removeIf(Char2ObjectSortedMap::isEmpty);
    }

    /**
     * Acceptance by epsilon-closure simulation; see {@link Simulator#closure()}.
     */
    public boolean accepts(CharSequence input) {
        return Simulator.closure().accepts(this, input);
    }

    public EpsilonNFA copy() {
        return new EpsilonNFA(this);
    }

    public IntSortedSet getStates() {
        return IntSortedSets.unmodifiable(states);
    }

    /**
     * @return read-only view of the alphabet; extend it with {@link #addSymbol(char)}
     */
    public Collection<Character> getAlphabet() {
        return Collections.unmodifiableCollection(alphabet);
    }

    public boolean containsSymbol(char symbol) {
        return symbol != EPSILON && alphabet.containsSymbol(symbol);
    }

    public int getStart() {
        return start;
    }

    public IntSortedSet getAcceptStates() {
        return IntSortedSets.unmodifiable(accept);
    }

    public boolean isAccepting(int state) {
        return accept.contains(state);
    }

    public boolean containsState(int state) {
        return states.contains(state);
    }

    /**
     * @return targets of (state, symbol); empty if there are none
     */
    public IntSortedSet getTransitions(int state, char symbol) {
        final Char2ObjectSortedMap<IntSortedSet> row = transitions.get(state);
        if (row == null) {
            return IntSortedSets.EMPTY_SET;
        }
        final IntSortedSet targets = row.get(symbol);
        return targets == null ? IntSortedSets.EMPTY_SET : IntSortedSets.unmodifiable(targets);
    }

    public IntSortedSet getEpsilonTransitions(int state) {
        return getTransitions(state, EPSILON);
    }

    /**
     * @return symbols with outgoing transitions from state, {@link #EPSILON} included
     */
    public CharSortedSet getSymbols(int state) {
        final Char2ObjectSortedMap<IntSortedSet> row = transitions.get(state);
        return row == null ? CharSortedSets.EMPTY_SET : CharSortedSets.unmodifiable(row.keySet());
    }

    /**
     * @return every target of state, over all symbols and epsilon
     */
    public IntSortedSet getSuccessors(int state) {
        final Char2ObjectSortedMap<IntSortedSet> row = transitions.get(state);
        if (row == null) {
            return IntSortedSets.EMPTY_SET;
        }
        final IntSortedSet successors = new IntRBTreeSet();
        for (IntSortedSet targets : row.values()) {
            successors.addAll(targets);
        }
        return successors;
    }

    public int maxState() {
        return states.lastInt();
    }

    public int size() {
        return states.size();
    }

    /**
     * @return number of (source, symbol, target) triples
     */
    public int transitionCount() {
        int count = 0;
        for (Char2ObjectSortedMap<IntSortedSet> row : transitions.values()) {
            for (IntSortedSet targets : row.values()) {
                count += targets.size();
            }
        }
        return count;
    }

    private void requireState(int state) {
        if (!states.contains(state)) {
            throw new UnknownStateException(state);
        }
    }

    // Integer.MIN_VALUE marks an exhausted identifier space
    private static int allocationBound(int max) {
        return max == Integer.MAX_VALUE ? Integer.MIN_VALUE : max + 1;
    }

    private Set<Character> alphabetSet() {
        return new HashSet<>(alphabet);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EpsilonNFA)) {
            return false;
        }
        EpsilonNFA other = (EpsilonNFA) o;
        return start == other.start
            && states.equals(other.states)
            && accept.equals(other.accept)
            && alphabetSet().equals(other.alphabetSet())
            && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, states, accept, alphabetSet(), transitions);
    }

    @Override
    public String toString() {
        return "EpsilonNFA{states=" + states
            + ", alphabet=" + alphabet
            + ", start=" + start
            + ", accept=" + accept
            + ", transitions=" + transitionCount() + "}";
    }
}
