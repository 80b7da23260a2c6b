package ENFA.Simulation;

import ENFA.Model.EpsilonNFA;

import java.util.List;

/**
 * Decides whether an automaton accepts an input string.
 * Implementations are stateless; a single instance may be shared.
 */
public interface Simulator {
    String CLOSURE = "closure";
    String BACKTRACK = "backtrack";
    List<String> ALGORITHMS = List.of(CLOSURE, BACKTRACK);

    /**
     * @return true iff some path from the start state consumes all of input and ends in an accept state.
     * Never throws for a valid automaton; symbols outside the alphabet simply lead nowhere.
     */
    boolean accepts(EpsilonNFA nfa, CharSequence input);

    String getName();

    /**
     * Subset simulation: step the epsilon-closed set of current states one symbol at a time.
     */
    static Simulator closure() {
        return new ClosureSimulation();
    }

    /**
     * Depth-first search over (state, position) pairs, memoized on the pair.
     */
    static Simulator backtracking() {
        return new BacktrackingSimulation();
    }

    static Simulator forName(String algorithm) {
        return switch (algorithm.toLowerCase()) {
            case CLOSURE -> closure();
            case BACKTRACK -> backtracking();
            default -> throw new IllegalArgumentException("Unexpected simulation algorithm: " + algorithm);
        };
    }
}
