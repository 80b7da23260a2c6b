package ENFA.Exceptions;

/**
 * Thrown when a transition would re-enter the automaton's start state.
 */
public class IllegalStartTargetException extends RuntimeException {
    private final int from;
    private final int start;

    public IllegalStartTargetException(int from, int start) {
        super("Transition to initial state is impossible (S" + from + " -> S" + start + ").");
        this.from = from;
        this.start = start;
    }

    public int getFrom() {
        return from;
    }

    public int getStart() {
        return start;
    }
}
