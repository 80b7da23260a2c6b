package ENFA.Exceptions;

/**
 * Thrown when a state is referenced that does not belong to the automaton.
 */
public class UnknownStateException extends RuntimeException {
    private final int state;

    public UnknownStateException(int state) {
        super("State S" + state + " does not belong to the automaton.");
        this.state = state;
    }

    public int getState() {
        return state;
    }
}
