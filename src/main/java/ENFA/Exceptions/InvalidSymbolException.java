package ENFA.Exceptions;

/**
 * Thrown when a transition uses a symbol that is not part of the automaton's alphabet,
 * or when the reserved epsilon symbol is offered as an alphabet member.
 */
public class InvalidSymbolException extends RuntimeException {
    private final char symbol;

    public InvalidSymbolException(char symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public InvalidSymbolException(char symbol) {
        this(symbol, "Symbol " + printable(symbol) + " does not belong to the automaton alphabet.");
    }

    public char getSymbol() {
        return symbol;
    }

    static String printable(char symbol) {
        return symbol == '\0' ? "\\0" : "'" + symbol + "'";
    }
}
