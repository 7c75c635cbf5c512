package RegAlgebra.Format;

/**
 * A persisted automaton record is malformed or references undeclared states or symbols.
 */
public class AutomatonFormatException extends Exception {
    public AutomatonFormatException(String message) {
        super(message);
    }

    public AutomatonFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
