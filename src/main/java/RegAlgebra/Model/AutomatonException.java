package RegAlgebra.Model;

/**
 * Base class of the contract violations raised by automaton operations.
 * These are programming errors, not transient faults; nothing retries them.
 */
public class AutomatonException extends RuntimeException {
    public AutomatonException(String message) {
        super(message);
    }
}
