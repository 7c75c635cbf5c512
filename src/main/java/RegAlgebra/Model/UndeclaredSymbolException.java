package RegAlgebra.Model;

/**
 * A transition uses a symbol that is not in the automaton's alphabet.
 */
public class UndeclaredSymbolException extends AutomatonException {
    private final String symbol;

    public UndeclaredSymbolException(String symbol) {
        super("Symbol " + symbol + " is not in the alphabet");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
