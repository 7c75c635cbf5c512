package RegAlgebra.Grammar;

import java.util.Collection;
import java.util.Map;

/**
 * Right-linear regular grammar as consumed by automaton construction.
 * <p>
 * A production is either {@link #EPSILON} or a string of one or two symbols: a terminal, optionally followed by
 * a non-terminal.
 */
public interface RegularGrammar {
    String EPSILON = "&";

    /**
     * @return the start non-terminal
     */
    String getInitialSymbol();

    /**
     * @return non-terminal -> its productions
     */
    Map<String, ? extends Collection<String>> getProductions();
}
