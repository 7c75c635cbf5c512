package RegAlgebra.Grammar;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Map-backed {@link RegularGrammar}.
 */
public class MapGrammar implements RegularGrammar {
    private final String initialSymbol;
    private final Map<String, Set<String>> productions;

    public MapGrammar(String initialSymbol) {
        this.initialSymbol = initialSymbol;
        this.productions = new TreeMap<>();
        this.productions.put(initialSymbol, new LinkedHashSet<>());
    }

    /**
     * Add productions to a non-terminal, declaring it if needed.
     * @return this grammar
     */
    public MapGrammar addProductions(String nonTerminal, String... bodies) {
        Set<String> set = productions.computeIfAbsent(nonTerminal, k -> new LinkedHashSet<>());
        Collections.addAll(set, bodies);
        return this;
    }

    @Override
    public String getInitialSymbol() {
        return initialSymbol;
    }

    @Override
    public Map<String, Set<String>> getProductions() {
        return Collections.unmodifiableMap(productions);
    }

    /**
     * One line per non-terminal, initial symbol first, e.g. {@code S -> aA | b | &}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendRule(sb, initialSymbol);
        for (String nonTerminal : productions.keySet()) {
            if (!nonTerminal.equals(initialSymbol)) {
                appendRule(sb, nonTerminal);
            }
        }
        return sb.toString();
    }

    private void appendRule(StringBuilder sb, String nonTerminal) {
        sb.append(nonTerminal).append(" -> ")
          .append(productions.get(nonTerminal).stream().collect(Collectors.joining(" | ")))
          .append('\n');
    }
}
