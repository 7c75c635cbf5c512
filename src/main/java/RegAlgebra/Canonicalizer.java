package RegAlgebra;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import RegAlgebra.Model.StateBudgetExceededException;

/**
 * Deterministic relabeling of states for stable output.
 */
public class Canonicalizer {
    static final String NUMERIC_PREFIX = "q";
    static final String ALPHABETIC_INITIAL = "S";
    static final int ALPHABETIC_BUDGET = 26;

    private Canonicalizer() {
    }

    /**
     * Relabel states to q{beginAt}, q{beginAt+1}, ...; the initial state gets q{beginAt}, the others follow in
     * natural order.
     */
    public static void relabelNumeric(Automaton automaton, int beginAt) {
        final List<String> states = automaton.getStates();
        final Map<String, String> mapping = new HashMap<>();
        for (int i = 0; i < states.size(); i++) {
            mapping.put(states.get(i), NUMERIC_PREFIX + (beginAt + i));
        }
        automaton.rename(mapping);
    }

    /**
     * Relabel states to S (initial), then A, B, ..., Z skipping S.
     * @throws StateBudgetExceededException with more than 26 states
     */
    public static void relabelAlphabetic(Automaton automaton) {
        final List<String> states = automaton.getStates();
        if (states.size() > ALPHABETIC_BUDGET) {
            throw new StateBudgetExceededException(ALPHABETIC_BUDGET, states.size());
        }
        final Map<String, String> mapping = new HashMap<>();
        char letter = 'A';
        for (int i = 0; i < states.size(); i++) {
            if (i == 0) {
                mapping.put(states.get(i), ALPHABETIC_INITIAL);
                continue;
            }
            if (letter == ALPHABETIC_INITIAL.charAt(0)) {
                letter++;
            }
            mapping.put(states.get(i), String.valueOf(letter++));
        }
        automaton.rename(mapping);
    }
}
