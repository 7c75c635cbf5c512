package RegAlgebra.Grammar;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import RegAlgebra.Automaton;
import RegAlgebra.Model.Transition;

/**
 * Conversions between {@link RegularGrammar} and {@link Automaton}.
 */
public class Grammars {
    static final String ACCEPT_STATE = "X";

    private Grammars() {
    }

    /**
     * States are the non-terminals plus one absorbing final state. {@code a} moves to the absorbing state,
     * {@code aB} moves to {@code B}, and {@code &} makes its non-terminal final.
     * @param grammar - regular grammar
     * @return automaton accepting the language of the grammar
     * @throws IllegalArgumentException on a malformed production or an undeclared non-terminal
     */
    public static Automaton toAutomaton(RegularGrammar grammar) {
        final String initial = grammar.getInitialSymbol();
        final Map<String, ? extends Collection<String>> productions = grammar.getProductions();
        if (!productions.containsKey(initial)) {
            throw new IllegalArgumentException("Initial symbol " + initial + " has no production entry");
        }

        final Set<String> nonTerminals = new TreeSet<>(productions.keySet());
        String accept = ACCEPT_STATE;
        for (int n = 0; nonTerminals.contains(accept); n++) {
            accept = ACCEPT_STATE + n;
        }

        final Automaton automaton = new Automaton();
        automaton.addState(initial);
        nonTerminals.forEach(automaton::addState);
        automaton.addState(accept);
        automaton.setFinal(accept, true);

        for (Map.Entry<String, ? extends Collection<String>> entry : productions.entrySet()) {
            String nonTerminal = entry.getKey();
            for (String production : entry.getValue()) {
                if (RegularGrammar.EPSILON.equals(production)) {
                    automaton.setFinal(nonTerminal, true);
                    continue;
                }
                if (production.isEmpty() || production.length() > 2) {
                    throw new IllegalArgumentException(
                        "Malformed production " + nonTerminal + " -> '" + production + "'");
                }
                String terminal = production.substring(0, 1);
                String target = production.length() == 1 ? accept : production.substring(1);
                if (!nonTerminals.contains(target) && !target.equals(accept)) {
                    throw new IllegalArgumentException(
                        "Production " + nonTerminal + " -> " + production + " names undeclared non-terminal " + target);
                }
                automaton.addSymbol(terminal);
                automaton.addTransition(nonTerminal, terminal, target);
            }
        }
        return automaton;
    }

    /**
     * Right-linear grammar of an automaton: {@code (A, a) -> B} yields {@code A -> aB}, plus {@code A -> a} when
     * {@code B} is final; a final initial state yields {@code S -> &}.
     * @param automaton - automaton whose states and symbols are single characters, e.g. after
     *                  {@link Automaton#relabelAlphabetic()}
     * @return grammar generating the language of the automaton
     * @throws IllegalArgumentException if the automaton is empty or a state or symbol is not a single character
     */
    public static MapGrammar fromAutomaton(Automaton automaton) {
        if (automaton.getInitialState() == null) {
            throw new IllegalArgumentException("Automaton has no states");
        }
        for (String state : automaton.getStates()) {
            requireSingleChar("state", state);
        }
        for (String symbol : automaton.getAlphabet()) {
            requireSingleChar("symbol", symbol);
        }

        final String initial = automaton.getInitialState();
        final MapGrammar grammar = new MapGrammar(initial);
        if (automaton.isFinal(initial)) {
            grammar.addProductions(initial, RegularGrammar.EPSILON);
        }
        for (String state : automaton.getStates()) {
            grammar.addProductions(state);
        }
        for (Transition t : automaton.getTransitions()) {
            if (!automaton.getAlphabet().contains(t.symbol())) {
                continue;
            }
            for (String target : t.targets()) {
                grammar.addProductions(t.state(), t.symbol() + target);
                if (automaton.isFinal(target)) {
                    grammar.addProductions(t.state(), t.symbol());
                }
            }
        }
        return grammar;
    }

    private static void requireSingleChar(String kind, String label) {
        if (label.length() != 1) {
            throw new IllegalArgumentException(
                "Grammar conversion needs single-character labels, got " + kind + " '" + label + "'");
        }
    }
}
