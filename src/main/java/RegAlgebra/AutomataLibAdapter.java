package RegAlgebra;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import RegAlgebra.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Conversions to and from AutomataLib, used to cross-check results against its reference algorithms.
 */
public class AutomataLibAdapter {
    private AutomataLibAdapter() {
    }

    /**
     * @return CompactNFA over the automaton's alphabet; transitions on symbols outside the alphabet are dropped
     */
    public static CompactNFA<String> toCompactNFA(Automaton automaton) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(automaton.getAlphabet());
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, automaton.size());
        final Map<String, Integer> ids = new HashMap<>();

        for (String state : automaton.getStates()) {
            ids.put(state, nfa.addState(automaton.isFinal(state)));
        }
        if (automaton.getInitialState() != null) {
            nfa.setInitial(ids.get(automaton.getInitialState()), true);
        }
        for (Transition t : automaton.getTransitions()) {
            if (!automaton.getAlphabet().contains(t.symbol())) {
                continue;
            }
            for (String target : t.targets()) {
                nfa.addTransition(ids.get(t.state()), t.symbol(), ids.get(target));
            }
        }
        return nfa;
    }

    /**
     * @param dfa - AutomataLib DFA
     * @param inputs - input symbols
     * @return automaton with states q0 (initial), q1, ... in the DFA's state order
     */
    public static <S> Automaton fromDFA(DFA<S, String> dfa, Collection<String> inputs) {
        final Automaton automaton = new Automaton();
        inputs.forEach(automaton::addSymbol);
        final S init = dfa.getInitialState();
        if (init == null) {
            return automaton;
        }

        final Map<S, String> labels = new HashMap<>();
        labels.put(init, Canonicalizer.NUMERIC_PREFIX + 0);
        for (S s : dfa.getStates()) {
            if (!labels.containsKey(s)) {
                labels.put(s, Canonicalizer.NUMERIC_PREFIX + labels.size());
            }
        }
        automaton.addState(labels.get(init));
        for (S s : dfa.getStates()) {
            automaton.addState(labels.get(s));
            automaton.setFinal(labels.get(s), dfa.isAccepting(s));
        }
        for (S s : dfa.getStates()) {
            for (String i : inputs) {
                S succ = dfa.getTransition(s, i);
                if (succ != null) {
                    automaton.addTransition(labels.get(s), i, labels.get(succ));
                }
            }
        }
        return automaton;
    }

    /**
     * Complete minimal DFA computed by AutomataLib's subset construction and Hopcroft minimization.
     */
    public static CompactDFA<String> referenceMinimalDFA(Automaton automaton) {
        final CompactNFA<String> nfa = toCompactNFA(automaton);
        final Alphabet<String> alphabet = nfa.getInputAlphabet();
        final CompactDFA<String> dfa = NFAs.determinize(nfa, alphabet, false, false);
        return HopcroftMinimizer.minimizeDFA(dfa, alphabet);
    }

    /**
     * Language equivalence decided by AutomataLib. Both automata must share the same alphabet.
     */
    public static boolean referenceEquivalent(Automaton a, Automaton b) {
        if (!a.getAlphabet().equals(b.getAlphabet())) {
            throw new IllegalArgumentException("Alphabets differ: " + a.getAlphabet() + " vs " + b.getAlphabet());
        }
        final CompactDFA<String> dfaA = referenceMinimalDFA(a);
        final CompactDFA<String> dfaB = referenceMinimalDFA(b);
        return Automata.testEquivalence(dfaA, dfaB, dfaA.getInputAlphabet());
    }
}
