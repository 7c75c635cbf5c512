package RegAlgebra;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import RegAlgebra.Grammar.Grammars;
import RegAlgebra.Grammar.RegularGrammar;
import RegAlgebra.Model.InvalidStateReferenceException;
import RegAlgebra.Model.Transition;
import RegAlgebra.Model.UndeclaredSymbolException;

/**
 * Non-deterministic finite automaton without epsilon transitions.
 * <p>
 * The transition relation maps (state, symbol) to a non-empty set of target states; the automaton is
 * deterministic iff every mapped set is a singleton. All algorithms mutate the receiver in place, except the
 * decision procedures ({@link #isEmpty()}, {@link #isFinite()}, {@link #contains(Automaton)},
 * {@link #isEqual(Automaton)}), which work on private copies.
 * <p>
 * Not thread-safe.
 */
public class Automaton {
    private final Set<String> states;
    private final Set<String> alphabet;
    private final Map<String, Map<String, Set<String>>> transitions;
    private final Set<String> finalStates;
    private String initialState;

    public Automaton() {
        this.states = new TreeSet<>();
        this.alphabet = new TreeSet<>();
        this.transitions = new TreeMap<>();
        this.finalStates = new TreeSet<>();
    }

    /**
     * Build an automaton without transitions.
     * @param states - state labels
     * @param alphabet - input symbols
     * @param initialState - initial state, must be one of states
     * @param finalStates - final states, must be a subset of states
     */
    public Automaton(Collection<String> states, Collection<String> alphabet, String initialState,
                     Collection<String> finalStates) {
        this();
        this.states.addAll(states);
        this.alphabet.addAll(alphabet);
        setInitialState(initialState);
        Set<String> missing = new TreeSet<>(finalStates);
        missing.removeAll(this.states);
        if (!missing.isEmpty()) {
            throw new InvalidStateReferenceException(missing);
        }
        this.finalStates.addAll(finalStates);
    }

    /**
     * Structural clone; the copy shares nothing with this automaton.
     */
    public Automaton copy() {
        Automaton copy = new Automaton();
        copy.states.addAll(states);
        copy.alphabet.addAll(alphabet);
        copy.finalStates.addAll(finalStates);
        copy.initialState = initialState;
        for (Map.Entry<String, Map<String, Set<String>>> entry : transitions.entrySet()) {
            Map<String, Set<String>> row = new TreeMap<>();
            for (Map.Entry<String, Set<String>> cell : entry.getValue().entrySet()) {
                row.put(cell.getKey(), new TreeSet<>(cell.getValue()));
            }
            copy.transitions.put(entry.getKey(), row);
        }
        return copy;
    }

    public static Automaton fromRegularGrammar(RegularGrammar grammar) {
        return Grammars.toAutomaton(grammar);
    }

    // ---------------------------------------------------------------- states

    /**
     * Add a state. The first state added to an empty automaton becomes the initial state.
     * @return true if the state was new
     */
    public boolean addState(String state) {
        Objects.requireNonNull(state, "state");
        if (initialState == null) {
            initialState = state;
        }
        return states.add(state);
    }

    /**
     * Remove a state with its outgoing transitions and every reference to it as a target.
     * Removing the initial state is a no-op.
     */
    public void removeState(String state) {
        if (state.equals(initialState) || !states.remove(state)) {
            return;
        }
        finalStates.remove(state);
        transitions.remove(state);

        Iterator<Map<String, Set<String>>> rows = transitions.values().iterator();
        while (rows.hasNext()) {
            Map<String, Set<String>> row = rows.next();
            row.values().removeIf(targets -> targets.remove(state) && targets.isEmpty());
            if (row.isEmpty()) {
                rows.remove();
            }
        }
    }

    public boolean hasState(String state) {
        return states.contains(state);
    }

    /**
     * @return states, initial state first, the rest in natural order
     */
    public List<String> getStates() {
        List<String> ordered = new ArrayList<>(states.size());
        if (initialState != null) {
            ordered.add(initialState);
        }
        for (String s : states) {
            if (!s.equals(initialState)) {
                ordered.add(s);
            }
        }
        return ordered;
    }

    public int size() {
        return states.size();
    }

    public String getInitialState() {
        return initialState;
    }

    public void setInitialState(String state) {
        if (state == null || !states.contains(state)) {
            throw new InvalidStateReferenceException(Collections.singleton(String.valueOf(state)));
        }
        this.initialState = state;
    }

    public Set<String> getFinalStates() {
        return Collections.unmodifiableSet(finalStates);
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    /**
     * Mark or unmark a state as final. Unknown states are ignored.
     */
    public void setFinal(String state, boolean isFinal) {
        if (!states.contains(state)) {
            return;
        }
        if (isFinal) {
            finalStates.add(state);
        } else {
            finalStates.remove(state);
        }
    }

    public void toggleFinalState(String state) {
        setFinal(state, !finalStates.contains(state));
    }

    // ---------------------------------------------------------------- alphabet

    public boolean addSymbol(String symbol) {
        return alphabet.add(Objects.requireNonNull(symbol, "symbol"));
    }

    /**
     * Remove a symbol and every transition on it.
     */
    public void removeSymbol(String symbol) {
        alphabet.remove(symbol);
        transitions.values().removeIf(row -> row.remove(symbol) != null && row.isEmpty());
    }

    public Set<String> getAlphabet() {
        return Collections.unmodifiableSet(alphabet);
    }

    // ---------------------------------------------------------------- transitions

    /**
     * Set the transition function for a state and symbol, replacing any previous targets.
     * @param state - source state
     * @param symbol - input symbol
     * @param targets - new targets; empty removes the transition
     * @throws InvalidStateReferenceException if the source or any target is not a state
     * @throws UndeclaredSymbolException if the symbol is not in the alphabet
     */
    public void setTransition(String state, String symbol, Collection<String> targets) {
        if (targets.isEmpty()) {
            Map<String, Set<String>> row = transitions.get(state);
            if (row != null) {
                row.remove(symbol);
                if (row.isEmpty()) {
                    transitions.remove(state);
                }
            }
            return;
        }
        if (!alphabet.contains(symbol)) {
            throw new UndeclaredSymbolException(symbol);
        }
        Set<String> missing = new TreeSet<>(targets);
        missing.add(state);
        missing.removeAll(states);
        if (!missing.isEmpty()) {
            throw new InvalidStateReferenceException(missing);
        }
        transitions.computeIfAbsent(state, k -> new TreeMap<>()).put(symbol, new TreeSet<>(targets));
    }

    /**
     * Add a single target to the transition for a state and symbol.
     */
    public void addTransition(String state, String symbol, String target) {
        Set<String> targets = new TreeSet<>(getTransition(state, symbol));
        targets.add(target);
        setTransition(state, symbol, targets);
    }

    /**
     * @return targets for the state and symbol, empty if there is no transition
     */
    public Set<String> getTransition(String state, String symbol) {
        Map<String, Set<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        Set<String> targets = row.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    public boolean hasTransition(String state, String symbol) {
        Map<String, Set<String>> row = transitions.get(state);
        return row != null && row.containsKey(symbol);
    }

    /**
     * @return all transitions, ordered by state then symbol
     */
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>();
        for (Map.Entry<String, Map<String, Set<String>>> row : transitions.entrySet()) {
            for (Map.Entry<String, Set<String>> cell : row.getValue().entrySet()) {
                result.add(new Transition(row.getKey(), cell.getKey(),
                        Collections.unmodifiableSet(new TreeSet<>(cell.getValue()))));
            }
        }
        return result;
    }

    public boolean isDeterministic() {
        for (Map<String, Set<String>> row : transitions.values()) {
            for (Set<String> targets : row.values()) {
                if (targets.size() != 1) {
                    return false;
                }
            }
        }
        return true;
    }

    // ---------------------------------------------------------------- membership

    /**
     * Membership test where every character of the word is one symbol.
     */
    public boolean accept(String word) {
        List<String> symbols = new ArrayList<>(word.length());
        word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return accept(symbols);
    }

    /**
     * Non-deterministic simulation: track the set of active states, starting from the initial state.
     */
    public boolean accept(List<String> word) {
        if (initialState == null) {
            return false;
        }
        Set<String> current = new HashSet<>();
        current.add(initialState);
        for (String symbol : word) {
            Set<String> next = new HashSet<>();
            for (String state : current) {
                next.addAll(getTransition(state, symbol));
            }
            current = next;
            if (current.isEmpty()) {
                return false;
            }
        }
        for (String state : current) {
            if (finalStates.contains(state)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------- algorithms

    public void removeUnreachable() {
        Reachability.removeUnreachable(this);
    }

    public void removeDead() {
        Reachability.removeDead(this);
    }

    public void determinize() {
        SubsetConstruction.determinize(this);
    }

    public void minimize() {
        Minimizer.minimize(this);
    }

    public void mergeEquivalent() {
        Minimizer.mergeEquivalent(this);
    }

    /**
     * Make the transition relation total.
     * @return label of the freshly added sink state, or null if the relation was already total
     */
    public String complete() {
        return LanguageAlgebra.complete(this);
    }

    public void complement() {
        LanguageAlgebra.complement(this);
    }

    /**
     * Replace this automaton by one accepting the union of both languages. The argument is not modified.
     */
    public void union(Automaton other) {
        LanguageAlgebra.union(this, other);
    }

    /**
     * Replace this automaton by one accepting the intersection of both languages. The argument is not modified.
     */
    public void intersection(Automaton other) {
        LanguageAlgebra.intersection(this, other);
    }

    public boolean isEmpty() {
        return LanguageAlgebra.isEmpty(this);
    }

    public boolean isFinite() {
        return LanguageAlgebra.isFinite(this);
    }

    /**
     * @return true iff every word accepted by other is accepted by this automaton
     */
    public boolean contains(Automaton other) {
        return LanguageAlgebra.contains(this, other);
    }

    public boolean isEqual(Automaton other) {
        return LanguageAlgebra.isEqual(this, other);
    }

    public void relabelNumeric() {
        Canonicalizer.relabelNumeric(this, 0);
    }

    public void relabelNumeric(int beginAt) {
        Canonicalizer.relabelNumeric(this, beginAt);
    }

    public void relabelAlphabetic() {
        Canonicalizer.relabelAlphabetic(this);
    }

    // ---------------------------------------------------------------- package internals

    /**
     * Mutable view of the outgoing transitions of a state (symbol -> targets); null if it has none.
     */
    Map<String, Set<String>> outgoing(String state) {
        return transitions.get(state);
    }

    /**
     * Set a transition without validating the targets. Callers guarantee the targets are states.
     */
    void putTransition(String state, String symbol, Set<String> targets) {
        transitions.computeIfAbsent(state, k -> new TreeMap<>()).put(symbol, targets);
    }

    /**
     * @return a label starting with prefix that is not a state of this automaton
     */
    String freshLabel(String prefix) {
        if (!states.contains(prefix)) {
            return prefix;
        }
        int n = 0;
        while (states.contains(prefix + n)) {
            n++;
        }
        return prefix + n;
    }

    /**
     * Rename every state in one pass. The mapping must be injective and cover all states.
     */
    void rename(Map<String, String> mapping) {
        Map<String, Map<String, Set<String>>> renamed = new TreeMap<>();
        for (Map.Entry<String, Map<String, Set<String>>> row : transitions.entrySet()) {
            Map<String, Set<String>> newRow = new TreeMap<>();
            for (Map.Entry<String, Set<String>> cell : row.getValue().entrySet()) {
                Set<String> targets = new TreeSet<>();
                for (String t : cell.getValue()) {
                    targets.add(mapping.get(t));
                }
                newRow.put(cell.getKey(), targets);
            }
            renamed.put(mapping.get(row.getKey()), newRow);
        }
        Set<String> newFinals = new TreeSet<>();
        for (String f : finalStates) {
            newFinals.add(mapping.get(f));
        }
        Set<String> newStates = new TreeSet<>();
        for (String s : states) {
            newStates.add(mapping.get(s));
        }

        states.clear();
        states.addAll(newStates);
        finalStates.clear();
        finalStates.addAll(newFinals);
        transitions.clear();
        transitions.putAll(renamed);
        if (initialState != null) {
            initialState = mapping.get(initialState);
        }
    }

    /**
     * Take over the whole structure of another automaton, which must not be used afterwards.
     */
    void absorb(Automaton other) {
        states.addAll(other.states);
        finalStates.addAll(other.finalStates);
        alphabet.addAll(other.alphabet);
        transitions.putAll(other.transitions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton that = (Automaton) o;
        return states.equals(that.states) && alphabet.equals(that.alphabet)
                && transitions.equals(that.transitions) && finalStates.equals(that.finalStates)
                && Objects.equals(initialState, that.initialState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, finalStates, initialState);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + getStates() + ", alphabet=" + alphabet + ", transitions=" + getTransitions()
                + ", initial=" + initialState + ", finals=" + finalStates + "}";
    }
}
