package RegAlgebra;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Boolean operations and decision procedures over regular languages.
 * <p>
 * Binary operations mutate the receiver and work on a private copy of their operand. Decision procedures never
 * mutate anything.
 */
public class LanguageAlgebra {
    static final String SINK_PREFIX = "qdead";

    private LanguageAlgebra() {
    }

    /**
     * Make the transition relation total by routing every undefined (state, symbol) pair to a fresh sink.
     * An automaton without states gets the sink as its initial state.
     * @return label of the sink, or null if the relation was already total
     */
    public static String complete(Automaton automaton) {
        if (automaton.getInitialState() != null && isComplete(automaton)) {
            return null;
        }
        final String sink = automaton.freshLabel(SINK_PREFIX);
        automaton.addState(sink);
        for (String state : automaton.getStates()) {
            for (String symbol : automaton.getAlphabet()) {
                if (!automaton.hasTransition(state, symbol)) {
                    automaton.setTransition(state, symbol, Set.of(sink));
                }
            }
        }
        return sink;
    }

    public static boolean isComplete(Automaton automaton) {
        for (String state : automaton.getStates()) {
            for (String symbol : automaton.getAlphabet()) {
                if (!automaton.hasTransition(state, symbol)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Determinize, complete, then swap final and non-final states.
     */
    public static void complement(Automaton automaton) {
        automaton.determinize();
        complete(automaton);
        for (String state : automaton.getStates()) {
            automaton.toggleFinalState(state);
        }
    }

    /**
     * Union without epsilon transitions: both operands are completed and relabeled into disjoint namespaces, and a
     * new initial state takes over the transitions of both former initial states. The result may be
     * non-deterministic at the new initial state.
     * @param automaton - receiver, replaced by the union
     * @param operand - other automaton, left untouched
     */
    public static void union(Automaton automaton, Automaton operand) {
        final Automaton other = operand.copy();
        mergeAlphabets(automaton, other);

        complete(automaton);
        automaton.relabelNumeric(0);
        complete(other);
        other.relabelNumeric(automaton.size());

        final String init = automaton.getInitialState();
        final String otherInit = other.getInitialState();
        final String newInit = Canonicalizer.NUMERIC_PREFIX + (automaton.size() + other.size());

        automaton.absorb(other);
        automaton.addState(newInit);
        automaton.setFinal(newInit, automaton.isFinal(init) || automaton.isFinal(otherInit));

        for (String symbol : automaton.getAlphabet()) {
            Set<String> targets = new TreeSet<>(automaton.getTransition(init, symbol));
            targets.addAll(automaton.getTransition(otherInit, symbol));
            automaton.setTransition(newInit, symbol, targets);
        }
        automaton.setInitialState(newInit);
    }

    /**
     * Intersection by De Morgan's law: complement(complement(A) union complement(B)).
     * @param automaton - receiver, replaced by the intersection
     * @param operand - other automaton, left untouched
     */
    public static void intersection(Automaton automaton, Automaton operand) {
        final Automaton other = operand.copy();
        mergeAlphabets(automaton, other);
        other.complement();
        automaton.complement();
        union(automaton, other);
        automaton.complement();
    }

    /**
     * The language is empty iff no final state is reachable from the initial state.
     */
    public static boolean isEmpty(Automaton automaton) {
        for (String state : Reachability.reachableStates(automaton)) {
            if (automaton.isFinal(state)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The language is infinite iff a cycle of alive states is reachable from the initial state.
     */
    public static boolean isFinite(Automaton automaton) {
        final String init = automaton.getInitialState();
        final Set<String> alive = Reachability.aliveStates(automaton);
        if (init == null || !alive.contains(init)) {
            return true;
        }
        return !hasCycle(automaton, init, alive);
    }

    /**
     * Depth-first search for a state revisited while still on the current search path.
     */
    private static boolean hasCycle(Automaton automaton, String init, Set<String> alive) {
        final Set<String> onPath = new HashSet<>();
        final Set<String> finished = new HashSet<>();
        final Deque<SearchFrame> stack = new ArrayDeque<>();
        stack.push(new SearchFrame(init, successors(automaton, init, alive).iterator()));
        onPath.add(init);

        while (!stack.isEmpty()) {
            SearchFrame frame = stack.peek();
            if (!frame.successors().hasNext()) {
                stack.pop();
                onPath.remove(frame.state());
                finished.add(frame.state());
                continue;
            }
            String next = frame.successors().next();
            if (onPath.contains(next)) {
                return true;
            }
            if (!finished.contains(next)) {
                onPath.add(next);
                stack.push(new SearchFrame(next, successors(automaton, next, alive).iterator()));
            }
        }
        return false;
    }

    private static Set<String> successors(Automaton automaton, String state, Set<String> alive) {
        final Set<String> result = new TreeSet<>();
        final Map<String, Set<String>> row = automaton.outgoing(state);
        if (row == null) {
            return result;
        }
        for (Map.Entry<String, Set<String>> cell : row.entrySet()) {
            if (automaton.getAlphabet().contains(cell.getKey())) {
                for (String target : cell.getValue()) {
                    if (alive.contains(target)) {
                        result.add(target);
                    }
                }
            }
        }
        return result;
    }

    /**
     * @return true iff L(contained) is a subset of L(container), i.e. L(contained) minus L(container) is empty
     */
    public static boolean contains(Automaton container, Automaton contained) {
        final Automaton complement = container.copy();
        for (String symbol : contained.getAlphabet()) {
            complement.addSymbol(symbol);
        }
        complement.complement();

        final Automaton difference = contained.copy();
        difference.intersection(complement);
        return difference.isEmpty();
    }

    public static boolean isEqual(Automaton a, Automaton b) {
        return contains(a, b) && contains(b, a);
    }

    private static void mergeAlphabets(Automaton a, Automaton b) {
        for (String symbol : b.getAlphabet()) {
            a.addSymbol(symbol);
        }
        for (String symbol : a.getAlphabet()) {
            b.addSymbol(symbol);
        }
    }

    private record SearchFrame(String state, Iterator<String> successors) { }
}
