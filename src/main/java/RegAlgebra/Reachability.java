package RegAlgebra;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forward and backward pruning.
 */
public class Reachability {
    private Reachability() {
    }

    /**
     * Remove the states that the automaton can never be in.
     */
    public static void removeUnreachable(Automaton automaton) {
        final Set<String> reachable = reachableStates(automaton);
        removeAllExcept(automaton, reachable);
    }

    /**
     * Remove the states from which no final state can be reached. The initial state is kept regardless.
     */
    public static void removeDead(Automaton automaton) {
        final Set<String> alive = aliveStates(automaton);
        removeAllExcept(automaton, alive);
    }

    /**
     * Forward closure from the initial state over the whole alphabet.
     */
    public static Set<String> reachableStates(Automaton automaton) {
        final Set<String> reachable = new HashSet<>();
        final String init = automaton.getInitialState();
        if (init == null) {
            return reachable;
        }
        final Deque<String> stack = new ArrayDeque<>();
        reachable.add(init);
        stack.push(init);

        while (!stack.isEmpty()) {
            String state = stack.pop();
            for (String symbol : automaton.getAlphabet()) {
                for (String succ : automaton.getTransition(state, symbol)) {
                    if (reachable.add(succ)) {
                        stack.push(succ);
                    }
                }
            }
        }
        return reachable;
    }

    /**
     * Backward closure from the final states: a state is alive if it is final or has a transition,
     * on any symbol, into an alive state.
     */
    public static Set<String> aliveStates(Automaton automaton) {
        // reverse the transition relation, restricted to the alphabet
        final Map<String, Set<String>> predecessors = new HashMap<>();
        for (String state : automaton.getStates()) {
            Map<String, Set<String>> row = automaton.outgoing(state);
            if (row == null) {
                continue;
            }
            for (Map.Entry<String, Set<String>> cell : row.entrySet()) {
                if (!automaton.getAlphabet().contains(cell.getKey())) {
                    continue;
                }
                for (String target : cell.getValue()) {
                    predecessors.computeIfAbsent(target, k -> new HashSet<>()).add(state);
                }
            }
        }

        final Set<String> alive = new HashSet<>(automaton.getFinalStates());
        final Deque<String> stack = new ArrayDeque<>(alive);
        while (!stack.isEmpty()) {
            String state = stack.pop();
            for (String pred : predecessors.getOrDefault(state, Set.of())) {
                if (alive.add(pred)) {
                    stack.push(pred);
                }
            }
        }
        return alive;
    }

    private static void removeAllExcept(Automaton automaton, Set<String> keep) {
        final List<String> states = automaton.getStates();
        int removed = 0;
        for (String state : states) {
            if (!keep.contains(state) && !state.equals(automaton.getInitialState())) {
                automaton.removeState(state);
                removed++;
            }
        }
        if (RegAlgebraCommandLine.DEBUG && removed > 0) {
            System.out.println("DEBUG: Pruned " + removed + " of " + states.size() + " states");
        }
    }
}
