package RegAlgebra;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import RegAlgebra.Model.DeterminismRequiredException;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Minimization of deterministic automata by pairwise distinguishability (Myhill-Nerode).
 */
public class Minimizer {
    private static final int NO_TRANSITION = -1;

    private Minimizer() {
    }

    /**
     * Remove unreachable and dead states, then merge equivalent states.
     * @throws DeterminismRequiredException if the automaton is non-deterministic
     */
    public static void minimize(Automaton automaton) {
        if (!automaton.isDeterministic()) {
            throw new DeterminismRequiredException("minimize");
        }
        automaton.removeUnreachable();
        automaton.removeDead();
        mergeEquivalent(automaton);
    }

    /**
     * Merge every class of indistinguishable states into one state. The initial state always survives its class;
     * otherwise the least label does.
     * @throws DeterminismRequiredException if the automaton is non-deterministic
     */
    public static void mergeEquivalent(Automaton automaton) {
        if (!automaton.isDeterministic()) {
            throw new DeterminismRequiredException("mergeEquivalent");
        }
        final List<String> states = automaton.getStates(); // initial state at index 0
        final List<String> symbols = new ArrayList<>(automaton.getAlphabet());
        final int[][] succ = successorTable(automaton, states, symbols);

        final Set<IntIntPair> undistinguishable = initialPairs(automaton, states);
        refine(undistinguishable, succ, symbols.size());

        final Map<String, String> merged = representatives(states, undistinguishable);
        if (merged.isEmpty()) {
            return;
        }
        redirect(automaton, states, merged);
        for (String discarded : merged.keySet()) {
            automaton.removeState(discarded);
        }
        if (RegAlgebraCommandLine.DEBUG) {
            System.out.println("DEBUG: Merged " + merged.size() + " equivalent states");
        }
    }

    private static int[][] successorTable(Automaton automaton, List<String> states, List<String> symbols) {
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>(states.size());
        for (int i = 0; i < states.size(); i++) {
            index.put(states.get(i), i);
        }
        final int[][] succ = new int[states.size()][symbols.size()];
        for (int i = 0; i < states.size(); i++) {
            for (int k = 0; k < symbols.size(); k++) {
                Set<String> targets = automaton.getTransition(states.get(i), symbols.get(k));
                succ[i][k] = targets.isEmpty() ? NO_TRANSITION : index.getInt(targets.iterator().next());
            }
        }
        return succ;
    }

    /**
     * Finality alone distinguishes final from non-final states, so only pairs within each side are candidates.
     */
    private static Set<IntIntPair> initialPairs(Automaton automaton, List<String> states) {
        final Set<IntIntPair> pairs = new HashSet<>();
        for (int i = 0; i < states.size(); i++) {
            boolean iFinal = automaton.isFinal(states.get(i));
            for (int j = i + 1; j < states.size(); j++) {
                if (iFinal == automaton.isFinal(states.get(j))) {
                    pairs.add(pair(i, j));
                }
            }
        }
        return pairs;
    }

    /**
     * Drop pairs that move to a distinguishable pair on some symbol, until nothing changes.
     */
    private static void refine(Set<IntIntPair> undistinguishable, int[][] succ, int symbolCount) {
        boolean changed = true;
        while (changed) {
            changed = false;
            Iterator<IntIntPair> it = undistinguishable.iterator();
            while (it.hasNext()) {
                IntIntPair p = it.next();
                if (!stillUndistinguishable(p, undistinguishable, succ, symbolCount)) {
                    it.remove();
                    changed = true;
                }
            }
        }
    }

    private static boolean stillUndistinguishable(IntIntPair p, Set<IntIntPair> undistinguishable, int[][] succ,
                                                  int symbolCount) {
        for (int k = 0; k < symbolCount; k++) {
            int a = succ[p.leftInt()][k];
            int b = succ[p.rightInt()][k];
            if (a == b) {
                continue;
            }
            // a missing transition behaves as a distinct phantom state
            if (a == NO_TRANSITION || b == NO_TRANSITION || !undistinguishable.contains(pair(a, b))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return discarded state -> surviving state
     */
    private static Map<String, String> representatives(List<String> states, Set<IntIntPair> undistinguishable) {
        final Map<String, String> merged = new HashMap<>();
        final boolean[] assigned = new boolean[states.size()];
        for (int i = 0; i < states.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            assigned[i] = true;
            for (int j = i + 1; j < states.size(); j++) {
                if (!assigned[j] && undistinguishable.contains(pair(i, j))) {
                    assigned[j] = true;
                    merged.put(states.get(j), states.get(i));
                }
            }
        }
        return merged;
    }

    private static void redirect(Automaton automaton, List<String> states, Map<String, String> merged) {
        for (String state : states) {
            Map<String, Set<String>> row = automaton.outgoing(state);
            if (row == null) {
                continue;
            }
            for (Map.Entry<String, Set<String>> cell : row.entrySet()) {
                String target = cell.getValue().iterator().next();
                String survivor = merged.get(target);
                if (survivor != null) {
                    Set<String> redirected = new TreeSet<>();
                    redirected.add(survivor);
                    cell.setValue(redirected);
                }
            }
        }
    }

    private static IntIntPair pair(int a, int b) {
        return a < b ? new IntIntImmutablePair(a, b) : new IntIntImmutablePair(b, a);
    }
}
