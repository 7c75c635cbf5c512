package RegAlgebra;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import RegAlgebra.Registry.SubsetRegistry;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * In-place subset construction.
 * <p>
 * Every subset of two or more original states reached non-deterministically becomes a composite state with a
 * freshly minted label; singleton subsets are the original state itself. Original transitions are rewritten to
 * the state representing their former target set, and unreachable states are pruned afterwards.
 */
public class SubsetConstruction {
    static final String COMPOSITE_PREFIX = "P";

    private final Automaton automaton;
    private final List<String> arena;
    private final Object2IntMap<String> stateIndex;
    private final SubsetRegistry registry;
    private final Deque<DeterminizeRecord> stack;
    private int nextLabel;

    private SubsetConstruction(Automaton automaton) {
        this.automaton = automaton;
        this.arena = automaton.getStates();
        this.stateIndex = new Object2IntOpenHashMap<>(arena.size());
        for (int i = 0; i < arena.size(); i++) {
            stateIndex.put(arena.get(i), i);
        }
        this.registry = new SubsetRegistry();
        this.stack = new ArrayDeque<>();
    }

    public static void determinize(Automaton automaton) {
        if (automaton.getInitialState() == null || automaton.isDeterministic()) {
            automaton.removeUnreachable();
            return;
        }
        new SubsetConstruction(automaton).run();
        automaton.removeUnreachable();
    }

    private void run() {
        // register the target set of every original entry before anything is rewritten
        final List<Rewrite> rewrites = new ArrayList<>();
        for (String state : arena) {
            Map<String, Set<String>> row = automaton.outgoing(state);
            if (row == null) {
                continue;
            }
            for (Map.Entry<String, Set<String>> cell : row.entrySet()) {
                if (cell.getValue().size() > 1) {
                    rewrites.add(new Rewrite(state, cell.getKey(), resolve(toBitSet(cell.getValue()))));
                }
            }
        }

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();
            for (String sym : automaton.getAlphabet()) {
                BitSet succ = successor(curr.subset(), sym);
                if (!succ.isEmpty()) {
                    automaton.putTransition(curr.label(), sym, singleton(resolve(succ)));
                }
            }
        }

        for (Rewrite rewrite : rewrites) {
            automaton.putTransition(rewrite.state(), rewrite.symbol(), singleton(rewrite.target()));
        }

        if (RegAlgebraCommandLine.DEBUG) {
            System.out.println("DEBUG: Subset construction added " + registry.size() + " composite states");
        }
    }

    /**
     * Union of the original targets of every member on the given symbol.
     */
    private BitSet successor(BitSet subset, String symbol) {
        BitSet succ = new BitSet(arena.size());
        for (int m = subset.nextSetBit(0); m >= 0; m = subset.nextSetBit(m + 1)) {
            for (String target : automaton.getTransition(arena.get(m), symbol)) {
                succ.set(stateIndex.getInt(target));
            }
        }
        return succ;
    }

    /**
     * @return the state standing for the subset, registering a new composite state if needed
     */
    private String resolve(BitSet subset) {
        if (subset.cardinality() == 1) {
            return arena.get(subset.nextSetBit(0));
        }
        String label = registry.getLabel(subset);
        if (label != null) {
            return label;
        }

        label = mintLabel();
        automaton.addState(label);
        automaton.setFinal(label, anyFinal(subset));
        registry.put(subset, label);
        stack.push(new DeterminizeRecord(subset, label));
        return label;
    }

    private String mintLabel() {
        String label;
        do {
            label = COMPOSITE_PREFIX + nextLabel++;
        } while (automaton.hasState(label));
        return label;
    }

    private boolean anyFinal(BitSet subset) {
        for (int m = subset.nextSetBit(0); m >= 0; m = subset.nextSetBit(m + 1)) {
            if (automaton.isFinal(arena.get(m))) {
                return true;
            }
        }
        return false;
    }

    private BitSet toBitSet(Set<String> states) {
        BitSet bits = new BitSet(arena.size());
        for (String s : states) {
            bits.set(stateIndex.getInt(s));
        }
        return bits;
    }

    private static Set<String> singleton(String state) {
        Set<String> set = new TreeSet<>();
        set.add(state);
        return set;
    }

    private record DeterminizeRecord(BitSet subset, String label) { }

    private record Rewrite(String state, String symbol, String target) { }
}
