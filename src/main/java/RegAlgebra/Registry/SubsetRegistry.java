package RegAlgebra.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;

/**
 * Maps each discovered subset of states (as a BitSet over state indices) to the label minted for it.
 * Labels are kept in an arena indexed by registration order.
 */
public class SubsetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<BitSet> key2Address;
    private final ObjectList<String> labels;

    public SubsetRegistry() {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.labels = new ObjectArrayList<>();
    }

    /**
     * @param subset - subset of state indices
     * @return address of the subset or MISSING_ELEMENT if it was never registered
     */
    public int get(BitSet subset) {
        return key2Address.getInt(subset);
    }

    /**
     * @param subset - subset of state indices
     * @return label of the subset, or null if it was never registered
     */
    public String getLabel(BitSet subset) {
        int address = get(subset);
        return address == MISSING_ELEMENT ? null : labels.get(address);
    }

    /**
     * Register a new subset. The subset must not be mutated afterwards.
     * @return address of the subset
     */
    public int put(BitSet subset, String label) {
        int address = labels.size();
        key2Address.put(subset, address);
        labels.add(label);
        return address;
    }

    public String labelAt(int address) {
        return labels.get(address);
    }

    public int size() {
        return labels.size();
    }

    @Override
    public String toString() {
        return "SubsetRegistry{" + size() + " subsets}";
    }
}
