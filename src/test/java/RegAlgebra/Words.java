package RegAlgebra;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class Words {
    // Only for tests: every word over the alphabet of length <= maxLength, shortest first
    public static List<List<String>> upTo(Collection<String> alphabet, int maxLength) {
        List<List<String>> result = new ArrayList<>();
        List<List<String>> layer = new ArrayList<>();
        layer.add(List.of());
        result.addAll(layer);
        for (int len = 1; len <= maxLength; len++) {
            List<List<String>> next = new ArrayList<>();
            for (List<String> prefix : layer) {
                for (String symbol : alphabet) {
                    List<String> word = new ArrayList<>(prefix);
                    word.add(symbol);
                    next.add(word);
                }
            }
            result.addAll(next);
            layer = next;
        }
        return result;
    }
}
