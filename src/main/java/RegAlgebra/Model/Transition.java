package RegAlgebra.Model;

import java.util.Set;

/**
 * One entry of the transition relation: (state, symbol) -> targets.
 * @param state - source state
 * @param symbol - input symbol
 * @param targets - non-empty set of target states
 */
public record Transition(String state, String symbol, Set<String> targets) {
}
