package RegAlgebra.Model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A transition (or initial/final designation) names states the automaton does not have.
 */
public class InvalidStateReferenceException extends AutomatonException {
    private final Set<String> missingStates;

    public InvalidStateReferenceException(Set<String> missingStates) {
        super("State(s) " + String.join(", ", new TreeSet<>(missingStates)) + " do not exist");
        this.missingStates = Collections.unmodifiableSet(new TreeSet<>(missingStates));
    }

    public Set<String> getMissingStates() {
        return missingStates;
    }
}
