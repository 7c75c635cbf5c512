package RegAlgebra.Model;

public class DeterminismRequiredException extends AutomatonException {
    public DeterminismRequiredException(String operation) {
        super("Automaton is non-deterministic; " + operation + " requires a deterministic automaton");
    }
}
