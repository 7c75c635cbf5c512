package RegAlgebra.Model;

public class StateBudgetExceededException extends AutomatonException {
    private final int budget;
    private final int states;

    public StateBudgetExceededException(int budget, int states) {
        super("Too many states: " + states + " exceeds the budget of " + budget);
        this.budget = budget;
        this.states = states;
    }

    public int getBudget() {
        return budget;
    }

    public int getStates() {
        return states;
    }
}
