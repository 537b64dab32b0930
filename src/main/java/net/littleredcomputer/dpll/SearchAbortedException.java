package net.littleredcomputer.dpll;

/**
 * Thrown by {@link AbstractSATSolver#solve()} when the solver's abort condition fires. The search
 * was cut short, so nothing is known about the satisfiability of the formula.
 */
public class SearchAbortedException extends RuntimeException {
    private final SearchStatistics statistics;

    SearchAbortedException(String solverName, SearchStatistics statistics) {
        super(solverName + " aborted after " + statistics);
        this.statistics = statistics;
    }

    /** @return the counters as they stood when the abort condition fired */
    public SearchStatistics statistics() {
        return statistics;
    }
}
