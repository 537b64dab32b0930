package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableSet;

import java.util.Optional;

/**
 * Outcome of a satisfiability search. When the formula is satisfiable, the assignment holds exactly one
 * literal for each variable of the formula.
 */
public final class SolveResult {
    private final boolean satisfiable;
    private final ImmutableSet<Integer> assignment;
    private final SearchStatistics statistics;

    private SolveResult(boolean satisfiable, ImmutableSet<Integer> assignment, SearchStatistics statistics) {
        this.satisfiable = satisfiable;
        this.assignment = assignment;
        this.statistics = statistics;
    }

    static SolveResult satisfiable(ImmutableSet<Integer> assignment, SearchStatistics statistics) {
        return new SolveResult(true, assignment, statistics);
    }

    static SolveResult unsatisfiable(SearchStatistics statistics) {
        return new SolveResult(false, ImmutableSet.of(), statistics);
    }

    public boolean isSatisfiable() { return satisfiable; }

    /** @return the literals set true by the solution; empty if there is no solution */
    public ImmutableSet<Integer> assignment() { return assignment; }

    public SearchStatistics statistics() { return statistics; }

    /**
     * @return the solution as a vector of truth values, where element i gives the value of variable i+1.
     * The vector is as long as the largest variable in the assignment. Empty if unsatisfiable.
     */
    public Optional<boolean[]> model() {
        if (!satisfiable) return Optional.empty();
        int n = 0;
        for (int l : assignment) n = Math.max(n, Math.abs(l));
        boolean[] m = new boolean[n];
        for (int l : assignment) if (l > 0) m[l - 1] = true;
        return Optional.of(m);
    }

    @Override
    public String toString() {
        return (satisfiable ? "SATISFIABLE " + assignment : "UNSATISFIABLE") + " (" + statistics + ")";
    }
}
