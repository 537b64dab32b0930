package net.littleredcomputer.dpll;

/**
 * Receives a callback as each search state is taken up, e.g. to drive a progress display.
 */
@FunctionalInterface
public interface SearchListener {
    /**
     * @param statistics counters including the state being entered
     * @param assigned number of literals in the state's partial assignment
     * @param clauses number of clauses remaining in the state's formula, before simplification
     */
    void onStep(SearchStatistics statistics, int assigned, int clauses);
}
