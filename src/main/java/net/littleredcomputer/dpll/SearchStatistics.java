package net.littleredcomputer.dpll;

/**
 * Counters describing the work done by a search. They are advisory: nothing in the search depends on
 * them.
 */
public final class SearchStatistics {
    private final long recursions;
    private final long conflicts;
    private final int maxDepth;

    SearchStatistics(long recursions, long conflicts, int maxDepth) {
        this.recursions = recursions;
        this.conflicts = conflicts;
        this.maxDepth = maxDepth;
    }

    /** @return number of search states processed; each corresponds to one call of the recursive procedure */
    public long recursions() { return recursions; }

    /** @return number of states abandoned because an empty clause appeared */
    public long conflicts() { return conflicts; }

    /** @return greatest number of branching decisions on any path explored so far */
    public int maxDepth() { return maxDepth; }

    @Override
    public String toString() {
        return String.format("%d recursions, %d conflicts, max depth %d", recursions, conflicts, maxDepth);
    }
}
