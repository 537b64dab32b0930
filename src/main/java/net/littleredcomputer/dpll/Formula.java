package net.littleredcomputer.dpll;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A propositional formula in conjunctive normal form. Literals are nonzero integers: {@code v}
 * asserts variable v and {@code -v} denies it. A clause is the disjunction of its literals, and the
 * formula is the conjunction of its clauses. Instances are immutable; clause order and literal order
 * within each clause are preserved exactly as given.
 */
public final class Formula {
    private static final Joiner orJoiner = Joiner.on(" ∨ ");
    private static final Formula EMPTY = new Formula(ImmutableList.of());

    private final ImmutableList<ImmutableList<Integer>> clauses;

    private Formula(ImmutableList<ImmutableList<Integer>> clauses) {
        this.clauses = clauses;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Formula of(int[]... clauses) {
        Builder b = builder();
        for (int[] c : clauses) b.addClause(c);
        return b.build();
    }

    public static Formula of(Iterable<? extends Iterable<Integer>> clauses) {
        Builder b = builder();
        for (Iterable<Integer> c : clauses) b.addClause(c);
        return b.build();
    }

    /** Clauses produced by the analysis rules are already validated; they skip the builder. */
    static Formula fromValidatedClauses(List<ImmutableList<Integer>> clauses) {
        return clauses.isEmpty() ? EMPTY : new Formula(ImmutableList.copyOf(clauses));
    }

    public int nClauses() {
        return clauses.size();
    }

    public ImmutableList<Integer> clause(int i) {
        return clauses.get(i);
    }

    public ImmutableList<ImmutableList<Integer>> clauses() {
        return clauses;
    }

    /** @return true if there are no clauses at all, i.e., the formula is trivially satisfied. */
    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /** @return true if some clause has no literals left, i.e., the formula cannot be satisfied. */
    public boolean hasEmptyClause() {
        for (List<Integer> c : clauses) if (c.isEmpty()) return true;
        return false;
    }

    /**
     * Evaluate the formula under a set of literals taken to be true.
     * @param assignment the literals which are true; literals absent from the set are not assumed false
     * @return true iff each clause contains at least one literal of the assignment
     */
    public boolean evaluate(Set<Integer> assignment) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (assignment.contains(literal)) continue CLAUSE;
            }
            return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        return clauses.equals(((Formula) o).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        if (clauses.isEmpty()) return "true";
        return clauses.stream()
                .map(c -> c.isEmpty() ? "false" : "(" + orJoiner.join(c) + ")")
                .collect(Collectors.joining(" ∧ "));
    }

    public static final class Builder {
        private final ImmutableList.Builder<ImmutableList<Integer>> clauses = ImmutableList.builder();
        private int nClauses = 0;

        private Builder() {}

        public Builder addClause(int... literals) {
            if (literals == null) throw new InvalidFormulaException("null clause at index " + nClauses);
            return addClause(Ints.asList(literals));
        }

        public Builder addClause(Iterable<Integer> literals) {
            ImmutableList<Integer> clause = ImmutableList.copyOf(checkLiterals(literals));
            clauses.add(clause);
            ++nClauses;
            return this;
        }

        public Formula build() {
            return nClauses == 0 ? EMPTY : new Formula(clauses.build());
        }

        private Iterable<Integer> checkLiterals(Iterable<Integer> literals) {
            if (literals == null) throw new InvalidFormulaException("null clause at index " + nClauses);
            for (Integer l : literals) {
                if (l == null) throw new InvalidFormulaException("null literal in clause " + nClauses);
                if (l == 0) {
                    throw new InvalidFormulaException("literal 0 in clause " + nClauses + ": " + literals);
                }
                // Its negation would overflow back to itself.
                if (l == Integer.MIN_VALUE) {
                    throw new InvalidFormulaException("literal out of range in clause " + nClauses + ": " + l);
                }
            }
            return literals;
        }
    }
}
