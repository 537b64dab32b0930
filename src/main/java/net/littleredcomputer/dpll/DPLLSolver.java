package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableSet;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * The Davis-Putnam-Logemann-Loveland procedure. Each search state is simplified by one round of unit
 * propagation and pure literal elimination. A state whose formula has no clauses left is a solution; one
 * with an empty clause is a dead end. Otherwise, a variable not yet assigned is chosen at random and the
 * search continues first with that variable false, then (if that fails) with it true.
 * <p>
 * The depth-first search is driven by an explicit stack of states rather than by recursion, so the
 * number of variables is not limited by the size of the call stack. States hold immutable formulas and
 * assignments, so no state can see changes made on behalf of another.
 */
public class DPLLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(DPLLSolver.class);

    private final int[] variables;
    private final SGBRandom random;

    private static final class State {
        final Formula formula;
        final ImmutableSet<Integer> assignment;
        final int depth;  // number of branching decisions leading here

        State(Formula formula, ImmutableSet<Integer> assignment, int depth) {
            this.formula = formula;
            this.assignment = assignment;
            this.depth = depth;
        }
    }

    public DPLLSolver(Formula formula) {
        this(formula, 0);
    }

    /**
     * @param formula the formula to decide
     * @param seed seeds the choice of branching variables. Searches of the same formula with the same
     *             seed visit the same states and find the same solution.
     */
    public DPLLSolver(Formula formula, int seed) {
        super("DPLL", formula);
        this.variables = FormulaAnalysis.variables(formula);
        this.random = new SGBRandom(seed);
    }

    /** @return the number of distinct variables in the formula */
    public int nVariables() {
        return variables.length;
    }

    @Override
    public SolveResult solve() {
        start();
        long recursions = 0;
        long conflicts = 0;
        int maxDepth = 0;
        Deque<State> stack = new ArrayDeque<>();
        stack.push(new State(formula, ImmutableSet.of(), 0));
        while (!stack.isEmpty()) {
            State s = stack.pop();
            ++recursions;
            if (s.depth > maxDepth) maxDepth = s.depth;
            step(new SearchStatistics(recursions, conflicts, maxDepth), s.assignment.size(), s.formula.nClauses());

            Simplification simplified = FormulaAnalysis.simplify(s.formula);
            Formula f = simplified.formula();
            ImmutableSet<Integer> assignment = union(s.assignment, simplified.forced());
            if (f.isEmpty()) {
                log.trace("%s: satisfied at depth %d by %s", name(), s.depth, assignment);
                return finish(SolveResult.satisfiable(complete(assignment),
                        new SearchStatistics(recursions, conflicts, maxDepth)));
            }
            if (f.hasEmptyClause()) {
                ++conflicts;
                log.trace("%s: conflict at depth %d", name(), s.depth);
                continue;
            }
            int x = random.choose(unassigned(assignment));
            log.trace("%s: depth %d branching on %d, %d clauses", name(), s.depth, x, f.nClauses());
            // Pushed in reverse, so that x = false is explored first.
            stack.push(new State(FormulaAnalysis.removeLiteral(f, x), union(assignment, ImmutableSet.of(x)), s.depth + 1));
            stack.push(new State(FormulaAnalysis.removeLiteral(f, -x), union(assignment, ImmutableSet.of(-x)), s.depth + 1));
        }
        return finish(SolveResult.unsatisfiable(new SearchStatistics(recursions, conflicts, maxDepth)));
    }

    private static ImmutableSet<Integer> union(ImmutableSet<Integer> a, Set<Integer> b) {
        if (b.isEmpty()) return a;
        return ImmutableSet.<Integer>builderWithExpectedSize(a.size() + b.size()).addAll(a).addAll(b).build();
    }

    /** @return the variables having neither polarity in the assignment, in ascending order */
    private TIntList unassigned(Set<Integer> assignment) {
        TIntList vs = new TIntArrayList();
        for (int v : variables) {
            if (!assignment.contains(v) && !assignment.contains(-v)) vs.add(v);
        }
        if (vs.isEmpty()) {
            throw new IllegalStateException("no variable left to branch on, yet the formula is undecided");
        }
        return vs;
    }

    /**
     * Extend a satisfying partial assignment to one literal per variable. Variables the search never
     * needed to decide are set false.
     */
    private ImmutableSet<Integer> complete(Set<Integer> assignment) {
        ImmutableSet.Builder<Integer> b = ImmutableSet.builderWithExpectedSize(variables.length);
        for (int v : variables) b.add(assignment.contains(v) ? v : -v);
        return b.build();
    }
}
