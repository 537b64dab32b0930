package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableSet;
import org.junit.Assert;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.CoreMatchers.is;

public class SATTestBase {
    int waerden(int j, int k, Function<Formula, AbstractSATSolver> solver) {
        // waerden(j, k; n) is satisfiable iff n < W(j, k). Compute W by finding the smallest
        // integer for which the associated formula is unsatisfiable.
        return IntStream.range(1, 1000)
                .filter(i -> !solver.apply(TestFormulas.waerden(j, k, i)).solve().isSatisfiable())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("did not establish Waerden value"));
    }

    void assertSAT(Formula f, Function<Formula, AbstractSATSolver> a) {
        SolveResult r = a.apply(f).solve();
        Assert.assertThat(r.isSatisfiable(), is(true));
        assertSolution(f, r.assignment());
    }

    void assertUNSAT(Formula f, Function<Formula, AbstractSATSolver> a) {
        SolveResult r = a.apply(f).solve();
        Assert.assertThat(r.isSatisfiable(), is(false));
        Assert.assertThat(r.assignment().isEmpty(), is(true));
    }

    /**
     * Check that the assignment satisfies f and decides each of its variables exactly once.
     */
    static void assertSolution(Formula f, ImmutableSet<Integer> assignment) {
        Assert.assertThat("satisfies " + f, f.evaluate(assignment), is(true));
        int[] vs = FormulaAnalysis.variables(f);
        Assert.assertThat(assignment.size(), is(vs.length));
        for (int v : vs) {
            Assert.assertThat("variable " + v + " decided once", assignment.contains(v) ^ assignment.contains(-v), is(true));
        }
    }

    /** @return true iff some assignment to the variables of f satisfies it, found by exhaustive enumeration */
    static boolean bruteForceSatisfiable(Formula f) {
        int[] vs = FormulaAnalysis.variables(f);
        if (vs.length > 20) throw new IllegalArgumentException("too many variables to enumerate: " + vs.length);
        for (long bits = 0; bits < 1L << vs.length; ++bits) {
            ImmutableSet.Builder<Integer> b = ImmutableSet.builder();
            for (int i = 0; i < vs.length; ++i) b.add((bits & (1L << i)) != 0 ? vs[i] : -vs[i]);
            if (f.evaluate(b.build())) return true;
        }
        return false;
    }

    public void testLangfordWith(Function<Formula, AbstractSATSolver> a) {
        Supplier<IntStream> range = () -> IntStream.range(2, 9);
        // The langford problem is solvable iff i mod 4 in {0, 3}. When it is solvable, we should expect the
        // number of true variables to be equal to the problem size (i.e., each digit receives exactly one
        // (dual) placement). When i mod 4 in {1, 2}, the solver should refute the problem instance.
        List<Optional<Integer>> expected = range.get().mapToObj(i -> i % 4 == 0 || i % 4 == 3 ? Optional.of(i) : Optional.<Integer>empty()).collect(toList());
        Stream<Optional<Integer>> observed = range.get().mapToObj(i -> a.apply(TestFormulas.langford(i)).solve()
                .model()
                .map(m -> {
                    // Every option appears in some clause, so the model covers them all.
                    Assert.assertThat(m.length, is(TestFormulas.langfordOptions(i)));
                    int trues = 0;
                    for (boolean b : m) if (b) ++trues;
                    return trues;
                }));
        Assert.assertThat(observed.collect(toList()), is(expected));
    }
}
