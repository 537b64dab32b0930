package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.util.stream.Collectors.toList;

/**
 * The simplification rules of the Davis-Putnam-Logemann-Loveland procedure. Every method is a pure
 * function of its arguments: formulas are immutable, and each rule that changes a formula returns a new
 * one. Sets of literals are returned in the order in which the literals first occur in the formula.
 */
public final class FormulaAnalysis {
    private FormulaAnalysis() {}

    /** @return every literal that appears in some clause of f */
    public static ImmutableSet<Integer> literals(Formula f) {
        ImmutableSet.Builder<Integer> b = ImmutableSet.builder();
        for (List<Integer> clause : f.clauses()) b.addAll(clause);
        return b.build();
    }

    /**
     * @return the variables of f (absolute values of its literals), distinct and in ascending order
     */
    public static int[] variables(Formula f) {
        TIntSet vs = new TIntHashSet();
        for (int l : literals(f)) vs.add(Math.abs(l));
        int[] a = vs.toArray();
        Arrays.sort(a);
        return a;
    }

    /**
     * A literal is pure if its negation appears nowhere in the formula. Such a literal may be set true
     * without loss of generality, since no clause depends on it being false.
     */
    public static ImmutableSet<Integer> pureLiterals(Formula f) {
        ImmutableSet<Integer> ls = literals(f);
        return ls.stream().filter(l -> !ls.contains(-l)).collect(ImmutableSet.toImmutableSet());
    }

    /**
     * @return the literal of each clause of length one. A literal and its negation may both be present;
     * that contradiction is not detected here.
     */
    public static ImmutableSet<Integer> unitClauses(Formula f) {
        return f.clauses().stream()
                .filter(c -> c.size() == 1)
                .map(c -> c.get(0))
                .collect(ImmutableSet.toImmutableSet());
    }

    /** Drop every clause containing l: setting l true satisfies them. */
    public static Formula removeClausesWithLiteral(Formula f, int l) {
        checkLiteral(l);
        return Formula.fromValidatedClauses(f.clauses().stream().filter(c -> !c.contains(l)).collect(toList()));
    }

    /** Delete l from each clause containing it. The clauses themselves remain, possibly empty. */
    public static Formula shortenClausesWithLiteral(Formula f, int l) {
        checkLiteral(l);
        List<ImmutableList<Integer>> shortened = new ArrayList<>(f.nClauses());
        for (ImmutableList<Integer> c : f.clauses()) {
            if (!c.contains(l)) {
                shortened.add(c);
                continue;
            }
            shortened.add(c.stream().filter(k -> k != l).collect(ImmutableList.toImmutableList()));
        }
        return Formula.fromValidatedClauses(shortened);
    }

    /**
     * Commit literal l to true: clauses containing l are satisfied and vanish, and -l is struck from
     * the clauses that remain.
     */
    public static Formula removeLiteral(Formula f, int l) {
        return shortenClausesWithLiteral(removeClausesWithLiteral(f, l), -l);
    }

    /**
     * Perform one round of unit propagation and pure literal elimination. The literals of the unit
     * clauses, followed by the pure literals, are each removed from f in turn. This is a single pass; the
     * resulting formula may well contain fresh unit clauses or pure literals.
     * @param f formula to simplify
     * @return the reduced formula together with the literals which were forced. When nothing is forced,
     * the formula returned is f itself.
     */
    public static Simplification simplify(Formula f) {
        ImmutableSet<Integer> forced = ImmutableSet.<Integer>builder()
                .addAll(unitClauses(f))
                .addAll(pureLiterals(f))
                .build();
        Formula g = f;
        for (int l : forced) g = removeLiteral(g, l);
        return new Simplification(g, forced);
    }

    private static void checkLiteral(int l) {
        if (l == 0 || l == Integer.MIN_VALUE) throw new IllegalArgumentException(l + " is not a literal");
    }
}
