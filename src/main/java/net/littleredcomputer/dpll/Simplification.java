package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableSet;

/**
 * The outcome of one {@link FormulaAnalysis#simplify} pass: the reduced formula and the literals that
 * pass committed to true.
 */
public final class Simplification {
    private final Formula formula;
    private final ImmutableSet<Integer> forced;

    Simplification(Formula formula, ImmutableSet<Integer> forced) {
        this.formula = formula;
        this.forced = forced;
    }

    public Formula formula() { return formula; }
    public ImmutableSet<Integer> forced() { return forced; }

    @Override
    public String toString() {
        return "forced " + forced + " leaving " + formula;
    }
}
