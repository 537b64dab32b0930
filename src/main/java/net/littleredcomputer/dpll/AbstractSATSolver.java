package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Machinery shared by satisfiability solvers: step counting, periodic progress reports, an optional
 * listener and an optional abort condition. A solver instance performs a single search.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    static final int logCheckSteps = 1000;
    protected final Formula formula;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private boolean started = false;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private SearchListener listener = (s, a, c) -> {};
    private Predicate<SearchStatistics> abortCondition = s -> false;

    AbstractSATSolver(String name, Formula formula) {
        this.name = name;
        this.formula = formula;
    }

    public AbstractSATSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public AbstractSATSolver setListener(SearchListener listener) {
        this.listener = listener;
        return this;
    }

    /**
     * @param abortCondition consulted before each search step; when it returns true, the search is
     *                       abandoned with a {@link SearchAbortedException}
     */
    public AbstractSATSolver setAbortCondition(Predicate<SearchStatistics> abortCondition) {
        this.abortCondition = abortCondition;
        return this;
    }

    String name() { return name; }

    void start() {
        if (started) throw new IllegalStateException(name + " solver has already been run");
        started = true;
        stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
        log.debug("%s: solving %d clauses", name, formula.nClauses());
    }

    /**
     * Account for one search step: notify the listener, honor the abort condition and report progress
     * if it is time to do so.
     */
    void step(SearchStatistics statistics, int assigned, int clauses) {
        ++stepCount;
        listener.onStep(statistics, assigned, clauses);
        if (abortCondition.test(statistics)) {
            stopwatch.stop();
            log.warn("%s: aborted after %s in %s", name, statistics, stopwatch);
            throw new SearchAbortedException(name, statistics);
        }
        if (stepCount % logCheckSteps == 0) {
            maybeReportProgress(() -> String.format("%s; %d assigned, %d clauses", statistics, assigned, clauses));
        }
    }

    SolveResult finish(SolveResult result) {
        stopwatch.stop();
        log.debug("%s: %s after %s in %s", name, result.isSatisfiable() ? "satisfiable" : "unsatisfiable",
                result.statistics(), stopwatch);
        return result;
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    public abstract SolveResult solve();
}
