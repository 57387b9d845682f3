package io.numstab.standalone.app;

import io.numstab.core.spi.StabilizerListener;

/** Counts what happened during one run. Single-threaded. */
final class RunSummary implements StabilizerListener {

    private int expressions;
    private int cacheHits;
    private int solverRuns;
    private int failures;

    void expressionSeen() {
        expressions++;
    }

    /** An input line that never reached the pipeline because it did not parse. */
    void inputRejected() {
        failures++;
    }

    @Override
    public void onCacheHit(CacheEvent event) {
        cacheHits++;
    }

    @Override
    public void onSolverCompleted(SolverCompletedEvent event) {
        solverRuns++;
    }

    @Override
    public void onFailure(FailureEvent event) {
        failures++;
    }

    int expressions() {
        return expressions;
    }

    int cacheHits() {
        return cacheHits;
    }

    int solverRuns() {
        return solverRuns;
    }

    int failures() {
        return failures;
    }
}
