package io.numstab.core.engine;

import io.numstab.core.error.ExprParseException;
import io.numstab.core.error.FailureKind;
import io.numstab.core.model.CanonicalForm;
import io.numstab.core.model.DbgInfo;
import io.numstab.core.model.MathExpr;
import io.numstab.core.model.SolverOutcome;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.Solver;
import io.numstab.core.spi.StabilizerListener;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Stabilization pipeline: canonicalize, consult the cache, run the solver on a
 * miss, record provenance, translate the verdict back into the host's
 * variables.
 *
 * <p>
 * No exception escapes {@link #stabilize}. Solver failures arrive as fallback
 * outcomes, store failures are absorbed by {@link ResultCache}, and a verdict
 * that cannot be translated back turns into a pass-through result
 * ({@code cmdout == cmdin}, unknown error).
 *
 * <p>
 * Fallback outcomes are not cached, so a solver outage is retried on the next
 * call.
 */
public final class Stabilizer {

    private static final Logger LOG = LoggerFactory.getLogger(Stabilizer.class);

    /** MDC key for the host module of the expression being stabilized. */
    static final String MDC_MODULE = "module";
    /** MDC key for the host function of the expression being stabilized. */
    static final String MDC_FUNCTION = "function";

    private final CanonicalTranslator translator;
    private final Solver solver;
    private final ResultCache cache;
    private final StabilizerListener listener;

    public Stabilizer(CanonicalTranslator translator, Solver solver, ResultCache cache) {
        this(translator, solver, cache, null);
    }

    /**
     * @param listener observability hooks, or {@code null} for none
     */
    public Stabilizer(
            CanonicalTranslator translator, Solver solver, ResultCache cache, StabilizerListener listener) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.solver = Objects.requireNonNull(solver, "solver must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.listener = listener;
    }

    /**
     * Returns a numerically more stable equivalent of {@code expr}, or
     * {@code expr} itself with {@code NaN} error estimates when no usable
     * answer can be had.
     *
     * @param expr    the host expression
     * @param dbgInfo where in the host program {@code expr} came from
     * @return {@code cmdin} is {@code expr}; {@code cmdout} uses the same
     *         variable names
     */
    public StabilizerResult<MathExpr> stabilize(MathExpr expr, DbgInfo dbgInfo) {
        Objects.requireNonNull(expr, "expr must not be null");
        DbgInfo provenance = dbgInfo != null ? dbgInfo : new DbgInfo(null, null, null, null);
        putMdc(provenance);
        try {
            return stabilizeInternal(expr, provenance);
        } catch (RuntimeException e) {
            LOG.error("Stabilization failed unexpectedly, passing expression through: {}", e.toString(), e);
            return StabilizerResult.fallback(expr);
        } catch (StackOverflowError e) {
            // translation and S-expression reading recurse once per tree level
            LOG.error("Expression nested too deeply to stabilize, passing expression through");
            return StabilizerResult.fallback(expr);
        } finally {
            clearMdc();
        }
    }

    private StabilizerResult<MathExpr> stabilizeInternal(MathExpr expr, DbgInfo dbgInfo) {
        CanonicalForm form = translator.toCanonical(expr);
        String text = form.text();

        StabilizerResult<String> verdict;
        Optional<StabilizerResult<String>> cached = cache.lookup(text);
        if (cached.isPresent()) {
            LOG.debug("Cache hit: cmdin={}", text);
            fire(l -> l.onCacheHit(new StabilizerListener.CacheEvent(text)));
            verdict = cached.get();
        } else {
            LOG.info("Cache miss, running solver: cmdin={}", text);
            fire(l -> l.onCacheMiss(new StabilizerListener.CacheEvent(text)));
            verdict = solve(form);
        }

        cache.recordDebugInfo(dbgInfo, text);

        try {
            MathExpr rewritten = translator.fromCanonical(verdict.cmdout(), form.varMap());
            LOG.info(
                    "Stabilized: cmdin={}, cmdout={}, errin={}, errout={}",
                    text,
                    verdict.cmdout(),
                    verdict.errin(),
                    verdict.errout());
            return verdict.withExprs(expr, rewritten);
        } catch (ExprParseException e) {
            LOG.warn("Cannot translate solver output back, passing expression through: {}", e.getMessage());
            fire(l -> l.onFailure(new StabilizerListener.FailureEvent(text, e.kind(), e.getMessage())));
            return StabilizerResult.fallback(expr);
        }
    }

    private StabilizerResult<String> solve(CanonicalForm form) {
        String text = form.text();
        long start = System.nanoTime();
        SolverOutcome outcome = solver.invoke(text, form.varMap().placeholders());
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        StabilizerResult<String> result = outcome.result();

        fire(l -> l.onSolverCompleted(new StabilizerListener.SolverCompletedEvent(
                text, durationMs, result.errin(), result.errout(), outcome.isFallback())));

        if (outcome.isFallback()) {
            FailureKind kind = outcome.failure();
            switch (kind) {
                case SOLVER_PROTOCOL_FAILURE -> LOG.warn(
                        "Solver gave no usable answer after {} ms, result not cached: cmdin={}, detail={}",
                        durationMs,
                        text,
                        outcome.detail());
                case PARSE_FAILURE, STORE_UNAVAILABLE -> LOG.warn(
                        "Solver failed ({}) after {} ms, result not cached: cmdin={}, detail={}",
                        kind,
                        durationMs,
                        text,
                        outcome.detail());
            }
            fire(l -> l.onFailure(new StabilizerListener.FailureEvent(text, kind, outcome.detail())));
            return result;
        }

        LOG.info("Solver finished in {} ms: cmdin={}", durationMs, text);
        cache.insert(result);
        return result;
    }

    private void fire(Consumer<StabilizerListener> event) {
        if (listener == null) return;
        try {
            event.accept(listener);
        } catch (Exception e) {
            LOG.warn("StabilizerListener callback failed", e);
        }
    }

    private static void putMdc(DbgInfo dbgInfo) {
        if (dbgInfo.moduleName() != null) {
            MDC.put(MDC_MODULE, dbgInfo.moduleName());
        }
        if (dbgInfo.functionName() != null) {
            MDC.put(MDC_FUNCTION, dbgInfo.functionName());
        }
    }

    private static void clearMdc() {
        MDC.remove(MDC_MODULE);
        MDC.remove(MDC_FUNCTION);
    }
}
