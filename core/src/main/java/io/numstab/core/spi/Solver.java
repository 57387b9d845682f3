package io.numstab.core.spi;

import io.numstab.core.model.SolverOutcome;
import java.util.List;

/**
 * An external stability-improving solver. Given canonical text and its free
 * variables, it returns a rewrite with before/after error estimates.
 *
 * <p>
 * Implementations MUST NOT throw: every failure is reported as a fallback
 * {@link SolverOutcome}.
 */
@FunctionalInterface
public interface Solver {

    /**
     * Asks the solver for a more stable equivalent of {@code canonicalText}.
     *
     * @param canonicalText prefix text over placeholder variables
     * @param variables     the placeholders occurring in {@code canonicalText},
     *                      in assignment order
     * @return the outcome; {@link SolverOutcome#result()} is always usable
     */
    SolverOutcome invoke(String canonicalText, List<String> variables);
}
