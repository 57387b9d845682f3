package io.numstab.core.model;

import java.util.Objects;

/**
 * Canonical encoding of an expression: prefix text over placeholder variables
 * plus the mapping back to the original names. {@code text} is the cache key.
 *
 * @param text   fully parenthesized prefix text, e.g.
 *               {@code (- (sqrt (+ v0 1)) (sqrt v0))}
 * @param varMap placeholder → original variable names, in placeholder order
 */
public record CanonicalForm(String text, VarMap varMap) {

    public CanonicalForm {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(varMap, "varMap must not be null");
    }
}
