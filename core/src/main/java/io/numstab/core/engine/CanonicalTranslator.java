package io.numstab.core.engine;

import io.numstab.core.error.ExprParseException;
import io.numstab.core.model.CanonicalForm;
import io.numstab.core.model.MathExpr;
import io.numstab.core.model.Operator;
import io.numstab.core.model.VarMap;
import io.numstab.core.syntax.Numerals;
import io.numstab.core.syntax.SExpr;
import io.numstab.core.syntax.SExprParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Translates between {@link MathExpr} trees and their canonical prefix text.
 *
 * <p>
 * {@link #toCanonical} renames variables to {@code v0, v1, ...} in order of
 * first occurrence (left-to-right, depth-first), so expressions that differ
 * only in variable naming share a cache key. {@link #fromCanonical} reverses
 * the renaming and also accepts the solver's own spellings ({@code expt},
 * {@code sqr}, {@code PI}, ...), mapping them onto host {@link Operator}s.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class CanonicalTranslator {

    /** Placeholder prefix; placeholders are {@code v0}, {@code v1}, ... */
    public static final String PLACEHOLDER_PREFIX = "v";

    private static final Map<String, Double> SOLVER_CONSTANTS = Map.of("PI", Math.PI, "E", Math.E);

    /** Solver operators that expand into a host {@link Operator} applied to extra operands. */
    private static final Set<String> EXPANDED_OPERATORS = Set.of("sqr", "cube");

    private final SExprParser parser = new SExprParser();

    /** Canonicalizes {@code expr}. Total over well-formed trees. */
    public CanonicalForm toCanonical(MathExpr expr) {
        Map<String, String> originalToPlaceholder = new LinkedHashMap<>();
        StringBuilder text = new StringBuilder();
        render(expr, originalToPlaceholder, text);

        Map<String, String> placeholderToOriginal = new LinkedHashMap<>();
        originalToPlaceholder.forEach((original, placeholder) -> placeholderToOriginal.put(placeholder, original));
        return new CanonicalForm(text.toString(), VarMap.of(placeholderToOriginal));
    }

    private static void render(MathExpr expr, Map<String, String> placeholders, StringBuilder out) {
        if (expr instanceof MathExpr.Variable v) {
            out.append(placeholders.computeIfAbsent(v.name(), name -> PLACEHOLDER_PREFIX + placeholders.size()));
        } else if (expr instanceof MathExpr.Literal l) {
            out.append(Numerals.render(l.value()));
        } else {
            MathExpr.Apply apply = (MathExpr.Apply) expr;
            out.append('(').append(apply.op().solverName());
            for (MathExpr arg : apply.args()) {
                out.append(' ');
                render(arg, placeholders, out);
            }
            out.append(')');
        }
    }

    /**
     * Parses canonical text and restores original variable names.
     *
     * @param text   prefix text as produced by {@link #toCanonical} or by the
     *               solver
     * @param varMap the map returned alongside the canonical text of the input
     *               expression
     * @throws ExprParseException if the text is not well parenthesized, or
     *                            contains a token that is neither a numeral, a
     *                            known constant, a placeholder in
     *                            {@code varMap}, nor an operator applied to the
     *                            right number of operands
     */
    public MathExpr fromCanonical(String text, VarMap varMap) {
        return toExpr(parser.parse(text), varMap, text);
    }

    private MathExpr toExpr(SExpr node, VarMap varMap, String source) {
        if (node instanceof SExpr.Atom atom) {
            return atomToExpr(atom, varMap, source);
        }
        SExpr.ListNode list = (SExpr.ListNode) node;
        String head = list.headSymbol();
        if (head == null || list.vector()) {
            throw new ExprParseException("Expected an operator at the head of the list", source, list.position());
        }
        if (!EXPANDED_OPERATORS.contains(head) && !Operator.isSolverName(head)) {
            throw new ExprParseException("Unrecognized operator '" + head + "'", source, list.position());
        }
        List<MathExpr> operands = new ArrayList<>();
        for (SExpr item : list.tail()) {
            operands.add(toExpr(item, varMap, source));
        }

        switch (head) {
            case "sqr" -> {
                requireOperands(head, operands, 1, source, list);
                return MathExpr.pow(operands.get(0), MathExpr.lit(2));
            }
            case "cube" -> {
                requireOperands(head, operands, 1, source, list);
                return MathExpr.pow(operands.get(0), MathExpr.lit(3));
            }
            case "+", "*" -> {
                if (operands.size() > 2) {
                    Operator op = head.equals("+") ? Operator.ADD : Operator.MUL;
                    MathExpr acc = operands.get(0);
                    for (int i = 1; i < operands.size(); i++) {
                        acc = MathExpr.apply(op, acc, operands.get(i));
                    }
                    return acc;
                }
            }
            default -> {
                // fixed-arity operators below
            }
        }

        Operator op = Operator.fromSolverName(head, operands.size())
                .orElseThrow(() -> new ExprParseException(
                        "Operator '" + head + "' cannot take " + operands.size() + " operand(s)",
                        source,
                        list.position()));
        return new MathExpr.Apply(op, operands);
    }

    private static MathExpr atomToExpr(SExpr.Atom atom, VarMap varMap, String source) {
        if (atom.quoted()) {
            throw new ExprParseException("Unexpected string literal", source, atom.position());
        }
        String token = atom.text();
        OptionalDouble number = Numerals.parse(token);
        if (number.isPresent()) {
            return MathExpr.lit(number.getAsDouble());
        }
        Double constant = SOLVER_CONSTANTS.get(token);
        if (constant != null) {
            return MathExpr.lit(constant);
        }
        return varMap.originalName(token)
                .<MathExpr>map(MathExpr.Variable::new)
                .orElseThrow(() -> new ExprParseException("Unrecognized token '" + token + "'", source, atom.position()));
    }

    private static void requireOperands(
            String head, List<MathExpr> operands, int expected, String source, SExpr.ListNode list) {
        if (operands.size() != expected) {
            throw new ExprParseException(
                    "Operator '" + head + "' cannot take " + operands.size() + " operand(s)", source, list.position());
        }
    }
}
