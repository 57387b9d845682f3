package io.numstab.core.syntax;

import io.numstab.core.model.MathExpr;
import io.numstab.core.model.Operator;
import java.util.stream.Collectors;

/**
 * Renders a {@link MathExpr} in host infix syntax with the fewest parentheses
 * that still read back to the same tree through {@link InfixParser}:
 * {@code 1 / (sqrt(x + 1) + sqrt(x))}.
 */
public final class InfixFormatter {

    private InfixFormatter() {
        // utility class
    }

    public static String format(MathExpr expr) {
        if (expr instanceof MathExpr.Variable v) {
            return v.name();
        }
        if (expr instanceof MathExpr.Literal l) {
            return Numerals.render(l.value());
        }
        MathExpr.Apply apply = (MathExpr.Apply) expr;
        Operator op = apply.op();
        return switch (op.notation()) {
            case FUNCTION -> op.hostSymbol() + "("
                    + apply.args().stream().map(InfixFormatter::format).collect(Collectors.joining(", ")) + ")";
            case PREFIX -> formatNegation(apply.args().get(0));
            case INFIX -> formatBinary(op, apply.args().get(0), apply.args().get(1));
        };
    }

    private static String formatNegation(MathExpr operand) {
        // a literal directly after '-' would read back as a negative literal
        if (operand instanceof MathExpr.Literal || precedence(operand) <= Operator.NEG.precedence()) {
            return "-(" + format(operand) + ")";
        }
        return "-" + format(operand);
    }

    private static String formatBinary(Operator op, MathExpr left, MathExpr right) {
        int p = op.precedence();
        boolean rightAssociative = op == Operator.POW;

        boolean wrapLeft = rightAssociative ? precedence(left) <= p : precedence(left) < p;
        boolean wrapRight = rightAssociative
                ? precedence(right) < p
                : precedence(right) <= p || isNegativeLiteral(right);

        return wrap(format(left), wrapLeft) + " " + op.hostSymbol() + " " + wrap(format(right), wrapRight);
    }

    private static String wrap(String text, boolean parens) {
        return parens ? "(" + text + ")" : text;
    }

    private static int precedence(MathExpr expr) {
        if (expr instanceof MathExpr.Apply apply) {
            return apply.op().precedence();
        }
        return isNegativeLiteral(expr) ? Operator.NEG.precedence() : Operator.ATOM_PRECEDENCE;
    }

    private static boolean isNegativeLiteral(MathExpr expr) {
        return expr instanceof MathExpr.Literal l
                && Numerals.render(l.value()).startsWith("-");
    }
}
