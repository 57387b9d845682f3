package io.numstab.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable numeric expression tree. Leaves are named free variables
 * ({@link Variable}) or numeric literals ({@link Literal}); interior nodes
 * apply an {@link Operator} of fixed arity ({@link Apply}).
 *
 * <p>
 * Equality is structural. Trees are acyclic by construction.
 */
public sealed interface MathExpr permits MathExpr.Variable, MathExpr.Literal, MathExpr.Apply {

    /** A free variable, named as in the host program. */
    record Variable(String name) implements MathExpr {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("variable name must not be blank");
            }
        }
    }

    /** A numeric literal. */
    record Literal(double value) implements MathExpr {}

    /**
     * An operator applied to its operands.
     *
     * @throws IllegalArgumentException if the operand count does not match the
     *                                  operator's arity
     */
    record Apply(Operator op, List<MathExpr> args) implements MathExpr {
        public Apply {
            Objects.requireNonNull(op, "op must not be null");
            args = List.copyOf(args);
            if (args.size() != op.arity()) {
                throw new IllegalArgumentException(
                        op + " takes " + op.arity() + " operand(s), got " + args.size());
            }
        }
    }

    static MathExpr var(String name) {
        return new Variable(name);
    }

    static MathExpr lit(double value) {
        return new Literal(value);
    }

    static MathExpr apply(Operator op, MathExpr... args) {
        return new Apply(op, Arrays.asList(args));
    }

    static MathExpr add(MathExpr a, MathExpr b) {
        return apply(Operator.ADD, a, b);
    }

    static MathExpr sub(MathExpr a, MathExpr b) {
        return apply(Operator.SUB, a, b);
    }

    static MathExpr mul(MathExpr a, MathExpr b) {
        return apply(Operator.MUL, a, b);
    }

    static MathExpr div(MathExpr a, MathExpr b) {
        return apply(Operator.DIV, a, b);
    }

    static MathExpr pow(MathExpr base, MathExpr exponent) {
        return apply(Operator.POW, base, exponent);
    }

    static MathExpr neg(MathExpr a) {
        return apply(Operator.NEG, a);
    }

    static MathExpr sqrt(MathExpr a) {
        return apply(Operator.SQRT, a);
    }
}
