package io.numstab.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of operators an {@link MathExpr} may apply. Each constant knows
 * its fixed arity, the spelling the host program uses for it, and the spelling
 * the solver uses in canonical text.
 *
 * <p>
 * Precedence is only meaningful for the infix operators and drives minimal
 * parenthesization when rendering host syntax.
 */
public enum Operator {
    ADD(2, "+", "+", Notation.INFIX, 1),
    SUB(2, "-", "-", Notation.INFIX, 1),
    MUL(2, "*", "*", Notation.INFIX, 2),
    DIV(2, "/", "/", Notation.INFIX, 2),
    NEG(1, "-", "-", Notation.PREFIX, 3),
    POW(2, "**", "pow", Notation.INFIX, 4),
    SQRT(1, "sqrt", "sqrt"),
    CBRT(1, "cbrt", "cbrt"),
    EXP(1, "exp", "exp"),
    EXPM1(1, "expm1", "expm1"),
    LOG(1, "log", "log"),
    LOG1P(1, "log1p", "log1p"),
    SIN(1, "sin", "sin"),
    COS(1, "cos", "cos"),
    TAN(1, "tan", "tan"),
    ASIN(1, "asin", "asin"),
    ACOS(1, "acos", "acos"),
    ATAN(1, "atan", "atan"),
    SINH(1, "sinh", "sinh"),
    COSH(1, "cosh", "cosh"),
    TANH(1, "tanh", "tanh"),
    ASINH(1, "asinh", "asinh"),
    ACOSH(1, "acosh", "acosh"),
    ATANH(1, "atanh", "atanh"),
    ABS(1, "abs", "fabs"),
    ATAN2(2, "atan2", "atan2"),
    HYPOT(2, "hypot", "hypot");

    /** How the host renders an operator. */
    public enum Notation {
        INFIX,
        PREFIX,
        FUNCTION
    }

    /** Precedence of atoms and function calls; binds tighter than every operator. */
    public static final int ATOM_PRECEDENCE = 5;

    private static final Map<String, Operator> BY_FUNCTION_NAME = Arrays.stream(values())
            .filter(op -> op.notation == Notation.FUNCTION)
            .collect(Collectors.toUnmodifiableMap(Operator::hostSymbol, Function.identity()));

    private static final Map<String, Operator> SOLVER_ALIASES = Map.of("expt", POW, "abs", ABS);

    private final int arity;
    private final String hostSymbol;
    private final String solverName;
    private final Notation notation;
    private final int precedence;

    Operator(int arity, String hostSymbol, String solverName) {
        this(arity, hostSymbol, solverName, Notation.FUNCTION, ATOM_PRECEDENCE);
    }

    Operator(int arity, String hostSymbol, String solverName, Notation notation, int precedence) {
        this.arity = arity;
        this.hostSymbol = hostSymbol;
        this.solverName = solverName;
        this.notation = notation;
        this.precedence = precedence;
    }

    public int arity() {
        return arity;
    }

    /** Spelling in host syntax, e.g. {@code **} for {@link #POW}. */
    public String hostSymbol() {
        return hostSymbol;
    }

    /** Spelling in canonical (solver) text, e.g. {@code pow} for {@link #POW}. */
    public String solverName() {
        return solverName;
    }

    public Notation notation() {
        return notation;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * Resolves a solver spelling for the given operand count. {@code -} is
     * {@link #NEG} with one operand and {@link #SUB} with two; aliases such as
     * {@code expt} are accepted.
     *
     * @param name    the symbol heading a solver list
     * @param operands number of operands that follow it
     * @return the operator, or empty if the spelling is unknown for that
     *         operand count
     */
    public static Optional<Operator> fromSolverName(String name, int operands) {
        Operator alias = SOLVER_ALIASES.get(name);
        if (alias != null) {
            return alias.arity == operands ? Optional.of(alias) : Optional.empty();
        }
        for (Operator op : values()) {
            if (op.solverName.equals(name) && op.arity == operands) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns {@code true} if some operator (of any arity) is spelled
     * {@code name} by the solver.
     */
    public static boolean isSolverName(String name) {
        if (SOLVER_ALIASES.containsKey(name)) {
            return true;
        }
        return Arrays.stream(values()).anyMatch(op -> op.solverName.equals(name));
    }

    /** Looks up a function-call operator by its host name, e.g. {@code sqrt}. */
    public static Optional<Operator> fromFunctionName(String name) {
        return Optional.ofNullable(BY_FUNCTION_NAME.get(name));
    }
}
