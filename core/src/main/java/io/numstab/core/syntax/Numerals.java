package io.numstab.core.syntax;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/** Reading and writing numeric literals in both canonical and host text. */
public final class Numerals {

    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern RATIONAL = Pattern.compile("[-+]?\\d+/\\d+");

    static final String NAN = "NAN";
    static final String INFINITY = "INFINITY";

    /** Largest magnitude rendered without a fractional part or exponent. */
    private static final double INTEGRAL_LIMIT = 1e15;

    private Numerals() {
        // utility class
    }

    /**
     * Renders a literal deterministically: integral values below 1e15 in
     * magnitude without a fractional part ({@code 1}, {@code -2}), non-finite
     * values as {@code NAN} and {@code INFINITY}, everything else via
     * {@link Double#toString} with a lower-case exponent marker. Negative zero
     * keeps its sign and renders as {@code -0.0}.
     */
    public static String render(double value) {
        if (Double.isNaN(value)) {
            return NAN;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        if (value == Math.rint(value) && Math.abs(value) < INTEGRAL_LIMIT && !isNegativeZero(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value).replace('E', 'e');
    }

    /** {@code -0.0} and {@code 0.0} are different literals and must not share a key. */
    private static boolean isNegativeZero(double value) {
        return Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(-0.0);
    }

    /**
     * Parses a decimal ({@code 1}, {@code -2.5}, {@code 1e-3}) or rational
     * ({@code 1/3}) numeral, or one of the non-finite spellings produced by
     * {@link #render}.
     *
     * @return the value, or empty if {@code token} is not a numeral
     */
    public static OptionalDouble parse(String token) {
        switch (token) {
            case NAN -> {
                return OptionalDouble.of(Double.NaN);
            }
            case INFINITY, "+" + INFINITY -> {
                return OptionalDouble.of(Double.POSITIVE_INFINITY);
            }
            case "-" + INFINITY -> {
                return OptionalDouble.of(Double.NEGATIVE_INFINITY);
            }
            default -> {
                // finite numerals below
            }
        }
        if (DECIMAL.matcher(token).matches()) {
            return OptionalDouble.of(Double.parseDouble(token));
        }
        if (RATIONAL.matcher(token).matches()) {
            int slash = token.indexOf('/');
            double numerator = Double.parseDouble(token.substring(0, slash));
            double denominator = Double.parseDouble(token.substring(slash + 1));
            return OptionalDouble.of(numerator / denominator);
        }
        return OptionalDouble.empty();
    }
}
