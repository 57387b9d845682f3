package io.numstab.core.syntax;

import static io.numstab.core.model.MathExpr.add;
import static io.numstab.core.model.MathExpr.div;
import static io.numstab.core.model.MathExpr.lit;
import static io.numstab.core.model.MathExpr.mul;
import static io.numstab.core.model.MathExpr.neg;
import static io.numstab.core.model.MathExpr.pow;
import static io.numstab.core.model.MathExpr.sqrt;
import static io.numstab.core.model.MathExpr.sub;
import static io.numstab.core.model.MathExpr.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.numstab.core.error.ExprParseException;
import io.numstab.core.model.MathExpr;
import io.numstab.core.model.Operator;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Tests for {@link InfixParser} and {@link InfixFormatter}. */
class InfixSyntaxTest {

    @Test
    void parsesPrecedenceAndFunctions() {
        assertThat(InfixParser.parse("sqrt(x+1) - sqrt(x)"))
                .isEqualTo(sub(sqrt(add(var("x"), lit(1))), sqrt(var("x"))));
        assertThat(InfixParser.parse("a + b * c")).isEqualTo(add(var("a"), mul(var("b"), var("c"))));
        assertThat(InfixParser.parse("a - b - c")).isEqualTo(sub(sub(var("a"), var("b")), var("c")));
        assertThat(InfixParser.parse("a ** b ** c")).isEqualTo(pow(var("a"), pow(var("b"), var("c"))));
        assertThat(InfixParser.parse("atan2(y, x)"))
                .isEqualTo(MathExpr.apply(Operator.ATAN2, var("y"), var("x")));
        assertThat(InfixParser.parse("1.5e-3")).isEqualTo(lit(0.0015));
    }

    @Test
    @DisplayName("'-' before a number is a negative literal unless the number is a power base")
    void negativeLiterals() {
        assertThat(InfixParser.parse("-2")).isEqualTo(lit(-2));
        assertThat(InfixParser.parse("-x")).isEqualTo(neg(var("x")));
        assertThat(InfixParser.parse("-2 ** 2")).isEqualTo(neg(pow(lit(2), lit(2))));
        assertThat(InfixParser.parse("(-2) ** 2")).isEqualTo(pow(lit(-2), lit(2)));
        assertThat(InfixParser.parse("-(2)")).isEqualTo(neg(lit(2)));
    }

    @Test
    void formatsWithMinimalParentheses() {
        MathExpr stable = div(lit(1), add(sqrt(add(var("x"), lit(1))), sqrt(var("x"))));

        assertThat(InfixFormatter.format(stable)).isEqualTo("1 / (sqrt(x + 1) + sqrt(x))");
        assertThat(InfixFormatter.format(pow(var("x"), lit(2)))).isEqualTo("x ** 2");
        assertThat(InfixFormatter.format(MathExpr.apply(Operator.ABS, var("x")))).isEqualTo("abs(x)");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("trees")
    @DisplayName("format then parse reproduces the tree")
    void formatParseRoundTrip(String label, MathExpr expr) {
        assertThat(InfixParser.parse(InfixFormatter.format(expr))).isEqualTo(expr);
    }

    static Stream<Arguments> trees() {
        return Stream.of(
                Arguments.of("right-nested sum", add(var("a"), add(var("b"), var("c")))),
                Arguments.of("right-nested difference", sub(var("a"), sub(var("b"), var("c")))),
                Arguments.of("quotient of products", div(mul(var("a"), var("b")), mul(var("c"), var("d")))),
                Arguments.of("left-nested power", pow(pow(var("a"), var("b")), var("c"))),
                Arguments.of("negated power", neg(pow(var("x"), lit(2)))),
                Arguments.of("power of negation", pow(neg(var("x")), lit(2))),
                Arguments.of("negated literal", neg(lit(2))),
                Arguments.of("double negation", neg(neg(var("x")))),
                Arguments.of("minus negative literal", sub(var("x"), lit(-2))),
                Arguments.of("negative exponent", pow(var("x"), lit(-0.5))),
                Arguments.of("hypot", MathExpr.apply(Operator.HYPOT, add(var("x"), lit(1)), var("y"))));
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> InfixParser.parse("sqrt(x"))
                .isInstanceOf(ExprParseException.class)
                .hasMessageContaining("Expected ')'");
        assertThatThrownBy(() -> InfixParser.parse("frob(x)"))
                .isInstanceOf(ExprParseException.class)
                .hasMessageContaining("Unknown function 'frob'");
        assertThatThrownBy(() -> InfixParser.parse("sqrt(x, y)"))
                .isInstanceOf(ExprParseException.class)
                .hasMessageContaining("sqrt takes 1 argument(s), got 2");
        assertThatThrownBy(() -> InfixParser.parse("x $ y"))
                .isInstanceOf(ExprParseException.class)
                .hasMessageContaining("Unexpected character '$'");
        assertThatThrownBy(() -> InfixParser.parse("x y"))
                .isInstanceOf(ExprParseException.class)
                .hasMessageContaining("Unexpected 'y'");
    }
}
