package io.numstab.core.engine.herbie;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.numstab.core.error.SolverProtocolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SolverReplyParserTest {

    private final SolverReplyParser parser = new SolverReplyParser();

    @Test
    @DisplayName("error estimates from lines 1-2, rewrite from the third group on line 3")
    void wellFormedReply() {
        SolverReply reply = parser.parse("Input error: 5.3\nOutput error: 0.1\n"
                + "(dummy (cmd (/ 1 (+ (sqrt (+ v0 1)) (sqrt v0)))))\n");

        assertThat(reply.errin()).isEqualTo(5.3);
        assertThat(reply.errout()).isEqualTo(0.1);
        assertThat(reply.output()).isEqualTo("(/ 1 (+ (sqrt (+ v0 1)) (sqrt v0)))");
    }

    @Test
    void extraLinesAndWhitespaceTolerated() {
        SolverReply reply = parser.parse("a:  12 \r\nb:3.25\r\n(x (y (*  v0   v0)))\ntrailing noise\n");

        assertThat(reply.errin()).isEqualTo(12.0);
        assertThat(reply.errout()).isEqualTo(3.25);
        assertThat(reply.output()).isEqualTo("(* v0 v0)");
    }

    @Test
    void tooFewLines() {
        assertThatThrownBy(() -> parser.parse("a: 1\nb: 2\n"))
                .isInstanceOf(SolverProtocolException.class)
                .hasMessageContaining("got 2");
    }

    @Test
    void missingSeparator() {
        assertThatThrownBy(() -> parser.parse("a 1\nb: 2\n(x (y (z)))"))
                .isInstanceOf(SolverProtocolException.class)
                .hasMessageContaining("Line 1 has no ':'");
    }

    @Test
    void nonNumericEstimate() {
        assertThatThrownBy(() -> parser.parse("a: 1\nb: lots\n(x (y (z)))"))
                .isInstanceOf(SolverProtocolException.class)
                .hasMessageContaining("Line 2 has no numeric error estimate");
    }

    @Test
    void missingThirdGroup() {
        assertThatThrownBy(() -> parser.parse("a: 1\nb: 2\n(x (y z))"))
                .isInstanceOf(SolverProtocolException.class)
                .hasMessageContaining("2 parenthesized group(s)");
    }

    @Test
    void unbalancedThirdLine() {
        assertThatThrownBy(() -> parser.parse("a: 1\nb: 2\n(x (y (z))"))
                .isInstanceOf(SolverProtocolException.class)
                .hasMessageContaining("not well parenthesized");
    }
}
