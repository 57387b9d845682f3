package io.numstab.core.engine.herbie;

import io.numstab.core.error.ExprParseException;
import io.numstab.core.error.SolverProtocolException;
import io.numstab.core.syntax.SExpr;
import io.numstab.core.syntax.SExprParser;
import java.util.List;

/**
 * Parses Herbie's standard output. The reply must have at least three lines:
 *
 * <ol>
 * <li>{@code <label>: <error before>}
 * <li>{@code <label>: <error after>}
 * <li>boilerplate wrapping the rewrite; the rewrite is the third parenthesized
 *     group counted by opening parenthesis
 * </ol>
 *
 * <p>
 * Further lines are ignored.
 */
final class SolverReplyParser {

    /** Zero-based index, by opening parenthesis, of the group holding the rewrite on line 3. */
    static final int OUTPUT_GROUP_INDEX = 2;

    private final SExprParser parser = new SExprParser();

    /**
     * @throws SolverProtocolException if the reply does not have the expected
     *                                 shape
     */
    SolverReply parse(String stdout) {
        List<String> lines = stdout.lines().toList();
        if (lines.size() < 3) {
            throw new SolverProtocolException("Expected at least 3 lines of solver output, got " + lines.size());
        }
        double errin = errorField(lines.get(0), 1);
        double errout = errorField(lines.get(1), 2);
        return new SolverReply(errin, errout, outputExpression(lines.get(2)));
    }

    private static double errorField(String line, int lineNumber) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            throw new SolverProtocolException("Line " + lineNumber + " has no ':' separator: " + line);
        }
        String value = line.substring(colon + 1).trim();
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new SolverProtocolException("Line " + lineNumber + " has no numeric error estimate: " + line, e);
        }
    }

    private String outputExpression(String line) {
        List<SExpr> forms;
        try {
            forms = parser.parseAll(line);
        } catch (ExprParseException e) {
            throw new SolverProtocolException("Line 3 is not well parenthesized: " + e.getMessage(), e);
        }
        List<SExpr.ListNode> groups = SExpr.listsInOpeningOrder(forms);
        if (groups.size() <= OUTPUT_GROUP_INDEX) {
            throw new SolverProtocolException(
                    "Line 3 has " + groups.size() + " parenthesized group(s), expected at least "
                            + (OUTPUT_GROUP_INDEX + 1) + ": " + line);
        }
        return groups.get(OUTPUT_GROUP_INDEX).toString();
    }
}
