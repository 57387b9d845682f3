package io.numstab.core.error;

/**
 * Thrown when expression text is malformed: unbalanced parentheses, an
 * unrecognized token, an unknown placeholder, or an operator applied to the
 * wrong number of operands.
 */
public final class ExprParseException extends StabilizerException {

    private static final long serialVersionUID = 1L;

    private final String input;
    private final int position;

    public ExprParseException(String message, String input, int position) {
        super(message + " at position " + position + " in: " + input, FailureKind.PARSE_FAILURE);
        this.input = input;
        this.position = position;
    }

    /** The text being parsed. */
    public String input() {
        return input;
    }

    /** Zero-based character offset where parsing failed. */
    public int position() {
        return position;
    }
}
