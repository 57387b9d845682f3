package io.numstab.core.syntax;

import io.numstab.core.error.ExprParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent reader for the solver's S-expression syntax: lists
 * {@code ( ... )}, vectors {@code #( ... )}, double-quoted strings, {@code ;}
 * line comments, and bare atoms.
 *
 * <p>
 * Stateless; each call parses independently.
 */
public final class SExprParser {

    /**
     * Reads exactly one form. Leading and trailing whitespace is allowed,
     * anything else is not.
     *
     * @throws ExprParseException on empty input, unbalanced parentheses, an
     *                            unterminated string, or trailing input
     */
    public SExpr parse(String text) {
        Reader reader = new Reader(text);
        reader.skipBlank();
        if (reader.atEnd()) {
            throw new ExprParseException("Expected an expression", text, reader.pos);
        }
        SExpr form = reader.readForm();
        reader.skipBlank();
        if (!reader.atEnd()) {
            throw new ExprParseException("Unexpected trailing input", text, reader.pos);
        }
        return form;
    }

    /**
     * Reads every top-level form in {@code text}.
     *
     * @throws ExprParseException on unbalanced parentheses or an unterminated
     *                            string
     */
    public List<SExpr> parseAll(String text) {
        Reader reader = new Reader(text);
        List<SExpr> forms = new ArrayList<>();
        reader.skipBlank();
        while (!reader.atEnd()) {
            forms.add(reader.readForm());
            reader.skipBlank();
        }
        return forms;
    }

    private static final class Reader {

        private final String text;
        private int pos;

        Reader(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        void skipBlank() {
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == ';') {
                    while (!atEnd() && text.charAt(pos) != '\n') {
                        pos++;
                    }
                } else {
                    return;
                }
            }
        }

        SExpr readForm() {
            char c = text.charAt(pos);
            if (c == '(') {
                return readList(pos, false);
            }
            if (c == '#' && pos + 1 < text.length() && text.charAt(pos + 1) == '(') {
                int start = pos;
                pos++;
                return readList(start, true);
            }
            if (c == ')') {
                throw new ExprParseException("Unbalanced ')'", text, pos);
            }
            if (c == '"') {
                return readString();
            }
            return readAtom();
        }

        private SExpr readList(int start, boolean vector) {
            pos++; // '('
            List<SExpr> items = new ArrayList<>();
            while (true) {
                skipBlank();
                if (atEnd()) {
                    throw new ExprParseException("Missing ')' for list opened", text, start);
                }
                if (text.charAt(pos) == ')') {
                    pos++;
                    return new SExpr.ListNode(items, vector, start);
                }
                items.add(readForm());
            }
        }

        private SExpr readString() {
            int start = pos;
            pos++; // opening quote
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return new SExpr.Atom(sb.toString(), true, start);
                }
                if (c == '\\' && !atEnd()) {
                    c = text.charAt(pos++);
                }
                sb.append(c);
            }
            throw new ExprParseException("Unterminated string", text, start);
        }

        private SExpr readAtom() {
            int start = pos;
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';') {
                    break;
                }
                pos++;
            }
            return new SExpr.Atom(text.substring(start, pos), false, start);
        }
    }
}
