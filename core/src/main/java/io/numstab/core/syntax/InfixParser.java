package io.numstab.core.syntax;

import io.numstab.core.error.ExprParseException;
import io.numstab.core.model.MathExpr;
import io.numstab.core.model.Operator;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Reads host infix syntax into a {@link MathExpr}.
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/') unary)*
 * unary   := '-' unary | power
 * power   := primary ('**' unary)?
 * primary := number | ident | ident '(' expr (',' expr)* ')' | '(' expr ')'
 * </pre>
 *
 * <p>
 * {@code -} immediately before a number reads as a negative literal unless the
 * number is the base of {@code **}, so {@code -2 ** 2} is {@code -(2 ** 2)}.
 */
public final class InfixParser {

    private enum Kind {
        NUMBER,
        IDENT,
        SYMBOL,
        END
    }

    private record Token(Kind kind, String text, int position) {}

    private final String text;
    private final List<Token> tokens;
    private int index;

    private InfixParser(String text) {
        this.text = text;
        this.tokens = tokenize(text);
    }

    /**
     * Parses a complete expression.
     *
     * @throws ExprParseException on any syntax error, unknown function or wrong
     *                            argument count
     */
    public static MathExpr parse(String text) {
        InfixParser parser = new InfixParser(text);
        MathExpr expr = parser.expr();
        Token trailing = parser.peek();
        if (trailing.kind() != Kind.END) {
            throw new ExprParseException("Unexpected '" + trailing.text() + "'", text, trailing.position());
        }
        return expr;
    }

    private MathExpr expr() {
        MathExpr left = term();
        while (peekSymbol("+") || peekSymbol("-")) {
            Operator op = next().text().equals("+") ? Operator.ADD : Operator.SUB;
            left = MathExpr.apply(op, left, term());
        }
        return left;
    }

    private MathExpr term() {
        MathExpr left = unary();
        while (peekSymbol("*") || peekSymbol("/")) {
            Operator op = next().text().equals("*") ? Operator.MUL : Operator.DIV;
            left = MathExpr.apply(op, left, unary());
        }
        return left;
    }

    private MathExpr unary() {
        if (peekSymbol("-")) {
            next();
            Token after = peek();
            boolean baseOfPower = peekAt(1).kind() == Kind.SYMBOL && peekAt(1).text().equals("**");
            if (after.kind() == Kind.NUMBER && !baseOfPower) {
                next();
                return MathExpr.lit(-number(after));
            }
            return MathExpr.neg(unary());
        }
        return power();
    }

    private MathExpr power() {
        MathExpr base = primary();
        if (peekSymbol("**")) {
            next();
            return MathExpr.pow(base, unary());
        }
        return base;
    }

    private MathExpr primary() {
        Token token = next();
        switch (token.kind()) {
            case NUMBER -> {
                return MathExpr.lit(number(token));
            }
            case IDENT -> {
                if (peekSymbol("(")) {
                    return call(token);
                }
                return MathExpr.var(token.text());
            }
            case SYMBOL -> {
                if (token.text().equals("(")) {
                    MathExpr inner = expr();
                    expect(")");
                    return inner;
                }
                throw new ExprParseException("Unexpected '" + token.text() + "'", text, token.position());
            }
            default -> throw new ExprParseException("Unexpected end of input", text, token.position());
        }
    }

    private MathExpr call(Token name) {
        Operator op = Operator.fromFunctionName(name.text())
                .orElseThrow(() -> new ExprParseException("Unknown function '" + name.text() + "'", text, name.position()));
        expect("(");
        List<MathExpr> args = new ArrayList<>();
        args.add(expr());
        while (peekSymbol(",")) {
            next();
            args.add(expr());
        }
        expect(")");
        if (args.size() != op.arity()) {
            throw new ExprParseException(
                    name.text() + " takes " + op.arity() + " argument(s), got " + args.size(), text, name.position());
        }
        return new MathExpr.Apply(op, args);
    }

    private double number(Token token) {
        OptionalDouble value = Numerals.parse(token.text());
        if (value.isEmpty()) {
            throw new ExprParseException("Malformed number '" + token.text() + "'", text, token.position());
        }
        return value.getAsDouble();
    }

    private void expect(String symbol) {
        Token token = next();
        if (token.kind() != Kind.SYMBOL || !token.text().equals(symbol)) {
            String found = token.kind() == Kind.END ? "end of input" : "'" + token.text() + "'";
            throw new ExprParseException("Expected '" + symbol + "' but found " + found, text, token.position());
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private boolean peekSymbol(String symbol) {
        Token token = peek();
        return token.kind() == Kind.SYMBOL && token.text().equals(symbol);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.kind() != Kind.END) {
            index++;
        }
        return token;
    }

    private static List<Token> tokenize(String text) {
        List<Token> out = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (Character.isDigit(c) || c == '.') {
                int start = pos;
                while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
                    pos++;
                }
                if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
                    int mark = pos++;
                    if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                        pos++;
                    }
                    if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                            pos++;
                        }
                    } else {
                        pos = mark; // 'e' belongs to whatever follows
                    }
                }
                out.add(new Token(Kind.NUMBER, text.substring(start, pos), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < text.length()
                        && (Character.isLetterOrDigit(text.charAt(pos))
                                || text.charAt(pos) == '_'
                                || text.charAt(pos) == '\'')) {
                    pos++;
                }
                String word = text.substring(start, pos);
                Kind kind = Numerals.parse(word).isPresent() ? Kind.NUMBER : Kind.IDENT;
                out.add(new Token(kind, word, start));
            } else if (c == '*' && pos + 1 < text.length() && text.charAt(pos + 1) == '*') {
                out.add(new Token(Kind.SYMBOL, "**", pos));
                pos += 2;
            } else if ("+-*/(),".indexOf(c) >= 0) {
                out.add(new Token(Kind.SYMBOL, String.valueOf(c), pos));
                pos++;
            } else {
                throw new ExprParseException("Unexpected character '" + c + "'", text, pos);
            }
        }
        out.add(new Token(Kind.END, "", text.length()));
        return out;
    }
}
