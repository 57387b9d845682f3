package io.numstab.core.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** A node read by {@link SExprParser}: an atom or a parenthesized list. */
public sealed interface SExpr permits SExpr.Atom, SExpr.ListNode {

    /** Zero-based offset of the node's first character in the parsed text. */
    int position();

    /**
     * A symbol, numeral, keyword or string literal.
     *
     * @param text   the atom text, without quotes for strings
     * @param quoted {@code true} for a double-quoted string literal
     */
    record Atom(String text, boolean quoted, int position) implements SExpr {
        public Atom {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String toString() {
            if (!quoted) {
                return text;
            }
            return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
    }

    /**
     * A parenthesized list; {@code vector} marks the {@code #( ... )} form.
     */
    record ListNode(List<SExpr> items, boolean vector, int position) implements SExpr {
        public ListNode {
            items = List.copyOf(items);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        /**
         * The head atom's text, or {@code null} if the list is empty or headed
         * by a list/string.
         */
        public String headSymbol() {
            if (!items.isEmpty() && items.get(0) instanceof Atom atom && !atom.quoted()) {
                return atom.text();
            }
            return null;
        }

        public List<SExpr> tail() {
            return items.isEmpty() ? List.of() : items.subList(1, items.size());
        }

        @Override
        public String toString() {
            String body = items.stream().map(SExpr::toString).collect(Collectors.joining(" "));
            return (vector ? "#(" : "(") + body + ")";
        }
    }

    /**
     * Collects every list in {@code roots} in order of its opening parenthesis
     * (pre-order, left to right).
     */
    static List<ListNode> listsInOpeningOrder(List<SExpr> roots) {
        List<ListNode> out = new ArrayList<>();
        for (SExpr root : roots) {
            collect(root, out);
        }
        return out;
    }

    private static void collect(SExpr node, List<ListNode> out) {
        if (node instanceof ListNode list) {
            out.add(list);
            for (SExpr item : list.items()) {
                collect(item, out);
            }
        }
    }
}
