package io.numstab.standalone.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.numstab.core.model.MathExpr;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.syntax.InfixFormatter;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Writes one line per expression plus a closing summary line, either as aligned
 * text or as one JSON object per line. Unknown error estimates are written as
 * {@code ?} in text and {@code null} in JSON.
 */
abstract class ResultPrinter {

    protected final PrintStream out;

    protected ResultPrinter(PrintStream out) {
        this.out = out;
    }

    static ResultPrinter create(boolean json, PrintStream out) {
        return json ? new Json(out) : new Text(out);
    }

    abstract void result(String input, String canonical, StabilizerResult<MathExpr> result);

    abstract void rejected(String input, String error);

    abstract void summary(RunSummary summary);

    static final class Text extends ResultPrinter {

        Text(PrintStream out) {
            super(out);
        }

        @Override
        void result(String input, String canonical, StabilizerResult<MathExpr> result) {
            out.println(input + "  =>  " + InfixFormatter.format(result.cmdout()) + "  ["
                    + bits(result.errin()) + " -> " + bits(result.errout()) + " bits]");
        }

        @Override
        void rejected(String input, String error) {
            out.println(input + "  !!  " + error);
        }

        @Override
        void summary(RunSummary summary) {
            out.println("expressions=" + summary.expressions()
                    + " cacheHits=" + summary.cacheHits()
                    + " solverRuns=" + summary.solverRuns()
                    + " failures=" + summary.failures());
        }

        private static String bits(double value) {
            return Double.isNaN(value) ? "?" : String.valueOf(value);
        }
    }

    static final class Json extends ResultPrinter {

        private final ObjectMapper mapper = new ObjectMapper();

        Json(PrintStream out) {
            super(out);
        }

        @Override
        void result(String input, String canonical, StabilizerResult<MathExpr> result) {
            ObjectNode node = mapper.createObjectNode();
            node.put("input", input);
            node.put("output", InfixFormatter.format(result.cmdout()));
            node.put("canonical", canonical);
            estimate(node, "errin", result.errin());
            estimate(node, "errout", result.errout());
            write(node);
        }

        @Override
        void rejected(String input, String error) {
            ObjectNode node = mapper.createObjectNode();
            node.put("input", input);
            node.put("error", error);
            write(node);
        }

        @Override
        void summary(RunSummary summary) {
            ObjectNode node = mapper.createObjectNode();
            node.put("expressions", summary.expressions());
            node.put("cacheHits", summary.cacheHits());
            node.put("solverRuns", summary.solverRuns());
            node.put("failures", summary.failures());
            write(node);
        }

        private static void estimate(ObjectNode node, String field, double value) {
            if (Double.isNaN(value)) {
                node.putNull(field);
            } else {
                node.put(field, value);
            }
        }

        private void write(ObjectNode node) {
            try {
                out.println(mapper.writeValueAsString(node));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
