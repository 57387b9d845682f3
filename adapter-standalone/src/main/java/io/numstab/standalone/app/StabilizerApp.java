package io.numstab.standalone.app;

import io.numstab.core.engine.CanonicalTranslator;
import io.numstab.core.engine.ResultCache;
import io.numstab.core.engine.Stabilizer;
import io.numstab.core.engine.herbie.HerbieSolver;
import io.numstab.core.error.ExprParseException;
import io.numstab.core.model.DbgInfo;
import io.numstab.core.model.MathExpr;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.ResultStore;
import io.numstab.core.spi.Solver;
import io.numstab.core.store.InMemoryResultStore;
import io.numstab.core.store.SqliteResultStore;
import io.numstab.core.syntax.InfixParser;
import io.numstab.standalone.config.ConfigLoader;
import io.numstab.standalone.config.StabilizerConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end: stabilizes infix expressions given as arguments or
 * read from standard input, printing one result line each and a summary.
 *
 * <p>
 * Exit status is 0 when every input parsed and {@value #EXIT_REJECTED_INPUT}
 * when at least one was rejected. Solver and cache failures do not change the
 * exit status; those expressions are printed unchanged with unknown error
 * estimates.
 */
public final class StabilizerApp {

    private static final Logger LOG = LoggerFactory.getLogger(StabilizerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED_INPUT = 2;

    private final StabilizerConfig config;
    private final CanonicalTranslator translator = new CanonicalTranslator();
    private final RunSummary summary = new RunSummary();
    private final Stabilizer stabilizer;

    StabilizerApp(StabilizerConfig config, Solver solver) {
        this.config = config;
        this.stabilizer = new Stabilizer(translator, solver, new ResultCache(createStore(config)), summary);
    }

    /**
     * Loads configuration, configures logging and processes the expressions
     * named by {@code args}.
     *
     * @return the process exit status
     * @throws io.numstab.standalone.config.ConfigLoadException if the
     *     configuration is invalid
     * @throws IllegalArgumentException                         if the arguments
     *     are malformed
     */
    public static int run(String[] args, InputStream in, PrintStream out) throws IOException {
        return run(args, in, out, System::getenv);
    }

    static int run(String[] args, InputStream in, PrintStream out, Function<String, String> envLookup)
            throws IOException {
        Arguments arguments = Arguments.parse(args);
        StabilizerConfig config = ConfigLoader.load(arguments.configPath(), envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info(
                "Configuration loaded: solver={}, cacheStore={}, cacheDir={}, output={}",
                config.solverBinary(),
                config.cacheStore(),
                config.cacheDir(),
                config.outputFormat());

        StabilizerApp app = new StabilizerApp(config, new HerbieSolver(config.solverSettings()));
        List<String> inputs = arguments.expressions().isEmpty() ? readInputs(in) : arguments.expressions();
        return app.process(inputs, arguments.dbgInfo(), out);
    }

    /**
     * Stabilizes each input in order and prints the results followed by the
     * summary line.
     *
     * @return the process exit status
     */
    int process(List<String> inputs, DbgInfo dbgInfo, PrintStream out) {
        ResultPrinter printer = ResultPrinter.create(config.jsonOutput(), out);
        boolean rejected = false;
        for (String input : inputs) {
            summary.expressionSeen();
            MathExpr expr;
            try {
                expr = InfixParser.parse(input);
            } catch (ExprParseException e) {
                LOG.warn("Input rejected: {}", e.getMessage());
                summary.inputRejected();
                printer.rejected(input, e.getMessage());
                rejected = true;
                continue;
            }
            StabilizerResult<MathExpr> result = stabilizer.stabilize(expr, dbgInfo);
            printer.result(input, translator.toCanonical(expr).text(), result);
        }
        printer.summary(summary);
        out.flush();
        LOG.info(
                "Run finished: expressions={}, cacheHits={}, solverRuns={}, failures={}",
                summary.expressions(),
                summary.cacheHits(),
                summary.solverRuns(),
                summary.failures());
        return rejected ? EXIT_REJECTED_INPUT : EXIT_OK;
    }

    /** Non-blank lines of {@code in} that do not start with {@code #}, trimmed. */
    static List<String> readInputs(InputStream in) throws IOException {
        List<String> inputs = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                inputs.add(trimmed);
            }
        }
        return inputs;
    }

    private static ResultStore createStore(StabilizerConfig config) {
        if (config.inMemoryCache()) {
            return new InMemoryResultStore();
        }
        return new SqliteResultStore(config.cacheDir());
    }

    RunSummary summary() {
        return summary;
    }
}
