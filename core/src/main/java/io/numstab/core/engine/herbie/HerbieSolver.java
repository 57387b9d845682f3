package io.numstab.core.engine.herbie;

import io.numstab.core.engine.SubprocessRunner;
import io.numstab.core.error.FailureKind;
import io.numstab.core.error.SolverProtocolException;
import io.numstab.core.model.SolverOutcome;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.ProcessRunner;
import io.numstab.core.spi.Solver;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Solver} that runs Herbie as a subprocess with a fixed random seed.
 *
 * <p>
 * The request is one line on stdin
 * ({@code (herbie-test (v0 ...) "cmd" <expr>)}); the reply is parsed by
 * {@link SolverReplyParser}. Any failure (missing binary, timeout, non-zero
 * exit, malformed reply) yields the fallback outcome and WARN log lines
 * carrying the request and whatever the process printed.
 */
public final class HerbieSolver implements Solver {

    private static final Logger LOG = LoggerFactory.getLogger(HerbieSolver.class);

    private final SolverSettings settings;
    private final ProcessRunner runner;
    private final SolverReplyParser replyParser = new SolverReplyParser();

    public HerbieSolver(SolverSettings settings) {
        this(settings, new SubprocessRunner(settings.timeout()));
    }

    public HerbieSolver(SolverSettings settings, ProcessRunner runner) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    @Override
    public SolverOutcome invoke(String canonicalText, List<String> variables) {
        String request = SolverRequest.render(canonicalText, variables);
        ProcessRunner.ProcessResult process;
        try {
            process = runner.run(settings.command(), request);
        } catch (IOException e) {
            LOG.warn("Solver could not be run: binary={}, error={}", settings.binary(), e.toString());
            LOG.warn("Solver request: {}", request.strip());
            return SolverOutcome.fallback(canonicalText, FailureKind.SOLVER_PROTOCOL_FAILURE, e.getMessage());
        }

        try {
            if (process.exitCode() != 0) {
                throw new SolverProtocolException("Solver exited with status " + process.exitCode());
            }
            SolverReply reply = replyParser.parse(process.stdout());
            LOG.debug(
                    "Solver answered: cmdin={}, cmdout={}, errin={}, errout={}",
                    canonicalText,
                    reply.output(),
                    reply.errin(),
                    reply.errout());
            return SolverOutcome.success(
                    new StabilizerResult<>(canonicalText, reply.output(), reply.errin(), reply.errout()));
        } catch (SolverProtocolException e) {
            LOG.warn("Solver reply rejected: {}", e.getMessage());
            LOG.warn("Solver request: {}", request.strip());
            LOG.warn("Solver stdout: {}", process.stdout());
            LOG.warn("Solver stderr: {}", process.stderr());
            return SolverOutcome.fallback(canonicalText, e.kind(), e.getMessage());
        }
    }

    public SolverSettings settings() {
        return settings;
    }
}
