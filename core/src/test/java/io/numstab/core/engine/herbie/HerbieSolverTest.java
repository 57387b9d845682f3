package io.numstab.core.engine.herbie;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.numstab.core.error.FailureKind;
import io.numstab.core.model.SolverOutcome;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.ProcessRunner;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class HerbieSolverTest {

    private static final String TEXT = "(- (sqrt (+ v0 1)) (sqrt v0))";
    private static final List<String> VARS = List.of("v0");

    private final List<List<String>> commands = new ArrayList<>();
    private final List<String> requests = new ArrayList<>();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger solverLogger;

    @BeforeEach
    void setUp() {
        solverLogger = (Logger) LoggerFactory.getLogger(HerbieSolver.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        solverLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        solverLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private HerbieSolver solverReplying(int exitCode, String stdout, String stderr) {
        return new HerbieSolver(SolverSettings.DEFAULT, (command, stdin) -> {
            commands.add(command);
            requests.add(stdin);
            return new ProcessRunner.ProcessResult(exitCode, stdout, stderr);
        });
    }

    private List<String> warnings() {
        return logAppender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    private static void assertFallback(SolverOutcome outcome) {
        assertThat(outcome.isFallback()).isTrue();
        assertThat(outcome.failure()).isEqualTo(FailureKind.SOLVER_PROTOCOL_FAILURE);
        StabilizerResult<String> result = outcome.result();
        assertThat(result.cmdin()).isEqualTo(TEXT);
        assertThat(result.cmdout()).isEqualTo(TEXT);
        assertThat(result.errin()).isNaN();
        assertThat(result.errout()).isNaN();
    }

    @Test
    @DisplayName("request line and seeded command follow the solver protocol")
    void requestProtocol() {
        solverReplying(0, "a: 1\nb: 1\n(x (y (sqrt v0)))\n", "").invoke("(sqrt v0)", VARS);

        assertThat(commands).containsExactly(SolverSettings.DEFAULT.command());
        assertThat(requests).containsExactly("(herbie-test (v0) \"cmd\" (sqrt v0)) \n");
    }

    @Test
    void variableFreeRequest() {
        solverReplying(0, "a: 0\nb: 0\n(x (y (+ 1 2)))\n", "").invoke("(+ 1 2)", List.of());

        assertThat(requests).containsExactly("(herbie-test () \"cmd\" (+ 1 2)) \n");
    }

    @Test
    @DisplayName("well-formed reply → success with parsed estimates and rewrite")
    void successfulReply() {
        SolverOutcome outcome = solverReplying(
                        0,
                        "Input error: 5.3\nOutput error: 0.1\n(dummy (cmd (/ 1 (+ (sqrt (+ v0 1)) (sqrt v0)))))\n",
                        "")
                .invoke(TEXT, VARS);

        assertThat(outcome.isFallback()).isFalse();
        assertThat(outcome.result())
                .isEqualTo(new StabilizerResult<>(TEXT, "(/ 1 (+ (sqrt (+ v0 1)) (sqrt v0)))", 5.3, 0.1));
        assertThat(warnings()).isEmpty();
    }

    @Test
    @DisplayName("two-line reply → fallback, never a crash")
    void twoLineReplyFallsBack() {
        SolverOutcome outcome = solverReplying(0, "Input error: 5.3\nOutput error: 0.1\n", "")
                .invoke(TEXT, VARS);

        assertFallback(outcome);
        assertThat(outcome.detail()).contains("got 2");
    }

    @Test
    @DisplayName("failure path logs exception, request, stdout and stderr")
    void failureIsLogged() {
        solverReplying(0, "garbage\n", "racket: boom").invoke(TEXT, VARS);

        assertThat(warnings())
                .anySatisfy(m -> assertThat(m).startsWith("Solver reply rejected"))
                .anySatisfy(m -> assertThat(m).contains("herbie-test (v0)"))
                .anySatisfy(m -> assertThat(m).isEqualTo("Solver stdout: garbage\n"))
                .anySatisfy(m -> assertThat(m).isEqualTo("Solver stderr: racket: boom"));
    }

    @Test
    void nonZeroExitFallsBack() {
        SolverOutcome outcome = solverReplying(1, "a: 1\nb: 0\n(x (y (sqrt v0)))\n", "error").invoke(TEXT, VARS);

        assertFallback(outcome);
        assertThat(outcome.detail()).contains("status 1");
    }

    @Test
    @DisplayName("missing binary → fallback")
    void runnerFailureFallsBack() {
        HerbieSolver solver = new HerbieSolver(SolverSettings.DEFAULT, (command, stdin) -> {
            throw new IOException("Cannot run program \"herbie-exec\"");
        });

        SolverOutcome outcome = solver.invoke(TEXT, VARS);

        assertFallback(outcome);
        assertThat(warnings()).anySatisfy(m -> assertThat(m).contains("Cannot run program"));
    }

    @Test
    void missingOutputGroupFallsBack() {
        assertFallback(solverReplying(0, "a: 1\nb: 0\n(only (two))\n", "").invoke(TEXT, VARS));
    }
}
