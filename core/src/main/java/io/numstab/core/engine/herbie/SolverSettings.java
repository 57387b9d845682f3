package io.numstab.core.engine.herbie;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * How to launch Herbie.
 *
 * @param binary  executable name or path
 * @param seed    the six integers of the random seed; a fixed seed makes solver
 *                output reproducible
 * @param timeout how long to wait for the solver; {@link Duration#ZERO} waits
 *                indefinitely
 */
public record SolverSettings(String binary, List<Long> seed, Duration timeout) {

    public static final String DEFAULT_BINARY = "herbie-exec";

    public static final List<Long> DEFAULT_SEED =
            List.of(1461197085L, 2376054483L, 1553562171L, 1611329376L, 2497620867L, 2308122621L);

    public static final SolverSettings DEFAULT = new SolverSettings(DEFAULT_BINARY, DEFAULT_SEED, Duration.ZERO);

    public SolverSettings {
        Objects.requireNonNull(binary, "binary must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (binary.isBlank()) {
            throw new IllegalArgumentException("binary must not be blank");
        }
        seed = List.copyOf(seed);
        if (seed.size() != 6) {
            throw new IllegalArgumentException("seed must have exactly 6 integers, got " + seed.size());
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    /** The seed as Herbie's {@code -r} argument: {@code #(a b c d e f)}. */
    public String seedArgument() {
        return seed.stream().map(String::valueOf).collect(Collectors.joining(" ", "#(", ")"));
    }

    /** Full command line: binary, {@code -r}, seed. */
    public List<String> command() {
        return List.of(binary, "-r", seedArgument());
    }
}
