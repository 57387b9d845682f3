package io.numstab.standalone.config;

import io.numstab.core.engine.herbie.SolverSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Root configuration of the standalone stabilizer. Use {@link #builder()};
 * every field has a default.
 *
 * @param solverBinary    Herbie executable name or path
 * @param solverSeed      the six integers of the solver's random seed
 * @param solverTimeoutMs how long to wait for one solver run; 0 waits
 *                        indefinitely
 * @param cacheStore      {@code sqlite} or {@code memory}
 * @param cacheDir        directory holding the SQLite cache file
 * @param outputFormat    {@code text} or {@code json}
 * @param loggingFormat   {@code text} or {@code json}
 * @param loggingLevel    root log level
 */
public record StabilizerConfig(
        String solverBinary,
        List<Long> solverSeed,
        long solverTimeoutMs,
        String cacheStore,
        Path cacheDir,
        String outputFormat,
        String loggingFormat,
        String loggingLevel) {

    public static final String STORE_SQLITE = "sqlite";
    public static final String STORE_MEMORY = "memory";
    public static final String FORMAT_TEXT = "text";
    public static final String FORMAT_JSON = "json";

    public StabilizerConfig {
        solverSeed = List.copyOf(solverSeed);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The solver part of this configuration. */
    public SolverSettings solverSettings() {
        return new SolverSettings(solverBinary, solverSeed, Duration.ofMillis(solverTimeoutMs));
    }

    public boolean inMemoryCache() {
        return STORE_MEMORY.equals(cacheStore);
    }

    public boolean jsonOutput() {
        return FORMAT_JSON.equals(outputFormat);
    }

    /** Builder for {@link StabilizerConfig}. */
    public static final class Builder {
        private String solverBinary = SolverSettings.DEFAULT_BINARY;
        private List<Long> solverSeed = SolverSettings.DEFAULT_SEED;
        private long solverTimeoutMs = 0;
        private String cacheStore = STORE_SQLITE;
        private Path cacheDir = Path.of(System.getProperty("user.home"), ".stabilizer");
        private String outputFormat = FORMAT_TEXT;
        private String loggingFormat = FORMAT_TEXT;
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder solverBinary(String solverBinary) {
            this.solverBinary = solverBinary;
            return this;
        }

        public Builder solverSeed(List<Long> solverSeed) {
            this.solverSeed = solverSeed;
            return this;
        }

        public Builder solverTimeoutMs(long solverTimeoutMs) {
            this.solverTimeoutMs = solverTimeoutMs;
            return this;
        }

        public Builder cacheStore(String cacheStore) {
            this.cacheStore = cacheStore;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public StabilizerConfig build() {
            return new StabilizerConfig(
                    solverBinary,
                    solverSeed,
                    solverTimeoutMs,
                    cacheStore,
                    cacheDir,
                    outputFormat,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
