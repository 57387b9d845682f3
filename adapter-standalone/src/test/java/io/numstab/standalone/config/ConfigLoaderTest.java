package io.numstab.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.numstab.core.engine.herbie.SolverSettings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = Map.<String, String>of()::get;

    @TempDir
    Path tempDir;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Test
    @DisplayName("full config file: every key mapped")
    void fullConfig() throws Exception {
        StabilizerConfig config = ConfigLoader.loadFile(fixture("full-config.yaml"), NO_ENV);

        assertThat(config.solverBinary()).isEqualTo("/opt/herbie/bin/herbie-exec");
        assertThat(config.solverSeed()).containsExactly(1L, 2L, 3L, 4L, 5L, 6L);
        assertThat(config.solverTimeoutMs()).isEqualTo(30000);
        assertThat(config.cacheStore()).isEqualTo("sqlite");
        assertThat(config.cacheDir()).isEqualTo(Path.of("/var/cache/numstab"));
        assertThat(config.outputFormat()).isEqualTo("json");
        assertThat(config.loggingFormat()).isEqualTo("json");
        assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        assertThat(config.jsonOutput()).isTrue();
        assertThat(config.inMemoryCache()).isFalse();
    }

    @Test
    @DisplayName("missing keys get defaults")
    void minimalConfig() throws Exception {
        StabilizerConfig config = ConfigLoader.loadFile(fixture("minimal-config.yaml"), NO_ENV);

        assertThat(config.inMemoryCache()).isTrue();
        assertThat(config.solverBinary()).isEqualTo("herbie-exec");
        assertThat(config.solverSeed()).isEqualTo(SolverSettings.DEFAULT_SEED);
        assertThat(config.solverTimeoutMs()).isZero();
        assertThat(config.cacheDir()).isEqualTo(Path.of(System.getProperty("user.home"), ".stabilizer"));
        assertThat(config.outputFormat()).isEqualTo("text");
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("INFO");
    }

    @Test
    void solverSettingsDerivedFromConfig() throws Exception {
        SolverSettings settings = ConfigLoader.loadFile(fixture("full-config.yaml"), NO_ENV).solverSettings();

        assertThat(settings.command())
                .containsExactly("/opt/herbie/bin/herbie-exec", "-r", "#(1 2 3 4 5 6)");
        assertThat(settings.timeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void emptyFileMeansDefaults() throws Exception {
        Path empty = Files.writeString(tempDir.resolve("empty.yaml"), "");

        StabilizerConfig config = ConfigLoader.loadFile(empty, NO_ENV);

        assertThat(config.cacheStore()).isEqualTo("sqlite");
    }

    @Test
    void seedAsString() throws Exception {
        Path file = Files.writeString(tempDir.resolve("seed.yaml"), "solver:\n  seed: \"10, 20 30,40 50 60\"\n");

        assertThat(ConfigLoader.loadFile(file, NO_ENV).solverSeed()).isEqualTo(List.of(10L, 20L, 30L, 40L, 50L, 60L));
    }

    @Test
    @DisplayName("explicit --config file must exist")
    void explicitMissingFile() {
        Path missing = tempDir.resolve("nope.yaml");

        assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("not found")
                .hasMessageContaining("nope.yaml");
    }

    @Test
    void malformedYaml() throws Exception {
        Path bad = Files.writeString(tempDir.resolve("bad.yaml"), "solver: [unclosed\n");

        assertThatThrownBy(() -> ConfigLoader.loadFile(bad, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Failed to parse YAML");
    }
}
