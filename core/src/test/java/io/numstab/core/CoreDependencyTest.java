package io.numstab.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core module stays free of adapter-level dependencies.
 * Configuration parsing and log output formatting belong to adapters; the core
 * only needs SLF4J and a JDBC driver.
 */
class CoreDependencyTest {

    /** Group IDs that MUST NOT appear on the core classpath. */
    private static final List<String> FORBIDDEN_GROUPS = List.of(
            "com.fasterxml.jackson", // configuration files are an adapter concern
            "io.javalin",
            "org.eclipse.jetty",
            "info.picocli");

    @Test
    void coreClasspathContainsNoAdapterDependencies() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbiddenGroup : FORBIDDEN_GROUPS) {
            String pathFragment = forbiddenGroup.replace('.', '/');
            assertThat(classpath)
                    .as("Core classpath must not contain: %s", forbiddenGroup)
                    .doesNotContain(pathFragment);
        }
    }

    @Test
    void sqliteDriverIsOnTheClasspath() throws Exception {
        assertThat(Class.forName("org.sqlite.JDBC")).isNotNull();
    }
}
