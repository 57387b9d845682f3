package io.numstab.core.engine.herbie;

import java.util.List;

/** Builds the single line Herbie reads on standard input. */
final class SolverRequest {

    private SolverRequest() {
        // utility class
    }

    /** {@code (herbie-test (v0 v1) "cmd" <canonicalText>) \n} */
    static String render(String canonicalText, List<String> variables) {
        return "(herbie-test (" + String.join(" ", variables) + ") \"cmd\" " + canonicalText + ") \n";
    }
}
