package io.numstab.core.spi;

import java.io.IOException;
import java.util.List;

/** Runs an external command to completion, feeding it standard input and capturing its output. */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * Runs {@code command} and blocks until it exits.
     *
     * @param command executable followed by its arguments
     * @param stdin   text written to the process's standard input, which is
     *                then closed
     * @return exit code and captured output
     * @throws IOException if the process cannot be started, times out, or its
     *                     streams fail
     */
    ProcessResult run(List<String> command, String stdin) throws IOException;

    /** Exit code plus everything the process wrote to stdout and stderr. */
    record ProcessResult(int exitCode, String stdout, String stderr) {}
}
