package io.numstab.standalone;

import io.numstab.standalone.app.StabilizerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone stabilizer.
 *
 * <p>
 * Delegates to {@link StabilizerApp#run}. On a startup failure (bad arguments,
 * invalid configuration) logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args {@code [--config file] [--module m] [--function f] [--type t] [--comment c] [expr ...]}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = StabilizerApp.run(args, System.in, System.out);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }
}
