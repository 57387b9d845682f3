package io.numstab.core.engine;

import io.numstab.core.spi.ProcessRunner;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}. Stdout and stderr are
 * drained on separate threads so a chatty child cannot block on a full pipe.
 *
 * <p>
 * A zero timeout waits indefinitely; otherwise the child is killed once the
 * timeout elapses.
 */
public final class SubprocessRunner implements ProcessRunner {

    private final Duration timeout;

    public SubprocessRunner() {
        this(Duration.ZERO);
    }

    public SubprocessRunner(Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.timeout = timeout;
    }

    @Override
    public ProcessResult run(List<String> command, String stdin) throws IOException {
        Process process = new ProcessBuilder(command).start();
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        try {
            try (OutputStream in = process.getOutputStream()) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
            if (timeout.isZero()) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Process " + command.get(0) + " timed out after " + timeout.toMillis() + " ms");
            }
            return new ProcessResult(process.exitValue(), stdout.join(), stderr.join());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for " + command.get(0), e);
        } catch (CompletionException e) {
            throw new IOException("Failed to read output of " + command.get(0), e.getCause());
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
