package ch.uzh.ifi.grading.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A running sandboxed child. Closing the handle terminates every process in the child's group, including
 * descendants that outlive the child itself, and deletes the captured output.
 */
@Slf4j
public class SandboxedProcess implements Closeable {

    private final Process process;

    private final boolean processGroup;

    private final Duration gracePeriod;

    private final Path captureDir;

    @Getter
    private final String label;

    @Getter
    private final Instant startedAt;

    private boolean terminated;

    SandboxedProcess(Process process, boolean processGroup, Duration gracePeriod, Path captureDir, String label) {
        this.process = process;
        this.processGroup = processGroup;
        this.gracePeriod = gracePeriod;
        this.captureDir = captureDir;
        this.label = label;
        this.startedAt = Instant.now();
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public boolean waitFor(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int exitValue() {
        return process.exitValue();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }

    public String readStdout(int limit) {
        return readBounded(captureDir.resolve("stdout"), limit);
    }

    public String readStderr(int limit) {
        return readBounded(captureDir.resolve("stderr"), limit);
    }

    private String readBounded(Path file, int limit) {
        if (!Files.exists(file))
            return "";
        try (InputStream content = new BoundedInputStream(Files.newInputStream(file), limit)) {
            return IOUtils.toString(content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read output of {}: {}", label, e.getMessage());
            return "";
        }
    }

    /**
     * Sends SIGTERM to the whole group, waits for the grace period if anything is still running, then SIGKILLs
     * whatever is left. Safe to call repeatedly.
     */
    public synchronized void terminate() {
        if (terminated)
            return;
        terminated = true;
        List<ProcessHandle> descendants = process.descendants().toList();
        if (processGroup)
            signalGroup("TERM");
        process.destroy();
        descendants.forEach(ProcessHandle::destroy);
        try {
            if (process.isAlive() || descendants.stream().anyMatch(ProcessHandle::isAlive))
                process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (processGroup)
            signalGroup("KILL");
        process.destroyForcibly();
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        log.debug("Terminated process group of {} (pid {})", label, process.pid());
    }

    private void signalGroup(String signal) {
        try {
            Process kill = new ProcessBuilder("kill", "-" + signal, "--", "-" + process.pid())
                    .redirectErrorStream(true).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
            if (!kill.waitFor(5, TimeUnit.SECONDS))
                kill.destroyForcibly();
        } catch (IOException e) {
            log.warn("Failed to send SIG{} to process group {}: {}", signal, process.pid(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        terminate();
        FileUtils.deleteQuietly(captureDir.toFile());
    }
}
