package com.netmeasure.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Worker that owns exactly one external process.
 *
 * <p>The command runs through {@code /bin/sh -c} with stdout and stderr captured to temporary
 * files. A graceful stop sends SIGTERM to the process tree and escalates to SIGKILL after
 * {@link #STOP_GRACE_MILLIS}; the partial output is still parsed. A hard kill destroys the tree
 * at once and the output is discarded.
 */
public abstract class ProcessWorker extends Worker {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorker.class);

    static final long POLL_MILLIS = 100;
    static final long STOP_GRACE_MILLIS = 2000;
    static final String CAPTURE_PREFIX = "netmeasure-";

    private volatile Process process;
    private volatile long stopRequestedAtNanos;

    protected ProcessWorker(WorkerContext context) {
        super(context);
        this.command = context.getSpec() != null ? context.getSpec().getCommand() : null;
    }

    /**
     * Parses the captured output of a completed or gracefully stopped process.
     *
     * @param output captured stdout
     * @param error captured stderr
     * @return parsed result
     */
    protected abstract WorkerResult parse(String output, String error);

    @Override
    protected WorkerResult execute() throws Exception {
        if (command == null || command.isBlank()) {
            throw new IllegalStateException("No command set for worker " + getName());
        }
        metadata.put("COMMAND", command);
        if (isHardKilled()) {
            return WorkerResult.empty();
        }

        // Capture files are owned by this thread and removed here on every path.
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile(CAPTURE_PREFIX, ".out");
            stderrFile = Files.createTempFile(CAPTURE_PREFIX, ".err");
            ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command)
                    .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            log.debug("Starting process: worker={}, command={}", getName(), command);
            process = pb.start();
            long startedAt = System.nanoTime();

            // A stop may have arrived between the start signal and the spawn.
            if (isStopRequested()) {
                terminate(!isHardKilled());
            }

            Double killTimeout = getSpec() != null ? getSpec().getKillTimeout() : null;
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (killTimeout != null && killTimeout > 0
                        && System.nanoTime() - startedAt > (long) (killTimeout * 1_000_000_000L)
                        && !isStopRequested()) {
                    log.debug("Kill timeout reached: worker={}, kill_timeout={}", getName(), killTimeout);
                    kill(true);
                }
                long stopAt = stopRequestedAtNanos;
                if (stopAt != 0 && System.nanoTime() - stopAt > TimeUnit.MILLISECONDS.toNanos(STOP_GRACE_MILLIS)) {
                    log.debug("Process did not exit after SIGTERM, sending SIGKILL: worker={}", getName());
                    terminate(false);
                }
            }

            exitCode = process.exitValue();
            stdout = readCaptured(stdoutFile);
            stderr = readCaptured(stderrFile);
        } finally {
            destroyProcessTree();
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }

        if (isHardKilled()) {
            return WorkerResult.empty();
        }
        if (exitCode != 0 && !isStopRequested()) {
            log.warn("Program exited non-zero: worker={}, exit_code={}, command={}, stderr={}",
                    getName(), exitCode, command, stderr.strip());
            return WorkerResult.empty();
        }

        WorkerResult parsed;
        try {
            parsed = parse(stdout, stderr);
        } catch (RuntimeException e) {
            log.warn("Unable to parse output: worker={}, command={}, error={}", getName(), command, e.getMessage());
            return WorkerResult.empty();
        }
        if ((parsed == null || parsed.isEmpty()) && !isSilent()) {
            log.warn("Command produced no valid data: worker={}, kind={}, command={}, stderr={}",
                    getName(), getClass().getSimpleName(), command, stderr.strip());
        }
        return parsed;
    }

    @Override
    protected void onStop(boolean graceful) {
        terminate(graceful);
    }

    private void terminate(boolean graceful) {
        Process p = process;
        if (p == null || !p.isAlive()) {
            return;
        }
        if (graceful) {
            if (stopRequestedAtNanos == 0) {
                stopRequestedAtNanos = System.nanoTime();
            }
            p.descendants().forEach(ProcessHandle::destroy);
            p.destroy();
        } else {
            p.descendants().forEach(ProcessHandle::destroyForcibly);
            p.destroyForcibly();
        }
    }

    /**
     * Kills whatever is left of the process tree. Capture files are removed by the worker thread.
     */
    @Override
    public void close() {
        destroyProcessTree();
    }

    private void destroyProcessTree() {
        Process p = process;
        if (p != null && p.isAlive()) {
            p.descendants().forEach(ProcessHandle::destroyForcibly);
            p.destroyForcibly();
        }
    }

    private static String readCaptured(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Unable to delete temporary file: worker={}, file={}", getName(), file, e);
        }
    }
}
