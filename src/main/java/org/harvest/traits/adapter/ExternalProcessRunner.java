package org.harvest.traits.adapter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.harvest.exception.ExtractionRuntimeException;
import org.jboss.logging.Logger;

/**
 * Runs backend scripts as child processes with a hard timeout.
 */
public class ExternalProcessRunner {

    private static final Logger LOG = Logger.getLogger(ExternalProcessRunner.class);

    private static final int MAX_LOGGED_OUTPUT = 2000;
    private static final Duration KILL_WAIT = Duration.ofSeconds(10);

    /**
     * Runs a command and waits for it to finish. A process that is still running
     * when this method returns, because it timed out or the caller was
     * interrupted, is killed together with its descendants.
     *
     * @param command program and arguments
     * @param workingDir working directory of the child process
     * @param timeout maximum run time; the process is killed when exceeded
     * @return exit code and combined stdout/stderr
     * @throws ExtractionRuntimeException if the process cannot start, times out or is interrupted
     */
    public ProcessResult run(List<String> command, Path workingDir, Duration timeout) {
        Path log = null;
        Process process = null;
        boolean completed = false;
        boolean interrupted = false;
        try {
            log = Files.createTempFile("harvest-process-", ".log");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDir.toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(log.toFile());

            LOG.infof("Executing command: %s", String.join(" ", command));

            process = pb.start();
            completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);

            if (!completed) {
                throw new ExtractionRuntimeException(
                    "Command timed out after " + timeout.toSeconds() + " seconds: " + command.get(0));
            }

            String output = Files.readString(log, StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                LOG.errorf("Command failed with exit code %d. Output: %s", exitCode, truncate(output));
            }
            return new ProcessResult(exitCode, output);
        } catch (IOException e) {
            throw new ExtractionRuntimeException("Failed to run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            interrupted = true;
            throw new ExtractionRuntimeException("Interrupted while running " + command.get(0), e);
        } finally {
            if (process != null && !completed) {
                interrupted |= kill(process, command.get(0));
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            deleteQuietly(log);
        }
    }

    /**
     * Kills the process tree and waits briefly for it to exit.
     *
     * @return true if the calling thread was interrupted while waiting
     */
    private static boolean kill(Process process, String program) {
        LOG.warnf("Killing %s (pid %d)", program, Long.valueOf(process.pid()));
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnf("%s (pid %d) did not exit after being killed", program, Long.valueOf(process.pid()));
            }
            return false;
        } catch (InterruptedException e) {
            LOG.warnf("Interrupted while waiting for %s to exit", program);
            return true;
        }
    }

    static String truncate(String output) {
        if (output == null || output.length() <= MAX_LOGGED_OUTPUT) {
            return output;
        }
        return output.substring(output.length() - MAX_LOGGED_OUTPUT);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debugf("Could not delete %s: %s", path, e.getMessage());
        }
    }
}
