package com.raditha.approx.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools with a hard timeout. Standard error is merged into standard
 * output, which is drained on a separate thread so a chatty tool cannot block on a
 * full pipe. A process that outlives its timeout is destroyed forcibly.
 */
public class ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessRunner.class);

    private static final int MAX_CAPTURED_CHARS = 64 * 1024;

    /**
     * Result of one invocation.
     */
    public record ProcessResult(int exitCode, String output, boolean timedOut, Duration duration) {

        public boolean success() {
            return !timedOut && exitCode == 0;
        }

        /**
         * Last {@code maxLines} lines of output, for error messages.
         */
        public String tail(int maxLines) {
            String[] lines = output.split("\n");
            int from = Math.max(0, lines.length - maxLines);
            return String.join("\n", List.of(lines).subList(from, lines.length));
        }
    }

    public ProcessResult run(List<String> command, Path workingDir, Duration timeout)
            throws IOException, InterruptedException {
        logger.debug("Running: {}", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectErrorStream(true);

        long start = System.nanoTime();
        Process process = pb.start();
        StringBuilder output = new StringBuilder();
        Thread drainer = new Thread(() -> drain(process, output), "process-output-drainer");
        drainer.setDaemon(true);
        drainer.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            logger.warn("Timed out after {}s, killing: {}", timeout.toSeconds(), command.get(0));
            process.destroyForcibly();
            process.waitFor(10, TimeUnit.SECONDS);
        }
        drainer.join(TimeUnit.SECONDS.toMillis(5));

        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        String captured;
        synchronized (output) {
            captured = output.toString();
        }
        int exitCode = finished ? process.exitValue() : -1;
        return new ProcessResult(exitCode, captured, !finished, duration);
    }

    private static void drain(Process process, StringBuilder output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (output) {
                    if (output.length() < MAX_CAPTURED_CHARS) {
                        output.append(line).append("\n");
                    }
                }
            }
        } catch (IOException e) {
            // Stream closes under us when the process is destroyed.
            if (process.isAlive()) {
                logger.warn("Lost output of running process: {}", e.getMessage());
            } else {
                logger.debug("Output stream closed: {}", e.getMessage());
            }
        }
    }
}
