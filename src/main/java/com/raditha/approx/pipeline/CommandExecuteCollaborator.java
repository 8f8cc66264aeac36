package com.raditha.approx.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs executables on an instruction-set simulator. The command is a template whose
 * arguments may contain {@code {executable}}, {@code {input}}, {@code {output}} and
 * {@code {log}}; the simulator is expected to write its instruction trace to
 * {@code {log}}.
 */
public class CommandExecuteCollaborator implements ExecuteCollaborator {

    private static final Logger logger = LoggerFactory.getLogger(CommandExecuteCollaborator.class);

    private final ProcessRunner runner;
    private final List<String> commandTemplate;
    private final Path outputsDir;
    private final Path logsDir;
    private final String outputSuffix;

    public CommandExecuteCollaborator(ProcessRunner runner, List<String> commandTemplate,
                                      Path outputsDir, Path logsDir, String outputSuffix) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("simulator command cannot be empty");
        }
        this.runner = runner;
        this.commandTemplate = List.copyOf(commandTemplate);
        this.outputsDir = outputsDir;
        this.logsDir = logsDir;
        this.outputSuffix = outputSuffix;
    }

    @Override
    public ExecutionResult run(Path executable, String inputData, Duration timeout) throws SimulationException {
        String name = executable.getFileName().toString();
        Path output = outputsDir.resolve(name + outputSuffix);
        Path log = logsDir.resolve(name + ".log");
        List<String> command = commandFor(executable, inputData, output, log);

        ProcessRunner.ProcessResult result;
        try {
            Files.createDirectories(outputsDir);
            Files.createDirectories(logsDir);
            Files.deleteIfExists(output);
            Files.createFile(output);
            result = runner.run(command, null, timeout);
        } catch (IOException e) {
            throw new SimulationException("Cannot run simulator: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationException("Interrupted while simulating " + name, e);
        }

        if (result.timedOut()) {
            discard(log);
            throw new SimulationException("Simulation timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            discard(log);
            throw new SimulationException("Simulator exited with " + result.exitCode() + ":\n" + result.tail(20));
        }
        if (isEmpty(output)) {
            discard(log);
            throw new SimulationException("Simulation produced no output in " + output.getFileName());
        }
        logger.debug("Simulated {} in {} ms", name, result.duration().toMillis());
        return new ExecutionResult(output, log, result.duration());
    }

    private static boolean isEmpty(Path file) {
        try {
            return Files.size(file) == 0;
        } catch (IOException e) {
            logger.warn("Cannot inspect output {}: {}", file, e.getMessage());
            return true;
        }
    }

    private static void discard(Path log) {
        try {
            Files.deleteIfExists(log);
        } catch (IOException e) {
            logger.warn("Could not delete simulator log {}: {}", log, e.getMessage());
        }
    }

    List<String> commandFor(Path executable, String inputData, Path output, Path log) {
        return commandTemplate.stream()
                .map(arg -> arg
                        .replace("{executable}", executable.toString())
                        .replace("{input}", inputData == null ? "" : inputData)
                        .replace("{output}", output.toString())
                        .replace("{log}", log.toString()))
                .filter(arg -> !arg.isEmpty())
                .toList();
    }
}
