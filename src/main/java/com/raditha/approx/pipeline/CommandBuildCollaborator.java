package com.raditha.approx.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds variants with a cross-compiler invoked as
 * {@code <compiler> <flags> -I<dir>... -o <exe> <variant> <sources>... <libraries>...}.
 */
public class CommandBuildCollaborator implements BuildCollaborator {

    private static final Logger logger = LoggerFactory.getLogger(CommandBuildCollaborator.class);

    private final ProcessRunner runner;
    private final String compiler;
    private final List<String> baseFlags;
    private final List<Path> includeDirs;
    private final List<Path> additionalSources;
    private final List<String> libraries;
    private final Path executablesDir;
    private final String executablePrefix;
    private final Duration timeout;

    public CommandBuildCollaborator(ProcessRunner runner, String compiler, List<String> baseFlags,
                                    List<Path> includeDirs, List<Path> additionalSources, List<String> libraries,
                                    Path executablesDir, String executablePrefix, Duration timeout) {
        this.runner = runner;
        this.compiler = compiler;
        this.baseFlags = List.copyOf(baseFlags);
        this.includeDirs = List.copyOf(includeDirs);
        this.additionalSources = List.copyOf(additionalSources);
        this.libraries = List.copyOf(libraries);
        this.executablesDir = executablesDir;
        this.executablePrefix = executablePrefix == null ? "" : executablePrefix;
        this.timeout = timeout;
    }

    @Override
    public Path compile(List<Path> variantFiles, List<String> flags) throws BuildException {
        if (variantFiles == null || variantFiles.isEmpty()) {
            throw new BuildException("No source files to compile");
        }
        Path executable = executablesDir.resolve(executablePrefix + stem(variantFiles.get(0)));
        List<String> command = buildCommand(variantFiles, flags, executable);

        ProcessRunner.ProcessResult result;
        try {
            Files.createDirectories(executablesDir);
            result = runner.run(command, null, timeout);
        } catch (IOException e) {
            throw new BuildException("Cannot run " + compiler + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildException("Interrupted while compiling " + variantFiles.get(0).getFileName(), e);
        }

        if (result.timedOut()) {
            throw new BuildException("Compilation timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            throw new BuildException("Compiler exited with " + result.exitCode() + ":\n" + result.tail(20));
        }
        if (!Files.exists(executable)) {
            throw new BuildException("Compiler reported success but " + executable + " is missing");
        }
        logger.debug("Built {} in {} ms", executable.getFileName(), result.duration().toMillis());
        return executable;
    }

    List<String> buildCommand(List<Path> variantFiles, List<String> flags, Path executable) {
        List<String> command = new ArrayList<>();
        command.add(compiler);
        command.addAll(baseFlags);
        if (flags != null) {
            command.addAll(flags);
        }
        for (Path dir : includeDirs) {
            command.add("-I" + dir);
        }
        command.add("-o");
        command.add(executable.toString());
        variantFiles.forEach(f -> command.add(f.toString()));
        additionalSources.forEach(f -> command.add(f.toString()));
        command.addAll(libraries);
        return command;
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
