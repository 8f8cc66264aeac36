package com.raditha.approx.workspace;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Directory tree that holds everything one run produces: variants, executables, program
 * outputs, logs, energy reports, modified-lines records, the cache and the checkpoint.
 * <p>
 * New workspaces are named {@code <app>_<mode>_<yyyyMMdd_HHmmss>} under the storage root.
 * Opening an existing workspace lets a later run resume from its cache and checkpoint.
 */
public class ExecutionWorkspace {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionWorkspace.class);

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final String INFO_FILE = "execution_info.json";
    public static final String CACHE_FILE = "executed_variants.jsonl";
    public static final String CHECKPOINT_FILE = "checkpoint.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path root;

    private ExecutionWorkspace(Path root) {
        this.root = root;
    }

    /**
     * Create a fresh workspace and write its {@code execution_info.json}.
     */
    public static ExecutionWorkspace create(Path storageRoot, String appName, String mode, LocalDateTime start)
            throws IOException {
        String timestamp = start.format(TIMESTAMP_FORMAT);
        Path root = storageRoot.resolve(appName + "_" + mode + "_" + timestamp);
        ExecutionWorkspace workspace = new ExecutionWorkspace(root);
        workspace.createDirectories();

        ExecutionInfo info = new ExecutionInfo(appName, mode, timestamp, start, root.toString(),
                storageRoot.toString());
        mapper.writerWithDefaultPrettyPrinter().writeValue(root.resolve(INFO_FILE).toFile(), info);
        logger.info("Workspace created: {}", root);
        return workspace;
    }

    /**
     * Reuse an existing workspace. Missing subdirectories are created.
     */
    public static ExecutionWorkspace open(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Workspace does not exist: " + root);
        }
        ExecutionWorkspace workspace = new ExecutionWorkspace(root);
        workspace.createDirectories();
        logger.info("Reusing workspace: {}", root);
        return workspace;
    }

    private void createDirectories() throws IOException {
        for (Path dir : new Path[]{getVariantsDir(), getExecutablesDir(), getOutputsDir(), getLogsDir(),
                getEnergyReportsDir(), getModifiedLinesDir()}) {
            Files.createDirectories(dir);
        }
    }

    /**
     * The information written when the workspace was created, if readable.
     */
    public Optional<ExecutionInfo> readInfo() {
        Path file = root.resolve(INFO_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), ExecutionInfo.class));
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Copy the approximate-operations header next to the variants so they compile from
     * the variants directory.
     */
    public Path installHeader(Path header) throws IOException {
        Path target = getVariantsDir().resolve(header.getFileName());
        Files.copy(header, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    public Path getRoot() {
        return root;
    }

    public Path getVariantsDir() {
        return root.resolve("variants");
    }

    public Path getExecutablesDir() {
        return root.resolve("executables");
    }

    public Path getOutputsDir() {
        return root.resolve("outputs");
    }

    public Path getLogsDir() {
        return root.resolve("logs");
    }

    public Path getEnergyReportsDir() {
        return root.resolve("energy-reports");
    }

    public Path getModifiedLinesDir() {
        return root.resolve("modified-lines");
    }

    public Path getCacheFile() {
        return root.resolve(CACHE_FILE);
    }

    public Path getCheckpointFile() {
        return root.resolve(CHECKPOINT_FILE);
    }
}
