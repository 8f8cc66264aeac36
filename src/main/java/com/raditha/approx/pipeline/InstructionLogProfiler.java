package com.raditha.approx.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Energy and latency estimate from an instruction trace.
 * <p>
 * The trace is either a simulator commit log ({@code core 0: 0x... (0x...) fmul.s ...})
 * or a JSON object of pre-counted mnemonics. Each executed instruction known to the
 * {@link EnergyModel} contributes {@code cycles} to latency and
 * {@code power * cycles} to energy:
 * <pre>
 * latency_ms = sum(count * cycles) / freqHz * 1000
 * energy     = sum(count * cycles * power) / freqHz * 1000
 * </pre>
 * A report with the totals and a per-instruction breakdown is written next to the other
 * energy reports.
 */
public class InstructionLogProfiler implements ProfileCollaborator {

    private static final Logger logger = LoggerFactory.getLogger(InstructionLogProfiler.class);

    private static final Pattern COMMIT_LINE = Pattern.compile(
            "core\\s+\\d+:\\s+0x[0-9a-f]+\\s+\\(0x[0-9a-f]+\\)\\s+(\\S+)", Pattern.CASE_INSENSITIVE);

    private static final ObjectMapper mapper = new ObjectMapper();

    private final Path reportsDir;

    public InstructionLogProfiler(Path reportsDir) {
        this.reportsDir = reportsDir;
    }

    public record InstructionDetail(long count, double cyclesPerInstruction, double power,
                                    double totalCycles, double energyContribution) {
    }

    public record Summary(String core, double freqMhz, long totalInstructions, long mappedInstructions,
                          int unmappedCount, double cycles, double ipc, double latencyMs, double energy) {
    }

    public record EnergyReport(Summary summary, Map<String, InstructionDetail> detailed, List<String> unmapped) {
    }

    @Override
    public ProfileResult profile(Path executionLog, Path energyModel) throws ProfileException {
        EnergyModel model;
        try {
            model = EnergyModel.load(energyModel);
        } catch (IOException e) {
            throw new ProfileException("Cannot load energy model: " + e.getMessage(), e);
        }

        Map<String, Long> counts;
        try {
            counts = countInstructions(executionLog);
        } catch (IOException e) {
            throw new ProfileException("Cannot read execution log " + executionLog + ": " + e.getMessage(), e);
        }
        if (counts.isEmpty()) {
            throw new ProfileException("No instructions found in " + executionLog.getFileName());
        }

        EnergyReport report = evaluate(counts, model);
        if (report.summary().cycles() <= 0) {
            throw new ProfileException("None of the executed instructions are in the energy model");
        }

        Path reportPath = reportsDir.resolve(stem(executionLog) + "_energy.json");
        try {
            Files.createDirectories(reportsDir);
            mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        } catch (IOException e) {
            throw new ProfileException("Cannot write energy report: " + e.getMessage(), e);
        }
        return new ProfileResult(report.summary().latencyMs(), report.summary().energy(), reportPath);
    }

    /**
     * Mnemonic histogram of a commit log or of a pre-counted JSON object.
     */
    public Map<String, Long> countInstructions(Path log) throws IOException {
        if (!Files.exists(log)) {
            throw new IOException("file not found");
        }
        Map<String, Long> precounted = readPrecounted(log);
        if (precounted != null) {
            return precounted;
        }

        Map<String, Long> counts = new TreeMap<>();
        long lines = 0;
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(log), decoder), 1 << 17)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines++;
                Matcher m = COMMIT_LINE.matcher(line);
                if (m.find()) {
                    counts.merge(m.group(1).toLowerCase(Locale.ROOT), 1L, Long::sum);
                }
            }
        }
        logger.debug("Counted {} instruction kinds in {} log lines", counts.size(), lines);
        return counts;
    }

    public EnergyReport evaluate(Map<String, Long> counts, EnergyModel model) {
        double freqHz = model.frequencyHz();
        double totalCycles = 0;
        double accumulatedPower = 0;
        long total = 0;
        long mapped = 0;
        Map<String, InstructionDetail> detailed = new TreeMap<>();
        List<String> unmapped = new ArrayList<>();

        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            long count = entry.getValue();
            total += count;
            EnergyModel.InstructionCost cost = model.costOf(entry.getKey());
            if (cost == null) {
                unmapped.add(entry.getKey());
                continue;
            }
            double cycles = cost.cycles() * count;
            double energy = cost.power() * count * cost.cycles();
            totalCycles += cycles;
            accumulatedPower += energy;
            mapped += count;
            detailed.put(entry.getKey(), new InstructionDetail(count, cost.cycles(), cost.power(), cycles, energy));
        }

        double latencyMs = totalCycles / freqHz * 1000;
        double energy = accumulatedPower / freqHz * 1000;
        double ipc = totalCycles > 0 ? mapped / totalCycles : 0;
        Summary summary = new Summary(model.core(), model.freqMhz(), total, mapped, unmapped.size(),
                totalCycles, ipc, latencyMs, energy);
        return new EnergyReport(summary, detailed, unmapped);
    }

    private static Map<String, Long> readPrecounted(Path log) throws IOException {
        String head;
        try (BufferedReader reader = Files.newBufferedReader(log, StandardCharsets.UTF_8)) {
            char[] buffer = new char[64];
            int read = reader.read(buffer);
            head = read <= 0 ? "" : new String(buffer, 0, read).strip();
        } catch (MalformedInputException e) {
            logger.debug("{} is not text JSON, reading it as a commit log", log.getFileName());
            return null;
        }
        if (!head.startsWith("{")) {
            return null;
        }
        try {
            Map<String, Object> raw = mapper.readValue(log.toFile(), new TypeReference<Map<String, Object>>() { });
            Map<String, Long> counts = new TreeMap<>();
            raw.forEach((k, v) -> {
                if (v instanceof Number n) {
                    counts.put(k.toLowerCase(Locale.ROOT), n.longValue());
                }
            });
            return counts;
        } catch (JsonProcessingException e) {
            logger.debug("{} looks like JSON but does not parse, reading it as a commit log", log.getFileName());
            return null;
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
