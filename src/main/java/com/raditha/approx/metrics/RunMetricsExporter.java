package com.raditha.approx.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.approx.search.SearchSummary;
import com.raditha.approx.search.VariantResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Exports the outcome of a run to CSV and JSON for later analysis.
 */
public class RunMetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Run-level metrics.
     */
    public record RunMetrics(
            String application,
            String mode,
            LocalDateTime startTime,
            LocalDateTime endTime,
            long durationMillis,
            int workers,
            int candidates,
            int evaluated,
            int succeeded,
            int failed,
            int pruned,
            int skipped,
            double baselineEnergy,
            double baselineLatency,
            String workspace,
            List<String> artifacts,
            List<VariantRow> variants) {
    }

    /**
     * Per-variant metrics.
     */
    public record VariantRow(
            String hash,
            String modifiedLines,
            String status,
            String reason,
            Double error,
            Double energy,
            Double latency,
            Double energyRatio,
            Double cost,
            boolean fromCache) {
    }

    public RunMetrics buildMetrics(String application, SearchSummary summary, int workers, Path workspace,
                                   LocalDateTime start, LocalDateTime end) {
        List<VariantRow> rows = summary.results().stream()
                .map(RunMetricsExporter::toRow)
                .toList();
        List<String> artifacts = summary.artifacts().stream()
                .map(Path::toString)
                .toList();
        return new RunMetrics(
                application,
                summary.mode().toCliString(),
                start,
                end,
                Duration.between(start, end).toMillis(),
                workers,
                summary.candidates(),
                summary.evaluated(),
                summary.succeeded(),
                summary.failed(),
                summary.pruned(),
                summary.skipped(),
                summary.baseline() == null ? 0.0 : summary.baseline().energy(),
                summary.baseline() == null ? 0.0 : summary.baseline().latency(),
                workspace == null ? null : workspace.toString(),
                artifacts,
                rows);
    }

    private static VariantRow toRow(VariantResult result) {
        String lines = result.modifiedLines().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(";"));
        return new VariantRow(
                result.identityHash(),
                lines,
                result.status().name(),
                result.reason(),
                result.error(),
                result.energy(),
                result.latency(),
                result.energyRatio(),
                result.cost(),
                result.fromCache());
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Run Summary\n");
        csv.append("start,end,application,mode,workers,candidates,evaluated,succeeded,failed,pruned,skipped,"
                + "baseline_energy,baseline_latency_ms\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%s,%s,%d,%d,%d,%d,%d,%d,%d,%.6f,%.6f\n",
                metrics.startTime().format(TIMESTAMP_FORMAT),
                metrics.endTime().format(TIMESTAMP_FORMAT),
                metrics.application(),
                metrics.mode(),
                metrics.workers(),
                metrics.candidates(),
                metrics.evaluated(),
                metrics.succeeded(),
                metrics.failed(),
                metrics.pruned(),
                metrics.skipped(),
                metrics.baselineEnergy(),
                metrics.baselineLatency()));

        csv.append("\n");

        csv.append("# Per-Variant Metrics\n");
        csv.append("hash,modified_lines,status,reason,error,energy,latency_ms,energy_ratio,cost,from_cache\n");
        for (VariantRow row : metrics.variants()) {
            csv.append(String.join(",",
                    row.hash() == null ? "" : row.hash(),
                    row.modifiedLines(),
                    row.status(),
                    row.reason() == null ? "" : row.reason(),
                    format(row.error()),
                    format(row.energy()),
                    format(row.latency()),
                    format(row.energyRatio()),
                    format(row.cost()),
                    String.valueOf(row.fromCache())));
            csv.append("\n");
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(RunMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    public String toJson(RunMetrics metrics) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(metrics);
    }

    private static String format(Double value) {
        return value == null ? "" : String.format(Locale.ROOT, "%.6f", value);
    }
}
