package com.raditha.approx.workflow;

/**
 * Formats of the run report written to the workspace.
 */
public enum ExportFormat {
    CSV,
    JSON,
    BOTH;

    public static ExportFormat fromString(String value) {
        return switch (value.toLowerCase()) {
            case "csv" -> CSV;
            case "json" -> JSON;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Invalid export format: " + value + ". Must be: csv, json or both");
        };
    }

    public boolean includesCsv() {
        return this == CSV || this == BOTH;
    }

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }
}
