package com.raditha.approx.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;

/**
 * Contents of {@code execution_info.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionInfo(
        String appName,
        String executionMode,
        String timestamp,
        LocalDateTime startTime,
        String workspacePath,
        String storageRoot) {
}
