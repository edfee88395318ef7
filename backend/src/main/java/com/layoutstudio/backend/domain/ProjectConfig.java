package com.layoutstudio.backend.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-project settings, stored as {@code layout_studio.toml} in the project
 * directory.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectConfig(
        String projectRoot,       // target crate root; relative to the project directory, null = the directory itself
        String outputFile,        // relative to the project root unless absolute
        String messageType,       // e.g. crate::Message
        String stateType,         // e.g. crate::AppState
        List<String> layoutFiles, // first existing one is loaded, the first one is saved to
        Boolean formatOutput
) {
    public static final String DEFAULT_OUTPUT_FILE = "src/ui/layout_generated.rs";
    public static final String DEFAULT_MESSAGE_TYPE = "crate::Message";
    public static final String DEFAULT_STATE_TYPE = "crate::AppState";

    public ProjectConfig {
        projectRoot = projectRoot == null || projectRoot.isBlank() ? null : projectRoot.trim();
        outputFile = blankTo(outputFile, DEFAULT_OUTPUT_FILE);
        messageType = blankTo(messageType, DEFAULT_MESSAGE_TYPE);
        stateType = blankTo(stateType, DEFAULT_STATE_TYPE);
        layoutFiles = layoutFiles == null ? List.of() : layoutFiles.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableList());
        formatOutput = formatOutput == null ? Boolean.TRUE : formatOutput;
    }

    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null, null);
    }

    public GenerationConfig generationConfig() {
        return new GenerationConfig(messageType, stateType, formatOutput);
    }

    private static String blankTo(String v, String fallback) {
        return v == null || v.isBlank() ? fallback : v.trim();
    }
}
