package com.layoutstudio.backend.domain;

/**
 * Input of the code generator besides the document itself. The generator only
 * relays {@code formatOutput}; formatting happens at export.
 */
public record GenerationConfig(String messageType, String stateType, boolean formatOutput) {

    public static GenerationConfig defaults() {
        return ProjectConfig.defaults().generationConfig();
    }
}
