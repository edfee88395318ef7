package com.layoutstudio.backend.config;

import com.layoutstudio.backend.domain.ProjectConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code layout-studio.*} settings from application.yml.
 */
@ConfigurationProperties(prefix = "layout-studio")
public record LayoutStudioProperties(
        Integer historyCapacity,
        Defaults defaults,
        Rustfmt rustfmt
) {
    public LayoutStudioProperties {
        historyCapacity = historyCapacity == null ? 50 : historyCapacity;
        defaults = defaults == null ? new Defaults(null, null, null, null) : defaults;
        rustfmt = rustfmt == null ? new Rustfmt(null, null) : rustfmt;
    }

    /** Configuration given to newly created projects. */
    public record Defaults(String outputFile, String messageType, String stateType, Boolean formatOutput) {
        public ProjectConfig toProjectConfig() {
            return new ProjectConfig(null, outputFile, messageType, stateType, null, formatOutput);
        }
    }

    public record Rustfmt(String command, Duration timeout) {
        public Rustfmt {
            command = command == null || command.isBlank() ? "rustfmt" : command;
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        }
    }
}
