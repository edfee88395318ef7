package com.layoutstudio.backend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * JSON for the API and {@code layout.json}; TOML for {@code layout_studio.toml}.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper om = new ObjectMapper();
        // updatedAt goes out as ISO-8601, not epoch numbers
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Fill and Shrink lengths carry nothing but their "mode" tag
        om.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        // layouts written by newer builds may carry fields we don't know yet
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    @Bean
    public TomlMapper tomlMapper() {
        TomlMapper toml = new TomlMapper();
        // hand-edited config files may carry keys of other tools
        toml.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return toml;
    }
}
