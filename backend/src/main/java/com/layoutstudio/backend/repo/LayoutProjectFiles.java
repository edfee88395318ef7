package com.layoutstudio.backend.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.layoutstudio.backend.domain.LayoutDocument;
import com.layoutstudio.backend.domain.ProjectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * On-disk layout of a project directory:
 * <pre>
 * layout_studio.toml   project configuration
 * layout.json          the layout document, unless layout_files names others
 * </pre>
 * Existing files are copied to {@code <name>.bak} before being overwritten.
 */
@Component
public class LayoutProjectFiles {
    private static final Logger log = LoggerFactory.getLogger(LayoutProjectFiles.class);

    public static final String CONFIG_FILENAME = "layout_studio.toml";
    public static final String LAYOUT_FILENAME = "layout.json";

    private final ObjectMapper json;
    private final TomlMapper toml;

    public LayoutProjectFiles(ObjectMapper json, TomlMapper toml) {
        this.json = json;
        this.toml = toml;
    }

    public boolean isProject(Path dir) {
        return Files.isRegularFile(dir.resolve(CONFIG_FILENAME));
    }

    public ProjectConfig loadConfig(Path dir) {
        Path file = dir.resolve(CONFIG_FILENAME);
        if (!Files.isRegularFile(file)) throw new NoSuchElementException("project_config_not_found: " + file);
        log.info("Loading config {}", file);
        try {
            return toml.readValue(file.toFile(), ProjectConfig.class);
        } catch (IOException e) {
            throw new ProjectStorageException("Failed to read config " + file, e);
        }
    }

    public void saveConfig(Path dir, ProjectConfig config) {
        Path file = dir.resolve(CONFIG_FILENAME);
        log.info("Saving config {}", file);
        try {
            write(file, toml.writeValueAsBytes(config));
        } catch (IOException e) {
            throw new ProjectStorageException("Failed to write config " + file, e);
        }
    }

    /**
     * Loads the first entry of {@code layout_files} that exists, falling back
     * to {@code layout.json}.
     */
    public LayoutDocument loadLayout(Path dir, ProjectConfig config) {
        List<Path> candidates = new ArrayList<>();
        for (String name : config.layoutFiles()) candidates.add(dir.resolve(name));
        candidates.add(dir.resolve(LAYOUT_FILENAME));

        Path file = candidates.stream()
                .filter(Files::isRegularFile)
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("layout_not_found: " + candidates.get(0)));
        log.info("Loading layout {}", file);
        try {
            return json.readValue(file.toFile(), LayoutDocument.class);
        } catch (IOException e) {
            throw new ProjectStorageException("Failed to read layout " + file, e);
        }
    }

    /** Saves to the first entry of {@code layout_files}, or {@code layout.json}. */
    public Path saveLayout(Path dir, ProjectConfig config, LayoutDocument document) {
        Path file = layoutFile(dir, config);
        log.info("Saving layout {}", file);
        try {
            write(file, json.writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
        } catch (IOException e) {
            throw new ProjectStorageException("Failed to write layout " + file, e);
        }
        return file;
    }

    public Path layoutFile(Path dir, ProjectConfig config) {
        List<String> names = config.layoutFiles();
        return dir.resolve(names.isEmpty() ? LAYOUT_FILENAME : names.get(0));
    }

    /**
     * Where generated code goes: {@code output_file} against
     * {@code project_root} (itself against the project directory), unless
     * absolute.
     */
    public Path outputPath(Path dir, ProjectConfig config) {
        Path root = config.projectRoot() == null ? dir : dir.resolve(config.projectRoot());
        return root.resolve(config.outputFile());
    }

    public Path writeGenerated(Path dir, ProjectConfig config, String code) {
        Path target = outputPath(dir, config);
        try {
            write(target, code.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ProjectStorageException("Failed to write generated code " + target, e);
        }
        log.info("Generated code written to {} ({} chars)", target, code.length());
        return target;
    }

    private void write(Path file, byte[] content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (Files.exists(file)) {
            Path backup = file.resolveSibling(file.getFileName() + ".bak");
            log.debug("Backing up {} to {}", file, backup);
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.write(file, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }
}
