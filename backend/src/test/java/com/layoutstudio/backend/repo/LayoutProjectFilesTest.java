package com.layoutstudio.backend.repo;

import com.layoutstudio.backend.config.JacksonConfig;
import com.layoutstudio.backend.domain.LayoutDocument;
import com.layoutstudio.backend.domain.ProjectConfig;
import com.layoutstudio.backend.domain.ProjectTemplate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class LayoutProjectFilesTest {

    private final JacksonConfig jackson = new JacksonConfig();
    private final LayoutProjectFiles files = new LayoutProjectFiles(jackson.objectMapper(), jackson.tomlMapper());

    @TempDir
    Path dir;

    @Test
    void configIsWrittenAsSnakeCaseToml() throws Exception {
        ProjectConfig config = new ProjectConfig(null, "gen/view.rs", "app::Msg", null, List.of("layouts/main.json"), false);

        files.saveConfig(dir, config);

        String toml = Files.readString(dir.resolve(LayoutProjectFiles.CONFIG_FILENAME));
        assertTrue(toml.contains("output_file = 'gen/view.rs'") || toml.contains("output_file = \"gen/view.rs\""), toml);
        assertTrue(toml.contains("format_output = false"), toml);
        assertTrue(files.isProject(dir));
        assertEquals(config, files.loadConfig(dir));
    }

    @Test
    void missingKeysFallBackToDefaults() throws Exception {
        Files.writeString(dir.resolve(LayoutProjectFiles.CONFIG_FILENAME), "message_type = \"ui::Message\"\n");

        ProjectConfig config = files.loadConfig(dir);

        assertEquals("ui::Message", config.messageType());
        assertEquals(ProjectConfig.DEFAULT_OUTPUT_FILE, config.outputFile());
        assertEquals(ProjectConfig.DEFAULT_STATE_TYPE, config.stateType());
        assertTrue(config.formatOutput());
    }

    @Test
    void layoutRoundTripsThroughDisk() {
        LayoutDocument doc = ProjectTemplate.FORM.newDocument();

        files.saveLayout(dir, ProjectConfig.defaults(), doc);

        assertTrue(Files.isRegularFile(dir.resolve(LayoutProjectFiles.LAYOUT_FILENAME)));
        assertEquals(doc, files.loadLayout(dir, ProjectConfig.defaults()));
    }

    @Test
    void layoutFilesPickTheFirstExisting() {
        LayoutDocument form = ProjectTemplate.FORM.newDocument();
        LayoutDocument dashboard = ProjectTemplate.DASHBOARD.newDocument();
        files.saveLayout(dir, ProjectConfig.defaults(), dashboard);
        ProjectConfig config = new ProjectConfig(null, null, null, null,
                List.of("missing.json", "ui/form.json"), null);
        files.saveLayout(dir, new ProjectConfig(null, null, null, null, List.of("ui/form.json"), null), form);

        assertEquals(form, files.loadLayout(dir, config));
        assertEquals(dir.resolve("missing.json"), files.layoutFile(dir, config));
    }

    @Test
    void layoutFallsBackToLayoutJson() {
        LayoutDocument doc = ProjectTemplate.DASHBOARD.newDocument();
        files.saveLayout(dir, ProjectConfig.defaults(), doc);
        ProjectConfig config = new ProjectConfig(null, null, null, null, List.of("gone.json"), null);

        assertEquals(doc, files.loadLayout(dir, config));
    }

    @Test
    void outputFileResolvesAgainstProjectRoot() {
        ProjectConfig config = new ProjectConfig("../crate", "src/ui/view.rs", null, null, null, null);

        assertEquals(dir.resolve("../crate").resolve("src/ui/view.rs"), files.outputPath(dir, config));
        assertEquals(dir.resolve(ProjectConfig.DEFAULT_OUTPUT_FILE), files.outputPath(dir, ProjectConfig.defaults()));
    }

    @Test
    void projectRootAndLayoutFilesSurviveToml() throws Exception {
        ProjectConfig config = new ProjectConfig("../app", null, null, null, List.of("a.json", "b.json"), true);

        files.saveConfig(dir, config);

        String toml = Files.readString(dir.resolve(LayoutProjectFiles.CONFIG_FILENAME));
        assertTrue(toml.contains("project_root"), toml);
        assertTrue(toml.contains("layout_files"), toml);
        assertEquals(config, files.loadConfig(dir));
    }

    @Test
    void overwriteKeepsBackup() throws Exception {
        ProjectConfig config = new ProjectConfig(null, "src/ui/view.rs", null, null, null, null);
        files.writeGenerated(dir, config, "first");
        Path out = files.writeGenerated(dir, config, "second");

        assertEquals("second", Files.readString(out, StandardCharsets.UTF_8));
        assertEquals("first", Files.readString(dir.resolve("src/ui/view.rs.bak"), StandardCharsets.UTF_8));
    }

    @Test
    void missingFilesAreNotFound() {
        assertFalse(files.isProject(dir));
        assertThrows(NoSuchElementException.class, () -> files.loadConfig(dir));
        assertThrows(NoSuchElementException.class, () -> files.loadLayout(dir, ProjectConfig.defaults()));
    }

    @Test
    void corruptLayoutIsAStorageError() throws Exception {
        Files.writeString(dir.resolve(LayoutProjectFiles.LAYOUT_FILENAME), "{ not json");

        assertThrows(ProjectStorageException.class, () -> files.loadLayout(dir, ProjectConfig.defaults()));
    }
}
