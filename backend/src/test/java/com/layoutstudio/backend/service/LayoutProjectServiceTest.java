package com.layoutstudio.backend.service;

import com.layoutstudio.backend.config.JacksonConfig;
import com.layoutstudio.backend.config.LayoutStudioProperties;
import com.layoutstudio.backend.domain.*;
import com.layoutstudio.backend.repo.InMemoryStore;
import com.layoutstudio.backend.repo.LayoutProjectFiles;
import com.layoutstudio.backend.service.LayoutProjectService.EditOutcome;
import com.layoutstudio.backend.service.LayoutProjectService.ExportResult;
import com.layoutstudio.backend.service.codegen.RustCodeGenerator;
import com.layoutstudio.backend.service.codegen.RustFormatter;
import com.layoutstudio.backend.service.editor.LayoutProject;
import com.layoutstudio.backend.service.validation.LayoutValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class LayoutProjectServiceTest {

    private LayoutProjectService service;

    @BeforeEach
    void setUp() {
        JacksonConfig jackson = new JacksonConfig();
        LayoutStudioProperties props = new LayoutStudioProperties(null, null,
                new LayoutStudioProperties.Rustfmt("layout-studio-no-such-rustfmt", Duration.ofSeconds(5)));
        service = new LayoutProjectService(
                new InMemoryStore(),
                new LayoutProjectFiles(jackson.objectMapper(), jackson.tomlMapper()),
                new LayoutValidator(),
                new RustCodeGenerator(),
                new RustFormatter(props),
                props);
    }

    private static WidgetPatch contentPatch(String content) {
        return new WidgetPatch(content, null, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    void blankProjectStartsWithEmptyColumn() {
        LayoutProject p = service.create("Blank", ProjectTemplate.BLANK, null);

        assertEquals("Blank", p.document().name());
        assertTrue(p.document().root().widget() instanceof Widget.Column);
        assertTrue(p.document().root().children().isEmpty());
        assertFalse(p.history().canUndo());
        assertFalse(p.isDirty());
        assertSame(p, service.get(p.id()));
    }

    @Test
    void addWithoutSelectionGoesToRootAndSelectsNewNode() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);

        EditOutcome outcome = service.addWidget(p.id(), WidgetKind.BUTTON, null);

        assertTrue(outcome.applied());
        assertEquals(outcome.nodeId(), p.document().root().children().get(0).id());
        assertEquals(outcome.nodeId(), p.selectedId().orElseThrow());
        assertEquals(1, p.history().undoCount());
        assertTrue(p.isDirty());
    }

    @Test
    void addGoesIntoSelectedContainer() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId row = service.addWidget(p.id(), WidgetKind.ROW, null).nodeId();

        NodeId text = service.addWidget(p.id(), WidgetKind.TEXT, null).nodeId();

        assertEquals(List.of(0, 0), p.editor().index().pathOf(text).orElseThrow());
        assertTrue(p.editor().index().contains(row));
    }

    @Test
    void selectedLeafFallsBackToRoot() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId first = service.addWidget(p.id(), WidgetKind.TEXT, null).nodeId();
        service.select(p.id(), first);

        service.addWidget(p.id(), WidgetKind.SLIDER, null);

        assertEquals(2, p.document().root().children().size());
    }

    @Test
    void refusedAddLeavesDocumentAndUndoStackAlone() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId text = service.addWidget(p.id(), WidgetKind.TEXT, null).nodeId();
        LayoutDocument before = p.document();
        int undoBefore = p.history().undoCount();

        EditOutcome outcome = service.addWidget(p.id(), WidgetKind.BUTTON, text);

        assertFalse(outcome.applied());
        assertSame(before, p.document());
        assertEquals(undoBefore, p.history().undoCount());
        assertEquals(text, p.selectedId().orElseThrow());
    }

    @Test
    void removingSelectedNodeClearsSelection() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId text = service.addWidget(p.id(), WidgetKind.TEXT, null).nodeId();

        assertTrue(service.removeNode(p.id(), text).applied());

        assertTrue(p.selectedId().isEmpty());
        assertTrue(p.document().root().children().isEmpty());
    }

    @Test
    void removingRootIsRefused() {
        LayoutProject p = service.create(null, ProjectTemplate.FORM, null);

        EditOutcome outcome = service.removeNode(p.id(), p.editor().rootId());

        assertFalse(outcome.applied());
        assertEquals(0, p.history().undoCount());
    }

    @Test
    void undoAndRedoSwapWholeDocuments() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        LayoutDocument empty = p.document();
        NodeId text = service.addWidget(p.id(), WidgetKind.TEXT, null).nodeId();
        LayoutDocument withText = p.document();

        assertTrue(service.undo(p.id()).applied());
        assertSame(empty, p.document());
        assertFalse(p.editor().index().contains(text));
        assertTrue(p.selectedId().isEmpty());

        assertTrue(service.redo(p.id()).applied());
        assertSame(withText, p.document());
        assertTrue(p.editor().find(text).isPresent());

        assertFalse(service.redo(p.id()).applied());
    }

    @Test
    void undoWithEmptyHistoryIsRefused() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);

        assertFalse(service.undo(p.id()).applied());
    }

    @Test
    void patchUpdatesNodeInPlace() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId text = service.addWidget(p.id(), WidgetKind.TEXT, null).nodeId();

        assertTrue(service.updateNode(p.id(), text, contentPatch("Hello")).applied());

        Widget.Text widget = (Widget.Text) service.findNode(p.id(), text).widget();
        assertEquals("Hello", widget.content());
        assertEquals(2, p.history().undoCount());
    }

    @Test
    void emptyPatchIsBadInput() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);

        assertThrows(IllegalArgumentException.class,
                () -> service.updateNode(p.id(), p.editor().rootId(), contentPatch(null)));
    }

    @Test
    void nullOptionIsBadInputAndLeavesHistoryAlone() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId pick = service.addWidget(p.id(), WidgetKind.PICK_LIST, null).nodeId();
        service.addWidget(p.id(), WidgetKind.TEXT, null);
        service.undo(p.id());
        LayoutDocument before = p.document();
        WidgetPatch patch = new WidgetPatch(null, null, null, null, null, Arrays.asList("a", null),
                null, null, null, null, null, null);

        assertThrows(IllegalArgumentException.class, () -> service.updateNode(p.id(), pick, patch));

        assertSame(before, p.document());
        assertEquals(1, p.history().undoCount());
        assertEquals(1, p.history().redoCount());
    }

    @Test
    void refusedAddKeepsPendingRedo() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId button = service.addWidget(p.id(), WidgetKind.BUTTON, null).nodeId();
        NodeId text = service.addWidget(p.id(), WidgetKind.TEXT, null).nodeId();
        LayoutDocument withText = p.document();
        service.undo(p.id());

        assertFalse(service.addWidget(p.id(), WidgetKind.TEXT, button).applied());
        assertFalse(service.removeNode(p.id(), p.editor().rootId()).applied());
        assertFalse(service.removeNode(p.id(), NodeId.random()).applied());
        assertFalse(service.updateNode(p.id(), NodeId.random(), contentPatch("x")).applied());

        assertTrue(service.redo(p.id()).applied());
        assertSame(withText, p.document());
        assertTrue(p.editor().find(text).isPresent());
        assertFalse(p.history().canRedo());
        assertEquals(2, p.history().undoCount());
    }

    @Test
    void addIntoFullWrapperIsRefusedWithoutHistory() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId box = service.addWidget(p.id(), WidgetKind.CONTAINER, null).nodeId();
        service.addWidget(p.id(), WidgetKind.TEXT, box);
        int undoBefore = p.history().undoCount();

        assertFalse(service.addWidget(p.id(), WidgetKind.TEXT, box).applied());

        assertEquals(undoBefore, p.history().undoCount());
        assertFalse(p.history().canRedo());
    }

    @Test
    void patchOfUnknownNodeIsRefused() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);

        assertFalse(service.updateNode(p.id(), NodeId.random(), contentPatch("x")).applied());
        assertEquals(0, p.history().undoCount());
    }

    @Test
    void exportIsRefusedWhileLayoutHasErrors() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);
        NodeId button = service.addWidget(p.id(), WidgetKind.BUTTON, null).nodeId();
        service.updateNode(p.id(), button,
                new WidgetPatch(null, null, "match", null, null, null, null, null, null, null, null, null));

        assertThrows(IllegalStateException.class, () -> service.export(p.id()));
    }

    @Test
    void exportWithoutDirectoryOnlyReturnsCode() {
        LayoutProject p = service.create(null, ProjectTemplate.FORM, null);

        ExportResult result = service.export(p.id());

        assertNull(result.path());
        assertEquals(service.generate(p.id()), result.code());
    }

    @Test
    void exportWritesConfiguredOutputFile(@TempDir Path dir) throws Exception {
        LayoutProject p = service.create("Form", ProjectTemplate.FORM, dir.toString());

        ExportResult result = service.export(p.id());

        Path out = dir.resolve(ProjectConfig.DEFAULT_OUTPUT_FILE);
        assertEquals(out.toString(), result.path());
        assertEquals(result.code(), Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void savedProjectReopensIdentically(@TempDir Path dir) {
        LayoutProject p = service.create("Dash", ProjectTemplate.DASHBOARD, null);
        service.addWidget(p.id(), WidgetKind.PICK_LIST, null);

        service.save(p.id(), dir.toString());
        LayoutProject reopened = service.open(dir.toString());

        assertFalse(p.isDirty());
        assertNotEquals(p.id(), reopened.id());
        assertEquals(p.document(), reopened.document());
        assertEquals(p.config(), reopened.config());
        assertEquals(2, service.list().size());
    }

    @Test
    void saveAndExportFollowProjectConfig(@TempDir Path dir) throws Exception {
        LayoutProject p = service.create("Form", ProjectTemplate.FORM, null);
        service.updateConfig(p.id(), new ProjectConfig("app", "src/view.rs", null, null,
                List.of("ui/main_layout.json"), false));

        service.save(p.id(), dir.toString());
        ExportResult result = service.export(p.id());

        assertTrue(Files.isRegularFile(dir.resolve("ui/main_layout.json")));
        assertFalse(Files.exists(dir.resolve("layout.json")));
        assertEquals(dir.resolve("app/src/view.rs").toString(), result.path());
        assertEquals(p.document(), service.open(dir.toString()).document());
    }

    @Test
    void saveNeedsADirectory() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);

        assertThrows(IllegalStateException.class, () -> service.save(p.id(), null));
    }

    @Test
    void unknownProjectIsNotFound() {
        assertThrows(NoSuchElementException.class, () -> service.get("nope"));
        assertThrows(NoSuchElementException.class, () -> service.close("nope"));
    }

    @Test
    void selectingUnknownNodeIsNotFound() {
        LayoutProject p = service.create(null, ProjectTemplate.BLANK, null);

        assertThrows(NoSuchElementException.class, () -> service.select(p.id(), NodeId.random()));
    }
}
