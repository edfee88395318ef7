package com.layoutstudio.backend.service.editor;

import com.layoutstudio.backend.domain.LayoutDocument;
import com.layoutstudio.backend.domain.NodeId;
import com.layoutstudio.backend.domain.ProjectConfig;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * An open project: the document under edit with its index, its undo history,
 * the current selection and where it lives on disk (if anywhere).
 */
public class LayoutProject {
    private final String id;
    private final LayoutEditor editor;
    private final EditHistory history;

    private Path directory;
    private ProjectConfig config;
    private NodeId selectedId;
    private boolean dirty;
    private Instant updatedAt;

    public LayoutProject(String id, Path directory, ProjectConfig config, LayoutDocument document, int historyCapacity) {
        this.id = id;
        this.directory = directory;
        this.config = config;
        this.editor = new LayoutEditor(document);
        this.history = new EditHistory(historyCapacity);
        this.updatedAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public LayoutEditor editor() {
        return editor;
    }

    public EditHistory history() {
        return history;
    }

    public LayoutDocument document() {
        return editor.document();
    }

    public Optional<Path> directory() {
        return Optional.ofNullable(directory);
    }

    public void setDirectory(Path directory) {
        this.directory = directory;
    }

    public ProjectConfig config() {
        return config;
    }

    public void setConfig(ProjectConfig config) {
        this.config = config;
    }

    public Optional<NodeId> selectedId() {
        return Optional.ofNullable(selectedId);
    }

    public void select(NodeId id) {
        this.selectedId = id;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        this.dirty = true;
        this.updatedAt = Instant.now();
    }

    public void markSaved() {
        this.dirty = false;
    }

    public Instant updatedAt() {
        return updatedAt;
    }
}
