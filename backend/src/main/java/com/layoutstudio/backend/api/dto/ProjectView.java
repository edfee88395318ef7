package com.layoutstudio.backend.api.dto;

import com.layoutstudio.backend.domain.LayoutDocument;
import com.layoutstudio.backend.domain.NodeId;
import com.layoutstudio.backend.domain.ProjectConfig;
import com.layoutstudio.backend.service.editor.LayoutProject;

import java.time.Instant;

public record ProjectView(
        String id,
        String name,
        String directory,
        ProjectConfig config,
        LayoutDocument document,
        NodeId selectedId,
        boolean dirty,
        boolean canUndo,
        boolean canRedo,
        int undoCount,
        int redoCount,
        Instant updatedAt
) {
    public static ProjectView from(LayoutProject p) {
        synchronized (p) {
            return new ProjectView(
                    p.id(),
                    p.document().name(),
                    p.directory().map(Object::toString).orElse(null),
                    p.config(),
                    p.document(),
                    p.selectedId().orElse(null),
                    p.isDirty(),
                    p.history().canUndo(),
                    p.history().canRedo(),
                    p.history().undoCount(),
                    p.history().redoCount(),
                    p.updatedAt()
            );
        }
    }
}
