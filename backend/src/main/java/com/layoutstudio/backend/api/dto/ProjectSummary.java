package com.layoutstudio.backend.api.dto;

import com.layoutstudio.backend.service.editor.LayoutProject;

import java.time.Instant;

public record ProjectSummary(String id, String name, String directory, int nodeCount, boolean dirty, Instant updatedAt) {
    public static ProjectSummary from(LayoutProject p) {
        synchronized (p) {
            return new ProjectSummary(
                    p.id(),
                    p.document().name(),
                    p.directory().map(Object::toString).orElse(null),
                    p.editor().index().size(),
                    p.isDirty(),
                    p.updatedAt()
            );
        }
    }
}
