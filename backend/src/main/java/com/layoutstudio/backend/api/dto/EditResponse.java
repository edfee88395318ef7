package com.layoutstudio.backend.api.dto;

import com.layoutstudio.backend.domain.NodeId;
import com.layoutstudio.backend.service.LayoutProjectService.EditOutcome;
import com.layoutstudio.backend.service.editor.LayoutProject;

/** Outcome of an edit plus the project as it stands afterwards. */
public record EditResponse(boolean applied, String message, NodeId nodeId, ProjectView project) {
    public static EditResponse of(EditOutcome outcome, LayoutProject p) {
        return new EditResponse(outcome.applied(), outcome.message(), outcome.nodeId(), ProjectView.from(p));
    }
}
