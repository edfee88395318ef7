package com.layoutstudio.backend.api;

import com.layoutstudio.backend.api.dto.*;
import com.layoutstudio.backend.domain.*;
import com.layoutstudio.backend.service.LayoutProjectService;
import com.layoutstudio.backend.service.LayoutProjectService.EditOutcome;
import com.layoutstudio.backend.service.LayoutProjectService.ExportResult;
import com.layoutstudio.backend.service.editor.LayoutProject;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/projects")
public class LayoutProjectController {

    private final LayoutProjectService projects;

    public LayoutProjectController(LayoutProjectService projects) {
        this.projects = projects;
    }

    public record CreateReq(String name, String template, String directory) {}
    public record OpenReq(String directory) {}
    public record SaveReq(String directory) {}
    public record AddNodeReq(String kind, String parentId) {}
    public record SelectReq(String nodeId) {}

    @GetMapping
    public List<ProjectSummary> list() {
        return projects.list().stream().map(ProjectSummary::from).collect(Collectors.toList());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectView create(@RequestBody(required = false) CreateReq body) {
        LayoutProject p = projects.create(
                body == null ? null : body.name(),
                body == null ? ProjectTemplate.BLANK : ProjectTemplate.parse(body.template()),
                body == null ? null : body.directory()
        );
        return ProjectView.from(p);
    }

    @PostMapping("/open")
    public ProjectView open(@RequestBody OpenReq body) {
        return ProjectView.from(projects.open(body == null ? null : body.directory()));
    }

    @GetMapping("/{id}")
    public ProjectView get(@PathVariable String id) {
        return ProjectView.from(projects.get(id));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void close(@PathVariable String id) {
        projects.close(id);
    }

    @PostMapping("/{id}/save")
    public ProjectView save(@PathVariable String id, @RequestBody(required = false) SaveReq body) {
        return ProjectView.from(projects.save(id, body == null ? null : body.directory()));
    }

    @PutMapping("/{id}/config")
    public ProjectView updateConfig(@PathVariable String id, @RequestBody ProjectConfig config) {
        return ProjectView.from(projects.updateConfig(id, config));
    }

    // ---- nodes

    @PostMapping("/{id}/nodes")
    public ResponseEntity<EditResponse> addNode(@PathVariable String id, @RequestBody AddNodeReq body) {
        if (body == null) throw new IllegalArgumentException("kind_required");
        NodeId parent = body.parentId() == null || body.parentId().isBlank() ? null : NodeId.parse(body.parentId());
        EditOutcome outcome = projects.addWidget(id, WidgetKind.parse(body.kind()), parent);
        return respond(id, outcome, HttpStatus.CREATED);
    }

    @GetMapping("/{id}/nodes/{nodeId}")
    public LayoutNode getNode(@PathVariable String id, @PathVariable String nodeId) {
        return projects.findNode(id, NodeId.parse(nodeId));
    }

    @PatchMapping("/{id}/nodes/{nodeId}")
    public ResponseEntity<EditResponse> updateNode(@PathVariable String id,
                                                   @PathVariable String nodeId,
                                                   @RequestBody WidgetPatch patch) {
        return respond(id, projects.updateNode(id, NodeId.parse(nodeId), patch), HttpStatus.OK);
    }

    @DeleteMapping("/{id}/nodes/{nodeId}")
    public ResponseEntity<EditResponse> removeNode(@PathVariable String id, @PathVariable String nodeId) {
        return respond(id, projects.removeNode(id, NodeId.parse(nodeId)), HttpStatus.OK);
    }

    @PutMapping("/{id}/selection")
    public ProjectView select(@PathVariable String id, @RequestBody SelectReq body) {
        projects.select(id, NodeId.parse(body == null ? null : body.nodeId()));
        return ProjectView.from(projects.get(id));
    }

    @DeleteMapping("/{id}/selection")
    public ProjectView deselect(@PathVariable String id) {
        projects.deselect(id);
        return ProjectView.from(projects.get(id));
    }

    // ---- history

    @PostMapping("/{id}/undo")
    public ResponseEntity<EditResponse> undo(@PathVariable String id) {
        return respond(id, projects.undo(id), HttpStatus.OK);
    }

    @PostMapping("/{id}/redo")
    public ResponseEntity<EditResponse> redo(@PathVariable String id) {
        return respond(id, projects.redo(id), HttpStatus.OK);
    }

    // ---- output

    @GetMapping("/{id}/validation")
    public ValidationReport validate(@PathVariable String id) {
        return ValidationReport.of(projects.validate(id));
    }

    @GetMapping(value = "/{id}/code", produces = MediaType.TEXT_PLAIN_VALUE)
    public String code(@PathVariable String id) {
        return projects.generate(id);
    }

    @PostMapping("/{id}/export")
    public ExportResult export(@PathVariable String id) {
        return projects.export(id);
    }

    private ResponseEntity<EditResponse> respond(String id, EditOutcome outcome, HttpStatus onSuccess) {
        EditResponse body = EditResponse.of(outcome, projects.get(id));
        return ResponseEntity.status(outcome.applied() ? onSuccess : HttpStatus.CONFLICT).body(body);
    }
}
