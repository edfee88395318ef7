package com.layoutstudio.backend.service;

import com.layoutstudio.backend.config.LayoutStudioProperties;
import com.layoutstudio.backend.domain.*;
import com.layoutstudio.backend.repo.InMemoryStore;
import com.layoutstudio.backend.repo.LayoutProjectFiles;
import com.layoutstudio.backend.service.codegen.RustCodeGenerator;
import com.layoutstudio.backend.service.codegen.RustFormatter;
import com.layoutstudio.backend.service.editor.LayoutEditor;
import com.layoutstudio.backend.service.editor.LayoutProject;
import com.layoutstudio.backend.service.validation.LayoutValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Open projects and the edit commands run against them. Each command locks
 * its project, so the editor underneath only ever sees one caller at a time.
 */
@Service
public class LayoutProjectService {
    private static final Logger log = LoggerFactory.getLogger(LayoutProjectService.class);

    private final InMemoryStore store;
    private final LayoutProjectFiles files;
    private final LayoutValidator validator;
    private final RustCodeGenerator generator;
    private final RustFormatter formatter;
    private final LayoutStudioProperties props;

    public LayoutProjectService(InMemoryStore store,
                                LayoutProjectFiles files,
                                LayoutValidator validator,
                                RustCodeGenerator generator,
                                RustFormatter formatter,
                                LayoutStudioProperties props) {
        this.store = store;
        this.files = files;
        this.validator = validator;
        this.generator = generator;
        this.formatter = formatter;
        this.props = props;
    }

    /**
     * Result of an edit command. {@code applied == false} is a normal refusal
     * (nothing changed, no history entry left behind).
     */
    public record EditOutcome(boolean applied, String message, NodeId nodeId) {
        static EditOutcome applied(String message, NodeId nodeId) {
            return new EditOutcome(true, message, nodeId);
        }

        static EditOutcome refused(String message, NodeId nodeId) {
            return new EditOutcome(false, message, nodeId);
        }
    }

    public record ExportResult(String code, String path) {}

    // ---- project lifecycle

    public LayoutProject create(String name, ProjectTemplate template, String directory) {
        LayoutDocument doc = (template == null ? ProjectTemplate.BLANK : template).newDocument();
        if (name != null && !name.isBlank()) doc = doc.withName(name.trim());

        Path dir = directory == null || directory.isBlank() ? null : Path.of(directory);
        LayoutProject p = register(dir, props.defaults().toProjectConfig(), doc);
        if (dir != null) {
            files.saveConfig(dir, p.config());
            files.saveLayout(dir, p.config(), doc);
        }
        log.info("Created project {} '{}' from template {}", p.id(), doc.name(), template);
        return p;
    }

    public LayoutProject open(String directory) {
        if (directory == null || directory.isBlank()) throw new IllegalArgumentException("directory_required");
        Path dir = Path.of(directory);
        ProjectConfig config = files.loadConfig(dir);
        LayoutDocument doc = files.loadLayout(dir, config);
        LayoutProject p = register(dir, config, doc);
        log.info("Opened project {} '{}' from {} ({} nodes)", p.id(), doc.name(), dir, p.editor().index().size());
        return p;
    }

    public LayoutProject save(String id, String directory) {
        LayoutProject p = get(id);
        synchronized (p) {
            if (directory != null && !directory.isBlank()) p.setDirectory(Path.of(directory));
            Path dir = p.directory().orElseThrow(() -> new IllegalStateException("project_has_no_directory"));
            files.saveConfig(dir, p.config());
            files.saveLayout(dir, p.config(), p.document());
            p.markSaved();
            log.info("Saved project {} to {}", id, dir);
            return p;
        }
    }

    public void close(String id) {
        if (store.projects.remove(id) == null) throw new NoSuchElementException("layout_project_not_found");
        log.info("Closed project {}", id);
    }

    public LayoutProject get(String id) {
        LayoutProject p = id == null ? null : store.projects.get(id);
        if (p == null) throw new NoSuchElementException("layout_project_not_found");
        return p;
    }

    public List<LayoutProject> list() {
        return store.projects.values().stream()
                .sorted(Comparator.comparing(LayoutProject::updatedAt).reversed())
                .collect(Collectors.toList());
    }

    public LayoutProject updateConfig(String id, ProjectConfig config) {
        LayoutProject p = get(id);
        synchronized (p) {
            p.setConfig(config == null ? ProjectConfig.defaults() : config);
            p.markDirty();
            return p;
        }
    }

    // ---- tree edits

    public LayoutNode findNode(String id, NodeId nodeId) {
        LayoutProject p = get(id);
        synchronized (p) {
            return p.editor().find(nodeId).orElseThrow(() -> new NoSuchElementException("node_not_found"));
        }
    }

    /**
     * Adds a palette widget. With an explicit parent the parent must accept it;
     * without one it goes into the selected node if that is a container, else
     * into the root. The new node becomes the selection.
     */
    public EditOutcome addWidget(String id, WidgetKind kind, NodeId parentId) {
        LayoutProject p = get(id);
        synchronized (p) {
            LayoutEditor editor = p.editor();
            LayoutNode node = WidgetFactory.create(kind);
            NodeId target = parentId != null
                    ? parentId
                    : p.selectedId().filter(editor::isContainer).orElse(editor.rootId());
            log.debug("Adding {} {} under {}", kind, node.id(), target);
            if (!editor.isContainer(target)) {
                return refusedUpfront(p, "Cannot add widget here", node.id());
            }

            EditOutcome outcome = edit(p,
                    () -> target.equals(editor.rootId()) ? editor.addChildToRoot(node) : editor.addChild(target, node),
                    "Added " + kind.displayName(),
                    "Cannot add widget here",
                    node.id());
            if (outcome.applied()) p.select(node.id());
            return outcome;
        }
    }

    public EditOutcome removeNode(String id, NodeId nodeId) {
        LayoutProject p = get(id);
        synchronized (p) {
            if (p.editor().find(nodeId).isEmpty() || nodeId.equals(p.editor().rootId())) {
                return refusedUpfront(p, "Cannot delete this component", nodeId);
            }
            EditOutcome outcome = edit(p, () -> p.editor().remove(nodeId),
                    "Component deleted", "Cannot delete this component", nodeId);
            if (outcome.applied()) dropStaleSelection(p);
            return outcome;
        }
    }

    public EditOutcome updateNode(String id, NodeId nodeId, WidgetPatch patch) {
        if (patch == null || patch.changesNothing()) throw new IllegalArgumentException("empty_patch");
        patch.checkValues();
        LayoutProject p = get(id);
        synchronized (p) {
            if (p.editor().find(nodeId).isEmpty()) {
                return refusedUpfront(p, "Node not found for property update", nodeId);
            }
            return edit(p, () -> p.editor().update(nodeId, patch::applyTo),
                    "Property updated", "Node not found for property update", nodeId);
        }
    }

    public void select(String id, NodeId nodeId) {
        LayoutProject p = get(id);
        synchronized (p) {
            if (p.editor().find(nodeId).isEmpty()) throw new NoSuchElementException("node_not_found");
            p.select(nodeId);
        }
    }

    public void deselect(String id) {
        LayoutProject p = get(id);
        synchronized (p) {
            p.select(null);
        }
    }

    // ---- history

    public EditOutcome undo(String id) {
        LayoutProject p = get(id);
        synchronized (p) {
            Optional<LayoutDocument> previous = p.history().undo(p.document());
            if (previous.isEmpty()) return EditOutcome.refused("Nothing to undo", null);
            restore(p, previous.get());
            log.info("Undo applied on project {}", id);
            return EditOutcome.applied("Undo", null);
        }
    }

    public EditOutcome redo(String id) {
        LayoutProject p = get(id);
        synchronized (p) {
            Optional<LayoutDocument> next = p.history().redo(p.document());
            if (next.isEmpty()) return EditOutcome.refused("Nothing to redo", null);
            restore(p, next.get());
            log.info("Redo applied on project {}", id);
            return EditOutcome.applied("Redo", null);
        }
    }

    // ---- validation & code

    public List<ValidationIssue> validate(String id) {
        LayoutProject p = get(id);
        synchronized (p) {
            return validator.validate(p.document());
        }
    }

    public String generate(String id) {
        LayoutProject p = get(id);
        synchronized (p) {
            return generator.generate(p.document(), p.config().generationConfig());
        }
    }

    /**
     * Generates, optionally formats and, for projects with a directory, writes
     * the code to the configured output file. Refused while the layout has
     * validation errors.
     */
    public ExportResult export(String id) {
        LayoutProject p = get(id);
        synchronized (p) {
            List<ValidationIssue> errors = validator.validate(p.document()).stream()
                    .filter(i -> i.severity() == Severity.ERROR)
                    .collect(Collectors.toList());
            if (!errors.isEmpty()) {
                log.warn("Export of project {} refused: {} validation error(s)", id, errors.size());
                throw new IllegalStateException("layout_has_errors: " + errors.get(0));
            }

            ProjectConfig config = p.config();
            String generated = generator.generate(p.document(), config.generationConfig());
            String code = config.formatOutput() ? formatter.formatOrKeep(generated) : generated;
            String path = p.directory()
                    .map(dir -> files.writeGenerated(dir, config, code).toString())
                    .orElse(null);
            log.info("Exported project {} ({} chars{})", id, code.length(), path == null ? "" : ", " + path);
            return new ExportResult(code, path);
        }
    }

    // ---- internals

    private LayoutProject register(Path dir, ProjectConfig config, LayoutDocument doc) {
        LayoutProject p = new LayoutProject(UUID.randomUUID().toString(), dir, config, doc, props.historyCapacity());
        store.projects.put(p.id(), p);
        return p;
    }

    /**
     * Snapshot first, then mutate. Callers rule out the refusals they can see
     * coming before getting here, since the push drops any pending redo. A
     * mutation that still refuses or throws takes its snapshot back off the
     * undo stack.
     */
    private EditOutcome edit(LayoutProject p, BooleanSupplier mutation, String done, String refused, NodeId subject) {
        p.history().push(p.document());
        boolean applied;
        try {
            applied = mutation.getAsBoolean();
        } catch (RuntimeException e) {
            p.history().undo(p.document());
            log.warn("Edit of {} failed (project {}): {}", subject, p.id(), e.toString());
            throw e;
        }
        if (applied) {
            p.markDirty();
            log.debug("{}: {} (project {})", done, subject, p.id());
            return EditOutcome.applied(done, subject);
        }
        p.history().undo(p.document());
        log.warn("{}: {} (project {})", refused, subject, p.id());
        return EditOutcome.refused(refused, subject);
    }

    private EditOutcome refusedUpfront(LayoutProject p, String refused, NodeId subject) {
        log.warn("{}: {} (project {})", refused, subject, p.id());
        return EditOutcome.refused(refused, subject);
    }

    private void restore(LayoutProject p, LayoutDocument snapshot) {
        p.editor().replaceDocument(snapshot);
        p.markDirty();
        dropStaleSelection(p);
    }

    private void dropStaleSelection(LayoutProject p) {
        p.selectedId()
                .filter(sel -> !p.editor().index().contains(sel))
                .ifPresent(sel -> p.select(null));
    }
}
