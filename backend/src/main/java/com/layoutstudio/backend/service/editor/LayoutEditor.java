package com.layoutstudio.backend.service.editor;

import com.layoutstudio.backend.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Structural edit engine for one document. Refusals are reported as
 * {@code false} and leave the document untouched; every successful change
 * swaps in the new document and rebuilds the index.
 * <p>
 * Not thread-safe. Callers serialize access per document.
 */
public class LayoutEditor {
    private static final Logger log = LoggerFactory.getLogger(LayoutEditor.class);

    private LayoutDocument document;
    private NodeIndex index;

    public LayoutEditor(LayoutDocument document) {
        replaceDocument(document);
    }

    public LayoutDocument document() {
        return document;
    }

    public NodeIndex index() {
        return index;
    }

    /** Installs a snapshot (undo, redo, open) and reindexes it. */
    public void replaceDocument(LayoutDocument next) {
        this.document = Objects.requireNonNull(next, "document");
        rebuildIndex();
    }

    public void rebuildIndex() {
        this.index = NodeIndex.build(document.root());
    }

    public NodeId rootId() {
        return document.root().id();
    }

    /**
     * Empty when the id is unknown or the indexed path no longer leads to it.
     */
    public Optional<LayoutNode> find(NodeId id) {
        return index.pathOf(id)
                .flatMap(path -> LayoutTrees.walk(document.root(), path))
                .filter(node -> node.id().equals(id));
    }

    /**
     * Replaces the widget of the node with the given id by {@code change}'s
     * result. The node keeps its id.
     */
    public boolean update(NodeId id, UnaryOperator<Widget> change) {
        Optional<List<Integer>> path = index.pathOf(id);
        if (path.isEmpty() || find(id).isEmpty()) return false;

        Optional<LayoutNode> root = LayoutTrees.rewrite(document.root(), path.get(),
                node -> Optional.of(node.withWidget(change.apply(node.widget()))));
        return commit(root, "update", id);
    }

    public boolean isContainer(NodeId id) {
        return find(id).map(node -> LayoutTrees.acceptsChild(node.widget())).orElse(false);
    }

    public boolean addChild(NodeId parentId, LayoutNode child) {
        Optional<List<Integer>> path = index.pathOf(parentId);
        if (path.isEmpty() || find(parentId).isEmpty()) {
            log.debug("add refused: parent {} not found", parentId);
            return false;
        }
        return insertAt(path.get(), child, parentId);
    }

    public boolean addChildToRoot(LayoutNode child) {
        return insertAt(List.of(), child, rootId());
    }

    /**
     * Removes the node and its whole subtree. The root cannot be removed.
     */
    public boolean remove(NodeId id) {
        Optional<List<Integer>> path = index.pathOf(id);
        if (path.isEmpty() || find(id).isEmpty()) {
            log.debug("remove refused: {} not found", id);
            return false;
        }
        List<Integer> p = path.get();
        if (p.isEmpty()) {
            log.debug("remove refused: {} is the root", id);
            return false;
        }

        List<Integer> parentPath = p.subList(0, p.size() - 1);
        int offset = p.get(p.size() - 1);
        Optional<LayoutNode> root = LayoutTrees.rewrite(document.root(), parentPath,
                parent -> LayoutTrees.withChildRemoved(parent.widget(), offset).map(parent::withWidget));
        return commit(root, "remove", id);
    }

    private boolean insertAt(List<Integer> parentPath, LayoutNode child, NodeId parentId) {
        Objects.requireNonNull(child, "child");
        // ids must stay unique within the tree
        if (NodeIndex.build(child).ids().stream().anyMatch(index::contains)) {
            log.debug("add refused: subtree {} reuses ids already in the tree", child.id());
            return false;
        }
        Optional<LayoutNode> root = LayoutTrees.rewrite(document.root(), parentPath,
                parent -> LayoutTrees.withChildAdded(parent.widget(), child).map(parent::withWidget));
        if (root.isEmpty()) {
            log.debug("add refused: {} does not accept a child", parentId);
        }
        return commit(root, "add", child.id());
    }

    private boolean commit(Optional<LayoutNode> nextRoot, String op, NodeId subject) {
        if (nextRoot.isEmpty()) return false;
        document = document.withRoot(nextRoot.get());
        rebuildIndex();
        log.debug("{} {} applied, {} nodes indexed", op, subject, index.size());
        return true;
    }
}
