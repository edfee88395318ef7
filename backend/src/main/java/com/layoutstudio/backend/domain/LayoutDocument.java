package com.layoutstudio.backend.domain;

import java.util.Objects;

/**
 * Unit of persistence, undo and code generation. Immutable, so a document
 * value doubles as its own snapshot.
 */
public record LayoutDocument(int version, String name, LayoutNode root) {

    public static final int CURRENT_VERSION = 1;

    public LayoutDocument {
        name = name == null || name.isBlank() ? "Untitled" : name;
        Objects.requireNonNull(root, "root");
    }

    /** Version 1, "Untitled", an empty Column as root. */
    public static LayoutDocument untitled() {
        return new LayoutDocument(CURRENT_VERSION, "Untitled", LayoutNode.of(Widget.Column.empty()));
    }

    public LayoutDocument withRoot(LayoutNode nextRoot) {
        return new LayoutDocument(version, name, nextRoot);
    }

    public LayoutDocument withName(String nextName) {
        return new LayoutDocument(version, nextName, root);
    }
}
