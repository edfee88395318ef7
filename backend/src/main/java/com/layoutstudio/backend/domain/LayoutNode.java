package com.layoutstudio.backend.domain;

import java.util.List;
import java.util.Objects;

/**
 * One element of the layout tree. A node exclusively owns the children held by
 * its widget; there are no parent pointers.
 */
public record LayoutNode(NodeId id, Widget widget) {

    public LayoutNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(widget, "widget");
    }

    /** Creates a node with a fresh id. */
    public static LayoutNode of(Widget widget) {
        return new LayoutNode(NodeId.random(), widget);
    }

    public LayoutNode withWidget(Widget next) {
        return new LayoutNode(id, next);
    }

    /**
     * Direct children in render order. An occupied single-child slot yields a
     * one-element list at offset 0.
     */
    public List<LayoutNode> children() {
        if (widget instanceof Widget.MultiChild) {
            return ((Widget.MultiChild) widget).children();
        }
        if (widget instanceof Widget.SingleChild) {
            LayoutNode child = ((Widget.SingleChild) widget).child();
            return child == null ? List.of() : List.of(child);
        }
        return List.of();
    }
}
