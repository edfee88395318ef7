package com.layoutstudio.backend.domain;

/**
 * Advisory report about one node. {@code path} reads like
 * {@code root.children[2].child}.
 */
public record ValidationIssue(String path, Severity severity, String message, NodeId nodeId) {

    public static ValidationIssue error(String path, String message, NodeId nodeId) {
        return new ValidationIssue(path, Severity.ERROR, message, nodeId);
    }

    public static ValidationIssue warning(String path, String message, NodeId nodeId) {
        return new ValidationIssue(path, Severity.WARNING, message, nodeId);
    }

    @Override
    public String toString() {
        return severity + " at " + path + ": " + message;
    }
}
