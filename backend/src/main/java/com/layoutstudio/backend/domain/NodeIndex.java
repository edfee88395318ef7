package com.layoutstudio.backend.domain;

import java.util.*;

/**
 * Maps every node id reachable from a root to its path, the offsets taken from
 * the root to reach it. The root's path is empty.
 * <p>
 * An index describes the tree it was built from and goes stale on the next
 * structural change; it is rebuilt wholesale, never patched.
 */
public final class NodeIndex {

    private final Map<NodeId, List<Integer>> paths;

    private NodeIndex(Map<NodeId, List<Integer>> paths) {
        this.paths = paths;
    }

    public static NodeIndex build(LayoutNode root) {
        Map<NodeId, List<Integer>> paths = new HashMap<>();
        collect(root, new ArrayDeque<>(), paths);
        return new NodeIndex(Collections.unmodifiableMap(paths));
    }

    // pre-order; offset 0 for an occupied single-child slot
    private static void collect(LayoutNode node, Deque<Integer> path, Map<NodeId, List<Integer>> out) {
        out.putIfAbsent(node.id(), List.copyOf(path));
        List<LayoutNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            path.addLast(i);
            collect(children.get(i), path, out);
            path.removeLast();
        }
    }

    public Optional<List<Integer>> pathOf(NodeId id) {
        return Optional.ofNullable(paths.get(id));
    }

    public boolean contains(NodeId id) {
        return paths.containsKey(id);
    }

    public Set<NodeId> ids() {
        return paths.keySet();
    }

    public int size() {
        return paths.size();
    }
}
