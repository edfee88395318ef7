package com.layoutstudio.backend.service.editor;

import com.layoutstudio.backend.domain.LayoutDocument;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Snapshot-based undo/redo: two bounded stacks of whole documents.
 * <p>
 * Callers push the current document before an edit. If the edit is refused,
 * they call {@link #undo} once and drop its result, so that every entry
 * stands for an edit that really changed the document.
 */
public class EditHistory {
    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<LayoutDocument> undoStack = new ArrayDeque<>();
    private final Deque<LayoutDocument> redoStack = new ArrayDeque<>();

    public EditHistory() {
        this(DEFAULT_CAPACITY);
    }

    public EditHistory(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("history_capacity_must_be_positive");
        this.capacity = capacity;
    }

    /** Records the state before an edit. Clears the redo stack. */
    public void push(LayoutDocument snapshot) {
        redoStack.clear();
        undoStack.addLast(snapshot);
        trim(undoStack);
    }

    /**
     * @param current the document being left, kept for redo
     * @return the previous state, or empty when there is nothing to undo
     */
    public Optional<LayoutDocument> undo(LayoutDocument current) {
        LayoutDocument previous = undoStack.pollLast();
        if (previous == null) return Optional.empty();
        redoStack.addLast(current);
        trim(redoStack);
        return Optional.of(previous);
    }

    /**
     * @param current the document being left, kept for undo
     * @return the next state, or empty when there is nothing to redo
     */
    public Optional<LayoutDocument> redo(LayoutDocument current) {
        LayoutDocument next = redoStack.pollLast();
        if (next == null) return Optional.empty();
        undoStack.addLast(current);
        trim(undoStack);
        return Optional.of(next);
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoCount() {
        return undoStack.size();
    }

    public int redoCount() {
        return redoStack.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    // oldest first out
    private void trim(Deque<LayoutDocument> stack) {
        while (stack.size() > capacity) {
            stack.removeFirst();
        }
    }
}
