package com.layoutstudio.backend.service.editor;

import com.layoutstudio.backend.domain.LayoutDocument;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EditHistoryTest {

    private static LayoutDocument doc(String name) {
        return LayoutDocument.untitled().withName(name);
    }

    @Test
    void undoThenRedoWalksBackAndForth() {
        EditHistory history = new EditHistory();
        LayoutDocument v0 = doc("v0");
        LayoutDocument v1 = doc("v1");

        history.push(v0);

        assertSame(v0, history.undo(v1).orElseThrow());
        assertTrue(history.canRedo());
        assertSame(v1, history.redo(v0).orElseThrow());
        assertEquals(1, history.undoCount());
        assertEquals(0, history.redoCount());
    }

    @Test
    void emptyStacksYieldNothing() {
        EditHistory history = new EditHistory();

        assertTrue(history.undo(doc("x")).isEmpty());
        assertTrue(history.redo(doc("x")).isEmpty());
        assertFalse(history.canRedo());
    }

    @Test
    void pushClearsRedo() {
        EditHistory history = new EditHistory();
        history.push(doc("a"));
        history.undo(doc("b"));

        history.push(doc("c"));

        assertFalse(history.canRedo());
    }

    @Test
    void oldestEntriesFallOffAtCapacity() {
        EditHistory history = new EditHistory();
        for (int i = 0; i < 60; i++) {
            history.push(doc("v" + i));
        }

        assertEquals(EditHistory.DEFAULT_CAPACITY, history.undoCount());

        LayoutDocument last = null;
        LayoutDocument current = doc("current");
        while (history.canUndo()) {
            last = history.undo(current).orElseThrow();
            current = last;
        }
        assertEquals("v10", last.name());
    }

    @Test
    void redoStackIsBoundedToo() {
        EditHistory history = new EditHistory(2);
        history.push(doc("a"));
        history.push(doc("b"));
        history.push(doc("c"));

        history.undo(doc("d"));
        history.undo(doc("c"));

        assertEquals(2, history.redoCount());
        assertEquals(0, history.undoCount());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new EditHistory(0));
    }
}
