package com.layoutstudio.backend.service.editor;

import com.layoutstudio.backend.domain.*;
import com.layoutstudio.backend.service.WidgetFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutEditorTest {

    private LayoutEditor editor;

    @BeforeEach
    void setUp() {
        editor = new LayoutEditor(LayoutDocument.untitled());
    }

    @Test
    void addToRootAppendsInOrder() {
        LayoutNode a = WidgetFactory.create(WidgetKind.TEXT);
        LayoutNode b = WidgetFactory.create(WidgetKind.BUTTON);

        assertTrue(editor.addChildToRoot(a));
        assertTrue(editor.addChildToRoot(b));

        assertEquals(List.of(a, b), editor.document().root().children());
        assertEquals(List.of(1), editor.index().pathOf(b.id()).orElseThrow());
        assertEquals(3, editor.index().size());
    }

    @Test
    void leafRefusesChildren() {
        LayoutNode text = WidgetFactory.create(WidgetKind.TEXT);
        editor.addChildToRoot(text);
        LayoutDocument before = editor.document();

        assertFalse(editor.addChild(text.id(), WidgetFactory.create(WidgetKind.BUTTON)));
        assertSame(before, editor.document());
    }

    @Test
    void singleChildSlotTakesOneChild() {
        LayoutNode box = WidgetFactory.create(WidgetKind.CONTAINER);
        editor.addChildToRoot(box);
        LayoutNode first = WidgetFactory.create(WidgetKind.TEXT);

        assertTrue(editor.isContainer(box.id()));
        assertTrue(editor.addChild(box.id(), first));
        assertFalse(editor.isContainer(box.id()));
        assertFalse(editor.addChild(box.id(), WidgetFactory.create(WidgetKind.TEXT)));

        assertEquals(List.of(0, 0), editor.index().pathOf(first.id()).orElseThrow());
    }

    @Test
    void addingToUnknownParentIsRefused() {
        assertFalse(editor.addChild(NodeId.random(), WidgetFactory.create(WidgetKind.TEXT)));
        assertEquals(1, editor.index().size());
    }

    @Test
    void subtreeWithExistingIdIsRefused() {
        LayoutNode text = WidgetFactory.create(WidgetKind.TEXT);
        editor.addChildToRoot(text);

        assertFalse(editor.addChildToRoot(text));
        assertEquals(1, editor.document().root().children().size());
    }

    @Test
    void removeDropsWholeSubtreeAndShiftsSiblings() {
        LayoutNode row = WidgetFactory.create(WidgetKind.ROW);
        LayoutNode tail = WidgetFactory.create(WidgetKind.TEXT);
        editor.addChildToRoot(row);
        editor.addChildToRoot(tail);
        LayoutNode nested = WidgetFactory.create(WidgetKind.BUTTON);
        editor.addChild(row.id(), nested);

        assertTrue(editor.remove(row.id()));

        assertFalse(editor.index().contains(row.id()));
        assertFalse(editor.index().contains(nested.id()));
        assertEquals(List.of(0), editor.index().pathOf(tail.id()).orElseThrow());
    }

    @Test
    void removingSingleChildEmptiesTheSlot() {
        LayoutNode scroll = WidgetFactory.create(WidgetKind.SCROLLABLE);
        editor.addChildToRoot(scroll);
        LayoutNode inner = WidgetFactory.create(WidgetKind.COLUMN);
        editor.addChild(scroll.id(), inner);

        assertTrue(editor.remove(inner.id()));

        Widget.Scrollable widget = (Widget.Scrollable) editor.find(scroll.id()).orElseThrow().widget();
        assertFalse(widget.hasChild());
    }

    @Test
    void rootCannotBeRemoved() {
        assertFalse(editor.remove(editor.rootId()));
        assertFalse(editor.remove(NodeId.random()));
    }

    @Test
    void updateKeepsIdAndTouchesOnlyTheTarget() {
        LayoutNode a = WidgetFactory.create(WidgetKind.TEXT);
        LayoutNode b = WidgetFactory.create(WidgetKind.TEXT);
        editor.addChildToRoot(a);
        editor.addChildToRoot(b);

        assertTrue(editor.update(b.id(), w -> new Widget.Text("changed", ((Widget.Text) w).attrs())));

        LayoutNode updated = editor.find(b.id()).orElseThrow();
        assertEquals("changed", ((Widget.Text) updated.widget()).content());
        assertSame(a, editor.find(a.id()).orElseThrow());
    }

    @Test
    void updateOfUnknownIdIsRefused() {
        LayoutDocument before = editor.document();

        assertFalse(editor.update(NodeId.random(), w -> w));
        assertSame(before, editor.document());
    }

    @Test
    void replaceDocumentReindexes() {
        LayoutDocument form = ProjectTemplate.FORM.newDocument();

        editor.replaceDocument(form);

        assertEquals(form.root().id(), editor.rootId());
        assertEquals(5, editor.index().size());
        for (LayoutNode child : form.root().children()) {
            assertEquals(child, editor.find(child.id()).orElseThrow());
        }
    }
}
