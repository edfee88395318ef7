package com.layoutstudio.backend.service.editor;

import com.layoutstudio.backend.domain.LayoutNode;
import com.layoutstudio.backend.domain.Widget;
import com.layoutstudio.backend.domain.WidgetVisitor;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Path walking and containment rules over immutable layout trees. Updates copy
 * the nodes along the path and share every other subtree.
 */
final class LayoutTrees {

    private LayoutTrees() {
    }

    static Optional<LayoutNode> walk(LayoutNode root, List<Integer> path) {
        LayoutNode current = root;
        for (int offset : path) {
            List<LayoutNode> children = current.children();
            if (offset < 0 || offset >= children.size()) return Optional.empty();
            current = children.get(offset);
        }
        return Optional.of(current);
    }

    /**
     * Rebuilds the tree with the node at {@code path} replaced by
     * {@code change}'s result. Empty when the path does not resolve or the
     * change refuses.
     */
    static Optional<LayoutNode> rewrite(LayoutNode root, List<Integer> path,
                                        Function<LayoutNode, Optional<LayoutNode>> change) {
        if (path.isEmpty()) return change.apply(root);

        int offset = path.get(0);
        List<Integer> rest = path.subList(1, path.size());
        return root.widget().accept(new ChildRewriter(offset, child -> rewrite(child, rest, change)))
                .map(root::withWidget);
    }

    /** Column/Row/Stack always; Container/Scrollable only while empty. */
    static boolean acceptsChild(Widget widget) {
        return widget.accept(new ContainmentRule<Boolean>() {
            @Override
            protected Boolean multi(Widget.MultiChild w) {
                return true;
            }

            @Override
            protected Boolean single(Widget.SingleChild w) {
                return !w.hasChild();
            }

            @Override
            protected Boolean leaf(Widget w) {
                return false;
            }
        });
    }

    static Optional<Widget> withChildAdded(Widget widget, LayoutNode child) {
        return widget.accept(new ContainmentRule<Optional<Widget>>() {
            @Override
            protected Optional<Widget> multi(Widget.MultiChild w) {
                return Optional.of(w.withAppended(child));
            }

            @Override
            protected Optional<Widget> single(Widget.SingleChild w) {
                if (w.hasChild()) return Optional.empty();
                return Optional.of(w.withChild(child));
            }

            @Override
            protected Optional<Widget> leaf(Widget w) {
                return Optional.empty();
            }
        });
    }

    static Optional<Widget> withChildRemoved(Widget widget, int offset) {
        return widget.accept(new ContainmentRule<Optional<Widget>>() {
            @Override
            protected Optional<Widget> multi(Widget.MultiChild w) {
                if (offset < 0 || offset >= w.children().size()) return Optional.empty();
                return Optional.of(w.withoutChildAt(offset));
            }

            @Override
            protected Optional<Widget> single(Widget.SingleChild w) {
                if (offset != 0 || !w.hasChild()) return Optional.empty();
                return Optional.of(w.withChild(null));
            }

            @Override
            protected Optional<Widget> leaf(Widget w) {
                return Optional.empty();
            }
        });
    }

    /**
     * Groups the variants by how they hold children. Still a full visitor, so
     * a new variant has to be placed in one of the three groups here.
     */
    private abstract static class ContainmentRule<R> implements WidgetVisitor<R> {

        protected abstract R multi(Widget.MultiChild w);

        protected abstract R single(Widget.SingleChild w);

        protected abstract R leaf(Widget w);

        @Override
        public R visitColumn(Widget.Column column) {
            return multi(column);
        }

        @Override
        public R visitRow(Widget.Row row) {
            return multi(row);
        }

        @Override
        public R visitStack(Widget.Stack stack) {
            return multi(stack);
        }

        @Override
        public R visitContainer(Widget.Container container) {
            return single(container);
        }

        @Override
        public R visitScrollable(Widget.Scrollable scrollable) {
            return single(scrollable);
        }

        @Override
        public R visitText(Widget.Text text) {
            return leaf(text);
        }

        @Override
        public R visitButton(Widget.Button button) {
            return leaf(button);
        }

        @Override
        public R visitTextInput(Widget.TextInput textInput) {
            return leaf(textInput);
        }

        @Override
        public R visitCheckbox(Widget.Checkbox checkbox) {
            return leaf(checkbox);
        }

        @Override
        public R visitSlider(Widget.Slider slider) {
            return leaf(slider);
        }

        @Override
        public R visitPickList(Widget.PickList pickList) {
            return leaf(pickList);
        }

        @Override
        public R visitSpace(Widget.Space space) {
            return leaf(space);
        }
    }

    private static final class ChildRewriter extends ContainmentRule<Optional<Widget>> {
        private final int offset;
        private final Function<LayoutNode, Optional<LayoutNode>> change;

        ChildRewriter(int offset, Function<LayoutNode, Optional<LayoutNode>> change) {
            this.offset = offset;
            this.change = change;
        }

        @Override
        protected Optional<Widget> multi(Widget.MultiChild w) {
            if (offset < 0 || offset >= w.children().size()) return Optional.empty();
            return change.apply(w.children().get(offset)).map(next -> w.withChildAt(offset, next));
        }

        @Override
        protected Optional<Widget> single(Widget.SingleChild w) {
            if (offset != 0 || !w.hasChild()) return Optional.empty();
            return change.apply(w.child()).map(w::withChild);
        }

        @Override
        protected Optional<Widget> leaf(Widget w) {
            return Optional.empty();
        }
    }
}
