package com.layoutstudio.backend.domain;

import com.layoutstudio.backend.domain.WidgetAttrs.*;

import java.util.List;
import java.util.Objects;

/**
 * Inspector edit of a node's literal fields. {@code null} means "leave as is";
 * fields a widget kind does not have are ignored for that kind.
 * {@code binding} targets whichever binding the kind carries (value, checked
 * or selected).
 */
public record WidgetPatch(
        String content,
        String label,
        String messageStub,
        String placeholder,
        String binding,
        List<String> options,
        Double padding,     // uniform
        Double spacing,
        Double min,
        Double max,
        LengthSpec width,
        LengthSpec height
) {

    public boolean changesNothing() {
        return content == null && label == null && messageStub == null && placeholder == null
                && binding == null && options == null && padding == null && spacing == null
                && min == null && max == null && width == null && height == null;
    }

    /**
     * @throws IllegalArgumentException for values no widget can hold
     */
    public void checkValues() {
        if (options != null && options.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("options_must_not_contain_null");
        }
    }

    public Widget applyTo(Widget widget) {
        return widget.accept(new Applier());
    }

    private final class Applier implements WidgetVisitor<Widget> {

        // only what the generated code renders for each container kind:
        // Column/Row everything, Container no spacing, Stack/Scrollable size only
        private ContainerAttrs size(ContainerAttrs a) {
            if (width == null && height == null) return a;
            return a.withSize(or(width, a.width()), or(height, a.height()));
        }

        private ContainerAttrs padded(ContainerAttrs a) {
            ContainerAttrs next = size(a);
            return padding == null ? next : next.withPadding(PaddingSpec.uniform(padding));
        }

        private ContainerAttrs attrs(ContainerAttrs a) {
            ContainerAttrs next = padded(a);
            return spacing == null ? next : next.withSpacing(spacing);
        }

        @Override
        public Widget visitColumn(Widget.Column column) {
            return column.withAttrs(attrs(column.attrs()));
        }

        @Override
        public Widget visitRow(Widget.Row row) {
            return row.withAttrs(attrs(row.attrs()));
        }

        @Override
        public Widget visitStack(Widget.Stack stack) {
            return stack.withAttrs(size(stack.attrs()));
        }

        @Override
        public Widget visitContainer(Widget.Container container) {
            return container.withAttrs(padded(container.attrs()));
        }

        @Override
        public Widget visitScrollable(Widget.Scrollable scrollable) {
            return scrollable.withAttrs(size(scrollable.attrs()));
        }

        @Override
        public Widget visitText(Widget.Text text) {
            return new Widget.Text(or(content, text.content()), text.attrs());
        }

        @Override
        public Widget visitButton(Widget.Button button) {
            ButtonAttrs a = button.attrs();
            return new Widget.Button(
                    or(label, button.label()),
                    or(messageStub, button.messageStub()),
                    new ButtonAttrs(or(width, a.width()), or(height, a.height())));
        }

        @Override
        public Widget visitTextInput(Widget.TextInput input) {
            return new Widget.TextInput(
                    or(placeholder, input.placeholder()),
                    or(binding, input.valueBinding()),
                    or(messageStub, input.messageStub()),
                    new InputAttrs(or(width, input.attrs().width())));
        }

        @Override
        public Widget visitCheckbox(Widget.Checkbox checkbox) {
            return new Widget.Checkbox(
                    or(label, checkbox.label()),
                    or(binding, checkbox.checkedBinding()),
                    or(messageStub, checkbox.messageStub()),
                    spacing == null ? checkbox.attrs() : new CheckboxAttrs(spacing));
        }

        @Override
        public Widget visitSlider(Widget.Slider slider) {
            return new Widget.Slider(
                    min == null ? slider.min() : min,
                    max == null ? slider.max() : max,
                    or(binding, slider.valueBinding()),
                    or(messageStub, slider.messageStub()),
                    new SliderAttrs(or(width, slider.attrs().width())));
        }

        @Override
        public Widget visitPickList(Widget.PickList pickList) {
            PickListAttrs a = pickList.attrs();
            return new Widget.PickList(
                    or(options, pickList.options()),
                    or(binding, pickList.selectedBinding()),
                    or(messageStub, pickList.messageStub()),
                    new PickListAttrs(or(width, a.width()), or(placeholder, a.placeholder())));
        }

        @Override
        public Widget visitSpace(Widget.Space space) {
            return new Widget.Space(or(width, space.width()), or(height, space.height()));
        }
    }

    private static <T> T or(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
