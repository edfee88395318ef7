package com.layoutstudio.backend.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.layoutstudio.backend.domain.WidgetAttrs.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of a {@link LayoutNode}: the widget kind together with its literal
 * fields. Containers own their children; leaves own nothing.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Widget.Column.class, name = "Column"),
        @JsonSubTypes.Type(value = Widget.Row.class, name = "Row"),
        @JsonSubTypes.Type(value = Widget.Stack.class, name = "Stack"),
        @JsonSubTypes.Type(value = Widget.Container.class, name = "Container"),
        @JsonSubTypes.Type(value = Widget.Scrollable.class, name = "Scrollable"),
        @JsonSubTypes.Type(value = Widget.Text.class, name = "Text"),
        @JsonSubTypes.Type(value = Widget.Button.class, name = "Button"),
        @JsonSubTypes.Type(value = Widget.TextInput.class, name = "TextInput"),
        @JsonSubTypes.Type(value = Widget.Checkbox.class, name = "Checkbox"),
        @JsonSubTypes.Type(value = Widget.Slider.class, name = "Slider"),
        @JsonSubTypes.Type(value = Widget.PickList.class, name = "PickList"),
        @JsonSubTypes.Type(value = Widget.Space.class, name = "Space")
})
public sealed interface Widget permits Widget.MultiChild, Widget.SingleChild,
        Widget.Text, Widget.Button, Widget.TextInput, Widget.Checkbox,
        Widget.Slider, Widget.PickList, Widget.Space {

    <R> R accept(WidgetVisitor<R> visitor);

    WidgetKind kind();

    /** Column, Row and Stack: an ordered sequence of children. */
    sealed interface MultiChild extends Widget permits Column, Row, Stack {
        List<LayoutNode> children();

        ContainerAttrs attrs();

        MultiChild withChildren(List<LayoutNode> children);

        MultiChild withAttrs(ContainerAttrs attrs);

        default MultiChild withAppended(LayoutNode child) {
            List<LayoutNode> next = new ArrayList<>(children());
            next.add(child);
            return withChildren(next);
        }

        default MultiChild withChildAt(int offset, LayoutNode child) {
            List<LayoutNode> next = new ArrayList<>(children());
            next.set(offset, child);
            return withChildren(next);
        }

        default MultiChild withoutChildAt(int offset) {
            List<LayoutNode> next = new ArrayList<>(children());
            next.remove(offset);
            return withChildren(next);
        }
    }

    /** Container and Scrollable: at most one child, {@code null} while empty. */
    sealed interface SingleChild extends Widget permits Container, Scrollable {
        LayoutNode child();

        ContainerAttrs attrs();

        SingleChild withChild(LayoutNode child);

        SingleChild withAttrs(ContainerAttrs attrs);

        default boolean hasChild() {
            return child() != null;
        }
    }

    record Column(List<LayoutNode> children, ContainerAttrs attrs) implements MultiChild {
        public Column {
            children = children == null ? List.of() : List.copyOf(children);
            attrs = attrs == null ? ContainerAttrs.DEFAULT : attrs;
        }

        public static Column empty() {
            return new Column(List.of(), ContainerAttrs.DEFAULT);
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitColumn(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.COLUMN;
        }

        @Override
        public Column withChildren(List<LayoutNode> c) {
            return new Column(c, attrs);
        }

        @Override
        public Column withAttrs(ContainerAttrs a) {
            return new Column(children, a);
        }
    }

    record Row(List<LayoutNode> children, ContainerAttrs attrs) implements MultiChild {
        public Row {
            children = children == null ? List.of() : List.copyOf(children);
            attrs = attrs == null ? ContainerAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitRow(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.ROW;
        }

        @Override
        public Row withChildren(List<LayoutNode> c) {
            return new Row(c, attrs);
        }

        @Override
        public Row withAttrs(ContainerAttrs a) {
            return new Row(children, a);
        }
    }

    /** Children drawn on top of each other, last one uppermost. */
    record Stack(List<LayoutNode> children, ContainerAttrs attrs) implements MultiChild {
        public Stack {
            children = children == null ? List.of() : List.copyOf(children);
            attrs = attrs == null ? ContainerAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitStack(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.STACK;
        }

        @Override
        public Stack withChildren(List<LayoutNode> c) {
            return new Stack(c, attrs);
        }

        @Override
        public Stack withAttrs(ContainerAttrs a) {
            return new Stack(children, a);
        }
    }

    record Container(LayoutNode child, ContainerAttrs attrs) implements SingleChild {
        public Container {
            attrs = attrs == null ? ContainerAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitContainer(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.CONTAINER;
        }

        @Override
        public Container withChild(LayoutNode c) {
            return new Container(c, attrs);
        }

        @Override
        public Container withAttrs(ContainerAttrs a) {
            return new Container(child, a);
        }
    }

    record Scrollable(LayoutNode child, ContainerAttrs attrs) implements SingleChild {
        public Scrollable {
            attrs = attrs == null ? ContainerAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitScrollable(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.SCROLLABLE;
        }

        @Override
        public Scrollable withChild(LayoutNode c) {
            return new Scrollable(c, attrs);
        }

        @Override
        public Scrollable withAttrs(ContainerAttrs a) {
            return new Scrollable(child, a);
        }
    }

    record Text(String content, TextAttrs attrs) implements Widget {
        public Text {
            content = content == null ? "" : content;
            attrs = attrs == null ? TextAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitText(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.TEXT;
        }
    }

    record Button(String label, String messageStub, ButtonAttrs attrs) implements Widget {
        public Button {
            label = label == null ? "" : label;
            messageStub = messageStub == null ? "" : messageStub;
            attrs = attrs == null ? ButtonAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitButton(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.BUTTON;
        }
    }

    record TextInput(String placeholder, String valueBinding, String messageStub, InputAttrs attrs)
            implements Widget {
        public TextInput {
            placeholder = placeholder == null ? "" : placeholder;
            valueBinding = valueBinding == null ? "" : valueBinding;
            messageStub = messageStub == null ? "" : messageStub;
            attrs = attrs == null ? InputAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitTextInput(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.TEXT_INPUT;
        }
    }

    record Checkbox(String label, String checkedBinding, String messageStub, CheckboxAttrs attrs)
            implements Widget {
        public Checkbox {
            label = label == null ? "" : label;
            checkedBinding = checkedBinding == null ? "" : checkedBinding;
            messageStub = messageStub == null ? "" : messageStub;
            attrs = attrs == null ? CheckboxAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitCheckbox(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.CHECKBOX;
        }
    }

    record Slider(double min, double max, String valueBinding, String messageStub, SliderAttrs attrs)
            implements Widget {
        public Slider {
            valueBinding = valueBinding == null ? "" : valueBinding;
            messageStub = messageStub == null ? "" : messageStub;
            attrs = attrs == null ? SliderAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitSlider(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.SLIDER;
        }
    }

    record PickList(List<String> options, String selectedBinding, String messageStub, PickListAttrs attrs)
            implements Widget {
        public PickList {
            options = options == null ? List.of() : List.copyOf(options);
            selectedBinding = selectedBinding == null ? "" : selectedBinding;
            messageStub = messageStub == null ? "" : messageStub;
            attrs = attrs == null ? PickListAttrs.DEFAULT : attrs;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitPickList(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.PICK_LIST;
        }
    }

    record Space(LengthSpec width, LengthSpec height) implements Widget {
        public Space {
            width = width == null ? LengthSpec.SHRINK : width;
            height = height == null ? LengthSpec.SHRINK : height;
        }

        @Override
        public <R> R accept(WidgetVisitor<R> visitor) {
            return visitor.visitSpace(this);
        }

        @Override
        public WidgetKind kind() {
            return WidgetKind.SPACE;
        }
    }
}
