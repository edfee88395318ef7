package com.layoutstudio.backend.service.codegen;

import com.layoutstudio.backend.domain.*;
import com.layoutstudio.backend.domain.WidgetAttrs.Rgba;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.layoutstudio.backend.service.codegen.RustLiterals.*;

/**
 * Renders a layout document as a Rust module exposing one Iced view function.
 * <p>
 * Pure and deterministic: the same document and config always give the same
 * text. Message stubs and bindings are relayed verbatim as
 * {@code <MessageType>::<stub>} and {@code state.<binding>}; checking them is
 * the validator's job, so invalid names simply produce code that won't compile.
 */
@Component
public class RustCodeGenerator {
    private static final String INDENT = "    ";

    public String generate(LayoutDocument document, GenerationConfig config) {
        StringBuilder out = new StringBuilder();
        out.append("// Generated by Layout Studio from layout ").append(string(document.name()))
                .append(". Do not edit by hand.\n");
        out.append("#![allow(unused_imports, unused_variables)]\n\n");
        out.append("use iced::widget::{\n");
        out.append(INDENT).append("button, checkbox, column, container, pick_list, row, scrollable, slider, stack, text,\n");
        out.append(INDENT).append("text_input, Space,\n");
        out.append("};\n");
        out.append("use iced::{Alignment, Color, Element, Length, Padding};\n\n");
        out.append("pub fn view<'a>(state: &'a ").append(config.stateType())
                .append(") -> Element<'a, ").append(config.messageType()).append("> {\n");

        Emitter root = new Emitter(out, config, 1);
        out.append(INDENT);
        document.root().widget().accept(root);
        root.chain(".into()");
        out.append("\n}\n");
        return out.toString();
    }

    /**
     * Writes one node's expression, starting at the current position and
     * leaving the cursor after its last character.
     */
    private static final class Emitter implements WidgetVisitor<Void> {
        private final StringBuilder out;
        private final GenerationConfig config;
        private final int depth;

        Emitter(StringBuilder out, GenerationConfig config, int depth) {
            this.out = out;
            this.config = config;
            this.depth = depth;
        }

        private String indent(int level) {
            return INDENT.repeat(level);
        }

        void chain(String call) {
            out.append('\n').append(indent(depth + 1)).append(call);
        }

        private String message(String stub) {
            return config.messageType() + "::" + stub;
        }

        private static String binding(String name) {
            return "state." + name;
        }

        private void nested(LayoutNode child, int level) {
            child.widget().accept(new Emitter(out, config, level));
        }

        private void sequence(String macro, List<LayoutNode> children) {
            if (children.isEmpty()) {
                out.append(macro).append("![]");
                return;
            }
            out.append(macro).append("![\n");
            for (LayoutNode child : children) {
                out.append(indent(depth + 1));
                nested(child, depth + 1);
                out.append(",\n");
            }
            out.append(indent(depth)).append(']');
        }

        private void wrapper(String function, LayoutNode child) {
            if (child == null) {
                out.append(function).append("(Space::new(Length::Shrink, Length::Shrink))");
                return;
            }
            out.append(function).append("(\n").append(indent(depth + 1));
            nested(child, depth + 1);
            out.append(",\n").append(indent(depth)).append(')');
        }

        private void size(LengthSpec width, LengthSpec height) {
            chain(".width(" + length(width) + ")");
            chain(".height(" + length(height) + ")");
        }

        @Override
        public Void visitColumn(Widget.Column column) {
            ContainerAttrs a = column.attrs();
            sequence("column", column.children());
            chain(".spacing(" + f32(a.spacing()) + ")");
            chain(".padding(" + padding(a.padding()) + ")");
            chain(".align_x(" + alignment(a.alignX()) + ")");
            size(a.width(), a.height());
            return null;
        }

        @Override
        public Void visitRow(Widget.Row row) {
            ContainerAttrs a = row.attrs();
            sequence("row", row.children());
            chain(".spacing(" + f32(a.spacing()) + ")");
            chain(".padding(" + padding(a.padding()) + ")");
            chain(".align_y(" + alignment(a.alignY()) + ")");
            size(a.width(), a.height());
            return null;
        }

        @Override
        public Void visitStack(Widget.Stack stack) {
            sequence("stack", stack.children());
            size(stack.attrs().width(), stack.attrs().height());
            return null;
        }

        @Override
        public Void visitContainer(Widget.Container container) {
            ContainerAttrs a = container.attrs();
            wrapper("container", container.child());
            chain(".padding(" + padding(a.padding()) + ")");
            chain(".align_x(" + alignment(a.alignX()) + ")");
            chain(".align_y(" + alignment(a.alignY()) + ")");
            size(a.width(), a.height());
            return null;
        }

        @Override
        public Void visitScrollable(Widget.Scrollable scrollable) {
            wrapper("scrollable", scrollable.child());
            size(scrollable.attrs().width(), scrollable.attrs().height());
            return null;
        }

        @Override
        public Void visitText(Widget.Text text) {
            WidgetAttrs.TextAttrs a = text.attrs();
            out.append("text(").append(string(text.content())).append(')');
            chain(".size(" + f32(a.fontSize()) + ")");
            Rgba color = a.color();
            if (color != null) {
                chain(".color(Color::from_rgba(" + f32(color.r()) + ", " + f32(color.g()) + ", "
                        + f32(color.b()) + ", " + f32(color.a()) + "))");
            }
            chain(".align_x(" + alignment(a.horizontalAlignment()) + ")");
            return null;
        }

        @Override
        public Void visitButton(Widget.Button button) {
            out.append("button(text(").append(string(button.label())).append("))");
            // no stub: emitted as a disabled button
            if (!button.messageStub().isEmpty()) {
                chain(".on_press(" + message(button.messageStub()) + ")");
            }
            size(button.attrs().width(), button.attrs().height());
            return null;
        }

        @Override
        public Void visitTextInput(Widget.TextInput input) {
            out.append("text_input(").append(string(input.placeholder()))
                    .append(", &").append(binding(input.valueBinding())).append(')');
            if (!input.messageStub().isEmpty()) {
                chain(".on_input(" + message(input.messageStub()) + ")");
            }
            chain(".width(" + length(input.attrs().width()) + ")");
            return null;
        }

        @Override
        public Void visitCheckbox(Widget.Checkbox checkbox) {
            out.append("checkbox(").append(string(checkbox.label()))
                    .append(", ").append(binding(checkbox.checkedBinding())).append(')');
            if (!checkbox.messageStub().isEmpty()) {
                chain(".on_toggle(" + message(checkbox.messageStub()) + ")");
            }
            chain(".spacing(" + f32(checkbox.attrs().spacing()) + ")");
            return null;
        }

        @Override
        public Void visitSlider(Widget.Slider slider) {
            out.append("slider(").append(f32(slider.min())).append("..=").append(f32(slider.max()))
                    .append(", ").append(binding(slider.valueBinding()))
                    .append(", ").append(message(slider.messageStub())).append(')');
            chain(".width(" + length(slider.attrs().width()) + ")");
            return null;
        }

        @Override
        public Void visitPickList(Widget.PickList pickList) {
            StringBuilder options = new StringBuilder("vec![");
            List<String> values = pickList.options();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) options.append(", ");
                options.append("String::from(").append(string(values.get(i))).append(')');
            }
            options.append(']');

            out.append("pick_list(").append(options)
                    .append(", ").append(binding(pickList.selectedBinding())).append(".clone()")
                    .append(", ").append(message(pickList.messageStub())).append(')');
            String placeholder = pickList.attrs().placeholder();
            if (!placeholder.isEmpty()) {
                chain(".placeholder(" + string(placeholder) + ")");
            }
            chain(".width(" + length(pickList.attrs().width()) + ")");
            return null;
        }

        @Override
        public Void visitSpace(Widget.Space space) {
            out.append("Space::new(").append(length(space.width())).append(", ")
                    .append(length(space.height())).append(')');
            return null;
        }
    }
}
