package com.layoutstudio.backend.service.validation;

import com.layoutstudio.backend.domain.*;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Read-only walk over a document reporting what would make the generated
 * code incomplete (warnings) or fail to compile (errors).
 */
@Component
public class LayoutValidator {

    public List<ValidationIssue> validate(LayoutDocument document) {
        List<ValidationIssue> issues = new ArrayList<>();
        walk(document.root(), "root", new HashSet<>(), issues);
        return issues;
    }

    public boolean hasErrors(LayoutDocument document) {
        return validate(document).stream().anyMatch(i -> i.severity() == Severity.ERROR);
    }

    private void walk(LayoutNode node, String path, Set<NodeId> seen, List<ValidationIssue> issues) {
        if (!seen.add(node.id())) {
            issues.add(ValidationIssue.error(path, "Duplicate node id " + node.id(), node.id()));
        }
        node.widget().accept(new NodeChecks(node, path, seen, issues));
    }

    private final class NodeChecks implements WidgetVisitor<Void> {
        private final LayoutNode node;
        private final String path;
        private final Set<NodeId> seen;
        private final List<ValidationIssue> issues;

        NodeChecks(LayoutNode node, String path, Set<NodeId> seen, List<ValidationIssue> issues) {
            this.node = node;
            this.path = path;
            this.seen = seen;
            this.issues = issues;
        }

        private Void children(List<LayoutNode> children) {
            if (children.isEmpty()) {
                issues.add(ValidationIssue.warning(path, "Container has no children", node.id()));
            }
            for (int i = 0; i < children.size(); i++) {
                walk(children.get(i), path + ".children[" + i + "]", seen, issues);
            }
            return null;
        }

        private Void child(LayoutNode child) {
            if (child == null) {
                issues.add(ValidationIssue.warning(path, "Container has no child", node.id()));
            } else {
                walk(child, path + ".child", seen, issues);
            }
            return null;
        }

        private void identifier(String field, String value) {
            if (value == null || value.isEmpty()) {
                issues.add(ValidationIssue.error(path, field + " must not be empty", node.id()));
            } else if (!Identifiers.isValidIdentifier(value)) {
                issues.add(ValidationIssue.error(path,
                        field + " '" + value + "' is not a valid identifier", node.id()));
            } else if (Identifiers.isReservedWord(value)) {
                issues.add(ValidationIssue.error(path,
                        field + " '" + value + "' is a reserved Rust keyword and cannot be used as an identifier",
                        node.id()));
            }
        }

        @Override
        public Void visitColumn(Widget.Column column) {
            return children(column.children());
        }

        @Override
        public Void visitRow(Widget.Row row) {
            return children(row.children());
        }

        @Override
        public Void visitStack(Widget.Stack stack) {
            return children(stack.children());
        }

        @Override
        public Void visitContainer(Widget.Container container) {
            return child(container.child());
        }

        @Override
        public Void visitScrollable(Widget.Scrollable scrollable) {
            return child(scrollable.child());
        }

        @Override
        public Void visitText(Widget.Text text) {
            return null;
        }

        @Override
        public Void visitButton(Widget.Button button) {
            identifier("message_stub", button.messageStub());
            return null;
        }

        @Override
        public Void visitTextInput(Widget.TextInput input) {
            identifier("value_binding", input.valueBinding());
            identifier("message_stub", input.messageStub());
            return null;
        }

        @Override
        public Void visitCheckbox(Widget.Checkbox checkbox) {
            identifier("checked_binding", checkbox.checkedBinding());
            identifier("message_stub", checkbox.messageStub());
            return null;
        }

        @Override
        public Void visitSlider(Widget.Slider slider) {
            identifier("value_binding", slider.valueBinding());
            identifier("message_stub", slider.messageStub());
            if (slider.min() >= slider.max()) {
                issues.add(ValidationIssue.warning(path,
                        "Slider range is empty (min " + slider.min() + " >= max " + slider.max() + ")", node.id()));
            }
            return null;
        }

        @Override
        public Void visitPickList(Widget.PickList pickList) {
            identifier("selected_binding", pickList.selectedBinding());
            identifier("message_stub", pickList.messageStub());
            return null;
        }

        @Override
        public Void visitSpace(Widget.Space space) {
            return null;
        }
    }
}
