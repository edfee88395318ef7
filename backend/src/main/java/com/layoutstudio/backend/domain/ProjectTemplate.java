package com.layoutstudio.backend.domain;

import com.layoutstudio.backend.domain.WidgetAttrs.*;

import java.util.List;
import java.util.Locale;

/**
 * Starter documents offered when a project is created.
 */
public enum ProjectTemplate {
    BLANK,
    FORM,
    DASHBOARD;

    public static ProjectTemplate parse(String raw) {
        if (raw == null || raw.isBlank()) return BLANK;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown_template: " + raw);
        }
    }

    public LayoutDocument newDocument() {
        switch (this) {
            case FORM:
                return form();
            case DASHBOARD:
                return dashboard();
            default:
                return LayoutDocument.untitled();
        }
    }

    private static LayoutDocument form() {
        ContainerAttrs attrs = ContainerAttrs.DEFAULT
                .withSpacing(10)
                .withPadding(PaddingSpec.uniform(20));
        return new LayoutDocument(LayoutDocument.CURRENT_VERSION, "Form", LayoutNode.of(new Widget.Column(List.of(
                LayoutNode.of(new Widget.Text("Form Title", TextAttrs.DEFAULT.withFontSize(24))),
                LayoutNode.of(new Widget.TextInput("Enter your name...", "name", "NameChanged", InputAttrs.DEFAULT)),
                LayoutNode.of(new Widget.TextInput("Enter your email...", "email", "EmailChanged", InputAttrs.DEFAULT)),
                LayoutNode.of(new Widget.Button("Submit", "Submit", ButtonAttrs.DEFAULT))
        ), attrs)));
    }

    private static LayoutDocument dashboard() {
        LayoutNode header = LayoutNode.of(new Widget.Row(List.of(
                LayoutNode.of(new Widget.Text("Dashboard", TextAttrs.DEFAULT.withFontSize(28))),
                LayoutNode.of(new Widget.Space(LengthSpec.FILL, LengthSpec.SHRINK)),
                LayoutNode.of(new Widget.Button("Settings", "OpenSettings", ButtonAttrs.DEFAULT))
        ), ContainerAttrs.DEFAULT.withSpacing(10)));

        LayoutNode left = LayoutNode.of(new Widget.Column(List.of(
                LayoutNode.of(new Widget.Text("Statistics", TextAttrs.DEFAULT))
        ), ContainerAttrs.DEFAULT.withSize(LengthSpec.fillPortion(1), LengthSpec.SHRINK)));
        LayoutNode right = LayoutNode.of(new Widget.Column(List.of(
                LayoutNode.of(new Widget.Text("Activity", TextAttrs.DEFAULT))
        ), ContainerAttrs.DEFAULT.withSize(LengthSpec.fillPortion(2), LengthSpec.SHRINK)));
        LayoutNode content = LayoutNode.of(new Widget.Row(List.of(left, right),
                ContainerAttrs.DEFAULT.withSpacing(20).withSize(LengthSpec.SHRINK, LengthSpec.FILL)));

        ContainerAttrs rootAttrs = ContainerAttrs.DEFAULT
                .withSpacing(20)
                .withPadding(PaddingSpec.uniform(20))
                .withSize(LengthSpec.FILL, LengthSpec.FILL);
        return new LayoutDocument(LayoutDocument.CURRENT_VERSION, "Dashboard",
                LayoutNode.of(new Widget.Column(List.of(header, content), rootAttrs)));
    }
}
