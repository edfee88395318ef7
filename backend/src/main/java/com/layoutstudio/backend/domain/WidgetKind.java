package com.layoutstudio.backend.domain;

import java.util.Locale;

/**
 * Palette entries, one per {@link Widget} variant.
 */
public enum WidgetKind {
    COLUMN("Column"),
    ROW("Row"),
    STACK("Stack"),
    CONTAINER("Container"),
    SCROLLABLE("Scrollable"),
    TEXT("Text"),
    BUTTON("Button"),
    TEXT_INPUT("Text Input"),
    CHECKBOX("Checkbox"),
    SLIDER("Slider"),
    PICK_LIST("Pick List"),
    SPACE("Space");

    private final String displayName;

    WidgetKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Accepts "TEXT_INPUT", "text_input", "TextInput" and "text-input".
     */
    public static WidgetKind parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("widget_kind_required");
        String key = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown_widget_kind: " + raw);
        }
    }
}
