package com.layoutstudio.backend.service;

import com.layoutstudio.backend.domain.*;
import com.layoutstudio.backend.domain.WidgetAttrs.*;

import java.util.List;

/**
 * Palette defaults: the node a freshly dropped widget of each kind starts as.
 */
public final class WidgetFactory {

    private WidgetFactory() {
    }

    public static LayoutNode create(WidgetKind kind) {
        Widget widget = switch (kind) {
            case COLUMN -> Widget.Column.empty();
            case ROW -> new Widget.Row(List.of(), ContainerAttrs.DEFAULT);
            case STACK -> new Widget.Stack(List.of(), ContainerAttrs.DEFAULT);
            case CONTAINER -> new Widget.Container(null, ContainerAttrs.DEFAULT);
            case SCROLLABLE -> new Widget.Scrollable(null, ContainerAttrs.DEFAULT);
            case TEXT -> new Widget.Text("Text", TextAttrs.DEFAULT);
            case BUTTON -> new Widget.Button("Button", "ButtonPressed", ButtonAttrs.DEFAULT);
            case TEXT_INPUT -> new Widget.TextInput("Enter text...", "input_value", "InputChanged", InputAttrs.DEFAULT);
            case CHECKBOX -> new Widget.Checkbox("Checkbox", "is_checked", "CheckboxToggled", CheckboxAttrs.DEFAULT);
            case SLIDER -> new Widget.Slider(0, 100, "slider_value", "SliderChanged", SliderAttrs.DEFAULT);
            case PICK_LIST -> new Widget.PickList(List.of("Option 1", "Option 2"),
                    "selected_option", "OptionSelected", PickListAttrs.DEFAULT);
            case SPACE -> new Widget.Space(LengthSpec.fixed(20), LengthSpec.fixed(20));
        };
        return LayoutNode.of(widget);
    }
}
