package com.layoutstudio.backend.domain;

/**
 * Exhaustive dispatch over the closed set of {@link Widget} variants. Adding a
 * variant adds a method here, so every consumer has to handle it.
 */
public interface WidgetVisitor<R> {

    R visitColumn(Widget.Column column);

    R visitRow(Widget.Row row);

    R visitStack(Widget.Stack stack);

    R visitContainer(Widget.Container container);

    R visitScrollable(Widget.Scrollable scrollable);

    R visitText(Widget.Text text);

    R visitButton(Widget.Button button);

    R visitTextInput(Widget.TextInput textInput);

    R visitCheckbox(Widget.Checkbox checkbox);

    R visitSlider(Widget.Slider slider);

    R visitPickList(Widget.PickList pickList);

    R visitSpace(Widget.Space space);
}
