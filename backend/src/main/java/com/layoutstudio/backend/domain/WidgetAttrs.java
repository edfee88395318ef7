package com.layoutstudio.backend.domain;

/**
 * Kind-specific attribute records for leaf widgets.
 */
public final class WidgetAttrs {

    private WidgetAttrs() {
    }

    /** RGBA color, each channel in [0, 1]. */
    public record Rgba(double r, double g, double b, double a) {}

    public record TextAttrs(double fontSize, Rgba color, AlignmentSpec horizontalAlignment) {
        public static final TextAttrs DEFAULT = new TextAttrs(16, null, AlignmentSpec.START);

        public TextAttrs {
            horizontalAlignment = horizontalAlignment == null ? AlignmentSpec.START : horizontalAlignment;
        }

        public TextAttrs withFontSize(double size) {
            return new TextAttrs(size, color, horizontalAlignment);
        }
    }

    public record ButtonAttrs(LengthSpec width, LengthSpec height) {
        public static final ButtonAttrs DEFAULT = new ButtonAttrs(LengthSpec.SHRINK, LengthSpec.SHRINK);

        public ButtonAttrs {
            width = width == null ? LengthSpec.SHRINK : width;
            height = height == null ? LengthSpec.SHRINK : height;
        }
    }

    public record InputAttrs(LengthSpec width) {
        public static final InputAttrs DEFAULT = new InputAttrs(LengthSpec.SHRINK);

        public InputAttrs {
            width = width == null ? LengthSpec.SHRINK : width;
        }
    }

    public record CheckboxAttrs(double spacing) {
        public static final CheckboxAttrs DEFAULT = new CheckboxAttrs(0);
    }

    public record SliderAttrs(LengthSpec width) {
        public static final SliderAttrs DEFAULT = new SliderAttrs(LengthSpec.FILL);

        public SliderAttrs {
            width = width == null ? LengthSpec.FILL : width;
        }
    }

    public record PickListAttrs(LengthSpec width, String placeholder) {
        public static final PickListAttrs DEFAULT = new PickListAttrs(LengthSpec.SHRINK, "");

        public PickListAttrs {
            width = width == null ? LengthSpec.SHRINK : width;
            placeholder = placeholder == null ? "" : placeholder;
        }
    }
}
