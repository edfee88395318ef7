package com.layoutstudio.backend.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Width/height of a widget.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "mode")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LengthSpec.Fill.class, name = "Fill"),
        @JsonSubTypes.Type(value = LengthSpec.Shrink.class, name = "Shrink"),
        @JsonSubTypes.Type(value = LengthSpec.FillPortion.class, name = "FillPortion"),
        @JsonSubTypes.Type(value = LengthSpec.Fixed.class, name = "Fixed")
})
public sealed interface LengthSpec
        permits LengthSpec.Fill, LengthSpec.Shrink, LengthSpec.FillPortion, LengthSpec.Fixed {

    LengthSpec FILL = new Fill();
    LengthSpec SHRINK = new Shrink();

    static LengthSpec fillPortion(int portion) {
        return new FillPortion(portion);
    }

    static LengthSpec fixed(double pixels) {
        return new Fixed(pixels);
    }

    /** Fill the available space. */
    record Fill() implements LengthSpec {}

    /** Shrink to fit the content. */
    record Shrink() implements LengthSpec {}

    record FillPortion(int portion) implements LengthSpec {
        public FillPortion {
            if (portion < 1) throw new IllegalArgumentException("fill_portion_must_be_positive");
        }
    }

    record Fixed(double pixels) implements LengthSpec {}
}
