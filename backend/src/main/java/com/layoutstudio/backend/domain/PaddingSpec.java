package com.layoutstudio.backend.domain;

public record PaddingSpec(double top, double right, double bottom, double left) {

    public static final PaddingSpec ZERO = new PaddingSpec(0, 0, 0, 0);

    public static PaddingSpec uniform(double value) {
        return new PaddingSpec(value, value, value, value);
    }
}
