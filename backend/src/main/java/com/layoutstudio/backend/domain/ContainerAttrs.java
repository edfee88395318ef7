package com.layoutstudio.backend.domain;

/**
 * Layout attributes shared by every container kind (Column, Row, Stack,
 * Container, Scrollable).
 */
public record ContainerAttrs(
        PaddingSpec padding,
        double spacing,
        AlignmentSpec alignX,
        AlignmentSpec alignY,
        LengthSpec width,
        LengthSpec height
) {
    public static final ContainerAttrs DEFAULT = new ContainerAttrs(
            PaddingSpec.ZERO, 0, AlignmentSpec.START, AlignmentSpec.START, LengthSpec.SHRINK, LengthSpec.SHRINK);

    public ContainerAttrs {
        padding = padding == null ? PaddingSpec.ZERO : padding;
        alignX = alignX == null ? AlignmentSpec.START : alignX;
        alignY = alignY == null ? AlignmentSpec.START : alignY;
        width = width == null ? LengthSpec.SHRINK : width;
        height = height == null ? LengthSpec.SHRINK : height;
    }

    public ContainerAttrs withPadding(PaddingSpec p) {
        return new ContainerAttrs(p, spacing, alignX, alignY, width, height);
    }

    public ContainerAttrs withSpacing(double s) {
        return new ContainerAttrs(padding, s, alignX, alignY, width, height);
    }

    public ContainerAttrs withSize(LengthSpec w, LengthSpec h) {
        return new ContainerAttrs(padding, spacing, alignX, alignY, w, h);
    }
}
