package com.layoutstudio.backend.domain;

public enum AlignmentSpec {
    START,
    CENTER,
    END
}
