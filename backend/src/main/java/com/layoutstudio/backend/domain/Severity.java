package com.layoutstudio.backend.domain;

public enum Severity {
    /** Makes the generated code fail to compile; blocks export. */
    ERROR,
    /** Incomplete but usable layout. */
    WARNING
}
