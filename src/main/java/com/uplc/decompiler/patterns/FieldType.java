package com.uplc.decompiler.patterns;

/** Type of a Data field, as revealed by the builtin that consumes it. */
public enum FieldType {
    INTEGER("integer"),
    BYTESTRING("bytestring"),
    STRING("string"),
    BOOL("bool"),
    LIST("list"),
    MAP("map"),
    DATA("data"),
    UNKNOWN("unknown");

    public final String label;

    FieldType(String label) {
        this.label = label;
    }
}
