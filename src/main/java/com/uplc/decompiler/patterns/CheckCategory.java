package com.uplc.decompiler.patterns;

public enum CheckCategory {
    SIGNER("signer"),
    DEADLINE("deadline"),
    TOKEN("token"),
    VALUE("value"),
    OWNER("owner"),
    EQUALITY("equality"),
    COMPARISON("comparison"),
    UNKNOWN("unknown");

    public final String label;

    CheckCategory(String label) {
        this.label = label;
    }
}
