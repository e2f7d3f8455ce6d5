package com.uplc.decompiler.patterns;

public enum ScriptPurpose {
    SPEND("spend"),
    MINT("mint"),
    WITHDRAW("withdraw"),
    PUBLISH("publish"),
    VOTE("vote"),
    PROPOSE("propose"),
    UNKNOWN("unknown");

    public final String label;

    ScriptPurpose(String label) {
        this.label = label;
    }
}
