package com.uplc.decompiler.patterns;

import com.uplc.decompiler.term.Constant;

/** A constant applied to the validator before deployment. */
public final class ScriptParameter {
    public final String name;
    public final Constant value;

    public ScriptParameter(String name, Constant value) {
        this.name = name;
        this.value = value;
    }

    public String typeName() {
        return value.type.toString();
    }
}
