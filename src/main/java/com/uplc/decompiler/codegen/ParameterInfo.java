package com.uplc.decompiler.codegen;

public final class ParameterInfo {
    public final String name;
    public final String type;

    public ParameterInfo(String name, String type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
