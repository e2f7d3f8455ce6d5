package com.uplc.decompiler.ir;

import java.util.List;

public final class IRFunction {

    public static final class Parameter {
        public final String name;
        public final IRType type;
        public final boolean optional;

        public Parameter(String name, IRType type, boolean optional) {
            this.name = name;
            this.type = type;
            this.optional = optional;
        }

        public Parameter(String name, IRType type) {
            this(name, type, false);
        }
    }

    public final String name;
    public final List<Parameter> params;
    public final IRType returnType;
    public final List<IRStatement> body;

    public IRFunction(String name, List<Parameter> params, IRType returnType, List<IRStatement> body) {
        this.name = name;
        this.params = List.copyOf(params);
        this.returnType = returnType;
        this.body = List.copyOf(body);
    }

    public IRFunction withBody(List<IRStatement> newBody) {
        return new IRFunction(name, params, returnType, newBody);
    }
}
