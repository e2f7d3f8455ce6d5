package com.uplc.decompiler.codegen;

import java.util.List;

/** One purpose handler inside a validator, e.g. {@code spend(...) { ... }}. */
public final class HandlerBlock {
    /** Handler keyword: spend, mint, withdraw, publish, vote or propose. */
    public final String kind;
    public final List<ParameterInfo> params;
    public final CodeBlock body;

    public HandlerBlock(String kind, List<ParameterInfo> params, CodeBlock body) {
        this.kind = kind;
        this.params = List.copyOf(params);
        this.body = body;
    }
}
