package com.uplc.decompiler.codegen;

import java.util.List;

public final class ValidatorBlock {
    public final String name;
    public final List<HandlerBlock> handlers;

    public ValidatorBlock(String name, List<HandlerBlock> handlers) {
        this.name = name;
        this.handlers = List.copyOf(handlers);
    }
}
