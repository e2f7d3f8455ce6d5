package com.uplc.decompiler.ir;

import java.util.ArrayList;
import java.util.List;

public final class IRWhenBranch implements IRNode {
    public final IRPattern pattern;
    /** Optional guard expression, or null. */
    public final IRExpression guard;
    public final List<IRStatement> body;

    public IRWhenBranch(IRPattern pattern, IRExpression guard, List<IRStatement> body) {
        this.pattern = pattern;
        this.guard = guard;
        this.body = List.copyOf(body);
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> out = new ArrayList<>(body.size() + 1);
        if (guard != null) out.add(guard);
        out.addAll(body);
        return out;
    }

    @Override
    public IRNode withChildren(List<IRNode> c) {
        if (guard == null) return new IRWhenBranch(pattern, null, IRNodes.statements(c));
        return new IRWhenBranch(pattern, (IRExpression) c.get(0), IRNodes.statements(c.subList(1, c.size())));
    }
}
