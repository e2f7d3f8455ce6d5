package com.uplc.decompiler.ir;

import java.util.List;

/**
 * Common shape of expressions, statements and when-branches, so passes can walk the whole
 * tree with one explicit stack.
 */
public interface IRNode {

    /** Direct child nodes in evaluation order. */
    List<IRNode> children();

    /**
     * Same node over new children. {@code children} must line up with {@link #children()}:
     * same length, same node categories.
     */
    IRNode withChildren(List<IRNode> children);
}
