package com.uplc.decompiler.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Bottom-up rewriting over IR trees with an explicit stack.
 */
final class IRNodes {

    private IRNodes() {}

    private static final class Frame {
        final IRNode node;
        final List<IRNode> kids;
        final List<IRNode> done;
        boolean changed;

        Frame(IRNode node) {
            this.node = node;
            this.kids = node.children();
            this.done = new ArrayList<>(kids.size());
        }
    }

    /**
     * Rebuilds every node over its rewritten children, then applies {@code post} to it.
     * Nodes whose children come back unchanged are not rebuilt.
     */
    static IRNode rewrite(IRNode root, UnaryOperator<IRNode> post) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        IRNode result = null;
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.done.size() < top.kids.size()) {
                stack.push(new Frame(top.kids.get(top.done.size())));
                continue;
            }
            stack.pop();
            IRNode rebuilt = top.changed ? top.node.withChildren(top.done) : top.node;
            IRNode out = post.apply(rebuilt);
            Frame parent = stack.peek();
            if (parent == null) {
                result = out;
            } else {
                if (out != parent.kids.get(parent.done.size())) parent.changed = true;
                parent.done.add(out);
            }
        }
        return result;
    }

    static List<IRStatement> rewriteAll(List<IRStatement> statements, UnaryOperator<IRNode> post) {
        List<IRStatement> out = new ArrayList<>(statements.size());
        for (IRStatement s : statements) {
            out.add((IRStatement) rewrite(s, post));
        }
        return out;
    }

    static List<IRExpression> expressions(List<IRNode> nodes) {
        List<IRExpression> out = new ArrayList<>(nodes.size());
        for (IRNode n : nodes) out.add((IRExpression) n);
        return out;
    }

    static List<IRStatement> statements(List<IRNode> nodes) {
        List<IRStatement> out = new ArrayList<>(nodes.size());
        for (IRNode n : nodes) out.add((IRStatement) n);
        return out;
    }

    static List<IRWhenBranch> branches(List<IRNode> nodes) {
        List<IRWhenBranch> out = new ArrayList<>(nodes.size());
        for (IRNode n : nodes) out.add((IRWhenBranch) n);
        return out;
    }
}
