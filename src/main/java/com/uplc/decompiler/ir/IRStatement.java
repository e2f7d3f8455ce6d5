package com.uplc.decompiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * IR statements: control flow over {@link IRExpression}s.
 */
public abstract class IRStatement implements IRNode {

    public enum Kind { LET, EXPECT, RETURN, IF, WHEN, EXPRESSION, FAIL }

    public final Kind kind;

    private IRStatement(Kind kind) {
        this.kind = kind;
    }

    /** Control never reaches the statement after this one. */
    public boolean isTerminator() {
        return kind == Kind.RETURN || kind == Kind.FAIL;
    }

    public static final class Let extends IRStatement {
        public final String name;
        public final IRType type;
        public final IRExpression value;

        public Let(String name, IRType type, IRExpression value) {
            super(Kind.LET);
            this.name = name;
            this.type = type;
            this.value = value;
        }

        @Override public List<IRNode> children() { return List.of(value); }
        @Override public IRNode withChildren(List<IRNode> c) { return new Let(name, type, (IRExpression) c.get(0)); }
    }

    public static final class Expect extends IRStatement {
        public final IRPattern pattern;
        public final IRExpression value;
        /** Message reported on mismatch, or null. */
        public final String message;

        public Expect(IRPattern pattern, IRExpression value, String message) {
            super(Kind.EXPECT);
            this.pattern = pattern;
            this.value = value;
            this.message = message;
        }

        @Override public List<IRNode> children() { return List.of(value); }
        @Override public IRNode withChildren(List<IRNode> c) { return new Expect(pattern, (IRExpression) c.get(0), message); }
    }

    public static final class Return extends IRStatement {
        public final IRExpression value;

        public Return(IRExpression value) {
            super(Kind.RETURN);
            this.value = value;
        }

        @Override public List<IRNode> children() { return List.of(value); }
        @Override public IRNode withChildren(List<IRNode> c) { return new Return((IRExpression) c.get(0)); }
    }

    public static final class If extends IRStatement {
        public final IRExpression condition;
        public final List<IRStatement> thenBranch;
        /** Empty when there is no else branch. */
        public final List<IRStatement> elseBranch;

        public If(IRExpression condition, List<IRStatement> thenBranch, List<IRStatement> elseBranch) {
            super(Kind.IF);
            this.condition = condition;
            this.thenBranch = List.copyOf(thenBranch);
            this.elseBranch = elseBranch == null ? List.of() : List.copyOf(elseBranch);
        }

        @Override
        public List<IRNode> children() {
            List<IRNode> out = new ArrayList<>(1 + thenBranch.size() + elseBranch.size());
            out.add(condition);
            out.addAll(thenBranch);
            out.addAll(elseBranch);
            return out;
        }

        @Override
        public IRNode withChildren(List<IRNode> c) {
            int split = 1 + thenBranch.size();
            return new If((IRExpression) c.get(0),
                    IRNodes.statements(c.subList(1, split)),
                    IRNodes.statements(c.subList(split, c.size())));
        }
    }

    public static final class When extends IRStatement {
        public final IRExpression scrutinee;
        public final List<IRWhenBranch> branches;

        public When(IRExpression scrutinee, List<IRWhenBranch> branches) {
            super(Kind.WHEN);
            this.scrutinee = scrutinee;
            this.branches = List.copyOf(branches);
        }

        @Override
        public List<IRNode> children() {
            List<IRNode> out = new ArrayList<>(branches.size() + 1);
            out.add(scrutinee);
            out.addAll(branches);
            return out;
        }

        @Override
        public IRNode withChildren(List<IRNode> c) {
            return new When((IRExpression) c.get(0), IRNodes.branches(c.subList(1, c.size())));
        }
    }

    public static final class ExpressionStatement extends IRStatement {
        public final IRExpression value;

        public ExpressionStatement(IRExpression value) {
            super(Kind.EXPRESSION);
            this.value = value;
        }

        @Override public List<IRNode> children() { return List.of(value); }
        @Override public IRNode withChildren(List<IRNode> c) { return new ExpressionStatement((IRExpression) c.get(0)); }
    }

    public static final class Fail extends IRStatement {
        /** Trace message, or null. */
        public final String message;

        public Fail(String message) {
            super(Kind.FAIL);
            this.message = message;
        }

        @Override public List<IRNode> children() { return List.of(); }
        @Override public IRNode withChildren(List<IRNode> c) { return this; }
    }
}
