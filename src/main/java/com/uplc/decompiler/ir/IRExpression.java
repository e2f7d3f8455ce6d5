package com.uplc.decompiler.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * IR expressions. Every node carries the type known for it, {@link IRType#UNKNOWN} when
 * nothing is known.
 */
public abstract class IRExpression implements IRNode {

    public enum Kind { LITERAL, VARIABLE, BINARY, UNARY, CALL, LAMBDA, CONSTRUCTOR, WHEN }

    public enum BinaryOp {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
        AND("&&"), OR("||"),
        CONCAT("++");

        public final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum UnaryOp {
        NOT("!"), NEGATE("-");

        public final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }
    }

    public final Kind kind;
    public final IRType type;

    private IRExpression(Kind kind, IRType type) {
        this.kind = kind;
        this.type = type != null ? type : IRType.UNKNOWN;
    }

    @Override
    public String toString() {
        return IRPrinter.expression(this);
    }

    // -------------------------
    // Nodes
    // -------------------------

    /**
     * Literal value: {@code BigInteger} for Int, {@code Boolean}, {@code byte[]} for ByteArray,
     * {@code String}, null for unit, and the original constant for anything else.
     */
    public static final class Literal extends IRExpression {
        public final Object value;

        public Literal(Object value, IRType type) {
            super(Kind.LITERAL, type);
            this.value = value;
        }

        @Override public List<IRNode> children() { return List.of(); }
        @Override public IRNode withChildren(List<IRNode> children) { return this; }
    }

    public static final class Variable extends IRExpression {
        public final String name;

        public Variable(String name, IRType type) {
            super(Kind.VARIABLE, type);
            this.name = Objects.requireNonNull(name);
        }

        @Override public List<IRNode> children() { return List.of(); }
        @Override public IRNode withChildren(List<IRNode> children) { return this; }
    }

    public static final class Binary extends IRExpression {
        public final BinaryOp op;
        public final IRExpression left;
        public final IRExpression right;

        public Binary(BinaryOp op, IRExpression left, IRExpression right, IRType type) {
            super(Kind.BINARY, type);
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override public List<IRNode> children() { return List.of(left, right); }

        @Override
        public IRNode withChildren(List<IRNode> c) {
            return new Binary(op, (IRExpression) c.get(0), (IRExpression) c.get(1), type);
        }
    }

    public static final class Unary extends IRExpression {
        public final UnaryOp op;
        public final IRExpression operand;

        public Unary(UnaryOp op, IRExpression operand, IRType type) {
            super(Kind.UNARY, type);
            this.op = op;
            this.operand = operand;
        }

        @Override public List<IRNode> children() { return List.of(operand); }

        @Override
        public IRNode withChildren(List<IRNode> c) {
            return new Unary(op, (IRExpression) c.get(0), type);
        }
    }

    public static final class Call extends IRExpression {
        public final IRExpression func;
        public final List<IRExpression> args;

        public Call(IRExpression func, List<IRExpression> args, IRType type) {
            super(Kind.CALL, type);
            this.func = func;
            this.args = List.copyOf(args);
        }

        @Override
        public List<IRNode> children() {
            List<IRNode> out = new ArrayList<>(args.size() + 1);
            out.add(func);
            out.addAll(args);
            return out;
        }

        @Override
        public IRNode withChildren(List<IRNode> c) {
            return new Call((IRExpression) c.get(0), IRNodes.expressions(c.subList(1, c.size())), type);
        }
    }

    public static final class Lambda extends IRExpression {
        public final List<IRFunction.Parameter> params;
        public final List<IRStatement> body;

        public Lambda(List<IRFunction.Parameter> params, List<IRStatement> body, IRType type) {
            super(Kind.LAMBDA, type);
            this.params = List.copyOf(params);
            this.body = List.copyOf(body);
        }

        @Override public List<IRNode> children() { return new ArrayList<>(body); }

        @Override
        public IRNode withChildren(List<IRNode> c) {
            return new Lambda(params, IRNodes.statements(c), type);
        }
    }

    public static final class Constructor extends IRExpression {
        public final String typeName;
        public final List<IRExpression> args;

        public Constructor(String typeName, List<IRExpression> args, IRType type) {
            super(Kind.CONSTRUCTOR, type);
            this.typeName = typeName;
            this.args = List.copyOf(args);
        }

        @Override public List<IRNode> children() { return new ArrayList<>(args); }

        @Override
        public IRNode withChildren(List<IRNode> c) {
            return new Constructor(typeName, IRNodes.expressions(c), type);
        }
    }

    public static final class When extends IRExpression {
        public final IRExpression scrutinee;
        public final List<IRWhenBranch> branches;

        public When(IRExpression scrutinee, List<IRWhenBranch> branches, IRType type) {
            super(Kind.WHEN, type);
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
            return new When((IRExpression) c.get(0), IRNodes.branches(c.subList(1, c.size())), type);
        }
    }

    // -------------------------
    // Factories
    // -------------------------

    public static Literal literal(Object value, IRType type) { return new Literal(value, type); }
    public static Literal unit() { return new Literal(null, IRType.UNIT); }
    public static Literal bool(boolean b) { return new Literal(b, IRType.BOOL); }
    public static Variable variable(String name) { return new Variable(name, IRType.UNKNOWN); }

    public static Binary binary(BinaryOp op, IRExpression left, IRExpression right) {
        return new Binary(op, left, right, IRType.UNKNOWN);
    }
}
