package com.uplc.decompiler.ir;

import java.util.List;

/**
 * Patterns on the left of a when-branch or an expect.
 */
public abstract class IRPattern {

    public enum Kind { WILDCARD, LITERAL, VARIABLE, CONSTRUCTOR, TUPLE }

    public static final IRPattern WILDCARD = new IRPattern(Kind.WILDCARD) {
        @Override public String toString() { return "_"; }
    };

    public final Kind kind;

    private IRPattern(Kind kind) {
        this.kind = kind;
    }

    public static IRPattern literal(Object value) { return new LiteralPattern(value); }
    public static IRPattern variable(String name, IRType type) { return new VariablePattern(name, type); }
    public static IRPattern constructor(String name, List<IRPattern> args) { return new ConstructorPattern(name, args); }
    public static IRPattern tuple(List<IRPattern> elements) { return new TuplePattern(elements); }

    public static final class LiteralPattern extends IRPattern {
        public final Object value;

        private LiteralPattern(Object value) {
            super(Kind.LITERAL);
            this.value = value;
        }

        @Override public String toString() { return String.valueOf(value); }
    }

    public static final class VariablePattern extends IRPattern {
        public final String name;
        public final IRType type;

        private VariablePattern(String name, IRType type) {
            super(Kind.VARIABLE);
            this.name = name;
            this.type = type;
        }

        @Override public String toString() { return name; }
    }

    public static final class ConstructorPattern extends IRPattern {
        public final String name;
        public final List<IRPattern> args;

        private ConstructorPattern(String name, List<IRPattern> args) {
            super(Kind.CONSTRUCTOR);
            this.name = name;
            this.args = List.copyOf(args);
        }

        @Override
        public String toString() {
            return args.isEmpty() ? name : name + "(" + join(args) + ")";
        }
    }

    public static final class TuplePattern extends IRPattern {
        public final List<IRPattern> elements;

        private TuplePattern(List<IRPattern> elements) {
            super(Kind.TUPLE);
            this.elements = List.copyOf(elements);
        }

        @Override public String toString() { return "(" + join(elements) + ")"; }
    }

    private static String join(List<IRPattern> patterns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < patterns.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(patterns.get(i));
        }
        return sb.toString();
    }
}
