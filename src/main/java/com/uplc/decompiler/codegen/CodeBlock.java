package com.uplc.decompiler.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A node of a generated handler body.
 */
public final class CodeBlock {

    public enum Kind { WHEN, IF, LET, EXPECT, EXPRESSION, BLOCK }

    /** One arm of a {@code when}, or the then/else part of an {@code if}. */
    public static final class Branch {
        public final String pattern;
        public final CodeBlock body;

        public Branch(String pattern, CodeBlock body) {
            this.pattern = pattern;
            this.body = body;
        }
    }

    public final Kind kind;
    /**
     * Expression text for EXPRESSION and EXPECT, the bound value for LET, the subject of a
     * WHEN; null otherwise.
     */
    public final String content;
    /** Bound name of a LET, condition of an IF. */
    public final String label;
    public final List<Branch> branches;
    /** Statements of a BLOCK. */
    public final List<CodeBlock> children;

    private CodeBlock(Kind kind, String content, String label, List<Branch> branches, List<CodeBlock> children) {
        this.kind = kind;
        this.content = content;
        this.label = label;
        this.branches = List.copyOf(branches);
        this.children = List.copyOf(children);
    }

    public static CodeBlock expression(String text) {
        return new CodeBlock(Kind.EXPRESSION, text, null, List.of(), List.of());
    }

    public static CodeBlock let(String name, String value) {
        return new CodeBlock(Kind.LET, value, name, List.of(), List.of());
    }

    public static CodeBlock expect(String condition) {
        return new CodeBlock(Kind.EXPECT, condition, null, List.of(), List.of());
    }

    public static CodeBlock when(String subject, List<Branch> branches) {
        return new CodeBlock(Kind.WHEN, subject, null, branches, List.of());
    }

    public static CodeBlock ifElse(String condition, CodeBlock then, CodeBlock otherwise) {
        return new CodeBlock(Kind.IF, null, condition,
                List.of(new Branch("then", then), new Branch("else", otherwise)), List.of());
    }

    /** A sequence; a single statement is returned as is. */
    public static CodeBlock block(List<CodeBlock> statements) {
        if (statements.size() == 1) return statements.get(0);
        return new CodeBlock(Kind.BLOCK, null, null, List.of(), statements);
    }

    /** Same block with every text run through {@code f}. */
    CodeBlock mapText(UnaryOperator<String> f) {
        switch (kind) {
            case EXPRESSION: return expression(f.apply(content));
            case LET: return let(label, f.apply(content));
            case EXPECT: return expect(f.apply(content));
            case WHEN: {
                List<Branch> out = new ArrayList<>();
                for (Branch b : branches) out.add(new Branch(b.pattern, b.body.mapText(f)));
                return when(f.apply(content), out);
            }
            case IF:
                return ifElse(f.apply(label), branches.get(0).body.mapText(f), branches.get(1).body.mapText(f));
            default: {
                List<CodeBlock> out = new ArrayList<>();
                for (CodeBlock c : children) out.add(c.mapText(f));
                return new CodeBlock(Kind.BLOCK, null, null, List.of(), out);
            }
        }
    }
}
