package com.uplc.decompiler.codegen;

import com.uplc.decompiler.term.Term;

/**
 * How one let-bound name is rendered.
 *
 * An {@link Category#INLINE} or {@link Category#ALIAS} binding disappears from the output: every
 * reference is replaced by {@link #substitution}. A {@link Category#KEEP} binding stays a
 * {@code let} and is referenced by its display name.
 */
public final class Binding {

    public enum Category { INLINE, ALIAS, KEEP }

    /** Shape of the bound value. */
    public enum Pattern {
        CONSTANT,
        IDENTITY,
        APPLY,
        IS_CONSTR,
        FIELD_ACCESSOR,
        BUILTIN_WRAPPER,
        PARTIAL_BUILTIN,
        BOOLEAN_AND,
        BOOLEAN_OR,
        Z_COMBINATOR,
        EXPRESSION,
        UNKNOWN
    }

    public final String name;
    public final Term value;
    public final Category category;
    public final Pattern pattern;
    /** Helper name such as {@code is_constr_1}, or null. */
    public final String semanticName;
    /** Source text of the substitution, for inline and alias bindings. */
    public final String inlineText;
    /** Value of a constant-foldable expression, or null. */
    public final String foldedValue;
    /** Last name of an alias chain. */
    public final String target;
    /** Term that replaces references, or null for kept bindings. */
    public final Term substitution;

    Binding(String name, Term value, Category category, Pattern pattern, String semanticName,
            String inlineText, String foldedValue, String target, Term substitution) {
        this.name = name;
        this.value = value;
        this.category = category;
        this.pattern = pattern;
        this.semanticName = semanticName;
        this.inlineText = inlineText;
        this.foldedValue = foldedValue;
        this.target = target;
        this.substitution = substitution;
    }

    static Binding keep(String name, Term value, Pattern pattern, String semanticName) {
        return new Binding(name, value, Category.KEEP, pattern, semanticName, null, null, null, null);
    }

    static Binding inline(String name, Term value, Pattern pattern, String semanticName, Term substitution,
                          String foldedValue) {
        return new Binding(name, value, Category.INLINE, pattern, semanticName, null, foldedValue, null, substitution);
    }

    static Binding alias(String name, Term value, String target, Term substitution, String foldedValue) {
        return new Binding(name, value, Category.ALIAS, Pattern.UNKNOWN, null, null, foldedValue, target, substitution);
    }

    Binding withInlineText(String text) {
        return new Binding(name, value, category, pattern, semanticName, text, foldedValue, target, substitution);
    }

    public boolean isInlinable() {
        return category != Category.KEEP;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(": ").append(category);
        if (pattern != Pattern.UNKNOWN) sb.append(' ').append(pattern);
        if (target != null) sb.append(" -> ").append(target);
        if (inlineText != null) sb.append(" = ").append(inlineText);
        return sb.toString();
    }
}
