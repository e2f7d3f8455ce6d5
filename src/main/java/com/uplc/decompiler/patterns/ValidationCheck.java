package com.uplc.decompiler.patterns;

import com.uplc.decompiler.term.Term;

public final class ValidationCheck {
    public final CheckCategory category;
    public final String builtin;
    public final String description;
    public final Term node;

    public ValidationCheck(CheckCategory category, String builtin, String description, Term node) {
        this.category = category;
        this.builtin = builtin;
        this.description = description;
        this.node = node;
    }

    @Override
    public String toString() {
        return category.label + ": " + description;
    }
}
