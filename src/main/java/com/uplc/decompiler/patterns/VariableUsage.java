package com.uplc.decompiler.patterns;

import com.uplc.decompiler.term.Term;

public final class VariableUsage {

    public enum Kind { COMPARISON, CRYPTO, ARITHMETIC, LIST_OP, DATA_EXTRACT, OTHER }

    public final Kind kind;
    public final String builtin;
    public final Term location;
    /** Surface type the builtin implies for the value ({@code Int}, {@code ByteArray}, ...), or null. */
    public final String impliedType;

    public VariableUsage(Kind kind, String builtin, Term location, String impliedType) {
        this.kind = kind;
        this.builtin = builtin;
        this.location = location;
        this.impliedType = impliedType;
    }
}
