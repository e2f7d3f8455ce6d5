package com.uplc.decompiler.patterns;

import java.util.List;

import com.uplc.decompiler.term.Term;

public final class RedeemerVariant {
    public final int index;
    public final String name;
    public final List<FieldInfo> fields;
    /** Branch taken for this constructor; a node of the analyzed tree. */
    public final Term body;

    public RedeemerVariant(int index, String name, List<FieldInfo> fields, Term body) {
        if (index < 0) throw new IllegalArgumentException("variant index must be non-negative: " + index);
        this.index = index;
        this.name = name;
        this.fields = List.copyOf(fields);
        this.body = body;
    }

    public RedeemerVariant withFields(List<FieldInfo> newFields) {
        return new RedeemerVariant(index, name, newFields, body);
    }
}
