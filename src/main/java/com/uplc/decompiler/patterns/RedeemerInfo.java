package com.uplc.decompiler.patterns;

import java.util.List;

import com.uplc.decompiler.term.Term;

public final class RedeemerInfo {

    public enum MatchPattern {
        /** Branches on the constructor index. */
        CONSTRUCTOR,
        /** Unpacked as a single constructor without branching. */
        STRUCT,
        UNKNOWN
    }

    public static final RedeemerInfo NONE = new RedeemerInfo(List.of(), MatchPattern.UNKNOWN, List.of(), null);

    /** Sorted by constructor index. */
    public final List<RedeemerVariant> variants;
    public final MatchPattern matchPattern;
    /** Fields of a {@link MatchPattern#STRUCT} redeemer. */
    public final List<FieldInfo> fields;
    /** Outermost conditional or case node that performs the dispatch, or null. */
    public final Term dispatchNode;

    public RedeemerInfo(List<RedeemerVariant> variants, MatchPattern matchPattern, List<FieldInfo> fields, Term dispatchNode) {
        this.variants = List.copyOf(variants);
        this.matchPattern = matchPattern;
        this.fields = List.copyOf(fields);
        this.dispatchNode = dispatchNode;
    }
}
