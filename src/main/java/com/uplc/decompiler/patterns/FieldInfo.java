package com.uplc.decompiler.patterns;

import com.uplc.decompiler.term.Term;

/**
 * A positional field read out of a constructor value:
 * {@code headList(tailList^index(sndPair(unConstrData(var))))}.
 */
public final class FieldInfo {
    public final int index;
    public final String accessPath;
    public final FieldType inferredType;
    /** Name suggested by data-flow analysis, or null. */
    public final String semanticName;
    /** First access node found. */
    public final Term node;

    public FieldInfo(int index, String accessPath, FieldType inferredType, String semanticName, Term node) {
        this.index = index;
        this.accessPath = accessPath;
        this.inferredType = inferredType;
        this.semanticName = semanticName;
        this.node = node;
    }

    public FieldInfo withSemanticName(String name) {
        return new FieldInfo(index, accessPath, inferredType, name, node);
    }

    @Override
    public String toString() {
        return "field " + index + ": " + inferredType.label + (semanticName != null ? " (" + semanticName + ")" : "");
    }
}
