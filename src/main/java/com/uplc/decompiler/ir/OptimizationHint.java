package com.uplc.decompiler.ir;

public final class OptimizationHint {

    public enum Kind { INLINE, DEAD_CODE, CONSTANT_FOLD, TAIL_CALL }

    public final Kind kind;
    public final String target;
    public final double confidence;

    public OptimizationHint(Kind kind, String target, double confidence) {
        this.kind = kind;
        this.target = target;
        this.confidence = confidence;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + target + " (" + confidence + ")";
    }
}
