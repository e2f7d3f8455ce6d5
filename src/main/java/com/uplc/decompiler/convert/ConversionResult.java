package com.uplc.decompiler.convert;

import com.uplc.decompiler.term.Term;

public final class ConversionResult {
    private final Term term;
    private final int unrecognizedCount;
    private final int unboundCount;

    ConversionResult(Term term, int unrecognizedCount, int unboundCount) {
        this.term = term;
        this.unrecognizedCount = unrecognizedCount;
        this.unboundCount = unboundCount;
    }

    public Term term() { return term; }

    /** Nodes replaced by {@code Error} because their shape was not understood. */
    public int unrecognizedCount() { return unrecognizedCount; }

    /** Variables whose index pointed past every binder, rendered as {@code ?i}. */
    public int unboundCount() { return unboundCount; }

    public boolean isClean() {
        return unrecognizedCount == 0 && unboundCount == 0;
    }
}
