package com.uplc.decompiler.patterns;

import com.uplc.decompiler.term.Term;

/** Non-constant let-binding wrapped around the validator lambdas (a shared helper). */
public final class OuterBinding {
    public final String name;
    public final Term value;

    public OuterBinding(String name, Term value) {
        this.name = name;
        this.value = value;
    }
}
