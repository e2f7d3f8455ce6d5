package com.uplc.decompiler.parser;

import com.uplc.decompiler.term.Term;

/** A parsed {@code (program version term)}. Bare terms get a null version. */
public final class Program {
    public final String version;
    public final Term term;

    public Program(String version, Term term) {
        this.version = version;
        this.term = term;
    }
}
