package com.uplc.decompiler.patterns;

import com.uplc.decompiler.term.Term;

/** A well-known contract idiom spotted in the body. */
public final class PatternMatch {

    public enum Kind { TIMELOCK, SIGNATURE, VALUE, NFT }

    public final Kind kind;
    public final String description;
    public final double confidence;
    public final Term location;

    public PatternMatch(Kind kind, String description, double confidence, Term location) {
        this.kind = kind;
        this.description = description;
        this.confidence = confidence;
        this.location = location;
    }
}
