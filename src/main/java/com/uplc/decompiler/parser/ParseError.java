package com.uplc.decompiler.parser;

/**
 * Failure to read UPLC text. Always carries the location of the offending token.
 */
public class ParseError extends RuntimeException {

    private final String description;
    private final SourceLocation location;

    public ParseError(String description, SourceLocation location) {
        super(description + " at " + location);
        this.description = description;
        this.location = location;
    }

    public String getDescription() {
        return description;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() { return location.line; }
    public int getColumn() { return location.column; }
    public int getOffset() { return location.offset; }
}
