package com.uplc.decompiler.parser;

/** Position in UPLC source text. Line and column are 1-based, offset is 0-based. */
public final class SourceLocation {
    public final int line;
    public final int column;
    public final int offset;

    public SourceLocation(int line, int column, int offset) {
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
