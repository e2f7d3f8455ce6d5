package com.uplc.decompiler.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    public final SourceLocation location;

    Token(TokenType type, String lexeme, Object literal, SourceLocation location) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.location = location;
    }

    public TokenType type() {
        return type;
    }

    /** How the token reads in an error message. */
    String describe() {
        switch (type) {
            case EOF: return "end of input";
            case IDENTIFIER: return "identifier '" + lexeme + "'";
            case INTEGER: return "integer " + lexeme;
            case STRING: return "string " + lexeme;
            default: return "'" + lexeme + "'";
        }
    }

    @Override
    public String toString() {
        return type + " " + lexeme + " @" + location;
    }
}
