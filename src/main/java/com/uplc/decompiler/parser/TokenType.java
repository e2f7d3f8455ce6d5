package com.uplc.decompiler.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA,

    // Keywords.
    VAR, LAM, APP, CON, BUILTIN, FORCE, DELAY, ERROR, CASE, CONSTR, PROGRAM,
    TRUE, FALSE,

    // Literals.
    UNIT, VERSION, INTEGER, BYTESTRING, STRING, IDENTIFIER,

    EOF
}
