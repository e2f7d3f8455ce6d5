package com.uplc.decompiler.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.uplc.debug.Debug;
import com.uplc.decompiler.term.Hex;

public class Lexer {
    private static final String TAG = "Lexer";
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("var", TokenType.VAR);
        map.put("lam", TokenType.LAM);
        map.put("app", TokenType.APP);
        map.put("con", TokenType.CON);
        map.put("builtin", TokenType.BUILTIN);
        map.put("force", TokenType.FORCE);
        map.put("delay", TokenType.DELAY);
        map.put("error", TokenType.ERROR);
        map.put("case", TokenType.CASE);
        map.put("constr", TokenType.CONSTR);
        map.put("program", TokenType.PROGRAM);
        map.put("True", TokenType.TRUE);
        map.put("False", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        start = current;
        startLine = line;
        startColumn = current - lineStart + 1;
        tokens.add(new Token(TokenType.EOF, "", null, location()));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(':
                if (peek() == ')') {
                    advance();
                    addToken(TokenType.UNIT);
                } else {
                    addToken(TokenType.LEFT_PAREN);
                }
                break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '-':
                if (match('-')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (isDigit(peek())) {
                    number();
                } else {
                    throw error("Unexpected character '-'");
                }
                break;
            case '+':
                if (isDigit(peek())) number();
                else throw error("Unexpected character '+'");
                break;
            case '#':
                hexBytes();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                lineStart = current;
                break;
            case '"':
                string();
                break;
            default:
                if (c == '0' && (peek() == 'x' || peek() == 'X') && isHexDigit(peekNext())) {
                    advance();
                    hexBytes();
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    /** Integers, plus the dotted {@code 1.0.0} program version. */
    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            while (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek())) advance();
            }
            addToken(TokenType.VERSION, source.substring(start, current));
            return;
        }
        String text = source.substring(start, current);
        if (text.startsWith("+")) text = text.substring(1);
        addToken(TokenType.INTEGER, new BigInteger(text));
    }

    private void hexBytes() {
        int digitsStart = current;
        while (isHexDigit(peek())) advance();
        String hex = source.substring(digitsStart, current);
        if ((hex.length() & 1) != 0) {
            throw error("Byte string literal has odd number of hex digits");
        }
        addToken(TokenType.BYTESTRING, Hex.decode(hex));
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') {
                line++;
                lineStart = current;
            }
            if (c == '\\') {
                if (isAtEnd()) break;
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    default: throw error("Unknown escape sequence '\\" + e + "'");
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        // Primes are legal in generated names: x', x''
        return isAlpha(c) || isDigit(c) || c == '\'';
    }

    private SourceLocation location() {
        return new SourceLocation(startLine, startColumn, start);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, location()));
    }

    private ParseError error(String msg) {
        SourceLocation at = location();
        Debug.get().d(TAG, msg + " at " + at.line + ":" + at.column);
        return new ParseError(msg, at);
    }
}
