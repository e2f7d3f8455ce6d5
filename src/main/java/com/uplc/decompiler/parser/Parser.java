package com.uplc.decompiler.parser;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.uplc.debug.Debug;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.PlutusData;
import com.uplc.decompiler.term.Term;

/**
 * Recursive-descent parser for UPLC text.
 *
 * Accepts both {@code (app f x)} and the bracket form {@code [f x y]}, which is left-folded
 * into nested applications. Variables must be bound by an enclosing {@code lam}.
 */
public class Parser {
    private static final String TAG = "Parser";

    private final List<Token> tokens;
    private int current = 0;
    private final Deque<String> scope = new ArrayDeque<>();

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public static Term parse(String source) {
        return parseProgram(source).term;
    }

    public static Program parseProgram(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        Debug.get().d(TAG, tokens.size() + " token(s)");
        return new Parser(tokens).program();
    }

    /** {@code (program 1.0.0 term)} or a bare term, followed by end of input. */
    public Program program() {
        String version = null;
        Term term;
        if (check(TokenType.LEFT_PAREN) && checkNext(TokenType.PROGRAM)) {
            advance();
            advance();
            Token v = consume(TokenType.VERSION, "version", "program");
            version = (String) v.literal;
            term = term("program");
            consume(TokenType.RIGHT_PAREN, "')'", "program");
        } else {
            term = term("program");
        }
        if (!isAtEnd()) {
            throw error(peek(), "Expected end of input but got " + peek().describe() + " in program");
        }
        return new Program(version, term);
    }

    private Term term(String context) {
        if (match(TokenType.LEFT_BRACKET)) return bracketApplication();
        if (!match(TokenType.LEFT_PAREN)) {
            throw expected("term", context);
        }

        if (isAtEnd()) throw expected("term keyword", context);
        Token keyword = advance();
        Term result;
        switch (keyword.type) {
            case VAR: result = variable(); break;
            case LAM: result = lambda(); break;
            case APP: result = application(); break;
            case CON: result = constant(); break;
            case BUILTIN: {
                Token name = consume(TokenType.IDENTIFIER, "builtin name", "builtin");
                result = Term.builtin(name.lexeme);
                break;
            }
            case FORCE: result = Term.force(term("force")); break;
            case DELAY: result = Term.delay(term("delay")); break;
            case ERROR: result = Term.error(); break;
            case CASE: result = caseTerm(); break;
            case CONSTR: result = constrTerm(); break;
            default:
                throw error(keyword, "Expected term keyword but got " + keyword.describe() + " in " + context);
        }
        consume(TokenType.RIGHT_PAREN, "')'", keyword.lexeme);
        return result;
    }

    private Term variable() {
        Token name = consume(TokenType.IDENTIFIER, "variable name", "var");
        if (!scope.contains(name.lexeme)) {
            throw error(name, "Unbound variable '" + name.lexeme + "' in var");
        }
        return Term.var(name.lexeme);
    }

    /**
     * Binders of directly nested {@code (lam x (lam y ...))} forms are collected in a loop, so
     * the body is parsed once at constant stack depth however long the chain is. The closing
     * parenthesis of the outermost lam is left to {@link #term}.
     */
    private Term lambda() {
        List<String> params = new ArrayList<>();
        int scopeDepth = scope.size();
        try {
            params.add(consume(TokenType.IDENTIFIER, "parameter name", "lam").lexeme);
            scope.push(params.get(0));
            while (check(TokenType.LEFT_PAREN) && checkNext(TokenType.LAM)) {
                advance();
                advance();
                String name = consume(TokenType.IDENTIFIER, "parameter name", "lam").lexeme;
                params.add(name);
                scope.push(name);
            }

            Term body = term("lam");
            for (int i = params.size() - 1; i >= 1; i--) {
                consume(TokenType.RIGHT_PAREN, "')'", "lam");
                body = Term.lam(params.get(i), body);
            }
            return Term.lam(params.get(0), body);
        } finally {
            while (scope.size() > scopeDepth) scope.pop();
        }
    }

    private Term application() {
        Term result = term("app");
        result = Term.apply(result, term("app"));
        while (!check(TokenType.RIGHT_PAREN) && !isAtEnd()) {
            result = Term.apply(result, term("app"));
        }
        return result;
    }

    private Term bracketApplication() {
        Term result = term("application");
        if (check(TokenType.RIGHT_BRACKET)) {
            throw error(peek(), "Expected argument but got ']' in application");
        }
        while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
            result = Term.apply(result, term("application"));
        }
        consume(TokenType.RIGHT_BRACKET, "']'", "application");
        return result;
    }

    private Term caseTerm() {
        Term scrutinee = term("case");
        List<Term> branches = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN) && !isAtEnd()) {
            branches.add(term("case"));
        }
        return Term.caseOf(scrutinee, branches);
    }

    private Term constrTerm() {
        long index = nonNegativeIndex("constr");
        List<Term> args = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN) && !isAtEnd()) {
            args.add(term("constr"));
        }
        return Term.constr(index, args);
    }

    // -------------------------
    // Constants
    // -------------------------

    private Term constant() {
        ConstType type = type();
        return Term.con(value(type));
    }

    private ConstType type() {
        if (match(TokenType.LEFT_PAREN)) {
            ConstType t = type();
            consume(TokenType.RIGHT_PAREN, "')'", "type");
            return t;
        }
        Token name = consume(TokenType.IDENTIFIER, "type name", "con");
        ConstType.Kind kind = ConstType.Kind.fromKeyword(name.lexeme);
        if (kind == null) {
            throw error(name, "Expected type name but got " + name.describe() + " in con");
        }
        switch (kind) {
            case LIST: return ConstType.list(type());
            case PAIR: {
                ConstType fst = type();
                return ConstType.pair(fst, type());
            }
            default: return ConstType.simple(kind);
        }
    }

    private Constant value(ConstType type) {
        switch (type.kind) {
            case INTEGER:
                return Constant.integer((BigInteger) consume(TokenType.INTEGER, "integer", "con integer").literal);
            case BYTESTRING:
                return Constant.bytes((byte[]) consume(TokenType.BYTESTRING, "byte string", "con bytestring").literal);
            case BLS12_381_G1_ELEMENT:
            case BLS12_381_G2_ELEMENT:
            case BLS12_381_ML_RESULT:
                return Constant.opaque(type, (byte[]) consume(TokenType.BYTESTRING, "byte string", "con " + type).literal);
            case STRING:
                return Constant.string((String) consume(TokenType.STRING, "string", "con string").literal);
            case BOOL:
                if (match(TokenType.TRUE)) return Constant.bool(true);
                if (match(TokenType.FALSE)) return Constant.bool(false);
                throw expected("True or False", "con bool");
            case UNIT:
                consume(TokenType.UNIT, "'()'", "con unit");
                return Constant.unit();
            case DATA:
                return Constant.data(data());
            case LIST: {
                consume(TokenType.LEFT_BRACKET, "'['", "con " + type);
                List<Constant> items = new ArrayList<>();
                if (!check(TokenType.RIGHT_BRACKET)) {
                    do {
                        items.add(value(type.first));
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_BRACKET, "']'", "con " + type);
                return Constant.list(type.first, items);
            }
            case PAIR: {
                consume(TokenType.LEFT_PAREN, "'('", "con " + type);
                Constant fst = value(type.first);
                consume(TokenType.COMMA, "','", "con " + type);
                Constant snd = value(type.second);
                consume(TokenType.RIGHT_PAREN, "')'", "con " + type);
                return Constant.pair(fst, snd);
            }
            default:
                throw error(peek(), "Unsupported constant type " + type);
        }
    }

    private PlutusData data() {
        if (match(TokenType.LEFT_PAREN)) {
            PlutusData d = data();
            consume(TokenType.RIGHT_PAREN, "')'", "data");
            return d;
        }
        Token ctor = consume(TokenType.IDENTIFIER, "data constructor", "data");
        switch (ctor.lexeme) {
            case "Constr": {
                long index = nonNegativeIndex("data Constr");
                return PlutusData.constr(index, dataList("data Constr"));
            }
            case "Map": {
                consume(TokenType.LEFT_BRACKET, "'['", "data Map");
                List<Map.Entry<PlutusData, PlutusData>> entries = new ArrayList<>();
                if (!check(TokenType.RIGHT_BRACKET)) {
                    do {
                        entries.add(mapEntry());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_BRACKET, "']'", "data Map");
                return PlutusData.map(entries);
            }
            case "List":
                return PlutusData.list(dataList("data List"));
            case "I":
                return PlutusData.integer((BigInteger) consume(TokenType.INTEGER, "integer", "data I").literal);
            case "B":
                return PlutusData.bytes((byte[]) consume(TokenType.BYTESTRING, "byte string", "data B").literal);
            default:
                throw error(ctor, "Expected data constructor but got " + ctor.describe() + " in data");
        }
    }

    /** Map entries are written {@code (k, v)} or {@code [k, v]}. */
    private Map.Entry<PlutusData, PlutusData> mapEntry() {
        TokenType close;
        if (match(TokenType.LEFT_PAREN)) close = TokenType.RIGHT_PAREN;
        else if (match(TokenType.LEFT_BRACKET)) close = TokenType.RIGHT_BRACKET;
        else throw expected("map entry", "data Map");
        PlutusData k = data();
        consume(TokenType.COMMA, "','", "data Map entry");
        PlutusData v = data();
        consume(close, close == TokenType.RIGHT_PAREN ? "')'" : "']'", "data Map entry");
        return Map.entry(k, v);
    }

    private List<PlutusData> dataList(String context) {
        consume(TokenType.LEFT_BRACKET, "'['", context);
        List<PlutusData> items = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACKET)) {
            do {
                items.add(data());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACKET, "']'", context);
        return items;
    }

    private long nonNegativeIndex(String context) {
        Token t = consume(TokenType.INTEGER, "constructor index", context);
        BigInteger i = (BigInteger) t.literal;
        if (i.signum() < 0 || i.bitLength() > 63) {
            throw error(t, "Expected non-negative constructor index but got " + t.lexeme + " in " + context);
        }
        return i.longValue();
    }

    // -------------------------
    // Token stream
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected, String context) {
        if (check(type)) return advance();
        throw expected(expected, context);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError expected(String what, String context) {
        return error(peek(), "Expected " + what + " but got " + peek().describe() + " in " + context);
    }

    private ParseError error(Token token, String message) {
        return new ParseError(message, token.location);
    }
}
