import com.uplc.decompiler.parser.ParseError;
import com.uplc.decompiler.parser.Parser;
import com.uplc.decompiler.parser.Program;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.TermPrinter;
import com.uplc.decompiler.term.Terms;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class UplcParserTest {

    @Test
    public void program_header_is_read_and_body_parsed() {
        Program p = Parser.parseProgram("(program 1.0.0 (lam x (var x)))");

        assertEquals("1.0.0", p.version);
        assertEquals(Term.Tag.LAMBDA, p.term.tag);
        Term.Lambda lam = (Term.Lambda) p.term;
        assertEquals("x", lam.param);
        assertEquals(Term.Tag.VAR, lam.body.tag);
        assertEquals("x", ((Term.Var) lam.body).name);
    }

    @Test
    public void bare_term_without_program_wrapper_is_accepted() {
        Program p = Parser.parseProgram("(con integer 7)");
        assertNull(p.version);
        assertEquals(BigInteger.valueOf(7), ((Term.Con) p.term).value.asInteger());
    }

    @Test
    public void bracket_application_is_left_folded() {
        Term t = Parser.parse("[(builtin addInteger) (con integer 1) (con integer 2)]");

        assertEquals(Term.Tag.APPLY, t.tag);
        Term.Apply outer = (Term.Apply) t;
        assertEquals(BigInteger.valueOf(2), ((Term.Con) outer.arg).value.asInteger());
        Term.Apply inner = (Term.Apply) outer.func;
        assertEquals("addInteger", ((Term.Builtin) inner.func).name);

        Terms.Spine spine = Terms.flattenApp(t);
        assertTrue(spine.isBuiltin("addInteger"));
        assertEquals(2, spine.args.size());
    }

    @Test
    public void app_keyword_form_matches_bracket_form() {
        Term a = Parser.parse("(app (builtin addInteger) (con integer 1) (con integer 2))");
        Term b = Parser.parse("[(builtin addInteger) (con integer 1) (con integer 2)]");
        assertTrue(Terms.structurallyEqual(a, b));
    }

    @Test
    public void constants_of_every_simple_type() {
        assertEquals(BigInteger.valueOf(-15), con("(con integer -15)").asInteger());
        assertEquals(BigInteger.valueOf(15), con("(con integer +15)").asInteger());
        assertArrayEquals(new byte[]{(byte) 0xde, (byte) 0xad}, con("(con bytestring #dead)").asBytes());
        assertEquals(0, con("(con bytestring #)").byteLength());
        assertEquals("hi\n\"there\"", con("(con string \"hi\\n\\\"there\\\"\")").asString());
        assertTrue(con("(con bool True)").asBool());
        assertFalse(con("(con bool False)").asBool());
        assertEquals(ConstType.Kind.UNIT, con("(con unit ())").kind());
    }

    @Test
    public void hex_prefixed_byte_strings_are_accepted() {
        assertArrayEquals(new byte[]{(byte) 0xca, (byte) 0xfe}, con("(con bytestring 0xcafe)").asBytes());
    }

    @Test
    public void big_integers_keep_full_precision() {
        String digits = "123456789012345678901234567890123456789";
        assertEquals(new BigInteger(digits), con("(con integer " + digits + ")").asInteger());
    }

    @Test
    public void list_pair_and_data_constants() {
        com.uplc.decompiler.term.Constant list = con("(con (list integer) [1, 2, 3])");
        assertEquals(ConstType.Kind.LIST, list.kind());
        assertEquals(3, list.asList().size());

        com.uplc.decompiler.term.Constant pair = con("(con (pair integer bool) (5, True))");
        assertEquals(ConstType.Kind.PAIR, pair.kind());
        assertEquals(BigInteger.valueOf(5), pair.first().asInteger());
        assertTrue(pair.second().asBool());

        com.uplc.decompiler.term.Constant data = con("(con data (Constr 0 [I 1, B #ff]))");
        assertEquals(ConstType.Kind.DATA, data.kind());
    }

    @Test
    public void case_and_constr_terms() {
        Term t = Parser.parse("(lam r (case (var r) (constr 0 (con integer 1)) (error)))");
        Term.Case cs = (Term.Case) ((Term.Lambda) t).body;
        assertEquals(2, cs.branches.size());
        Term.Constr constr = (Term.Constr) cs.branches.get(0);
        assertEquals(0, constr.index);
        assertEquals(1, constr.args.size());
        assertEquals(Term.Tag.ERROR, cs.branches.get(1).tag);
    }

    @Test
    public void comments_are_skipped() {
        Term t = Parser.parse("-- leading comment\n(lam x -- trailing\n (var x))");
        assertEquals(Term.Tag.LAMBDA, t.tag);
    }

    @Test
    public void unbound_variable_is_rejected_with_location() {
        ParseError e = assertThrows(ParseError.class,
                () -> Parser.parse("(program 1.0.0\n  (lam x (var y)))"));

        assertTrue(e.getDescription().contains("Unbound variable 'y'"), e.getDescription());
        assertEquals(2, e.getLine());
        assertTrue(e.getColumn() > 1);
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());
    }

    @Test
    public void shadowed_binding_goes_out_of_scope() {
        assertThrows(ParseError.class, () -> Parser.parse("[(lam x (var x)) (var x)]"));
    }

    @Test
    public void lexer_errors_are_parse_errors() {
        ParseError odd = assertThrows(ParseError.class, () -> Parser.parse("(con bytestring #abc)"));
        assertTrue(odd.getDescription().contains("odd number of hex digits"));

        ParseError str = assertThrows(ParseError.class, () -> Parser.parse("(con string \"open"));
        assertTrue(str.getDescription().contains("Unterminated string"));

        ParseError ch = assertThrows(ParseError.class, () -> Parser.parse("(lam x @)"));
        assertTrue(ch.getDescription().contains("Unexpected character"));
    }

    @Test
    public void structural_errors_name_what_was_expected() {
        assertThrows(ParseError.class, () -> Parser.parse("(lam x"));
        assertThrows(ParseError.class, () -> Parser.parse("[(builtin addInteger)]"));
        assertThrows(ParseError.class, () -> Parser.parse("(con integer True)"));
        assertThrows(ParseError.class, () -> Parser.parse("(con unit ()) (con unit ())"));
        assertThrows(ParseError.class, () -> Parser.parse("(con widget 1)"));
    }

    @Test
    public void printed_text_parses_back_to_the_same_term() {
        String src = "(lam d (lam r [(force (builtin ifThenElse)) [(builtin equalsInteger) (var r) (con integer -3)]"
                + " (delay (con bytestring #00ff)) (delay (error))]))";
        Term first = Parser.parse(src);
        Term second = Parser.parse(TermPrinter.showText(first));
        assertTrue(Terms.structurallyEqual(first, second));
    }

    @Test
    public void deeply_nested_lambdas_parse() {
        StringBuilder sb = new StringBuilder();
        int depth = 50_000;
        for (int i = 0; i < depth; i++) sb.append("(lam x").append(i).append(' ');
        sb.append("(var x0)");
        for (int i = 0; i < depth; i++) sb.append(')');

        Term t = Parser.parse(sb.toString());
        assertEquals(depth + 1, Terms.size(t));
        assertEquals("x0", ((Term.Lambda) t).param);
    }

    @Test
    public void nested_lambda_binders_go_out_of_scope_together() {
        Term t = Parser.parse("(lam x (lam y [(var x) (var y)]))");
        Term.Lambda inner = (Term.Lambda) ((Term.Lambda) t).body;
        assertEquals("y", inner.param);
        assertEquals(Term.Tag.APPLY, inner.body.tag);

        ParseError e = assertThrows(ParseError.class,
                () -> Parser.parse("(lam z [(lam x (lam y (var y))) (var y)])"));
        assertTrue(e.getMessage().contains("Unbound variable 'y'"), e.getMessage());

        assertThrows(ParseError.class, () -> Parser.parse("(lam x (lam y (var y))"));
    }

    private static com.uplc.decompiler.term.Constant con(String src) {
        Term t = Parser.parse(src);
        assertEquals(Term.Tag.CON, t.tag);
        return ((Term.Con) t).value;
    }
}
