import com.uplc.decompiler.codegen.Binding;
import com.uplc.decompiler.codegen.BindingEnvironment;
import com.uplc.decompiler.parser.Parser;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Term;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UplcBindingsTest {

    /** Environment of {@code [(lam h (var h)) VALUE]}, with VALUE bound to h. */
    private static Binding helper(String value) {
        BindingEnvironment env = BindingEnvironment.build(Parser.parse("[(lam h (var h)) " + value + "]"));
        Binding b = env.get("h");
        assertNotNull(b);
        return b;
    }

    @Test
    public void alias_chain_collapses_onto_the_constant() {
        BindingEnvironment env = BindingEnvironment.build(Parser.parse(
                "[(lam c [(lam b [(lam a (var a)) (var b)]) (var c)]) (con integer 42)]"));

        Binding c = env.get("c");
        assertEquals(Binding.Category.INLINE, c.category);
        assertEquals(Binding.Pattern.CONSTANT, c.pattern);

        for (String name : List.of("a", "b")) {
            Binding alias = env.get(name);
            assertEquals(Binding.Category.ALIAS, alias.category, name);
            assertEquals("c", alias.target, name);
            assertEquals("42", alias.inlineText, name);
            assertTrue(env.isInlinable(name));
        }
    }

    @Test
    public void single_use_arithmetic_is_inlined_with_folded_value() {
        BindingEnvironment env = BindingEnvironment.build(Parser.parse(
                "[(lam c [(lam b (var b)) [(builtin addInteger) (var c) (con integer 1)]]) (con integer 42)]"));

        Binding b = env.get("b");
        assertEquals(Binding.Category.INLINE, b.category);
        assertEquals(Binding.Pattern.EXPRESSION, b.pattern);
        assertEquals("43", b.foldedValue);
        assertEquals("42 + 1", b.inlineText);
    }

    @Test
    public void multiply_used_expression_is_kept() {
        BindingEnvironment env = BindingEnvironment.build(Parser.parse(
                "[(lam c [(lam b [(builtin multiplyInteger) (var b) (var b)]) [(builtin addInteger) (var c) (con integer 1)]])"
                        + " (con integer 42)]"));

        Binding b = env.get("b");
        assertEquals(Binding.Category.KEEP, b.category);
        assertFalse(env.isInlinable("b"));
        assertNull(env.inlineTerm("b"));
        assertTrue(env.isInlinable("c"));
    }

    @Test
    public void alias_cycle_keeps_every_name() {
        Term t = Term.let("a", Term.var("b"), Term.let("b", Term.var("a"), Term.var("a")));
        BindingEnvironment env = BindingEnvironment.build(t);

        assertEquals(Binding.Category.KEEP, env.get("a").category);
        assertEquals(Binding.Category.KEEP, env.get("b").category);
    }

    @Test
    public void names_bound_twice_to_different_values_are_kept() {
        Term t = Term.apply(
                Term.let("x", Term.con(Constant.integer(1)), Term.var("x")),
                Term.let("x", Term.con(Constant.integer(2)), Term.var("x")));
        BindingEnvironment env = BindingEnvironment.build(t);

        assertEquals(Binding.Category.KEEP, env.get("x").category);
    }

    @Test
    public void pinned_names_stay_named() {
        Term t = Parser.parse("[(lam owner (lam d (var owner))) (con bytestring #abcd)]");

        assertTrue(BindingEnvironment.build(t).isInlinable("owner"));
        assertFalse(BindingEnvironment.build(t, List.of("owner")).isInlinable("owner"));
    }

    @Test
    public void plain_lambda_parameters_are_not_bindings() {
        BindingEnvironment env = BindingEnvironment.build(Parser.parse("(lam x (lam y (var x)))"));
        assertNull(env.get("x"));
        assertTrue(env.all().isEmpty());
    }

    @Test
    public void identity_and_apply_helpers_are_inlined() {
        Binding id = helper("(lam x (var x))");
        assertEquals(Binding.Pattern.IDENTITY, id.pattern);
        assertTrue(id.isInlinable());

        Binding app = helper("(lam f (lam x [(var f) (var x)]))");
        assertEquals(Binding.Pattern.APPLY, app.pattern);
        assertTrue(app.isInlinable());
    }

    @Test
    public void boolean_combinators_are_recognized() {
        Binding and = helper("(lam a (lam b [(force (builtin ifThenElse)) (var a) (var b) (con bool False)]))");
        assertEquals(Binding.Pattern.BOOLEAN_AND, and.pattern);
        assertEquals("and_also", and.semanticName);

        Binding or = helper("(lam a (lam b [(force (builtin ifThenElse)) (var a) (con bool True) (var b)]))");
        assertEquals(Binding.Pattern.BOOLEAN_OR, or.pattern);
        assertEquals("or_else", or.semanticName);
    }

    @Test
    public void self_application_is_a_fixpoint() {
        Binding fix = helper("(lam f [(lam s [(var f) (lam x [(var s) (var s) (var x)])]) (lam s [(var f) (lam x [(var s) (var s) (var x)])])])");
        assertEquals(Binding.Pattern.Z_COMBINATOR, fix.pattern);
        assertEquals("fix", fix.semanticName);
        assertEquals(Binding.Category.KEEP, fix.category);
    }

    @Test
    public void data_helpers_get_descriptive_names() {
        Binding field = helper("(lam x [(force (builtin headList)) [(force (builtin tailList))"
                + " [(force (force (builtin sndPair))) [(builtin unConstrData) (var x)]]]])");
        assertEquals(Binding.Pattern.FIELD_ACCESSOR, field.pattern);
        assertEquals("get_field_1", field.semanticName);

        Binding isConstr = helper("(lam x [(builtin equalsInteger)"
                + " [(force (force (builtin fstPair))) [(builtin unConstrData) (var x)]] (con integer 2)])");
        assertEquals(Binding.Pattern.IS_CONSTR, isConstr.pattern);
        assertEquals("is_constr_2", isConstr.semanticName);

        Binding wrapper = helper("(lam x [(builtin unIData) (var x)])");
        assertEquals(Binding.Pattern.BUILTIN_WRAPPER, wrapper.pattern);
        assertEquals("to_int", wrapper.semanticName);
    }

    @Test
    public void partially_applied_builtin_is_named_after_its_constant() {
        Binding eq = helper("[(builtin equalsInteger) (con integer 0)]");
        assertEquals(Binding.Pattern.PARTIAL_BUILTIN, eq.pattern);
        assertEquals("eq_0", eq.semanticName);
        assertTrue(eq.isInlinable());

        Binding lt = helper("[(builtin lessThanInteger) (con integer -5)]");
        assertEquals("lt_neg5", lt.semanticName);
    }

    @Test
    public void kept_helper_is_displayed_under_its_semantic_name() {
        BindingEnvironment env = BindingEnvironment.build(Parser.parse(
                "[(lam h [(var h) (con data (I 1))]) (lam x [(builtin unIData) (var x)])]"));
        assertEquals("to_int", env.displayName("h"));
        assertEquals("zzz", env.displayName("zzz"));
    }
}
