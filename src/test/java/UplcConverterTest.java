import com.uplc.decompiler.convert.BuiltinTags;
import com.uplc.decompiler.convert.ConversionError;
import com.uplc.decompiler.convert.ConversionMode;
import com.uplc.decompiler.convert.ConversionResult;
import com.uplc.decompiler.convert.DecodedData;
import com.uplc.decompiler.convert.DecodedTerm;
import com.uplc.decompiler.convert.DecodedTermConverter;
import com.uplc.decompiler.convert.DecodedTermJson;
import com.uplc.decompiler.convert.NameCounter;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.PlutusData;
import com.uplc.decompiler.term.Term;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UplcConverterTest {

    private static ConversionResult convert(DecodedTerm tree) {
        return new DecodedTermConverter().convert(tree);
    }

    @Test
    public void lambdas_get_fresh_names_and_indices_resolve_innermost_first() {
        // \ \ [1 0]
        DecodedTerm tree = DecodedTerm.lambda(DecodedTerm.lambda(
                DecodedTerm.application(DecodedTerm.variable(1), DecodedTerm.variable(0))));

        ConversionResult r = convert(tree);
        assertTrue(r.isClean());

        Term.Lambda outer = (Term.Lambda) r.term();
        Term.Lambda inner = (Term.Lambda) outer.body;
        assertEquals("a", outer.param);
        assertEquals("b", inner.param);
        Term.Apply app = (Term.Apply) inner.body;
        assertEquals("a", ((Term.Var) app.func).name);
        assertEquals("b", ((Term.Var) app.arg).name);
    }

    @Test
    public void sibling_lambdas_do_not_reuse_names() {
        DecodedTerm tree = DecodedTerm.application(
                DecodedTerm.lambda(DecodedTerm.variable(0)),
                DecodedTerm.lambda(DecodedTerm.variable(0)));

        Term.Apply app = (Term.Apply) convert(tree).term();
        assertEquals("a", ((Term.Lambda) app.func).param);
        assertEquals("b", ((Term.Lambda) app.arg).param);
        assertEquals("b", ((Term.Var) ((Term.Lambda) app.arg).body).name);
    }

    @Test
    public void name_counter_rolls_over_with_suffix() {
        assertEquals("a", NameCounter.nameFor(0));
        assertEquals("z", NameCounter.nameFor(25));
        assertEquals("a1", NameCounter.nameFor(26));
        assertEquals("c2", NameCounter.nameFor(54));
    }

    @Test
    public void out_of_range_index_is_rendered_unbound_and_counted() {
        DecodedTerm tree = DecodedTerm.lambda(DecodedTerm.variable(3));

        ConversionResult r = convert(tree);
        assertEquals(1, r.unboundCount());
        assertFalse(r.isClean());
        assertEquals("?3", ((Term.Var) ((Term.Lambda) r.term()).body).name);
    }

    @Test
    public void constants_are_normalized_from_raw_payloads() {
        Term i = convert(DecodedTerm.constant(List.of(0), 42L)).term();
        assertEquals(BigInteger.valueOf(42), ((Term.Con) i).value.asInteger());

        Term b = convert(DecodedTerm.constant(List.of(1), "beef")).term();
        assertArrayEquals(new byte[]{(byte) 0xbe, (byte) 0xef}, ((Term.Con) b).value.asBytes());

        Term list = convert(DecodedTerm.constant(List.of(7, 5, 0), List.of(1L, 2L))).term();
        Constant lc = ((Term.Con) list).value;
        assertEquals(ConstType.Kind.LIST, lc.kind());
        assertEquals(2, lc.asList().size());

        DecodedData d = DecodedData.constr(0L, List.of(DecodedData.integer(5L), DecodedData.bytes("ff")));
        Term data = convert(DecodedTerm.constant(List.of(8), d)).term();
        PlutusData pd = ((Term.Con) data).value.asData();
        assertNotNull(pd);
    }

    @Test
    public void bls_builtin_names_are_corrected() {
        Term t = convert(DecodedTerm.builtin("bls12_381_G1_hashToGroup")).term();
        assertEquals("bls12_381_G1_compress", ((Term.Builtin) t).name);

        Term g2 = convert(DecodedTerm.builtin("bls12_381_G2_uncompress")).term();
        assertEquals("bls12_381_G2_hashToGroup", ((Term.Builtin) g2).name);

        Term plain = convert(DecodedTerm.builtin("addInteger")).term();
        assertEquals("addInteger", ((Term.Builtin) plain).name);
    }

    @Test
    public void builtin_tags_map_to_canonical_names_after_correction() {
        int tag = BuiltinTags.CANONICAL.indexOf("bls12_381_G1_compress");
        assertEquals("bls12_381_G1_hashToGroup", BuiltinTags.upstreamName(tag));

        Term t = convert(DecodedTerm.builtinTag(tag)).term();
        assertEquals("bls12_381_G1_compress", ((Term.Builtin) t).name);

        for (int i = 0; i < BuiltinTags.CANONICAL.size(); i++) {
            assertEquals(BuiltinTags.canonicalName(i), BuiltinTags.correctName(BuiltinTags.upstreamName(i)));
        }
    }

    @Test
    public void diagnostic_mode_replaces_unrecognized_nodes_with_error() {
        DecodedTerm tree = DecodedTerm.lambda(DecodedTerm.application(
                DecodedTerm.unrecognized("mystery"),
                DecodedTerm.constant(List.of(99), 1L)));

        ConversionResult r = new DecodedTermConverter(ConversionMode.DIAGNOSTIC).convert(tree);
        assertEquals(2, r.unrecognizedCount());
        Term.Apply app = (Term.Apply) ((Term.Lambda) r.term()).body;
        assertEquals(Term.Tag.ERROR, app.func.tag);
        assertEquals(Term.Tag.ERROR, app.arg.tag);
    }

    @Test
    public void strict_mode_fails_on_first_unrecognized_node() {
        DecodedTerm tree = DecodedTerm.lambda(DecodedTerm.unrecognized("mystery"));

        ConversionError e = assertThrows(ConversionError.class,
                () -> new DecodedTermConverter(ConversionMode.STRICT).convert(tree));
        assertTrue(e.getMessage().contains("mystery"), e.getMessage());
    }

    @Test
    public void case_and_constr_nodes_convert() {
        DecodedTerm tree = DecodedTerm.lambda(DecodedTerm.caseOf(
                DecodedTerm.variable(0),
                List.of(DecodedTerm.constr(1, List.of(DecodedTerm.variable(0))), DecodedTerm.error())));

        Term.Case cs = (Term.Case) ((Term.Lambda) convert(tree).term()).body;
        assertEquals("a", ((Term.Var) cs.scrutinee).name);
        assertEquals(2, cs.branches.size());
        assertEquals(1L, ((Term.Constr) cs.branches.get(0)).index);
    }

    @Test
    public void deep_decoded_trees_convert_without_recursion() {
        DecodedTerm tree = DecodedTerm.constant(List.of(3), null);
        for (int i = 0; i < 20_000; i++) tree = DecodedTerm.lambda(tree);

        ConversionResult r = convert(tree);
        assertTrue(r.isClean());
        assertEquals(Term.Tag.LAMBDA, r.term().tag);
    }

    @Test
    public void deep_json_trees_are_read_without_recursion() throws Exception {
        int depth = 20_000;
        StringBuilder json = new StringBuilder();
        for (int i = 0; i < depth; i++) json.append("{\"type\":\"lam\",\"body\":");
        json.append("{\"type\":\"var\",\"index\":").append(depth - 1).append('}');
        for (int i = 0; i < depth; i++) json.append('}');

        ConversionResult r = convert(DecodedTermJson.read(json.toString()));
        assertTrue(r.isClean());
        assertEquals(Term.Tag.LAMBDA, r.term().tag);
        assertEquals("a", ((Term.Lambda) r.term()).param);
    }

    @Test
    public void json_case_and_constr_keep_child_order() throws Exception {
        DecodedTerm tree = DecodedTermJson.read("{\"type\":\"case\",\"scrutinee\":{\"type\":\"error\"},"
                + "\"branches\":[{\"type\":\"constr\",\"index\":1,\"fields\":[]},{\"type\":\"builtin\",\"name\":\"addInteger\"}]}");

        Term.Case cs = (Term.Case) convert(tree).term();
        assertEquals(Term.Tag.ERROR, cs.scrutinee.tag);
        assertEquals(Term.Tag.CONSTR, cs.branches.get(0).tag);
        assertEquals(Term.Tag.BUILTIN, cs.branches.get(1).tag);
    }

    @Test
    public void json_tree_is_read_and_converted() throws Exception {
        String json = "{\"type\":\"lam\",\"body\":{\"type\":\"app\","
                + "\"func\":{\"type\":\"app\",\"func\":{\"type\":\"builtin\",\"name\":\"addInteger\"},"
                + "\"arg\":{\"type\":\"var\",\"index\":0}},"
                + "\"arg\":{\"type\":\"con\",\"constType\":[0],\"value\":5}}}";

        ConversionResult r = convert(DecodedTermJson.read(json));
        assertTrue(r.isClean());
        Term.Lambda lam = (Term.Lambda) r.term();
        Term.Apply outer = (Term.Apply) lam.body;
        assertEquals(BigInteger.valueOf(5), ((Term.Con) outer.arg).value.asInteger());
    }

    @Test
    public void json_with_unknown_node_type_is_counted_in_diagnostic_mode() throws Exception {
        DecodedTerm tree = DecodedTermJson.read("{\"type\":\"lam\",\"body\":{\"type\":\"teleport\"}}");
        ConversionResult r = convert(tree);
        assertEquals(1, r.unrecognizedCount());
    }
}
