import com.uplc.decompiler.DecompileResult;
import com.uplc.decompiler.UplcDecompiler;
import com.uplc.decompiler.codegen.CodeBlock;
import com.uplc.decompiler.codegen.CodeFormatter;
import com.uplc.decompiler.codegen.CodeGenerator;
import com.uplc.decompiler.codegen.ExpressionWriter;
import com.uplc.decompiler.codegen.GeneratedCode;
import com.uplc.decompiler.codegen.HandlerBlock;
import com.uplc.decompiler.codegen.TypeDefinition;
import com.uplc.decompiler.convert.DecodedTerm;
import com.uplc.decompiler.parser.Parser;
import com.uplc.decompiler.patterns.ContractAnalyzer;
import com.uplc.decompiler.patterns.ContractStructure;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.PlutusData;
import com.uplc.decompiler.term.Term;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UplcCodegenTest {

    private static GeneratedCode generate(String src) {
        return CodeGenerator.generate(ContractAnalyzer.analyze(Parser.parse(src)));
    }

    private static CodeBlock body(GeneratedCode code) {
        List<HandlerBlock> handlers = code.validator.handlers;
        assertEquals(1, handlers.size());
        return handlers.get(0).body;
    }

    @Test
    public void alias_chain_renders_as_the_constant() {
        GeneratedCode code = generate("[(lam c [(lam b [(lam a (var a)) (var b)]) (var c)]) (con integer 42)]");

        CodeBlock body = body(code);
        assertEquals(CodeBlock.Kind.EXPRESSION, body.kind);
        assertEquals("42", body.content);
        assertEquals("mint", code.validator.handlers.get(0).kind);
    }

    @Test
    public void single_use_arithmetic_is_written_unfolded() {
        GeneratedCode code = generate("[(lam c [(lam b (var b)) [(builtin addInteger) (var c) (con integer 1)]]) (con integer 42)]");

        CodeBlock body = body(code);
        assertEquals(CodeBlock.Kind.EXPRESSION, body.kind);
        assertEquals("42 + 1", body.content);
    }

    @Test
    public void multiply_used_binding_becomes_a_let() {
        String out = CodeFormatter.format(generate(
                "[(lam c [(lam b [(builtin multiplyInteger) (var b) (var b)]) [(builtin addInteger) (var c) (con integer 1)]])"
                        + " (con integer 42)]"));

        assertTrue(out.contains("let b = 42 + 1"), out);
        assertTrue(out.contains("b * b"), out);
    }

    @Test
    public void escrow_renders_types_and_redeemer_dispatch() {
        String out = new UplcDecompiler().decompile(UplcPatternsTest.fixture("escrow.uplc")).source;

        assertTrue(out.contains("use cardano/transaction.{OutputReference, Transaction}"), out);
        assertTrue(out.contains("type Datum {"), out);
        assertTrue(out.contains("type Action {"), out);
        assertTrue(out.contains("validator script {"), out);
        assertTrue(out.contains("spend(datum: Option<Datum>, redeemer: Action, own_ref: OutputReference, tx: Transaction) {"), out);
        assertTrue(out.contains("when redeemer is {"), out);
        assertTrue(out.contains("Claim -> True"), out);
        assertTrue(out.contains("datum."), out);
        assertTrue(out.contains("< 1000"), out);
        assertTrue(out.indexOf("Cancel") < out.indexOf("Update"), out);
        assertTrue(out.indexOf("Update") < out.indexOf("Claim"), out);
    }

    @Test
    public void escrow_datum_type_fills_gaps_with_data_fields() {
        GeneratedCode code = new UplcDecompiler().decompile(UplcPatternsTest.fixture("escrow.uplc")).code;

        TypeDefinition datum = code.type(CodeGenerator.DATUM_TYPE);
        assertNotNull(datum);
        assertEquals(4, datum.fields.size());
        assertEquals("ByteArray", datum.fields.get(0).type);
        assertEquals("Data", datum.fields.get(1).type);
        assertEquals("Data", datum.fields.get(2).type);
        assertEquals("Int", datum.fields.get(3).type);

        TypeDefinition action = code.type(CodeGenerator.ACTION_TYPE);
        assertEquals(TypeDefinition.Kind.ENUM, action.kind);
        assertEquals(3, action.variants.size());
    }

    @Test
    public void case_dispatch_renders_failing_branch() {
        String out = new UplcDecompiler().decompile(UplcPatternsTest.fixture("v3_case.uplc")).source;

        assertTrue(out.contains("validator policy {"), out);
        assertTrue(out.contains("mint(redeemer: Action, policy_id: PolicyId, tx: Transaction) {"), out);
        assertTrue(out.contains("use cardano/assets.{PolicyId}"), out);
        assertTrue(out.contains("Cancel -> True"), out);
        assertTrue(out.contains("Update -> fail"), out);
    }

    @Test
    public void minimal_policy_has_no_types() {
        DecompileResult r = new UplcDecompiler().decompile(UplcPatternsTest.fixture("minimal.uplc"));

        assertTrue(r.code.types.isEmpty());
        assertTrue(r.code.constants.isEmpty());
        assertTrue(r.source.contains("mint(redeemer: Data, policy_id: PolicyId, tx: Transaction) {"), r.source);
        assertTrue(r.source.contains("    True"), r.source);
        assertTrue(r.source.endsWith("}\n"));
    }

    @Test
    public void script_parameters_and_repeated_hashes_become_constants() {
        String out = new UplcDecompiler().decompile(UplcPatternsTest.fixture("parameterized.uplc")).source;

        assertTrue(out.contains("const owner = #\"abababababababababababababababababababababababababababababab\""), out);
        assertTrue(out.contains("const script_hash_0 = #\"1234567890abcdef1234567890abcdef1234567890abcdef12345678\""), out);
        assertTrue(out.contains("bytearray.concat(script_hash_0, script_hash_0)"), out);
        assertTrue(out.contains("use aiken/primitive/bytearray"), out);
        assertTrue(out.contains("owner =="), out);
    }

    @Test
    public void deep_lambda_nesting_renders_without_overflow() {
        Term t = Term.con(Constant.bool(true));
        for (int i = 699; i >= 0; i--) t = Term.lam("v" + i, t);

        UplcDecompiler decompiler = new UplcDecompiler();
        String out = decompiler.generate(decompiler.analyzeContract(t));

        assertTrue(out.contains("fn("), out.substring(0, Math.min(out.length(), 400)));
        assertFalse(out.contains("???"));
        assertTrue(out.contains("True"));
    }

    @Test
    public void formatting_is_deterministic() {
        UplcDecompiler decompiler = new UplcDecompiler();
        String src = UplcPatternsTest.fixture("escrow.uplc");

        DecompileResult first = decompiler.decompile(src);
        DecompileResult second = decompiler.decompile(src);
        assertEquals(first.source, second.source);
        assertEquals(first.source, CodeFormatter.format(first.code));
    }

    @Test
    public void decoded_bls_builtin_is_rendered_under_its_corrected_name() {
        DecodedTerm tree = DecodedTerm.lambda(DecodedTerm.application(
                DecodedTerm.builtin("bls12_381_G1_hashToGroup"), DecodedTerm.variable(0)));

        DecompileResult r = new UplcDecompiler().decompileDecoded(tree);
        assertNotNull(r.conversion);
        assertTrue(r.conversion.isClean());
        assertTrue(r.source.contains("use aiken/builtin"), r.source);
        assertTrue(r.source.contains("builtin.bls12_381_g1_compress(redeemer)"), r.source);
    }

    @Test
    public void if_with_error_branch_becomes_expect() {
        String out = CodeFormatter.format(generate(
                "(lam r (lam ctx [(force (builtin ifThenElse)) [(builtin lessThanInteger) [(builtin unIData) (var r)] (con integer 10)]"
                        + " (delay (con unit ())) (delay (error))]))"));

        assertTrue(out.contains("expect "), out);
        assertTrue(out.contains("< 10"), out);
    }

    @Test
    public void constant_text_follows_source_syntax() {
        assertEquals("-7", ExpressionWriter.constantText(Constant.integer(-7)));
        assertEquals("#\"00ff\"", ExpressionWriter.constantText(Constant.bytes(new byte[]{0, (byte) 0xff})));
        assertEquals("@\"hi\"", ExpressionWriter.constantText(Constant.string("hi")));
        assertEquals("True", ExpressionWriter.constantText(Constant.bool(true)));
        assertEquals("Void", ExpressionWriter.constantText(Constant.unit()));

        String data = ExpressionWriter.constantText(Constant.data(
                PlutusData.constr(1, List.of(PlutusData.integer(BigInteger.valueOf(5))))));
        assertTrue(data.startsWith("Constr(1"), data);
    }
}
