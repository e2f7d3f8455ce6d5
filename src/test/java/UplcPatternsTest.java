import com.uplc.decompiler.parser.Parser;
import com.uplc.decompiler.patterns.CheckCategory;
import com.uplc.decompiler.patterns.CheckClassifier;
import com.uplc.decompiler.patterns.ContractAnalyzer;
import com.uplc.decompiler.patterns.ContractStructure;
import com.uplc.decompiler.patterns.EntryPoint;
import com.uplc.decompiler.patterns.FieldInfo;
import com.uplc.decompiler.patterns.FieldType;
import com.uplc.decompiler.patterns.PatternMatch;
import com.uplc.decompiler.patterns.PurposeInference;
import com.uplc.decompiler.patterns.Recognition;
import com.uplc.decompiler.patterns.RedeemerInfo;
import com.uplc.decompiler.patterns.RedeemerVariant;
import com.uplc.decompiler.patterns.ScriptPurpose;
import com.uplc.decompiler.patterns.ValidationCheck;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Term;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UplcPatternsTest {

    static String fixture(String name) {
        try (InputStream in = UplcPatternsTest.class.getResourceAsStream("/contracts/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static ContractStructure analyze(String src) {
        return ContractAnalyzer.analyze(Parser.parse(src));
    }

    @Test
    public void escrow_is_a_spend_validator_with_roles_assigned() {
        ContractStructure s = analyze(fixture("escrow.uplc"));

        assertEquals(ScriptPurpose.SPEND, s.purpose);
        assertTrue(s.purposeRecognition.isFound());
        assertEquals(List.of("datum_0", "redeemer_1", "ctx_2"), s.params);
        assertEquals("datum_0", s.datumParam);
        assertEquals("redeemer_1", s.redeemerParam);
        assertEquals("ctx_2", s.contextParam);
    }

    @Test
    public void escrow_variants_are_ordered_by_constructor_index() {
        ContractStructure s = analyze(fixture("escrow.uplc"));

        assertEquals(RedeemerInfo.MatchPattern.CONSTRUCTOR, s.redeemer.matchPattern);
        List<Integer> indices = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (RedeemerVariant v : s.redeemer.variants) {
            indices.add(v.index);
            names.add(v.name);
        }
        assertEquals(List.of(0, 1, 2), indices);
        assertEquals(List.of("Cancel", "Update", "Claim"), names);
        assertNotNull(s.redeemer.dispatchNode);
    }

    @Test
    public void escrow_datum_fields_follow_tail_depth() {
        ContractStructure s = analyze(fixture("escrow.uplc"));

        assertTrue(s.datum.used);
        assertFalse(s.datum.optional);
        List<Integer> indices = new ArrayList<>();
        for (FieldInfo f : s.datum.fields) indices.add(f.index);
        assertEquals(List.of(0, 3), indices);

        assertEquals(FieldType.BYTESTRING, s.datum.fields.get(0).inferredType);
        assertEquals(FieldType.INTEGER, s.datum.fields.get(1).inferredType);
    }

    @Test
    public void escrow_checks_are_classified() {
        ContractStructure s = analyze(fixture("escrow.uplc"));

        assertTrue(hasCheck(s, CheckCategory.SIGNER, "verifyEd25519Signature"));
        assertTrue(hasCheck(s, CheckCategory.COMPARISON, "lessThanInteger"));
        assertTrue(hasCheck(s, CheckCategory.EQUALITY, "equalsInteger"));

        boolean signature = false;
        for (PatternMatch m : s.commonPatterns) {
            if (m.kind == PatternMatch.Kind.SIGNATURE && m.confidence == 1.0) signature = true;
        }
        assertTrue(signature);
    }

    @Test
    public void single_parameter_script_is_a_mint_policy() {
        ContractStructure s = analyze(fixture("minimal.uplc"));

        assertEquals(ScriptPurpose.MINT, s.purpose);
        assertEquals("x", s.redeemerParam);
        assertNull(s.datumParam);
        assertNull(s.contextParam);
        assertTrue(s.redeemer.variants.isEmpty());
        assertTrue(s.datum.fields.isEmpty());
    }

    @Test
    public void zero_parameter_program_is_mint_with_low_confidence() {
        ContractStructure s = analyze("(con unit ())");
        assertEquals(ScriptPurpose.MINT, s.purpose);
        assertEquals(0.3, s.purposeRecognition.confidence(), 1e-9);
        assertNull(s.redeemerParam);
    }

    @Test
    public void two_parameters_are_ambiguous_between_mint_withdraw_publish() {
        Recognition<ScriptPurpose> r = PurposeInference.infer(List.of("r", "ctx"), Term.error());

        assertTrue(r.isAmbiguous());
        assertEquals(ScriptPurpose.MINT, r.orElse(ScriptPurpose.UNKNOWN));
        assertEquals(List.of(ScriptPurpose.MINT, ScriptPurpose.WITHDRAW, ScriptPurpose.PUBLISH), r.candidates());
    }

    @Test
    public void three_parameters_without_datum_evidence_stay_ambiguous() {
        ContractStructure s = analyze("(lam d (lam r (lam ctx (con unit ()))))");

        assertTrue(s.purposeRecognition.isAmbiguous());
        assertEquals(ScriptPurpose.SPEND, s.purpose);
        assertFalse(s.datum.used);
    }

    @Test
    public void four_parameters_reading_votes_are_a_vote_handler() {
        // tx field 12 read off the context: headList of twelve tails of the tx fields
        StringBuilder read = new StringBuilder("[(force (force (builtin sndPair))) [(builtin unConstrData) (var tx)]]");
        for (int i = 0; i < 12; i++) read.insert(0, "[(force (builtin tailList)) ").append(']');
        String src = "(lam a (lam b (lam c (lam tx [(builtin unMapData) [(force (builtin headList)) " + read + "]]))))";

        ContractStructure s = analyze(src);
        assertEquals(ScriptPurpose.VOTE, s.purpose);
        assertEquals("a", s.redeemerParam);
        assertNull(s.datumParam);
        assertEquals("tx", s.contextParam);
    }

    @Test
    public void case_on_unconstr_redeemer_yields_variants() {
        ContractStructure s = analyze(fixture("v3_case.uplc"));

        assertEquals(ScriptPurpose.MINT, s.purpose);
        assertEquals("r", s.redeemerParam);
        assertEquals(RedeemerInfo.MatchPattern.CONSTRUCTOR, s.redeemer.matchPattern);
        assertEquals(2, s.redeemer.variants.size());
        assertEquals(Term.Tag.ERROR, s.redeemer.variants.get(1).body.tag);
    }

    @Test
    public void constant_applied_ahead_of_validator_is_a_script_parameter() {
        ContractStructure s = analyze(fixture("parameterized.uplc"));

        assertEquals(1, s.scriptParameters.size());
        assertEquals("owner", s.scriptParameters.get(0).name);
        assertEquals(List.of("d", "r", "ctx"), s.params);
        assertTrue(s.outerBindings.isEmpty());
    }

    @Test
    public void constant_let_without_validator_is_an_outer_binding() {
        EntryPoint e = EntryPoint.detect(Parser.parse("[(lam c [(builtin addInteger) (var c) (con integer 1)]) (con integer 42)]"));

        assertTrue(e.params.isEmpty());
        assertTrue(e.scriptParameters.isEmpty());
        assertEquals(1, e.outerBindings.size());
        assertEquals("c", e.outerBindings.get(0).name);
    }

    @Test
    public void validators_take_at_most_four_parameters() {
        EntryPoint e = EntryPoint.detect(Parser.parse("(lam a (lam b (lam c (lam d (lam e (var e))))))"));
        assertEquals(List.of("a", "b", "c", "d"), e.params);
        assertEquals(Term.Tag.LAMBDA, e.body.tag);
    }

    @Test
    public void struct_redeemer_is_recognized_from_field_reads() {
        String src = "(lam r (lam ctx [(builtin equalsInteger) [(builtin unIData) [(force (builtin headList))"
                + " [(force (force (builtin sndPair))) [(builtin unConstrData) (var r)]]]] (con integer 7)]))";
        ContractStructure s = analyze(src);

        assertEquals(RedeemerInfo.MatchPattern.STRUCT, s.redeemer.matchPattern);
        assertEquals(1, s.redeemer.fields.size());
        assertEquals(FieldType.INTEGER, s.redeemer.fields.get(0).inferredType);
    }

    private static final String KEY_HASH = "00112233445566778899aabbccddeeff00112233445566778899aabb";

    @Test
    public void byte_comparison_against_a_key_hash_is_an_owner_check() {
        ContractStructure s = analyze("(lam r (lam ctx [(builtin equalsByteString) [(builtin unBData) (var r)]"
                + " (con bytestring #" + KEY_HASH + ")]))");

        ValidationCheck check = onlyCheck(s, "equalsByteString");
        assertEquals(CheckCategory.OWNER, check.category);
        assertTrue(check.description.contains(KEY_HASH), check.description);
    }

    @Test
    public void policy_id_compared_against_a_value_map_is_a_token_check() {
        String policy = "[(builtin unBData) [(force (force (builtin fstPair))) [(force (builtin headList)) [(builtin unMapData) (var r)]]]]";
        ContractStructure s = analyze("(lam r (lam ctx [(builtin equalsByteString) " + policy
                + " (con bytestring #" + KEY_HASH + ")]))");

        assertEquals(CheckCategory.TOKEN, onlyCheck(s, "equalsByteString").category);
    }

    @Test
    public void large_integer_constant_marks_a_deadline() {
        ContractStructure s = analyze("(lam r (lam ctx [(builtin lessThanInteger) [(builtin unIData) (var r)]"
                + " (con integer 1700000000000)]))");

        ValidationCheck check = onlyCheck(s, "lessThanInteger");
        assertEquals(CheckCategory.DEADLINE, check.category);
        assertTrue(check.description.contains("1700000000000"), check.description);

        ContractStructure small = analyze("(lam r (lam ctx [(builtin lessThanInteger) [(builtin unIData) (var r)]"
                + " (con integer 1000000000)]))");
        assertEquals(CheckCategory.COMPARISON, onlyCheck(small, "lessThanInteger").category);
    }

    @Test
    public void shared_check_nodes_are_reported_once() {
        Term check = Term.apply(Term.builtin("equalsInteger"), Term.var("x"), Term.con(Constant.integer(1)));
        Term body = Term.apply(Term.lam("y", check), check);
        assertEquals(1, CheckClassifier.classify(body).size());

        Term copy = Term.apply(Term.builtin("equalsInteger"), Term.var("x"), Term.con(Constant.integer(1)));
        assertEquals(2, CheckClassifier.classify(Term.apply(Term.lam("y", check), copy)).size());
    }

    @Test
    public void datum_tag_guard_marks_the_datum_optional() {
        ContractStructure s = analyze("(lam d (lam r (lam ctx [(builtin equalsInteger)"
                + " [(force (force (builtin fstPair))) [(builtin unConstrData) (var d)]] (con integer 0)])))");

        assertEquals(ScriptPurpose.SPEND, s.purpose);
        assertTrue(s.datum.used);
        assertTrue(s.datum.optional);
    }

    @Test
    public void choose_data_on_the_datum_marks_it_optional() {
        ContractStructure s = analyze("(lam d (lam r (lam ctx"
                + " [(force (builtin chooseData)) (var d) (con bool True) (con bool False)])))");

        assertEquals("d", s.datumParam);
        assertTrue(s.datum.optional);
    }

    @Test
    public void four_parameters_reading_proposals_are_a_propose_handler() {
        StringBuilder read = new StringBuilder("[(force (force (builtin sndPair))) [(builtin unConstrData) (var tx)]]");
        for (int i = 0; i < 13; i++) read.insert(0, "[(force (builtin tailList)) ").append(']');
        String src = "(lam a (lam b (lam c (lam tx [(builtin unListData) [(force (builtin headList)) " + read + "]]))))";

        ContractStructure s = analyze(src);
        assertEquals(ScriptPurpose.PROPOSE, s.purpose);
        assertTrue(s.purposeRecognition.isFound());
        assertEquals("tx", s.contextParam);
    }

    @Test
    public void comparison_against_the_context_is_a_timelock() {
        String validFrom = "[(builtin unIData) [(force (builtin headList)) [(force (force (builtin sndPair)))"
                + " [(builtin unConstrData) (var ctx)]]]]";
        ContractStructure s = analyze("(lam r (lam ctx [(builtin lessThanInteger) (con integer 1700000000000) " + validFrom + "]))");

        PatternMatch timelock = pattern(s, PatternMatch.Kind.TIMELOCK);
        assertNotNull(timelock);
        assertTrue(timelock.confidence > 0 && timelock.confidence <= 1);
    }

    @Test
    public void fixed_policy_with_quantity_one_is_an_nft() {
        ContractStructure s = analyze("(lam r (lam ctx [(force (builtin ifThenElse))"
                + " [(builtin equalsByteString) [(builtin unBData) (var r)] (con bytestring #" + KEY_HASH + ")]"
                + " [(builtin equalsInteger) [(builtin unIData) (var r)] (con integer 1)]"
                + " (con bool False)]))");

        PatternMatch nft = pattern(s, PatternMatch.Kind.NFT);
        assertNotNull(nft);
        assertEquals(0.8, nft.confidence, 1e-9);
    }

    @Test
    public void arithmetic_on_runtime_values_is_a_value_pattern() {
        ContractStructure s = analyze("(lam r (lam ctx [(builtin lessThanInteger) (con integer 0)"
                + " [(builtin addInteger) [(builtin unIData) (var r)] (con integer 5)]]))");
        assertNotNull(pattern(s, PatternMatch.Kind.VALUE));

        ContractStructure constant = analyze("(lam r (lam ctx [(builtin addInteger) (con integer 1) (con integer 5)]))");
        assertNull(pattern(constant, PatternMatch.Kind.VALUE));
    }

    private static ValidationCheck onlyCheck(ContractStructure s, String builtin) {
        ValidationCheck found = null;
        for (ValidationCheck c : s.checks) {
            if (builtin.equals(c.builtin)) {
                assertNull(found, "more than one " + builtin + " check");
                found = c;
            }
        }
        assertNotNull(found, "no " + builtin + " check");
        return found;
    }

    private static PatternMatch pattern(ContractStructure s, PatternMatch.Kind kind) {
        for (PatternMatch m : s.commonPatterns) {
            if (m.kind == kind) return m;
        }
        return null;
    }

    private static boolean hasCheck(ContractStructure s, CheckCategory category, String builtin) {
        for (ValidationCheck c : s.checks) {
            if (c.category == category && builtin.equals(c.builtin)) return true;
        }
        return false;
    }
}
