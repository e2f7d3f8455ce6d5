package com.uplc.decompiler.patterns;

import java.util.List;

import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Guesses the script purpose from validator arity and how the parameters are used.
 *
 * Arity alone cannot separate mint, withdraw and publish handlers (two parameters) or spend,
 * vote and propose handlers (four). Those cases come back ambiguous unless the body gives
 * the purpose away.
 */
public final class PurposeInference {

    private PurposeInference() {}

    public static Recognition<ScriptPurpose> infer(List<String> params, Term body) {
        int n = params.size();
        if (n <= 1) {
            return Recognition.found(ScriptPurpose.MINT, n == 0 ? 0.3 : 0.4);
        }
        if (n == 2) {
            return Recognition.ambiguous(ScriptPurpose.MINT,
                    List.of(ScriptPurpose.MINT, ScriptPurpose.WITHDRAW, ScriptPurpose.PUBLISH), 0.4);
        }

        boolean datumEvidence = unpacksAsConstructor(body, params.get(0));
        if (n == 3) {
            if (datumEvidence) return Recognition.found(ScriptPurpose.SPEND, 0.9);
            return Recognition.ambiguous(ScriptPurpose.SPEND, List.of(ScriptPurpose.SPEND, ScriptPurpose.MINT), 0.5);
        }

        if (datumEvidence) return Recognition.found(ScriptPurpose.SPEND, 0.85);
        String tx = params.get(n - 1);
        List<FieldInfo> txFields = FieldExtractor.extract(body, tx);
        boolean votes = hasField(txFields, TxFields.VOTES);
        boolean proposals = hasField(txFields, TxFields.PROPOSAL_PROCEDURES);
        if (votes && !proposals) return Recognition.found(ScriptPurpose.VOTE, 0.7);
        if (proposals && !votes) return Recognition.found(ScriptPurpose.PROPOSE, 0.7);
        return Recognition.ambiguous(ScriptPurpose.SPEND,
                List.of(ScriptPurpose.SPEND, ScriptPurpose.VOTE, ScriptPurpose.PROPOSE), 0.4);
    }

    /** {@code unConstrData(param)} appears, i.e. the parameter is taken apart as a constructor. */
    static boolean unpacksAsConstructor(Term body, String param) {
        return Terms.findFirst(body, t -> t.tag == Term.Tag.APPLY && FieldExtractor.isUnConstrOf(t, param)) != null;
    }

    private static boolean hasField(List<FieldInfo> fields, int index) {
        for (FieldInfo f : fields) {
            if (f.index == index) return true;
        }
        return false;
    }

    /** Index of the redeemer among the parameters, or -1. */
    public static int redeemerIndex(ScriptPurpose purpose, int paramCount) {
        if (paramCount == 0) return -1;
        if (purpose == ScriptPurpose.SPEND && paramCount >= 3) return 1;
        return 0;
    }
}
