package com.uplc.decompiler.patterns;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/** Spots timelock, signature, value and NFT idioms. */
public final class CommonPatternDetector {

    private CommonPatternDetector() {}

    public static List<PatternMatch> detect(Term body, String contextParam) {
        List<PatternMatch> matches = new ArrayList<>();
        boolean policyConstant = false;
        Term quantityOne = null;

        Deque<Term> stack = new ArrayDeque<>();
        stack.push(body);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            if (t.tag != Term.Tag.APPLY) {
                for (Term c : t.children()) stack.push(c);
                continue;
            }
            Terms.Spine spine = Terms.flattenApp(t);
            String builtin = spine.builtin();
            for (Term a : spine.args) stack.push(a);
            if (builtin == null) {
                stack.push(spine.head);
                continue;
            }

            if (contextParam != null && FieldExtractor.fieldIndex(t, contextParam) == TxFields.EXTRA_SIGNATORIES) {
                matches.add(new PatternMatch(PatternMatch.Kind.SIGNATURE,
                        "Reads tx.extra_signatories for a required signer", 0.7, t));
            }
            switch (builtin) {
                case "lessThanInteger":
                case "lessThanEqualsInteger":
                    if (contextParam != null && referencesAny(spine.args, contextParam)) {
                        matches.add(new PatternMatch(PatternMatch.Kind.TIMELOCK,
                                "Deadline check using the tx validity range", 0.8, t));
                    }
                    break;
                case "verifyEd25519Signature":
                case "verifyEcdsaSecp256k1Signature":
                case "verifySchnorrSecp256k1Signature":
                    matches.add(new PatternMatch(PatternMatch.Kind.SIGNATURE,
                            "Cryptographic signature verification (" + builtin + ")", 1.0, t));
                    break;
                case "addInteger":
                case "subtractInteger":
                    if (!allConstant(spine.args)) {
                        matches.add(new PatternMatch(PatternMatch.Kind.VALUE,
                                "Value arithmetic (likely summing lovelace or token quantities)", 0.6, t));
                    }
                    break;
                case "equalsByteString":
                    for (Term a : spine.args) {
                        Term c = Terms.stripForceDelay(a);
                        if (c.tag == Term.Tag.CON && ((Term.Con) c).value.kind() == ConstType.Kind.BYTESTRING
                                && ((Term.Con) c).value.byteLength() == CheckClassifier.HASH28_LENGTH) {
                            policyConstant = true;
                        }
                    }
                    break;
                case "equalsInteger":
                    for (Term a : spine.args) {
                        if (BigInteger.ONE.equals(Terms.extractIntConstant(a))) quantityOne = t;
                    }
                    break;
                default:
                    break;
            }
        }

        if (policyConstant && quantityOne != null) {
            matches.add(new PatternMatch(PatternMatch.Kind.NFT,
                    "NFT authentication (fixed policy id with quantity 1)", 0.8, quantityOne));
        }
        return matches;
    }

    private static boolean referencesAny(List<Term> args, String var) {
        for (Term a : args) {
            if (Terms.referencesVar(a, var)) return true;
        }
        return false;
    }

    private static boolean allConstant(List<Term> args) {
        for (Term a : args) {
            if (Terms.stripForceDelay(a).tag != Term.Tag.CON) return false;
        }
        return true;
    }
}
