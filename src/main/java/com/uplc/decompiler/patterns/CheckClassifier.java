package com.uplc.decompiler.patterns;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.uplc.decompiler.convert.BuiltinTags;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Hex;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Classifies the checking builtins of a validator body by what their operands look like.
 *
 * Only the outermost application of each builtin spine is inspected, and every node is
 * reported at most once.
 */
public final class CheckClassifier {

    /** Integer constants above this are treated as POSIX-millisecond timestamps. */
    static final BigInteger TIMESTAMP_THRESHOLD = BigInteger.TEN.pow(9);

    /** Length of a key hash or a minting policy id. */
    static final int HASH28_LENGTH = 28;

    private CheckClassifier() {}

    public static List<ValidationCheck> classify(Term body) {
        List<ValidationCheck> checks = new ArrayList<>();
        Set<Term> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(body);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            if (t.tag == Term.Tag.APPLY) {
                Terms.Spine spine = Terms.flattenApp(t);
                String builtin = spine.builtin();
                if (builtin == null) {
                    stack.push(spine.head);
                } else if (seen.add(t)) {
                    ValidationCheck check = classify(builtin, spine, t);
                    if (check != null) checks.add(check);
                }
                for (int i = spine.args.size() - 1; i >= 0; i--) stack.push(spine.args.get(i));
                continue;
            }
            List<Term> children = t.children();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
        return checks;
    }

    static ValidationCheck classify(String builtin, Terms.Spine spine, Term node) {
        if (BuiltinGroups.SIGNATURE_VERIFY.contains(builtin)) {
            return new ValidationCheck(CheckCategory.SIGNER, builtin,
                    "Verifies a " + scheme(builtin) + " signature", node);
        }
        if ("bls12_381_finalVerify".equals(builtin)) {
            return new ValidationCheck(CheckCategory.SIGNER, builtin, "Verifies a BLS12-381 pairing", node);
        }
        if (BuiltinGroups.HASHES.contains(builtin)) {
            return new ValidationCheck(CheckCategory.UNKNOWN, builtin, "Computes a " + builtin + " hash", node);
        }
        if ("equalsByteString".equals(builtin)) return byteEquality(builtin, spine, node);
        if (BuiltinGroups.INTEGER_COMPARISONS.contains(builtin)) return integerComparison(builtin, spine, node);
        if (BuiltinGroups.BYTES_COMPARISONS.contains(builtin)) {
            return new ValidationCheck(CheckCategory.COMPARISON, builtin, "Orders two byte strings", node);
        }
        if (BuiltinGroups.OTHER_EQUALITY.contains(builtin)) {
            return new ValidationCheck(CheckCategory.EQUALITY, builtin, "Compares two values with " + builtin, node);
        }
        if (!BuiltinTags.isKnown(builtin)) {
            return new ValidationCheck(CheckCategory.UNKNOWN, builtin, "Calls unrecognized builtin " + builtin, node);
        }
        return null;
    }

    private static ValidationCheck byteEquality(String builtin, Terms.Spine spine, Term node) {
        for (int i = 0; i < spine.args.size(); i++) {
            Constant c = constantOf(spine.args.get(i));
            if (c == null || c.kind() != ConstType.Kind.BYTESTRING) continue;
            String hex = Hex.encode(c.asBytes());
            if (c.byteLength() == HASH28_LENGTH) {
                Term other = spine.arg(1 - i);
                if (other != null && involvesValueMap(other)) {
                    return new ValidationCheck(CheckCategory.TOKEN, builtin, "Checks policy id #" + hex, node);
                }
                return new ValidationCheck(CheckCategory.OWNER, builtin, "Checks key hash #" + hex, node);
            }
            return new ValidationCheck(CheckCategory.EQUALITY, builtin, "Compares against #" + hex, node);
        }
        return new ValidationCheck(CheckCategory.EQUALITY, builtin, "Compares two byte strings", node);
    }

    private static ValidationCheck integerComparison(String builtin, Terms.Spine spine, Term node) {
        boolean equality = "equalsInteger".equals(builtin);
        for (Term arg : spine.args) {
            BigInteger k = Terms.extractIntConstant(arg);
            if (k != null && k.compareTo(TIMESTAMP_THRESHOLD) > 0) {
                return new ValidationCheck(CheckCategory.DEADLINE, builtin, "Checks time against " + k, node);
            }
        }
        for (Term arg : spine.args) {
            if (involvesValueMap(arg)) {
                return new ValidationCheck(CheckCategory.VALUE, builtin,
                        equality ? "Checks an exact asset quantity" : "Checks an asset quantity bound", node);
            }
        }
        if (equality) {
            return new ValidationCheck(CheckCategory.EQUALITY, builtin, "Compares two integers", node);
        }
        return new ValidationCheck(CheckCategory.COMPARISON, builtin, "Orders two integers", node);
    }

    /** Values are maps of maps; quantities are read out of them with unMapData. */
    private static boolean involvesValueMap(Term term) {
        return Terms.findFirst(term, t -> t.tag == Term.Tag.BUILTIN && "unMapData".equals(((Term.Builtin) t).name)) != null;
    }

    private static Constant constantOf(Term term) {
        Term t = Terms.stripForceDelay(term);
        return t.tag == Term.Tag.CON ? ((Term.Con) t).value : null;
    }

    private static String scheme(String builtin) {
        switch (builtin) {
            case "verifyEd25519Signature": return "Ed25519";
            case "verifyEcdsaSecp256k1Signature": return "ECDSA secp256k1";
            default: return "Schnorr secp256k1";
        }
    }
}
