package com.uplc.decompiler.patterns;

import java.util.Set;

/** Builtin families the recognizers reason about. */
final class BuiltinGroups {

    static final Set<String> SIGNATURE_VERIFY = Set.of(
            "verifyEd25519Signature", "verifyEcdsaSecp256k1Signature", "verifySchnorrSecp256k1Signature");

    static final Set<String> HASHES = Set.of(
            "sha2_256", "sha3_256", "blake2b_256", "blake2b_224", "keccak_256", "ripemd_160");

    static final Set<String> INTEGER_COMPARISONS = Set.of(
            "equalsInteger", "lessThanInteger", "lessThanEqualsInteger");

    static final Set<String> BYTES_COMPARISONS = Set.of(
            "equalsByteString", "lessThanByteString", "lessThanEqualsByteString");

    static final Set<String> OTHER_EQUALITY = Set.of(
            "equalsData", "equalsString", "bls12_381_G1_equal", "bls12_381_G2_equal");

    static final Set<String> ARITHMETIC = Set.of(
            "addInteger", "subtractInteger", "multiplyInteger", "divideInteger",
            "quotientInteger", "remainderInteger", "modInteger");

    static final Set<String> LIST_OPS = Set.of(
            "headList", "tailList", "nullList", "mkCons", "chooseList");

    static final Set<String> DATA_EXTRACT = Set.of(
            "unConstrData", "unListData", "unMapData", "unIData", "unBData", "fstPair", "sndPair");

    /** Builtins that reshape a value rather than test it. */
    static final Set<String> TRANSFORMS = Set.of(
            "unConstrData", "unListData", "unMapData", "unIData", "unBData", "fstPair", "sndPair",
            "headList", "tailList", "sha2_256", "sha3_256", "blake2b_256", "blake2b_224",
            "serialiseData", "decodeUtf8", "encodeUtf8");

    private BuiltinGroups() {}

    static boolean isCheck(String builtin) {
        return SIGNATURE_VERIFY.contains(builtin)
                || HASHES.contains(builtin)
                || INTEGER_COMPARISONS.contains(builtin)
                || BYTES_COMPARISONS.contains(builtin)
                || OTHER_EQUALITY.contains(builtin)
                || "bls12_381_finalVerify".equals(builtin);
    }

    static VariableUsage.Kind usageKind(String builtin) {
        if (SIGNATURE_VERIFY.contains(builtin) || HASHES.contains(builtin)) return VariableUsage.Kind.CRYPTO;
        if (INTEGER_COMPARISONS.contains(builtin) || BYTES_COMPARISONS.contains(builtin)
                || "equalsData".equals(builtin)) {
            return VariableUsage.Kind.COMPARISON;
        }
        if (ARITHMETIC.contains(builtin)) return VariableUsage.Kind.ARITHMETIC;
        if (LIST_OPS.contains(builtin)) return VariableUsage.Kind.LIST_OP;
        if (DATA_EXTRACT.contains(builtin)) return VariableUsage.Kind.DATA_EXTRACT;
        return VariableUsage.Kind.OTHER;
    }

    static String impliedType(String builtin) {
        if (SIGNATURE_VERIFY.contains(builtin)) return "ByteArray";
        if (INTEGER_COMPARISONS.contains(builtin) || ARITHMETIC.contains(builtin)) return "Int";
        if (BYTES_COMPARISONS.contains(builtin)) return "ByteArray";
        if (LIST_OPS.contains(builtin)) return "List";
        return null;
    }
}
