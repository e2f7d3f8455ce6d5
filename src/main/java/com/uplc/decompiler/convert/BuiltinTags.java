package com.uplc.decompiler.convert;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builtin tag tables.
 *
 * The upstream decoder names BLS12-381 tags 58-60 and 65-67 one step off from the protocol
 * ordering (it reports compress as hashToGroup and so on). {@link #correctName} undoes that
 * rotation and is applied to every builtin the converter sees, whether it arrived as a name
 * or as a numeric tag.
 */
public final class BuiltinTags {

    /** Protocol ordering of builtin tags. */
    public static final List<String> CANONICAL = Collections.unmodifiableList(Arrays.asList(
            "addInteger", "subtractInteger", "multiplyInteger", "divideInteger", "quotientInteger",
            "remainderInteger", "modInteger", "equalsInteger", "lessThanInteger", "lessThanEqualsInteger",
            "appendByteString", "consByteString", "sliceByteString", "lengthOfByteString", "indexByteString",
            "equalsByteString", "lessThanByteString", "lessThanEqualsByteString",
            "sha2_256", "sha3_256", "blake2b_256", "verifyEd25519Signature",
            "appendString", "equalsString", "encodeUtf8", "decodeUtf8",
            "ifThenElse", "chooseUnit", "trace", "fstPair", "sndPair",
            "chooseList", "mkCons", "headList", "tailList", "nullList",
            "chooseData", "constrData", "mapData", "listData", "iData", "bData",
            "unConstrData", "unMapData", "unListData", "unIData", "unBData", "equalsData",
            "mkPairData", "mkNilData", "mkNilPairData", "serialiseData",
            "verifyEcdsaSecp256k1Signature", "verifySchnorrSecp256k1Signature",
            "bls12_381_G1_add", "bls12_381_G1_neg", "bls12_381_G1_scalarMul", "bls12_381_G1_equal",
            "bls12_381_G1_compress", "bls12_381_G1_uncompress", "bls12_381_G1_hashToGroup",
            "bls12_381_G2_add", "bls12_381_G2_neg", "bls12_381_G2_scalarMul", "bls12_381_G2_equal",
            "bls12_381_G2_compress", "bls12_381_G2_uncompress", "bls12_381_G2_hashToGroup",
            "bls12_381_millerLoop", "bls12_381_mulMlResult", "bls12_381_finalVerify",
            "keccak_256", "blake2b_224", "integerToByteString", "byteStringToInteger",
            "andByteString", "orByteString", "xorByteString", "complementByteString",
            "readBit", "writeBits", "replicateByte", "shiftByteString", "rotateByteString",
            "countSetBits", "findFirstSetBit", "ripemd_160"));

    private static final Map<String, String> BLS_FIX;
    static {
        Map<String, String> map = new HashMap<>();
        map.put("bls12_381_G1_hashToGroup", "bls12_381_G1_compress");
        map.put("bls12_381_G1_compress", "bls12_381_G1_uncompress");
        map.put("bls12_381_G1_uncompress", "bls12_381_G1_hashToGroup");
        map.put("bls12_381_G2_hashToGroup", "bls12_381_G2_compress");
        map.put("bls12_381_G2_compress", "bls12_381_G2_uncompress");
        map.put("bls12_381_G2_uncompress", "bls12_381_G2_hashToGroup");
        BLS_FIX = Collections.unmodifiableMap(map);
    }

    private static final String[] UPSTREAM;
    static {
        UPSTREAM = CANONICAL.toArray(new String[0]);
        // invert the fix so that correctName(upstreamName(tag)) is the canonical name
        for (Map.Entry<String, String> e : BLS_FIX.entrySet()) {
            UPSTREAM[CANONICAL.indexOf(e.getValue())] = e.getKey();
        }
    }

    private BuiltinTags() {}

    /** Name the upstream decoder reports for {@code tag}, or null when out of range. */
    public static String upstreamName(int tag) {
        if (tag < 0 || tag >= UPSTREAM.length) return null;
        return UPSTREAM[tag];
    }

    public static String canonicalName(int tag) {
        if (tag < 0 || tag >= CANONICAL.size()) return null;
        return CANONICAL.get(tag);
    }

    public static String correctName(String reported) {
        return BLS_FIX.getOrDefault(reported, reported);
    }

    public static boolean isRemapped(String reported) {
        return BLS_FIX.containsKey(reported);
    }

    public static boolean isKnown(String name) {
        return CANONICAL.contains(name);
    }
}
