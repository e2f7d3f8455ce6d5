package com.uplc.decompiler.codegen;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.uplc.decompiler.convert.BuiltinTags;

/**
 * Surface syntax for every builtin: a template over the argument texts, the module the
 * template needs imported, and the number of arguments it takes.
 *
 * Builtins without a hand-written template are called through the {@code aiken/builtin}
 * module under their snake_case name.
 */
public final class BuiltinMap {

    public static final String BUILTIN_MODULE = "aiken/builtin";
    public static final String CRYPTO_MODULE = "aiken/crypto";
    public static final String BYTEARRAY_MODULE = "aiken/primitive/bytearray";
    public static final String LIST_MODULE = "aiken/collection/list";

    public static final class Mapping {
        public final String builtin;
        /** Placeholders {@code {0}}, {@code {1}}, ... stand for the argument texts. */
        public final String template;
        /** Module to import, or null. */
        public final String module;
        public final int arity;
        /** Binary operator template; compound operands get parenthesized. */
        public final boolean infix;

        Mapping(String builtin, String template, String module, int arity, boolean infix) {
            this.builtin = builtin;
            this.template = template;
            this.module = module;
            this.arity = arity;
            this.infix = infix;
        }

        /** Function-position name, used when the builtin is not fully applied. */
        public String functionName() {
            return module == null ? builtin : qualifier(module) + "." + snakeCase(builtin);
        }

        public String render(List<String> args) {
            String out = template;
            for (int i = 0; i < args.size() && i < arity; i++) {
                String a = args.get(i);
                if (infix && !isAtomic(a)) a = "(" + a + ")";
                out = out.replace("{" + i + "}", a);
            }
            return out;
        }
    }

    private static final Map<String, Integer> ARITY = new HashMap<>();
    private static final Map<String, Mapping> MAPPINGS = new HashMap<>();

    static {
        arity(1, "lengthOfByteString", "sha2_256", "sha3_256", "blake2b_256", "encodeUtf8", "decodeUtf8",
                "fstPair", "sndPair", "headList", "tailList", "nullList", "mapData", "listData", "iData", "bData",
                "unConstrData", "unMapData", "unListData", "unIData", "unBData", "mkNilData", "mkNilPairData",
                "serialiseData", "bls12_381_G1_neg", "bls12_381_G1_compress", "bls12_381_G1_uncompress",
                "bls12_381_G2_neg", "bls12_381_G2_compress", "bls12_381_G2_uncompress", "keccak_256",
                "blake2b_224", "complementByteString", "countSetBits", "findFirstSetBit", "ripemd_160");
        arity(2, "addInteger", "subtractInteger", "multiplyInteger", "divideInteger", "quotientInteger",
                "remainderInteger", "modInteger", "equalsInteger", "lessThanInteger", "lessThanEqualsInteger",
                "appendByteString", "consByteString", "indexByteString", "equalsByteString", "lessThanByteString",
                "lessThanEqualsByteString", "appendString", "equalsString", "chooseUnit", "trace", "mkCons",
                "constrData", "equalsData", "mkPairData", "bls12_381_G1_add", "bls12_381_G1_scalarMul",
                "bls12_381_G1_equal", "bls12_381_G1_hashToGroup", "bls12_381_G2_add", "bls12_381_G2_scalarMul",
                "bls12_381_G2_equal", "bls12_381_G2_hashToGroup", "bls12_381_millerLoop", "bls12_381_mulMlResult",
                "bls12_381_finalVerify", "byteStringToInteger", "readBit", "replicateByte", "shiftByteString",
                "rotateByteString");
        arity(3, "sliceByteString", "verifyEd25519Signature", "ifThenElse", "chooseList",
                "verifyEcdsaSecp256k1Signature", "verifySchnorrSecp256k1Signature", "integerToByteString",
                "andByteString", "orByteString", "xorByteString", "writeBits");
        arity(6, "chooseData");

        infix("addInteger", "+");
        infix("subtractInteger", "-");
        infix("multiplyInteger", "*");
        infix("divideInteger", "/");
        infix("quotientInteger", "/");
        infix("modInteger", "%");
        infix("remainderInteger", "%");
        infix("equalsInteger", "==");
        infix("lessThanInteger", "<");
        infix("lessThanEqualsInteger", "<=");
        infix("equalsByteString", "==");
        infix("equalsString", "==");
        infix("equalsData", "==");

        template("appendByteString", "bytearray.concat({0}, {1})", BYTEARRAY_MODULE);
        template("appendString", "{0} <> {1}", null);
        template("mkCons", "[{0}, ..{1}]", null);
        template("mkPairData", "Pair({0}, {1})", null);
        template("mkNilData", "[]", null);
        template("mkNilPairData", "[]", null);
        template("chooseUnit", "{1}", null);
        template("trace", "trace {0}: {1}", null);
        template("ifThenElse", "if {0} { {1} } else { {2} }", null);
        template("chooseList", "if builtin.null_list({0}) { {1} } else { {2} }", BUILTIN_MODULE);

        for (String hash : List.of("sha2_256", "sha3_256", "blake2b_256", "blake2b_224", "keccak_256", "ripemd_160")) {
            template(hash, "crypto." + hash + "({0})", CRYPTO_MODULE);
        }

        for (String name : BuiltinTags.CANONICAL) {
            if (!MAPPINGS.containsKey(name)) {
                int n = ARITY.get(name);
                MAPPINGS.put(name, new Mapping(name, "builtin." + snakeCase(name) + "(" + placeholders(n) + ")",
                        BUILTIN_MODULE, n, false));
            }
        }
    }

    private BuiltinMap() {}

    private static void arity(int n, String... names) {
        for (String name : names) ARITY.put(name, n);
    }

    private static void infix(String name, String op) {
        MAPPINGS.put(name, new Mapping(name, "{0} " + op + " {1}", null, 2, true));
    }

    private static void template(String name, String template, String module) {
        MAPPINGS.put(name, new Mapping(name, template, module, ARITY.get(name), false));
    }

    private static String placeholders(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) sb.append(", ");
            sb.append('{').append(i).append('}');
        }
        return sb.toString();
    }

    /** Mapping for a builtin, or null when the name is not a known builtin. */
    public static Mapping get(String builtin) {
        return MAPPINGS.get(builtin);
    }

    /** Number of arguments a saturated call takes, or -1 for an unknown builtin. */
    public static int arity(String builtin) {
        Integer n = ARITY.get(builtin);
        return n == null ? -1 : n;
    }

    /** {@code bls12_381_G1_scalarMul} becomes {@code bls12_381_g1_scalar_mul}. */
    public static String snakeCase(String builtin) {
        if ("bls12_381_mulMlResult".equals(builtin)) return "bls12_381_mul_miller_loop_result";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < builtin.length(); i++) {
            char c = builtin.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && builtin.charAt(i - 1) != '_') sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString().replace("byte_string", "bytearray");
    }

    /** Last path segment of a module, used to qualify its functions. */
    static String qualifier(String module) {
        int slash = module.lastIndexOf('/');
        return slash < 0 ? module : module.substring(slash + 1);
    }

    /** No top-level spaces, so the text can be an operand without parentheses. */
    static boolean isAtomic(String text) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
                continue;
            }
            switch (c) {
                case '"': inString = true; break;
                case '(': case '[': case '{': depth++; break;
                case ')': case ']': case '}': depth--; break;
                case ' ': if (depth == 0) return false; break;
                default: break;
            }
        }
        return true;
    }
}
