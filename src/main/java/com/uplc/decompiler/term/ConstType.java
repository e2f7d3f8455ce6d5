package com.uplc.decompiler.term;

import java.util.Objects;

/**
 * Type of a UPLC constant. Compound types (list, pair) carry their element types.
 */
public final class ConstType {

    public enum Kind {
        INTEGER("integer"),
        BYTESTRING("bytestring"),
        STRING("string"),
        UNIT("unit"),
        BOOL("bool"),
        LIST("list"),
        PAIR("pair"),
        DATA("data"),
        BLS12_381_G1_ELEMENT("bls12_381_G1_element"),
        BLS12_381_G2_ELEMENT("bls12_381_G2_element"),
        BLS12_381_ML_RESULT("bls12_381_mlresult");

        public final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public static Kind fromKeyword(String keyword) {
            for (Kind k : values()) {
                if (k.keyword.equals(keyword)) return k;
            }
            return null;
        }
    }

    public static final ConstType INTEGER = new ConstType(Kind.INTEGER, null, null);
    public static final ConstType BYTESTRING = new ConstType(Kind.BYTESTRING, null, null);
    public static final ConstType STRING = new ConstType(Kind.STRING, null, null);
    public static final ConstType UNIT = new ConstType(Kind.UNIT, null, null);
    public static final ConstType BOOL = new ConstType(Kind.BOOL, null, null);
    public static final ConstType DATA = new ConstType(Kind.DATA, null, null);
    public static final ConstType G1_ELEMENT = new ConstType(Kind.BLS12_381_G1_ELEMENT, null, null);
    public static final ConstType G2_ELEMENT = new ConstType(Kind.BLS12_381_G2_ELEMENT, null, null);
    public static final ConstType ML_RESULT = new ConstType(Kind.BLS12_381_ML_RESULT, null, null);

    public final Kind kind;
    /** Element type of a list, first component of a pair. */
    public final ConstType first;
    /** Second component of a pair. */
    public final ConstType second;

    private ConstType(Kind kind, ConstType first, ConstType second) {
        this.kind = kind;
        this.first = first;
        this.second = second;
    }

    public static ConstType list(ConstType element) {
        return new ConstType(Kind.LIST, Objects.requireNonNull(element, "element"), null);
    }

    public static ConstType pair(ConstType fst, ConstType snd) {
        return new ConstType(Kind.PAIR, Objects.requireNonNull(fst, "fst"), Objects.requireNonNull(snd, "snd"));
    }

    public static ConstType simple(Kind kind) {
        switch (kind) {
            case INTEGER: return INTEGER;
            case BYTESTRING: return BYTESTRING;
            case STRING: return STRING;
            case UNIT: return UNIT;
            case BOOL: return BOOL;
            case DATA: return DATA;
            case BLS12_381_G1_ELEMENT: return G1_ELEMENT;
            case BLS12_381_G2_ELEMENT: return G2_ELEMENT;
            case BLS12_381_ML_RESULT: return ML_RESULT;
            default: throw new IllegalArgumentException(kind + " needs type arguments");
        }
    }

    public boolean isByteLike() {
        return kind == Kind.BYTESTRING
                || kind == Kind.BLS12_381_G1_ELEMENT
                || kind == Kind.BLS12_381_G2_ELEMENT
                || kind == Kind.BLS12_381_ML_RESULT;
    }

    /** Canonical textual form: {@code integer}, {@code (list integer)}, {@code (pair integer data)}. */
    @Override
    public String toString() {
        switch (kind) {
            case LIST: return "(list " + first + ")";
            case PAIR: return "(pair " + first + " " + second + ")";
            default: return kind.keyword;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstType)) return false;
        ConstType other = (ConstType) o;
        return kind == other.kind && Objects.equals(first, other.first) && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, first, second);
    }
}
