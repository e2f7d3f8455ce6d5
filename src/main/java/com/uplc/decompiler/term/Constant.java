package com.uplc.decompiler.term;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed UPLC constant value.
 */
public final class Constant {

    public final ConstType type;
    private final Object value;

    private Constant(ConstType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Constant integer(BigInteger i) { return new Constant(ConstType.INTEGER, Objects.requireNonNull(i)); }
    public static Constant integer(long i) { return integer(BigInteger.valueOf(i)); }
    public static Constant bytes(byte[] b) { return new Constant(ConstType.BYTESTRING, b.clone()); }
    public static Constant string(String s) { return new Constant(ConstType.STRING, Objects.requireNonNull(s)); }
    public static Constant bool(boolean b) { return new Constant(ConstType.BOOL, b); }
    public static Constant unit() { return new Constant(ConstType.UNIT, null); }
    public static Constant data(PlutusData d) { return new Constant(ConstType.DATA, Objects.requireNonNull(d)); }

    /** BLS group elements and Miller loop results are kept as their compressed bytes. */
    public static Constant opaque(ConstType type, byte[] b) {
        if (!type.isByteLike()) throw new IllegalArgumentException("not a byte-backed type: " + type);
        return new Constant(type, b.clone());
    }

    public static Constant list(ConstType elementType, List<Constant> items) {
        List<Constant> copy = new ArrayList<>(items.size());
        for (Constant c : items) {
            if (!c.type.equals(elementType)) {
                throw new IllegalArgumentException("list element of type " + c.type + " in list of " + elementType);
            }
            copy.add(c);
        }
        return new Constant(ConstType.list(elementType), Collections.unmodifiableList(copy));
    }

    public static Constant pair(Constant fst, Constant snd) {
        return new Constant(ConstType.pair(fst.type, snd.type), List.of(fst, snd));
    }

    public ConstType.Kind kind() { return type.kind; }

    public BigInteger asInteger() {
        if (type.kind != ConstType.Kind.INTEGER) throw new RuntimeException("Expected integer, got " + type);
        return (BigInteger) value;
    }

    public byte[] asBytes() {
        if (!type.isByteLike()) throw new RuntimeException("Expected bytestring, got " + type);
        return ((byte[]) value).clone();
    }

    public int byteLength() {
        if (!type.isByteLike()) throw new RuntimeException("Expected bytestring, got " + type);
        return ((byte[]) value).length;
    }

    public String asString() {
        if (type.kind != ConstType.Kind.STRING) throw new RuntimeException("Expected string, got " + type);
        return (String) value;
    }

    public boolean asBool() {
        if (type.kind != ConstType.Kind.BOOL) throw new RuntimeException("Expected bool, got " + type);
        return (boolean) value;
    }

    public PlutusData asData() {
        if (type.kind != ConstType.Kind.DATA) throw new RuntimeException("Expected data, got " + type);
        return (PlutusData) value;
    }

    @SuppressWarnings("unchecked")
    public List<Constant> asList() {
        if (type.kind != ConstType.Kind.LIST) throw new RuntimeException("Expected list, got " + type);
        return (List<Constant>) value;
    }

    public Constant first() { return asPair().get(0); }
    public Constant second() { return asPair().get(1); }

    @SuppressWarnings("unchecked")
    private List<Constant> asPair() {
        if (type.kind != ConstType.Kind.PAIR) throw new RuntimeException("Expected pair, got " + type);
        return (List<Constant>) value;
    }

    /** Value literal as written after the type in {@code (con type value)}. */
    public String valueText() {
        switch (type.kind) {
            case INTEGER: return value.toString();
            case BYTESTRING:
            case BLS12_381_G1_ELEMENT:
            case BLS12_381_G2_ELEMENT:
            case BLS12_381_ML_RESULT:
                return "#" + Hex.encode((byte[]) value);
            case STRING: return quote((String) value);
            case BOOL: return ((Boolean) value) ? "True" : "False";
            case UNIT: return "()";
            case DATA: return "(" + value + ")";
            case LIST: {
                StringBuilder sb = new StringBuilder("[");
                List<Constant> items = asList();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i).valueText());
                }
                return sb.append(']').toString();
            }
            case PAIR: return "(" + first().valueText() + ", " + second().valueText() + ")";
            default: throw new IllegalStateException("unhandled constant kind " + type.kind);
        }
    }

    public static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String toString() {
        return type + " " + valueText();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant)) return false;
        Constant other = (Constant) o;
        if (!type.equals(other.type)) return false;
        if (value instanceof byte[]) return Arrays.equals((byte[]) value, (byte[]) other.value);
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        int h = type.hashCode();
        return 31 * h + (value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
    }
}
