package com.uplc.decompiler.term;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * On-chain Data value: constructor, map, list, integer or bytes.
 */
public final class PlutusData {
    public enum Type { CONSTR, MAP, LIST, INT, BYTES }

    public final Type type;
    private final long index;
    private final List<PlutusData> items;
    private final List<Map.Entry<PlutusData, PlutusData>> entries;
    private final BigInteger integer;
    private final byte[] bytes;

    private PlutusData(Type type, long index, List<PlutusData> items,
                       List<Map.Entry<PlutusData, PlutusData>> entries, BigInteger integer, byte[] bytes) {
        this.type = type;
        this.index = index;
        this.items = items;
        this.entries = entries;
        this.integer = integer;
        this.bytes = bytes;
    }

    public static PlutusData constr(long index, List<PlutusData> fields) {
        if (index < 0) throw new IllegalArgumentException("constructor index must be non-negative: " + index);
        return new PlutusData(Type.CONSTR, index, copyOf(fields), null, null, null);
    }

    public static PlutusData map(List<Map.Entry<PlutusData, PlutusData>> entries) {
        List<Map.Entry<PlutusData, PlutusData>> copy = new ArrayList<>(entries.size());
        for (Map.Entry<PlutusData, PlutusData> e : entries) {
            copy.add(Map.entry(Objects.requireNonNull(e.getKey()), Objects.requireNonNull(e.getValue())));
        }
        return new PlutusData(Type.MAP, 0, null, Collections.unmodifiableList(copy), null, null);
    }

    public static PlutusData list(List<PlutusData> items) {
        return new PlutusData(Type.LIST, 0, copyOf(items), null, null, null);
    }

    public static PlutusData integer(BigInteger value) {
        return new PlutusData(Type.INT, 0, null, null, Objects.requireNonNull(value), null);
    }

    public static PlutusData integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static PlutusData bytes(byte[] value) {
        return new PlutusData(Type.BYTES, 0, null, null, null, value.clone());
    }

    private static List<PlutusData> copyOf(List<PlutusData> in) {
        List<PlutusData> out = new ArrayList<>(in.size());
        for (PlutusData d : in) out.add(Objects.requireNonNull(d, "data element"));
        return Collections.unmodifiableList(out);
    }

    public long constrIndex() {
        require(Type.CONSTR);
        return index;
    }

    /** Fields of a constructor or items of a list. */
    public List<PlutusData> items() {
        if (type != Type.CONSTR && type != Type.LIST) {
            throw new RuntimeException("Expected constr or list data, got " + type);
        }
        return items;
    }

    public List<Map.Entry<PlutusData, PlutusData>> entries() {
        require(Type.MAP);
        return entries;
    }

    public BigInteger asInteger() {
        require(Type.INT);
        return integer;
    }

    public byte[] asBytes() {
        require(Type.BYTES);
        return bytes.clone();
    }

    private void require(Type expected) {
        if (type != expected) throw new RuntimeException("Expected " + expected + " data, got " + type);
    }

    /** Textual literal form: {@code Constr 0 [I 1, B #ab]}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        write(sb);
        return sb.toString();
    }

    private void write(StringBuilder sb) {
        switch (type) {
            case CONSTR:
                sb.append("Constr ").append(index).append(' ');
                writeList(sb, items);
                break;
            case LIST:
                sb.append("List ");
                writeList(sb, items);
                break;
            case MAP:
                sb.append("Map [");
                for (int i = 0; i < entries.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append('(');
                    entries.get(i).getKey().write(sb);
                    sb.append(", ");
                    entries.get(i).getValue().write(sb);
                    sb.append(')');
                }
                sb.append(']');
                break;
            case INT:
                sb.append("I ").append(integer);
                break;
            case BYTES:
                sb.append("B #").append(Hex.encode(bytes));
                break;
        }
    }

    private static void writeList(StringBuilder sb, List<PlutusData> list) {
        sb.append('[');
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) sb.append(", ");
            list.get(i).write(sb);
        }
        sb.append(']');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlutusData)) return false;
        PlutusData other = (PlutusData) o;
        return type == other.type
                && index == other.index
                && Objects.equals(items, other.items)
                && Objects.equals(entries, other.entries)
                && Objects.equals(integer, other.integer)
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, index, items, entries, integer, Arrays.hashCode(bytes));
    }
}
