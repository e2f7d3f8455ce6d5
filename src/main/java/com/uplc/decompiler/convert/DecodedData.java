package com.uplc.decompiler.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Data payload as produced by an external decoder. Integer and byte leaves hold raw payloads
 * that {@link PayloadNormalizer} converts.
 */
public final class DecodedData {
    public enum Kind { CONSTR, MAP, LIST, INT, BYTES }

    public final Kind kind;
    public final Object index;
    public final List<DecodedData> items;
    public final List<Map.Entry<DecodedData, DecodedData>> entries;
    public final Object payload;

    private DecodedData(Kind kind, Object index, List<DecodedData> items,
                        List<Map.Entry<DecodedData, DecodedData>> entries, Object payload) {
        this.kind = kind;
        this.index = index;
        this.items = items;
        this.entries = entries;
        this.payload = payload;
    }

    public static DecodedData constr(Object index, List<DecodedData> fields) {
        return new DecodedData(Kind.CONSTR, index, Collections.unmodifiableList(new ArrayList<>(fields)), null, null);
    }

    public static DecodedData map(List<Map.Entry<DecodedData, DecodedData>> entries) {
        return new DecodedData(Kind.MAP, null, null, Collections.unmodifiableList(new ArrayList<>(entries)), null);
    }

    public static DecodedData list(List<DecodedData> items) {
        return new DecodedData(Kind.LIST, null, Collections.unmodifiableList(new ArrayList<>(items)), null, null);
    }

    public static DecodedData integer(Object payload) {
        return new DecodedData(Kind.INT, null, null, null, payload);
    }

    public static DecodedData bytes(Object payload) {
        return new DecodedData(Kind.BYTES, null, null, null, payload);
    }
}
