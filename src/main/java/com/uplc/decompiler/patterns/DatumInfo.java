package com.uplc.decompiler.patterns;

import java.util.List;

public final class DatumInfo {
    public static final DatumInfo ABSENT = new DatumInfo(false, false, List.of(), "unit");

    public final boolean used;
    public final boolean optional;
    public final List<FieldInfo> fields;
    /** {@code unit} when unused, {@code custom} when fields were found, otherwise {@code unknown}. */
    public final String inferredType;

    public DatumInfo(boolean used, boolean optional, List<FieldInfo> fields, String inferredType) {
        this.used = used;
        this.optional = optional;
        this.fields = List.copyOf(fields);
        this.inferredType = inferredType;
    }
}
