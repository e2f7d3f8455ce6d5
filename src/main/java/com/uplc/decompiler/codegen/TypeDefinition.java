package com.uplc.decompiler.codegen;

import java.util.List;

/**
 * A generated {@code type}: a struct with fields, or an enum with variants.
 */
public final class TypeDefinition {

    public enum Kind { STRUCT, ENUM }

    public static final class Field {
        public final String name;
        public final String type;

        public Field(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    public static final class Variant {
        public final String name;
        public final List<Field> fields;

        public Variant(String name, List<Field> fields) {
            this.name = name;
            this.fields = List.copyOf(fields);
        }
    }

    public final String name;
    public final Kind kind;
    public final List<Field> fields;
    public final List<Variant> variants;

    private TypeDefinition(String name, Kind kind, List<Field> fields, List<Variant> variants) {
        this.name = name;
        this.kind = kind;
        this.fields = List.copyOf(fields);
        this.variants = List.copyOf(variants);
    }

    public static TypeDefinition struct(String name, List<Field> fields) {
        return new TypeDefinition(name, Kind.STRUCT, fields, List.of());
    }

    public static TypeDefinition enumeration(String name, List<Variant> variants) {
        return new TypeDefinition(name, Kind.ENUM, List.of(), variants);
    }
}
