package com.uplc.decompiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A complete IR program: type definitions, functions and imports.
 */
public final class IRModule {

    public static final class Field {
        public final String name;
        public final IRType type;

        public Field(String name, IRType type) {
            this.name = name;
            this.type = type;
        }
    }

    /** A struct when {@code variants} is empty, otherwise an enum. */
    public static final class TypeDefinition {
        public final String name;
        public final List<Field> fields;
        public final List<String> variants;

        public TypeDefinition(String name, List<Field> fields, List<String> variants) {
            this.name = name;
            this.fields = List.copyOf(fields);
            this.variants = List.copyOf(variants);
        }

        public boolean isEnum() {
            return !variants.isEmpty();
        }
    }

    public static final class Import {
        public final String module;
        public final List<String> items;

        public Import(String module, List<String> items) {
            this.module = module;
            this.items = List.copyOf(items);
        }
    }

    public final List<TypeDefinition> types;
    public final List<IRFunction> functions;
    public final List<Import> imports;

    public IRModule(List<TypeDefinition> types, List<IRFunction> functions, List<Import> imports) {
        this.types = List.copyOf(types);
        this.functions = List.copyOf(functions);
        this.imports = List.copyOf(imports);
    }

    public IRModule withFunctions(List<IRFunction> newFunctions) {
        return new IRModule(types, new ArrayList<>(newFunctions), imports);
    }

    public IRFunction function(String name) {
        for (IRFunction f : functions) {
            if (f.name.equals(name)) return f;
        }
        return null;
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }
}
