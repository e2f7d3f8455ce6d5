package com.uplc.decompiler.codegen;

import java.util.List;

/**
 * Formatting-ready output of the generator. Render it with {@link CodeFormatter}.
 */
public final class GeneratedCode {

    /** A module-level {@code const} declaration. */
    public static final class ConstantDeclaration {
        public final String name;
        public final String value;

        public ConstantDeclaration(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }

    /** Imported module paths, sorted. */
    public final List<String> imports;
    /** Script parameters first, then extracted constants. */
    public final List<ConstantDeclaration> constants;
    public final List<TypeDefinition> types;
    public final ValidatorBlock validator;

    public GeneratedCode(List<String> imports, List<ConstantDeclaration> constants,
                         List<TypeDefinition> types, ValidatorBlock validator) {
        this.imports = List.copyOf(imports);
        this.constants = List.copyOf(constants);
        this.types = List.copyOf(types);
        this.validator = validator;
    }

    public TypeDefinition type(String name) {
        for (TypeDefinition t : types) {
            if (t.name.equals(name)) return t;
        }
        return null;
    }

    @Override
    public String toString() {
        return CodeFormatter.format(this);
    }
}
