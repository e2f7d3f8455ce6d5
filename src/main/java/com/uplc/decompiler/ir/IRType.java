package com.uplc.decompiler.ir;

import java.util.List;
import java.util.Objects;

import com.uplc.decompiler.term.ConstType;

/**
 * Types of the intermediate representation. Richer than UPLC constant types, simpler than a
 * surface language.
 */
public final class IRType {

    public enum Kind { INT, BOOL, BYTES, STRING, UNIT, LIST, TUPLE, OPTION, CUSTOM, FUNCTION, UNKNOWN }

    public static final IRType INT = new IRType(Kind.INT, null, List.of(), null);
    public static final IRType BOOL = new IRType(Kind.BOOL, null, List.of(), null);
    public static final IRType BYTES = new IRType(Kind.BYTES, null, List.of(), null);
    public static final IRType STRING = new IRType(Kind.STRING, null, List.of(), null);
    public static final IRType UNIT = new IRType(Kind.UNIT, null, List.of(), null);
    public static final IRType UNKNOWN = new IRType(Kind.UNKNOWN, null, List.of(), null);

    public final Kind kind;
    /** Name of a custom type, else null. */
    public final String name;
    /** Element type of a list or option, tuple members, or function parameters. */
    public final List<IRType> params;
    /** Return type of a function type, else null. */
    public final IRType returns;

    private IRType(Kind kind, String name, List<IRType> params, IRType returns) {
        this.kind = kind;
        this.name = name;
        this.params = List.copyOf(params);
        this.returns = returns;
    }

    public static IRType list(IRType element) { return new IRType(Kind.LIST, null, List.of(element), null); }
    public static IRType tuple(List<IRType> members) { return new IRType(Kind.TUPLE, null, members, null); }
    public static IRType option(IRType inner) { return new IRType(Kind.OPTION, null, List.of(inner), null); }
    public static IRType custom(String name) { return new IRType(Kind.CUSTOM, Objects.requireNonNull(name), List.of(), null); }

    public static IRType function(List<IRType> params, IRType returns) {
        return new IRType(Kind.FUNCTION, null, params, Objects.requireNonNull(returns));
    }

    public static IRType of(ConstType type) {
        switch (type.kind) {
            case INTEGER: return INT;
            case BOOL: return BOOL;
            case BYTESTRING: return BYTES;
            case STRING: return STRING;
            case UNIT: return UNIT;
            case LIST: return list(of(type.first));
            case PAIR: return tuple(List.of(of(type.first), of(type.second)));
            case DATA: return custom("Data");
            default: return UNKNOWN;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case INT: return "Int";
            case BOOL: return "Bool";
            case BYTES: return "ByteArray";
            case STRING: return "String";
            case UNIT: return "Void";
            case LIST: return "List<" + params.get(0) + ">";
            case OPTION: return "Option<" + params.get(0) + ">";
            case CUSTOM: return name;
            case TUPLE: return "(" + join(params) + ")";
            case FUNCTION: return "fn(" + join(params) + ") -> " + returns;
            default: return "Unknown";
        }
    }

    private static String join(List<IRType> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(types.get(i));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IRType)) return false;
        IRType other = (IRType) o;
        return kind == other.kind && Objects.equals(name, other.name)
                && params.equals(other.params) && Objects.equals(returns, other.returns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, params, returns);
    }
}
