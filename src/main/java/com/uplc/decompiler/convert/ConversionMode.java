package com.uplc.decompiler.convert;

public enum ConversionMode {
    /** Unrecognized nodes become {@code Error} terms and are counted. */
    DIAGNOSTIC,
    /** Unrecognized nodes abort the conversion with a {@link ConversionError}. */
    STRICT
}
