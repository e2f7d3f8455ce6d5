package com.uplc.decompiler.convert;

/** Unrecognized decoded node, raised only in {@link ConversionMode#STRICT}. */
public class ConversionError extends RuntimeException {

    public ConversionError(String message) {
        super(message);
    }

    public ConversionError(String message, Throwable cause) {
        super(message, cause);
    }
}
