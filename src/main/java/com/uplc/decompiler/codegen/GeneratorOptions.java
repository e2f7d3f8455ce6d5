package com.uplc.decompiler.codegen;

/**
 * Code generation switches.
 */
public final class GeneratorOptions {
    private int maxLambdaParams = 6;
    private int maxBlockDepth = 64;
    private boolean extractLongConstants = true;
    private boolean useFieldNames = true;

    public static GeneratorOptions defaults() {
        return new GeneratorOptions();
    }

    /** Consecutive lambdas folded into one {@code fn(a, b, ...)}. */
    public int maxLambdaParams() { return maxLambdaParams; }

    /** Statement nesting beyond which bodies are written as plain expressions. */
    public int maxBlockDepth() { return maxBlockDepth; }

    public boolean extractLongConstants() { return extractLongConstants; }
    public boolean useFieldNames() { return useFieldNames; }

    public GeneratorOptions setMaxLambdaParams(int n) {
        if (n < 1) throw new IllegalArgumentException("maxLambdaParams must be at least 1: " + n);
        this.maxLambdaParams = n;
        return this;
    }

    public GeneratorOptions setMaxBlockDepth(int n) {
        if (n < 0) throw new IllegalArgumentException("maxBlockDepth must not be negative: " + n);
        this.maxBlockDepth = n;
        return this;
    }

    public GeneratorOptions setExtractLongConstants(boolean on) { this.extractLongConstants = on; return this; }
    public GeneratorOptions setUseFieldNames(boolean on) { this.useFieldNames = on; return this; }
}
