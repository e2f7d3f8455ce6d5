package com.uplc.decompiler;

import java.util.Objects;

import com.uplc.decompiler.codegen.GeneratorOptions;
import com.uplc.decompiler.convert.ConversionMode;
import com.uplc.decompiler.ir.OptimizerOptions;

/** Settings for one {@link UplcDecompiler}. */
public final class DecompilerOptions {
    private ConversionMode conversionMode = ConversionMode.DIAGNOSTIC;
    private OptimizerOptions optimizerOptions = OptimizerOptions.defaults();
    private GeneratorOptions generatorOptions = GeneratorOptions.defaults();

    public static DecompilerOptions defaults() {
        return new DecompilerOptions();
    }

    public ConversionMode conversionMode() { return conversionMode; }
    public OptimizerOptions optimizerOptions() { return optimizerOptions; }
    public GeneratorOptions generatorOptions() { return generatorOptions; }

    public DecompilerOptions setConversionMode(ConversionMode mode) {
        this.conversionMode = Objects.requireNonNull(mode, "mode");
        return this;
    }

    public DecompilerOptions setOptimizerOptions(OptimizerOptions options) {
        this.optimizerOptions = Objects.requireNonNull(options, "options");
        return this;
    }

    public DecompilerOptions setGeneratorOptions(GeneratorOptions options) {
        this.generatorOptions = Objects.requireNonNull(options, "options");
        return this;
    }
}
