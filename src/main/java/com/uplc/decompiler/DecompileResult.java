package com.uplc.decompiler;

import com.uplc.decompiler.codegen.BindingEnvironment;
import com.uplc.decompiler.codegen.GeneratedCode;
import com.uplc.decompiler.convert.ConversionResult;
import com.uplc.decompiler.patterns.ContractStructure;
import com.uplc.decompiler.term.Term;

/** Everything one decompilation produced, from the input term to the formatted source. */
public final class DecompileResult {
    public final Term term;
    public final ContractStructure structure;
    public final BindingEnvironment bindings;
    public final GeneratedCode code;
    public final String source;
    /** Present when the input was a decoded tree. */
    public final ConversionResult conversion;

    DecompileResult(Term term, ContractStructure structure, BindingEnvironment bindings, GeneratedCode code,
                    String source, ConversionResult conversion) {
        this.term = term;
        this.structure = structure;
        this.bindings = bindings;
        this.code = code;
        this.source = source;
        this.conversion = conversion;
    }
}
