package com.uplc.decompiler;

import com.uplc.decompiler.codegen.BindingEnvironment;
import com.uplc.decompiler.codegen.CodeFormatter;
import com.uplc.decompiler.codegen.CodeGenerator;
import com.uplc.decompiler.codegen.GeneratedCode;
import com.uplc.decompiler.convert.ConversionResult;
import com.uplc.decompiler.convert.DecodedTerm;
import com.uplc.decompiler.convert.DecodedTermConverter;
import com.uplc.decompiler.ir.IRConverter;
import com.uplc.decompiler.ir.IRModule;
import com.uplc.decompiler.ir.IROptimizer;
import com.uplc.decompiler.parser.Parser;
import com.uplc.decompiler.patterns.ContractAnalyzer;
import com.uplc.decompiler.patterns.ContractStructure;
import com.uplc.decompiler.term.Term;

/**
 * UPLC decompiler.
 *
 * - Input: UPLC text, or a decoded bytecode tree from an external decoder
 * - Pipeline: term, contract analysis, let-binding resolution, code generation
 * - Output: Aiken-flavoured source plus the structures behind it
 * - Stateless between calls: one instance may serve any number of threads
 */
public final class UplcDecompiler {

    private final DecompilerOptions options;

    public UplcDecompiler() {
        this(DecompilerOptions.defaults());
    }

    public UplcDecompiler(DecompilerOptions options) {
        this.options = options;
    }

    public DecompilerOptions getOptions() {
        return options;
    }

    /** @throws com.uplc.decompiler.parser.ParseError on malformed text */
    public Term parse(String text) {
        return Parser.parse(text);
    }

    /**
     * @throws com.uplc.decompiler.convert.ConversionError in strict mode, on a node it cannot read
     */
    public Term convertFromDecoded(DecodedTerm tree) {
        return convert(tree).term();
    }

    /** Conversion with its diagnostic counters. */
    public ConversionResult convert(DecodedTerm tree) {
        return new DecodedTermConverter(options.conversionMode()).convert(tree);
    }

    public ContractStructure analyzeContract(Term term) {
        return ContractAnalyzer.analyze(term);
    }

    public IRModule toIR(Term term) {
        return IRConverter.termToIR(term);
    }

    public IRModule optimize(IRModule module) {
        return IROptimizer.optimize(module, options.optimizerOptions());
    }

    public GeneratedCode generateCode(ContractStructure structure) {
        return generateCode(structure, CodeGenerator.bindingsFor(structure));
    }

    private GeneratedCode generateCode(ContractStructure structure, BindingEnvironment bindings) {
        return CodeGenerator.generate(structure, bindings, options.generatorOptions());
    }

    /** Formatted source for an analyzed contract. */
    public String generate(ContractStructure structure) {
        return CodeFormatter.format(generateCode(structure));
    }

    public DecompileResult decompile(String text) {
        return run(parse(text), null);
    }

    public DecompileResult decompileDecoded(DecodedTerm tree) {
        ConversionResult conversion = convert(tree);
        return run(conversion.term(), conversion);
    }

    private DecompileResult run(Term term, ConversionResult conversion) {
        ContractStructure structure = analyzeContract(term);
        BindingEnvironment bindings = CodeGenerator.bindingsFor(structure);
        GeneratedCode code = generateCode(structure, bindings);
        return new DecompileResult(term, structure, bindings, code, CodeFormatter.format(code), conversion);
    }
}
