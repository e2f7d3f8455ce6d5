package com.uplc.decompiler.patterns;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.uplc.debug.Debug;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Runs the recognizers over a term and assembles the {@link ContractStructure}.
 *
 * Nothing here throws on unfamiliar input; a recognizer that finds nothing contributes an
 * empty or unknown result.
 */
public final class ContractAnalyzer {

    private static final String TAG = "Patterns";

    private ContractAnalyzer() {}

    public static ContractStructure analyze(Term root) {
        EntryPoint entry = EntryPoint.detect(root);
        List<String> params = entry.params;
        Term body = entry.body;

        Recognition<ScriptPurpose> purpose = PurposeInference.infer(params, body);
        ScriptPurpose resolved = purpose.orElse(ScriptPurpose.UNKNOWN);
        Debug.get().d(TAG, params.size() + " validator param(s), purpose " + purpose);

        int r = PurposeInference.redeemerIndex(resolved, params.size());
        String redeemerParam = r >= 0 ? params.get(r) : null;
        String datumParam = resolved == ScriptPurpose.SPEND && params.size() >= 3 ? params.get(0) : null;
        String contextParam = params.size() >= 2 ? params.get(params.size() - 1) : null;

        Map<Term, Term> parents = Terms.parentMap(body);
        DatumInfo datum = DatumAnalyzer.analyze(body, datumParam, parents);
        RedeemerInfo redeemer = RedeemerAnalyzer.analyze(body, redeemerParam, parents);
        List<ValidationCheck> checks = CheckClassifier.classify(body);
        Map<String, VariableFlow> flows = DataFlowAnalyzer.analyze(body, datumParam, redeemerParam, contextParam);

        datum = new DatumInfo(datum.used, datum.optional,
                nameFields(datum.fields, parents, VariableFlow.Source.DATUM, contextParam), datum.inferredType);
        redeemer = nameRedeemerFields(redeemer, parents, contextParam);

        Debug.get().d(TAG, redeemer.variants.size() + " redeemer variant(s), "
                + datum.fields.size() + " datum field(s), " + checks.size() + " check(s)");

        return ContractStructure.builder(body)
                .purpose(purpose)
                .params(params)
                .datumParam(datumParam)
                .redeemerParam(redeemerParam)
                .contextParam(contextParam)
                .datum(datum)
                .redeemer(redeemer)
                .checks(checks)
                .fullTerm(root)
                .scriptParameters(entry.scriptParameters)
                .outerBindings(entry.outerBindings)
                .commonPatterns(CommonPatternDetector.detect(body, contextParam))
                .flows(flows)
                .build();
    }

    private static RedeemerInfo nameRedeemerFields(RedeemerInfo info, Map<Term, Term> parents, String contextParam) {
        if (info.variants.isEmpty() && info.fields.isEmpty()) return info;
        List<RedeemerVariant> variants = new ArrayList<>();
        for (RedeemerVariant v : info.variants) {
            variants.add(v.withFields(nameFields(v.fields, parents, VariableFlow.Source.REDEEMER, contextParam)));
        }
        return new RedeemerInfo(variants, info.matchPattern,
                nameFields(info.fields, parents, VariableFlow.Source.REDEEMER, contextParam), info.dispatchNode);
    }

    private static List<FieldInfo> nameFields(List<FieldInfo> fields, Map<Term, Term> parents,
                                              VariableFlow.Source source, String contextParam) {
        List<FieldInfo> out = new ArrayList<>(fields.size());
        for (FieldInfo f : fields) {
            VariableFlow flow = DataFlowAnalyzer.forField(f, parents, source, contextParam);
            out.add(flow.usages().isEmpty() ? f : f.withSemanticName(flow.semanticName()));
        }
        return out;
    }
}
