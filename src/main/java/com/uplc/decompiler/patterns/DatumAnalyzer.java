package com.uplc.decompiler.patterns;

import java.util.List;
import java.util.Map;

import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

public final class DatumAnalyzer {

    private DatumAnalyzer() {}

    public static DatumInfo analyze(Term body, String datumParam, Map<Term, Term> parents) {
        if (datumParam == null) return DatumInfo.ABSENT;
        if (!Terms.referencesVar(body, datumParam)) {
            return new DatumInfo(false, false, List.of(), "unit");
        }
        List<FieldInfo> fields = FieldExtractor.extract(body, datumParam, parents);
        boolean optional = isOptional(body, datumParam);
        return new DatumInfo(true, optional, fields, fields.isEmpty() ? "unknown" : "custom");
    }

    /** Some/None tag tests or a chooseData on the datum mark it as an Option. */
    static boolean isOptional(Term body, String datumParam) {
        Term test = Terms.findFirst(body, t -> {
            if (t.tag != Term.Tag.APPLY) return false;
            Integer k = RedeemerAnalyzer.constructorIndexCheck(t, datumParam);
            if (k != null) return true;
            Terms.Spine s = Terms.flattenApp(t);
            return s.isBuiltin("chooseData") && !s.args.isEmpty() && Terms.isVar(s.args.get(0), datumParam);
        });
        return test != null;
    }
}
