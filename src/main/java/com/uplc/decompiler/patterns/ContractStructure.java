package com.uplc.decompiler.patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.uplc.decompiler.term.Term;

/**
 * High-level shape reconstructed from a validator term. Read-only once built.
 */
public final class ContractStructure {
    public final ScriptPurpose purpose;
    public final Recognition<ScriptPurpose> purposeRecognition;
    public final List<String> params;
    public final String datumParam;
    public final String redeemerParam;
    public final String contextParam;
    public final DatumInfo datum;
    public final RedeemerInfo redeemer;
    public final List<ValidationCheck> checks;
    /** Innermost validator body. */
    public final Term body;
    /** Whole analyzed term, including outer bindings and script parameters. */
    public final Term fullTerm;
    public final List<ScriptParameter> scriptParameters;
    public final List<OuterBinding> outerBindings;
    public final List<PatternMatch> commonPatterns;
    public final Map<String, VariableFlow> flows;

    private ContractStructure(Builder b) {
        this.purposeRecognition = b.purposeRecognition;
        this.purpose = b.purposeRecognition.orElse(ScriptPurpose.UNKNOWN);
        this.params = List.copyOf(b.params);
        this.datumParam = b.datumParam;
        this.redeemerParam = b.redeemerParam;
        this.contextParam = b.contextParam;
        this.datum = b.datum;
        this.redeemer = b.redeemer;
        this.checks = List.copyOf(b.checks);
        this.body = b.body;
        this.fullTerm = b.fullTerm != null ? b.fullTerm : b.body;
        this.scriptParameters = List.copyOf(b.scriptParameters);
        this.outerBindings = List.copyOf(b.outerBindings);
        this.commonPatterns = List.copyOf(b.commonPatterns);
        this.flows = Collections.unmodifiableMap(new LinkedHashMap<>(b.flows));
    }

    public static Builder builder(Term body) {
        return new Builder(body);
    }

    public static final class Builder {
        private final Term body;
        private Recognition<ScriptPurpose> purposeRecognition = Recognition.notFound();
        private List<String> params = new ArrayList<>();
        private String datumParam;
        private String redeemerParam;
        private String contextParam;
        private DatumInfo datum = DatumInfo.ABSENT;
        private RedeemerInfo redeemer = RedeemerInfo.NONE;
        private List<ValidationCheck> checks = new ArrayList<>();
        private Term fullTerm;
        private List<ScriptParameter> scriptParameters = new ArrayList<>();
        private List<OuterBinding> outerBindings = new ArrayList<>();
        private List<PatternMatch> commonPatterns = new ArrayList<>();
        private Map<String, VariableFlow> flows = new LinkedHashMap<>();

        private Builder(Term body) {
            this.body = body;
        }

        public Builder purpose(ScriptPurpose purpose) {
            this.purposeRecognition = Recognition.found(purpose, 1.0);
            return this;
        }

        public Builder purpose(Recognition<ScriptPurpose> recognition) {
            this.purposeRecognition = recognition;
            return this;
        }

        public Builder params(List<String> params) { this.params = params; return this; }
        public Builder datumParam(String name) { this.datumParam = name; return this; }
        public Builder redeemerParam(String name) { this.redeemerParam = name; return this; }
        public Builder contextParam(String name) { this.contextParam = name; return this; }
        public Builder datum(DatumInfo datum) { this.datum = datum; return this; }
        public Builder redeemer(RedeemerInfo redeemer) { this.redeemer = redeemer; return this; }
        public Builder checks(List<ValidationCheck> checks) { this.checks = checks; return this; }
        public Builder fullTerm(Term fullTerm) { this.fullTerm = fullTerm; return this; }
        public Builder scriptParameters(List<ScriptParameter> p) { this.scriptParameters = p; return this; }
        public Builder outerBindings(List<OuterBinding> b) { this.outerBindings = b; return this; }
        public Builder commonPatterns(List<PatternMatch> p) { this.commonPatterns = p; return this; }
        public Builder flows(Map<String, VariableFlow> flows) { this.flows = flows; return this; }

        public ContractStructure build() {
            return new ContractStructure(this);
        }
    }
}
