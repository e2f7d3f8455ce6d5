package com.uplc.decompiler.patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * How one tracked value (a parameter or an extracted field) is transformed and consumed.
 */
public final class VariableFlow {

    public enum Source { DATUM, REDEEMER, CONTEXT, LOCAL }

    public final String variable;
    public final Source source;
    private final List<String> transforms = new ArrayList<>();
    private final List<VariableUsage> usages = new ArrayList<>();
    private boolean touchesContext;

    VariableFlow(String variable, Source source) {
        this.variable = variable;
        this.source = source;
    }

    void addUsage(VariableUsage usage) { usages.add(usage); }
    void addTransform(String builtin) { transforms.add(builtin); }
    void markContextInteraction() { touchesContext = true; }

    public List<String> transforms() { return Collections.unmodifiableList(transforms); }
    public List<VariableUsage> usages() { return Collections.unmodifiableList(usages); }

    /** True when some usage also involves the script context (e.g. the validity range). */
    public boolean touchesContext() { return touchesContext; }

    public boolean hasUsage(VariableUsage.Kind kind) {
        for (VariableUsage u : usages) {
            if (u.kind == kind) return true;
        }
        return false;
    }

    /** Most frequently implied type, or {@code Data}. */
    public String inferredType() {
        String best = "Data";
        int bestCount = 0;
        List<String> seen = new ArrayList<>();
        for (VariableUsage u : usages) {
            if (u.impliedType == null || seen.contains(u.impliedType)) continue;
            seen.add(u.impliedType);
            int count = 0;
            for (VariableUsage other : usages) {
                if (u.impliedType.equals(other.impliedType)) count++;
            }
            if (count > bestCount) {
                bestCount = count;
                best = u.impliedType;
            }
        }
        return best;
    }

    /**
     * Suggested surface name. Transforms are consulted first, then usage kinds, then the source.
     */
    public String semanticName() {
        if (transforms.contains("unIData")) {
            if (touchesContext && hasUsage(VariableUsage.Kind.COMPARISON)) return "deadline";
            return "amount";
        }
        if (transforms.contains("unBData")) {
            return hasUsage(VariableUsage.Kind.CRYPTO) ? "signature" : "token_name";
        }

        for (VariableUsage u : usages) {
            if (u.kind == VariableUsage.Kind.CRYPTO) {
                return u.builtin.startsWith("verify") ? "signer" : "hash";
            }
        }
        if (hasUsage(VariableUsage.Kind.COMPARISON)) {
            return "Int".equals(inferredType()) ? "deadline" : "owner";
        }
        if (hasUsage(VariableUsage.Kind.ARITHMETIC)) return "amount";

        switch (source) {
            case DATUM: return "datum_field";
            case REDEEMER: return "redeemer_field";
            default: return "value";
        }
    }
}
