package com.uplc.decompiler.patterns;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Tracks how parameters and extracted fields flow into builtins, to name them.
 */
public final class DataFlowAnalyzer {

    /** How far up the tree a field value is followed. */
    private static final int FIELD_CLIMB_LIMIT = 4;

    private DataFlowAnalyzer() {}

    public static Map<String, VariableFlow> analyze(Term body, String datumParam, String redeemerParam, String contextParam) {
        Map<String, VariableFlow> flows = new LinkedHashMap<>();
        if (datumParam != null) {
            flows.put(datumParam, forParameter(body, datumParam, VariableFlow.Source.DATUM, contextParam));
        }
        if (redeemerParam != null && !flows.containsKey(redeemerParam)) {
            flows.put(redeemerParam, forParameter(body, redeemerParam, VariableFlow.Source.REDEEMER, contextParam));
        }
        if (contextParam != null && !flows.containsKey(contextParam)) {
            flows.put(contextParam, forParameter(body, contextParam, VariableFlow.Source.CONTEXT, null));
        }
        return flows;
    }

    /** Every builtin application that takes {@code var} (free) somewhere in its arguments. */
    public static VariableFlow forParameter(Term body, String var, VariableFlow.Source source, String contextParam) {
        VariableFlow flow = new VariableFlow(var, source);
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(body);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            if (t.tag == Term.Tag.LAMBDA) {
                Term.Lambda lam = (Term.Lambda) t;
                if (!lam.param.equals(var)) stack.push(lam.body);
                continue;
            }
            if (t.tag == Term.Tag.APPLY) {
                Terms.Spine spine = Terms.flattenApp(t);
                String builtin = spine.builtin();
                if (builtin == null) {
                    stack.push(spine.head);
                } else if (anyReferences(spine.args, var)) {
                    record(flow, builtin, t, contextParam != null && anyReferences(spine.args, contextParam));
                }
                for (Term a : spine.args) stack.push(a);
                continue;
            }
            for (Term c : t.children()) stack.push(c);
        }
        return flow;
    }

    /** Follows the value of one field access upward through the builtins consuming it. */
    public static VariableFlow forField(FieldInfo field, Map<Term, Term> parents, VariableFlow.Source source, String contextParam) {
        VariableFlow flow = new VariableFlow(field.accessPath, source);
        if (field.node == null) return flow;
        Term cur = field.node;
        int steps = 0;
        while (steps < FIELD_CLIMB_LIMIT) {
            Term p = parents.get(cur);
            if (p == null) break;
            if (p.tag == Term.Tag.FORCE || p.tag == Term.Tag.DELAY) {
                cur = p;
                continue;
            }
            if (p.tag != Term.Tag.APPLY) break;
            Term top = p;
            Term up = parents.get(top);
            while (up != null && up.tag == Term.Tag.APPLY && ((Term.Apply) up).func == top) {
                top = up;
                up = parents.get(top);
            }
            Terms.Spine spine = Terms.flattenApp(top);
            String builtin = spine.builtin();
            if (builtin == null) break;
            record(flow, builtin, top, contextParam != null && anyReferences(spine.args, contextParam));
            cur = top;
            steps++;
        }
        return flow;
    }

    private static void record(VariableFlow flow, String builtin, Term node, boolean withContext) {
        flow.addUsage(new VariableUsage(BuiltinGroups.usageKind(builtin), builtin, node, BuiltinGroups.impliedType(builtin)));
        if (BuiltinGroups.TRANSFORMS.contains(builtin)) flow.addTransform(builtin);
        if (withContext) flow.markContextInteraction();
    }

    private static boolean anyReferences(List<Term> args, String var) {
        for (Term a : args) {
            if (Terms.referencesVar(a, var)) return true;
        }
        return false;
    }
}
