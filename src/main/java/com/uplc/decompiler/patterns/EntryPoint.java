package com.uplc.decompiler.patterns;

import java.util.ArrayList;
import java.util.List;

import com.uplc.decompiler.term.Term;

/**
 * The validator's parameter lambdas, found under any outer let-bindings.
 */
public final class EntryPoint {

    /** Validator lambdas taken as parameters; the longest V3 handler takes four. */
    public static final int MAX_PARAMS = 4;

    public final List<String> params;
    public final Term body;
    public final List<ScriptParameter> scriptParameters;
    public final List<OuterBinding> outerBindings;

    private EntryPoint(List<String> params, Term body, List<ScriptParameter> scriptParameters, List<OuterBinding> outerBindings) {
        this.params = List.copyOf(params);
        this.body = body;
        this.scriptParameters = List.copyOf(scriptParameters);
        this.outerBindings = List.copyOf(outerBindings);
    }

    /**
     * Peels {@code [(lam p1 ... (lam pn V)) a1 ... an]} layers, then takes up to
     * {@link #MAX_PARAMS} lambdas. When validator lambdas follow the layers, constant arguments
     * are script parameters; every other peeled argument is an outer binding.
     */
    public static EntryPoint detect(Term root) {
        List<OuterBinding> peeled = new ArrayList<>();
        Term t = root;
        while (t.tag == Term.Tag.APPLY) {
            List<Term> args = new ArrayList<>();
            Term head = t;
            while (head.tag == Term.Tag.APPLY) {
                args.add(0, ((Term.Apply) head).arg);
                head = ((Term.Apply) head).func;
            }
            Term inner = head;
            List<String> names = new ArrayList<>();
            while (inner.tag == Term.Tag.LAMBDA && names.size() < args.size()) {
                names.add(((Term.Lambda) inner).param);
                inner = ((Term.Lambda) inner).body;
            }
            if (names.size() < args.size()) break;
            for (int i = 0; i < args.size(); i++) {
                peeled.add(new OuterBinding(names.get(i), args.get(i)));
            }
            t = inner;
        }

        boolean validatorFollows = t.tag == Term.Tag.LAMBDA;
        List<ScriptParameter> scriptParameters = new ArrayList<>();
        List<OuterBinding> outerBindings = new ArrayList<>();
        for (OuterBinding b : peeled) {
            if (validatorFollows && b.value.tag == Term.Tag.CON) {
                scriptParameters.add(new ScriptParameter(b.name, ((Term.Con) b.value).value));
            } else {
                outerBindings.add(b);
            }
        }

        List<String> params = new ArrayList<>();
        while (t.tag == Term.Tag.LAMBDA && params.size() < MAX_PARAMS) {
            Term.Lambda lam = (Term.Lambda) t;
            params.add(lam.param);
            t = lam.body;
        }
        return new EntryPoint(params, t, scriptParameters, outerBindings);
    }
}
