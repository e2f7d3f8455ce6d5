package com.uplc.decompiler.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

import com.uplc.decompiler.patterns.FieldExtractor;
import com.uplc.decompiler.patterns.TxFields;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Hex;
import com.uplc.decompiler.term.PlutusData;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Renders a term as a single-line surface expression.
 *
 * Inline bindings are substituted, helper applications are simplified, field reads of the
 * datum, redeemer and transaction come out by name, and builtins go through {@link BuiltinMap}.
 * Modules the text needs are collected in {@link #imports()}.
 *
 * The walk is post-order over an explicit work stack: arbitrarily deep terms render without
 * recursion.
 */
public final class ExpressionWriter {

    private static final Set<String> CONVERSIONS = Set.of("unIData", "unBData", "unListData", "unMapData");

    /** Field reads of one variable, rendered through a name table. */
    private static final class FieldScope {
        final String var;
        /** Rendered without the owner, as inside a destructured variant. */
        final boolean bare;
        /** Null for the transaction, whose field names are fixed. */
        final Map<Integer, String> names;

        FieldScope(String var, boolean bare, Map<Integer, String> names) {
            this.var = var;
            this.bare = bare;
            this.names = names;
        }
    }

    /** Pops {@code arity} rendered children and pushes their combination. */
    private static final class Combine {
        final int arity;
        final Function<List<String>, String> fn;

        Combine(int arity, Function<List<String>, String> fn) {
            this.arity = arity;
            this.fn = fn;
        }
    }

    private final BindingEnvironment env;
    private final GeneratorOptions options;
    private final Map<String, String> renames;
    private final List<FieldScope> scopes;
    private final Set<String> imports;

    public ExpressionWriter(BindingEnvironment env, GeneratorOptions options) {
        this(env, options, new HashMap<>(), new ArrayList<>(), new TreeSet<>());
    }

    private ExpressionWriter(BindingEnvironment env, GeneratorOptions options, Map<String, String> renames,
                             List<FieldScope> scopes, Set<String> imports) {
        this.env = env;
        this.options = options;
        this.renames = renames;
        this.scopes = scopes;
        this.imports = imports;
    }

    /** Copy that prints {@code var} as {@code display}. Imports stay shared. */
    public ExpressionWriter withRename(String var, String display) {
        Map<String, String> r = new HashMap<>(renames);
        r.put(var, display);
        return new ExpressionWriter(env, options, r, scopes, imports);
    }

    /** Copy that prints field reads of {@code var} as {@code owner.name}, or bare names. */
    public ExpressionWriter withFields(String var, boolean bare, Map<Integer, String> names) {
        List<FieldScope> s = new ArrayList<>(scopes);
        s.add(0, new FieldScope(var, bare, Map.copyOf(names)));
        return new ExpressionWriter(env, options, renames, s, imports);
    }

    /** Copy that prints field reads of {@code var} with the transaction field names. */
    public ExpressionWriter withTransaction(String var) {
        List<FieldScope> s = new ArrayList<>(scopes);
        s.add(new FieldScope(var, false, null));
        return new ExpressionWriter(env, options, renames, s, imports);
    }

    /** Modules referenced by everything written so far, sorted. */
    public Set<String> imports() {
        return Collections.unmodifiableSet(imports);
    }

    public String name(String var) {
        String r = renames.get(var);
        return r != null ? r : env.displayName(var);
    }

    public String write(Term root) {
        Deque<Object> work = new ArrayDeque<>();
        Deque<String> results = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof Combine) {
                Combine c = (Combine) item;
                String[] parts = new String[c.arity];
                for (int i = c.arity - 1; i >= 0; i--) parts[i] = results.pop();
                results.push(c.fn.apply(List.of(parts)));
            } else {
                visit((Term) item, work, results);
            }
        }
        return results.pop();
    }

    private void visit(Term t, Deque<Object> work, Deque<String> results) {
        switch (t.tag) {
            case VAR: {
                String n = ((Term.Var) t).name;
                Term sub = env.inlineTerm(n);
                if (sub != null && !(sub.tag == Term.Tag.VAR && ((Term.Var) sub).name.equals(n))) {
                    work.push(sub);
                } else {
                    results.push(name(n));
                }
                return;
            }
            case CON:
                results.push(constantText(((Term.Con) t).value));
                return;
            case BUILTIN: {
                String b = ((Term.Builtin) t).name;
                BuiltinMap.Mapping m = BuiltinMap.get(b);
                if (m == null) {
                    results.push(b);
                } else {
                    if (m.module != null) imports.add(m.module);
                    results.push(m.functionName());
                }
                return;
            }
            case FORCE:
                work.push(((Term.Force) t).term);
                return;
            case DELAY:
                work.push(((Term.Delay) t).term);
                return;
            case ERROR:
                results.push("fail");
                return;
            case LAMBDA: {
                List<String> params = new ArrayList<>();
                Term body = t;
                while (body.tag == Term.Tag.LAMBDA && params.size() < options.maxLambdaParams()) {
                    params.add(name(((Term.Lambda) body).param));
                    body = ((Term.Lambda) body).body;
                }
                String head = "fn(" + String.join(", ", params) + ") { ";
                schedule(work, List.of(body), r -> head + r.get(0) + " }");
                return;
            }
            case CASE: {
                Term.Case c = (Term.Case) t;
                List<Term> children = new ArrayList<>();
                children.add(c.scrutinee);
                children.addAll(c.branches);
                schedule(work, children, r -> {
                    StringBuilder sb = new StringBuilder("when ").append(r.get(0)).append(" is { ");
                    for (int i = 1; i < r.size(); i++) {
                        if (i > 1) sb.append(", ");
                        sb.append(i - 1).append(" -> ").append(r.get(i));
                    }
                    return sb.append(" }").toString();
                });
                return;
            }
            case CONSTR: {
                Term.Constr c = (Term.Constr) t;
                String head = "Constr(" + c.index;
                schedule(work, c.args, r -> r.isEmpty() ? head + ")" : head + ", " + String.join(", ", r) + ")");
                return;
            }
            case APPLY:
                visitApply((Term.Apply) t, work, results);
                return;
            default:
                throw new IllegalStateException("unhandled term " + t.tag);
        }
    }

    private void visitApply(Term.Apply app, Deque<Object> work, Deque<String> results) {
        if (app.func.tag == Term.Tag.LAMBDA) {
            Term.Lambda lam = (Term.Lambda) app.func;
            if (env.isInlinable(lam.param)) {
                work.push(lam.body);
            } else {
                String x = name(lam.param);
                schedule(work, List.of(lam.body, app.arg), r -> "(fn(" + x + ") { " + r.get(0) + " })(" + r.get(1) + ")");
            }
            return;
        }

        String field = fieldRead(app);
        if (field != null) {
            results.push(field);
            return;
        }

        Terms.Spine spine = Terms.flattenApp(app);
        List<Term> args = spine.args;
        Term head = Terms.stripForceDelay(spine.head);

        if (head.tag == Term.Tag.VAR) {
            Binding b = env.get(((Term.Var) head).name);
            if (b != null && b.pattern == Binding.Pattern.IDENTITY && b.isInlinable()) {
                work.push(reapply(args.get(0), args.subList(1, args.size())));
                return;
            }
            if (b != null && b.pattern == Binding.Pattern.APPLY && b.isInlinable() && args.size() >= 2) {
                List<Term> rest = new ArrayList<>(args.subList(1, args.size()));
                work.push(reapply(args.get(0), rest));
                return;
            }
        }

        String builtin = spine.builtin();
        if (builtin == null) {
            List<Term> children = new ArrayList<>();
            children.add(spine.head);
            children.addAll(args);
            boolean wrap = head.tag == Term.Tag.LAMBDA;
            schedule(work, children, r -> {
                String f = wrap ? "(" + r.get(0) + ")" : r.get(0);
                return f + "(" + String.join(", ", r.subList(1, r.size())) + ")";
            });
            return;
        }

        if (builtin.equals("ifThenElse") && args.size() == 3) {
            Boolean thenConst = boolConstant(args.get(1));
            Boolean elseConst = boolConstant(args.get(2));
            if (Boolean.TRUE.equals(thenConst) && Boolean.FALSE.equals(elseConst)) {
                work.push(args.get(0));
                return;
            }
            if (Boolean.FALSE.equals(thenConst) && Boolean.TRUE.equals(elseConst)) {
                schedule(work, List.of(args.get(0)), r -> negate(r.get(0)));
                return;
            }
        }
        if (options.useFieldNames() && CONVERSIONS.contains(builtin) && args.size() == 1) {
            String inner = fieldRead(args.get(0));
            if (inner != null) {
                results.push(inner);
                return;
            }
        }
        if (builtin.equals("headList") && args.size() == 1) {
            int depth = FieldExtractor.tailDepth(args.get(0));
            if (depth >= 2) {
                imports.add(BuiltinMap.LIST_MODULE);
                schedule(work, List.of(FieldExtractor.stripTails(args.get(0))), r -> "list.at(" + r.get(0) + ", " + depth + ")");
                return;
            }
        }

        BuiltinMap.Mapping m = BuiltinMap.get(builtin);
        int n = args.size();
        if (m == null) {
            schedule(work, args, r -> builtin + "(" + String.join(", ", r) + ")");
            return;
        }
        if (m.module != null) imports.add(m.module);
        if (n < m.arity) {
            schedule(work, args, r -> m.functionName() + "(" + String.join(", ", r) + ")");
        } else if (n == m.arity) {
            schedule(work, args, m::render);
        } else {
            schedule(work, args, r -> "(" + m.render(r.subList(0, m.arity)) + ")("
                    + String.join(", ", r.subList(m.arity, r.size())) + ")");
        }
    }

    private static void schedule(Deque<Object> work, List<Term> children, Function<List<String>, String> fn) {
        work.push(new Combine(children.size(), fn));
        for (int i = children.size() - 1; i >= 0; i--) work.push(children.get(i));
    }

    private static Term reapply(Term head, List<Term> args) {
        Term t = head;
        for (Term a : args) t = Term.apply(t, a);
        return t;
    }

    /** Named field access for a canonical field read of a tracked variable, or null. */
    private String fieldRead(Term t) {
        if (!options.useFieldNames() || scopes.isEmpty()) return null;
        for (FieldScope scope : scopes) {
            int k = FieldExtractor.fieldIndex(t, scope.var);
            if (k < 0) continue;
            if (scope.names == null) return name(scope.var) + "." + TxFields.name(k);
            String field = scope.names.get(k);
            if (field == null) field = "field_" + k;
            return scope.bare ? field : name(scope.var) + "." + field;
        }
        return null;
    }

    static String negate(String text) {
        return BuiltinMap.isAtomic(text) ? "!" + text : "!(" + text + ")";
    }

    private static Boolean boolConstant(Term t) {
        Term s = Terms.stripForceDelay(t);
        if (s.tag != Term.Tag.CON) return null;
        Constant c = ((Term.Con) s).value;
        return c.kind() == ConstType.Kind.BOOL ? c.asBool() : null;
    }

    // -------------------------
    // Constants
    // -------------------------

    public static String constantText(Constant c) {
        switch (c.kind()) {
            case INTEGER: return c.asInteger().toString();
            case BYTESTRING: return "#\"" + Hex.encode(c.asBytes()) + "\"";
            case STRING: return "@" + Constant.quote(c.asString());
            case BOOL: return c.asBool() ? "True" : "False";
            case UNIT: return "Void";
            case DATA: return dataText(c.asData());
            case LIST: {
                List<String> items = new ArrayList<>();
                for (Constant item : c.asList()) items.add(constantText(item));
                return "[" + String.join(", ", items) + "]";
            }
            case PAIR: return "Pair(" + constantText(c.first()) + ", " + constantText(c.second()) + ")";
            case BLS12_381_G1_ELEMENT: return "#<Bls12_381, G1>\"" + Hex.encode(c.asBytes()) + "\"";
            case BLS12_381_G2_ELEMENT: return "#<Bls12_381, G2>\"" + Hex.encode(c.asBytes()) + "\"";
            default: return "#\"" + Hex.encode(c.asBytes()) + "\"";
        }
    }

    static String dataText(PlutusData d) {
        switch (d.type) {
            case INT: return d.asInteger().toString();
            case BYTES: return "#\"" + Hex.encode(d.asBytes()) + "\"";
            case LIST: {
                List<String> items = new ArrayList<>();
                for (PlutusData item : d.items()) items.add(dataText(item));
                return "[" + String.join(", ", items) + "]";
            }
            case MAP: {
                List<String> entries = new ArrayList<>();
                for (Map.Entry<PlutusData, PlutusData> e : d.entries()) {
                    entries.add("Pair(" + dataText(e.getKey()) + ", " + dataText(e.getValue()) + ")");
                }
                return "[" + String.join(", ", entries) + "]";
            }
            case CONSTR: {
                StringBuilder sb = new StringBuilder("Constr(").append(d.constrIndex());
                for (PlutusData f : d.items()) sb.append(", ").append(dataText(f));
                return sb.append(')').toString();
            }
            default: throw new IllegalStateException("unhandled data " + d.type);
        }
    }
}
