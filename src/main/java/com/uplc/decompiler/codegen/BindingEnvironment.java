package com.uplc.decompiler.codegen;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.uplc.debug.Debug;
import com.uplc.decompiler.ir.IRConverter;
import com.uplc.decompiler.ir.IRExpression;
import com.uplc.decompiler.ir.IROptimizer;
import com.uplc.decompiler.ir.IRType;
import com.uplc.decompiler.patterns.FieldExtractor;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Resolves every let-bound name of a program, i.e. each {@code [(lam name body) value]}, to a
 * {@link Binding}.
 *
 * Constants, alias chains ending in a constant, and single-use builtin calls over inline
 * operands are inlined. Alias chains are followed to any depth; a chain that runs into itself
 * is kept. Lambda values are kept as {@code let}s and, when they match a known helper shape,
 * get a descriptive display name.
 */
public final class BindingEnvironment {

    private static final String TAG = "Bindings";

    private static final Map<String, String> WRAPPER_NAMES = new HashMap<>();
    private static final Map<String, String> PARTIAL_PREFIXES = new HashMap<>();

    static {
        WRAPPER_NAMES.put("unIData", "to_int");
        WRAPPER_NAMES.put("unBData", "to_bytes");
        WRAPPER_NAMES.put("unListData", "to_list");
        WRAPPER_NAMES.put("unMapData", "to_map");
        WRAPPER_NAMES.put("unConstrData", "to_constr");
        WRAPPER_NAMES.put("iData", "from_int");
        WRAPPER_NAMES.put("bData", "from_bytes");
        WRAPPER_NAMES.put("listData", "from_list");
        WRAPPER_NAMES.put("fstPair", "first");
        WRAPPER_NAMES.put("sndPair", "second");
        WRAPPER_NAMES.put("headList", "head");
        WRAPPER_NAMES.put("tailList", "tail");
        WRAPPER_NAMES.put("nullList", "is_empty");

        PARTIAL_PREFIXES.put("equalsInteger", "eq");
        PARTIAL_PREFIXES.put("lessThanInteger", "lt");
        PARTIAL_PREFIXES.put("lessThanEqualsInteger", "lte");
        PARTIAL_PREFIXES.put("addInteger", "add");
        PARTIAL_PREFIXES.put("subtractInteger", "sub");
        PARTIAL_PREFIXES.put("multiplyInteger", "mul");
        PARTIAL_PREFIXES.put("equalsByteString", "eq_bytes");
        PARTIAL_PREFIXES.put("appendByteString", "concat");
    }

    private final Map<String, Binding> bindings;
    private final Map<String, String> displayNames;

    private BindingEnvironment(Map<String, Binding> bindings, Map<String, String> displayNames) {
        this.bindings = bindings;
        this.displayNames = displayNames;
    }

    public static BindingEnvironment build(Term root) {
        return build(root, Set.of());
    }

    /**
     * @param pinned names that must stay named, e.g. script parameters emitted as constants
     */
    public static BindingEnvironment build(Term root, Collection<String> pinned) {
        Resolver r = new Resolver(Set.copyOf(pinned));
        r.scan(root);
        for (String name : r.values.keySet()) r.resolve(name);

        Map<String, Binding> ordered = new LinkedHashMap<>();
        for (String name : r.values.keySet()) ordered.put(name, r.resolved.get(name));

        BindingEnvironment env = new BindingEnvironment(ordered, displayNames(ordered));
        ExpressionWriter writer = new ExpressionWriter(env, GeneratorOptions.defaults());
        int inlined = 0;
        for (Map.Entry<String, Binding> e : ordered.entrySet()) {
            Binding b = e.getValue();
            if (b.isInlinable() && b.substitution != null) {
                e.setValue(b.withInlineText(writer.write(b.substitution)));
                inlined++;
            }
        }
        Debug.get().d(TAG, ordered.size() + " binding(s), " + inlined + " inlined");
        return env;
    }

    public Binding get(String name) {
        return bindings.get(name);
    }

    /** Every binding, in the order the names first appear. */
    public Collection<Binding> all() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    public boolean isInlinable(String name) {
        Binding b = bindings.get(name);
        return b != null && b.isInlinable();
    }

    /** Name to print for a kept binding; the helper name when it is unique. */
    public String displayName(String name) {
        String d = displayNames.get(name);
        return d != null ? d : name;
    }

    /** Term that replaces references to {@code name}, or null when the name stays. */
    public Term inlineTerm(String name) {
        Binding b = bindings.get(name);
        return b != null && b.isInlinable() ? b.substitution : null;
    }

    private static Map<String, String> displayNames(Map<String, Binding> bindings) {
        Map<String, Integer> counts = new HashMap<>();
        for (Binding b : bindings.values()) {
            if (b.semanticName != null && !b.isInlinable()) counts.merge(b.semanticName, 1, Integer::sum);
        }
        Map<String, String> out = new HashMap<>();
        for (Binding b : bindings.values()) {
            if (b.semanticName == null || b.isInlinable()) continue;
            if (counts.get(b.semanticName) == 1 && !bindings.containsKey(b.semanticName)) {
                out.put(b.name, b.semanticName);
            }
        }
        return out;
    }

    // -------------------------
    // Resolution
    // -------------------------

    private static final class Resolver {
        final Set<String> pinned;
        final Map<String, List<Term>> values = new LinkedHashMap<>();
        final Map<String, Term> scopes = new HashMap<>();
        final Set<String> plainParams = new HashSet<>();
        final Map<String, Binding> resolved = new HashMap<>();
        final Map<String, Constant> folded = new HashMap<>();

        Resolver(Set<String> pinned) {
            this.pinned = pinned;
        }

        void scan(Term root) {
            Set<Term> letLambdas = Collections.newSetFromMap(new IdentityHashMap<>());
            Deque<Term> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                Term t = stack.pop();
                if (t.tag == Term.Tag.APPLY) {
                    Term.Apply app = (Term.Apply) t;
                    if (app.func.tag == Term.Tag.LAMBDA) {
                        Term.Lambda lam = (Term.Lambda) app.func;
                        letLambdas.add(lam);
                        values.computeIfAbsent(lam.param, k -> new ArrayList<>()).add(app.arg);
                        scopes.put(lam.param, lam.body);
                    }
                } else if (t.tag == Term.Tag.LAMBDA && !letLambdas.contains(t)) {
                    plainParams.add(((Term.Lambda) t).param);
                }
                List<Term> children = t.children();
                for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
            }
        }

        /** Bound exactly once (up to structural equality) and free to be rewritten. */
        boolean resolvable(String name) {
            List<Term> vs = values.get(name);
            if (vs == null || plainParams.contains(name) || pinned.contains(name)) return false;
            for (int i = 1; i < vs.size(); i++) {
                if (!Terms.structurallyEqual(vs.get(0), vs.get(i))) return false;
            }
            return true;
        }

        void resolve(String name) {
            if (resolved.containsKey(name)) return;

            List<String> chain = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            String current = name;
            while (resolvable(current) && !resolved.containsKey(current)) {
                Term v = values.get(current).get(0);
                if (v.tag != Term.Tag.VAR) break;
                chain.add(current);
                seen.add(current);
                String next = ((Term.Var) v).name;
                if (seen.contains(next)) {
                    Debug.get().d(TAG, "alias cycle through " + chain);
                    for (String n : chain) resolved.put(n, Binding.keep(n, values.get(n).get(0), Binding.Pattern.UNKNOWN, null));
                    return;
                }
                current = next;
            }

            String terminal = current;
            Binding tb = resolved.get(terminal);
            if (tb == null && values.containsKey(terminal)) {
                tb = resolvable(terminal)
                        ? compute(terminal)
                        : Binding.keep(terminal, values.get(terminal).get(0), Binding.Pattern.UNKNOWN, null);
                resolved.put(terminal, tb);
            }

            for (int i = chain.size() - 1; i >= 0; i--) {
                String n = chain.get(i);
                Binding alias;
                if (tb != null && tb.isInlinable()) {
                    String target = tb.category == Binding.Category.ALIAS ? tb.target : terminal;
                    alias = Binding.alias(n, values.get(n).get(0), target, tb.substitution, tb.foldedValue);
                    if (folded.containsKey(terminal)) folded.put(n, folded.get(terminal));
                } else {
                    alias = Binding.alias(n, values.get(n).get(0), terminal, Term.var(terminal), null);
                }
                resolved.put(n, alias);
            }
        }

        private Binding compute(String name) {
            Term value = values.get(name).get(0);
            switch (value.tag) {
                case CON: {
                    Constant c = ((Term.Con) value).value;
                    if (c.kind() == ConstType.Kind.INTEGER || c.kind() == ConstType.Kind.BOOL) folded.put(name, c);
                    return Binding.inline(name, value, Binding.Pattern.CONSTANT, null, value, null);
                }
                case BUILTIN:
                    return Binding.inline(name, value, Binding.Pattern.BUILTIN_WRAPPER, null, value, null);
                case APPLY:
                case FORCE:
                    return computeApplication(name, value);
                case LAMBDA:
                    return computeLambda(name, (Term.Lambda) value);
                default:
                    return Binding.keep(name, value, Binding.Pattern.UNKNOWN, null);
            }
        }

        private Binding computeApplication(String name, Term value) {
            Terms.Spine spine = Terms.flattenApp(value);
            String builtin = spine.builtin();
            if (builtin == null || spine.args.isEmpty()) return Binding.keep(name, value, Binding.Pattern.EXPRESSION, null);

            boolean closed = true;
            for (Term a : spine.args) closed &= isClosed(a);
            int arity = BuiltinMap.arity(builtin);

            if (closed && arity > spine.args.size()) {
                return Binding.inline(name, value, Binding.Pattern.PARTIAL_BUILTIN, partialName(builtin, spine.args), value, null);
            }
            if (closed && arity == spine.args.size() && Terms.countVarRefs(scopes.get(name), name) <= 1) {
                Constant c = fold(builtin, spine.args);
                if (c != null) folded.put(name, c);
                return Binding.inline(name, value, Binding.Pattern.EXPRESSION, null, value, c == null ? null : c.valueText());
            }
            return Binding.keep(name, value, Binding.Pattern.EXPRESSION, null);
        }

        private boolean isClosed(Term arg) {
            switch (arg.tag) {
                case CON:
                case BUILTIN:
                    return true;
                case VAR: {
                    Binding b = resolved.get(((Term.Var) arg).name);
                    return b != null && b.isInlinable() && b.substitution.tag != Term.Tag.VAR;
                }
                default:
                    return false;
            }
        }

        private Binding computeLambda(String name, Term.Lambda lam) {
            Term body = Terms.stripForceDelay(lam.body);
            String x = lam.param;

            if (Terms.isVar(body, x)) {
                return Binding.inline(name, lam, Binding.Pattern.IDENTITY, "identity", lam, null);
            }
            if (body.tag == Term.Tag.LAMBDA) {
                Term.Lambda inner = (Term.Lambda) body;
                Terms.Spine s = Terms.flattenApp(Terms.stripForceDelay(inner.body));
                if (s.args.size() == 1 && Terms.isVar(s.head, x) && Terms.isVar(s.args.get(0), inner.param)) {
                    return Binding.inline(name, lam, Binding.Pattern.APPLY, "apply", lam, null);
                }
                Binding.Pattern logic = booleanShape(x, inner);
                if (logic != null) {
                    return Binding.keep(name, lam, logic, logic == Binding.Pattern.BOOLEAN_AND ? "and_also" : "or_else");
                }
            }
            if (hasSelfApplication(lam.body)) {
                return Binding.keep(name, lam, Binding.Pattern.Z_COMBINATOR, "fix");
            }

            int field = FieldExtractor.fieldIndex(body, x);
            if (field >= 0) return Binding.keep(name, lam, Binding.Pattern.FIELD_ACCESSOR, "get_field_" + field);

            Terms.Spine s = Terms.flattenApp(body);
            if (s.isBuiltin("equalsInteger") && s.args.size() == 2) {
                for (int i = 0; i < 2; i++) {
                    BigInteger n = Terms.extractIntConstant(s.args.get(i));
                    if (n != null && isConstrIndexOf(s.args.get(1 - i), x)) {
                        return Binding.keep(name, lam, Binding.Pattern.IS_CONSTR, "is_constr_" + n);
                    }
                }
            }
            if (s.builtin() != null && s.args.size() == 1 && Terms.isVar(s.args.get(0), x)) {
                String wrapper = WRAPPER_NAMES.get(s.builtin());
                return Binding.keep(name, lam, Binding.Pattern.BUILTIN_WRAPPER,
                        wrapper != null ? wrapper : BuiltinMap.snakeCase(s.builtin()));
            }
            return Binding.keep(name, lam, Binding.Pattern.UNKNOWN, null);
        }

        /** {@code lam a (lam b (ifThenElse a b False))} and {@code (ifThenElse a True b)}. */
        private static Binding.Pattern booleanShape(String a, Term.Lambda inner) {
            Terms.Spine s = Terms.flattenApp(Terms.stripForceDelay(inner.body));
            if (!s.isBuiltin("ifThenElse") || s.args.size() != 3 || !Terms.isVar(s.args.get(0), a)) return null;
            String b = inner.param;
            Boolean thenConst = boolConstant(s.args.get(1));
            Boolean elseConst = boolConstant(s.args.get(2));
            if (Terms.isVar(s.args.get(1), b) && Boolean.FALSE.equals(elseConst)) return Binding.Pattern.BOOLEAN_AND;
            if (Boolean.TRUE.equals(thenConst) && Terms.isVar(s.args.get(2), b)) return Binding.Pattern.BOOLEAN_OR;
            return null;
        }

        private static Boolean boolConstant(Term t) {
            Term s = Terms.stripForceDelay(t);
            if (s.tag != Term.Tag.CON) return null;
            Constant c = ((Term.Con) s).value;
            return c.kind() == ConstType.Kind.BOOL ? c.asBool() : null;
        }

        /** {@code fstPair(unConstrData(x))}. */
        private static boolean isConstrIndexOf(Term t, String x) {
            Terms.Spine fst = Terms.flattenApp(t);
            if (!fst.isBuiltin("fstPair") || fst.args.size() != 1) return false;
            Terms.Spine un = Terms.flattenApp(fst.args.get(0));
            return un.isBuiltin("unConstrData") && un.args.size() == 1 && Terms.isVar(un.args.get(0), x);
        }

        /** Some variable applied to itself, the mark of a fixpoint combinator. */
        private static boolean hasSelfApplication(Term body) {
            return Terms.findFirst(body, t -> {
                if (t.tag != Term.Tag.APPLY) return false;
                Term.Apply app = (Term.Apply) t;
                Term f = Terms.stripForceDelay(app.func);
                Term a = Terms.stripForceDelay(app.arg);
                return f.tag == Term.Tag.VAR && a.tag == Term.Tag.VAR
                        && ((Term.Var) f).name.equals(((Term.Var) a).name);
            }) != null;
        }

        private String partialName(String builtin, List<Term> args) {
            String prefix = PARTIAL_PREFIXES.get(builtin);
            if (prefix == null) prefix = BuiltinMap.snakeCase(builtin);
            if (args.size() == 1) {
                Constant c = constantOf(args.get(0));
                if (c != null && c.kind() == ConstType.Kind.INTEGER) {
                    BigInteger n = c.asInteger();
                    return prefix + "_" + (n.signum() < 0 ? "neg" + n.negate() : n.toString());
                }
            }
            return prefix;
        }

        private Constant constantOf(Term arg) {
            if (arg.tag == Term.Tag.CON) return ((Term.Con) arg).value;
            if (arg.tag == Term.Tag.VAR) return folded.get(((Term.Var) arg).name);
            return null;
        }

        /** Value of a binary builtin over known integer or boolean operands, or null. */
        private Constant fold(String builtin, List<Term> args) {
            IRExpression.BinaryOp op = IRConverter.binaryOp(builtin);
            if (op == null || args.size() != 2) return null;
            IRExpression.Literal left = literal(constantOf(args.get(0)));
            IRExpression.Literal right = literal(constantOf(args.get(1)));
            if (left == null || right == null) return null;
            IRExpression result = IROptimizer.fold(IRExpression.binary(op, left, right));
            if (result.kind != IRExpression.Kind.LITERAL) return null;
            Object v = ((IRExpression.Literal) result).value;
            if (v instanceof BigInteger) return Constant.integer((BigInteger) v);
            if (v instanceof Boolean) return Constant.bool((Boolean) v);
            return null;
        }

        private static IRExpression.Literal literal(Constant c) {
            if (c == null) return null;
            if (c.kind() == ConstType.Kind.INTEGER) return IRExpression.literal(c.asInteger(), IRType.INT);
            if (c.kind() == ConstType.Kind.BOOL) return IRExpression.bool(c.asBool());
            return null;
        }
    }
}
