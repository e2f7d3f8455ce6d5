package com.uplc.decompiler.term;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Traversal helpers over {@link Term} trees.
 *
 * All walks use an explicit stack so that machine-generated terms nested thousands of
 * levels deep do not exhaust the thread stack.
 */
public final class Terms {

    private Terms() {}

    /** An application spine: {@code [head a0 a1 ...]}, with forces on the spine removed. */
    public static final class Spine {
        public final Term head;
        public final List<Term> args;

        Spine(Term head, List<Term> args) {
            this.head = head;
            this.args = Collections.unmodifiableList(args);
        }

        /** Builtin name at the head, or null. */
        public String builtin() {
            return head.tag == Term.Tag.BUILTIN ? ((Term.Builtin) head).name : null;
        }

        public boolean isBuiltin(String name) {
            return name.equals(builtin());
        }

        public Term arg(int i) {
            return i < args.size() ? args.get(i) : null;
        }
    }

    public static Spine flattenApp(Term term) {
        List<Term> reversed = new ArrayList<>();
        Term t = term;
        while (true) {
            if (t.tag == Term.Tag.APPLY) {
                Term.Apply app = (Term.Apply) t;
                reversed.add(app.arg);
                t = app.func;
            } else if (t.tag == Term.Tag.FORCE) {
                t = ((Term.Force) t).term;
            } else {
                break;
            }
        }
        Collections.reverse(reversed);
        return new Spine(t, reversed);
    }

    /** Name of the builtin at the head of a (possibly forced, possibly partial) application. */
    public static String builtinName(Term term) {
        Term t = term;
        while (true) {
            switch (t.tag) {
                case BUILTIN: return ((Term.Builtin) t).name;
                case FORCE: t = ((Term.Force) t).term; break;
                case APPLY: t = ((Term.Apply) t).func; break;
                default: return null;
            }
        }
    }

    /** True when {@code term} applies builtin {@code name} to at least one argument. */
    public static boolean isBuiltinApp(Term term, String name) {
        Term t = stripForce(term);
        return t.tag == Term.Tag.APPLY && name.equals(builtinName(t));
    }

    public static Term stripForce(Term term) {
        Term t = term;
        while (t.tag == Term.Tag.FORCE) t = ((Term.Force) t).term;
        return t;
    }

    /** Removes any mix of force/delay wrappers. */
    public static Term stripForceDelay(Term term) {
        Term t = term;
        while (true) {
            if (t.tag == Term.Tag.FORCE) t = ((Term.Force) t).term;
            else if (t.tag == Term.Tag.DELAY) t = ((Term.Delay) t).term;
            else return t;
        }
    }

    public static boolean isVar(Term term, String name) {
        Term t = stripForceDelay(term);
        return t.tag == Term.Tag.VAR && ((Term.Var) t).name.equals(name);
    }

    /** Integer literal value, or null. */
    public static BigInteger extractIntConstant(Term term) {
        Term t = stripForceDelay(term);
        if (t.tag == Term.Tag.CON) {
            Constant c = ((Term.Con) t).value;
            if (c.kind() == ConstType.Kind.INTEGER) return c.asInteger();
        }
        return null;
    }

    /** Pre-order list of every node satisfying {@code predicate}. */
    public static List<Term> findAll(Term root, Predicate<Term> predicate) {
        List<Term> out = new ArrayList<>();
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            if (predicate.test(t)) out.add(t);
            pushChildren(stack, t);
        }
        return out;
    }

    public static Term findFirst(Term root, Predicate<Term> predicate) {
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            if (predicate.test(t)) return t;
            pushChildren(stack, t);
        }
        return null;
    }

    /** Free occurrence test: a lambda rebinding {@code name} hides its body. */
    public static boolean referencesVar(Term root, String name) {
        return countVarRefs(root, name, true) > 0;
    }

    public static int countVarRefs(Term root, String name) {
        return countVarRefs(root, name, false);
    }

    private static int countVarRefs(Term root, String name, boolean stopAtFirst) {
        int count = 0;
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            if (t.tag == Term.Tag.VAR) {
                if (((Term.Var) t).name.equals(name)) {
                    count++;
                    if (stopAtFirst) return count;
                }
            } else if (t.tag == Term.Tag.LAMBDA) {
                Term.Lambda lam = (Term.Lambda) t;
                if (!lam.param.equals(name)) stack.push(lam.body);
            } else {
                pushChildren(stack, t);
            }
        }
        return count;
    }

    /** Child-to-parent links for every node under {@code root}, keyed by identity. */
    public static Map<Term, Term> parentMap(Term root) {
        Map<Term, Term> parents = new IdentityHashMap<>();
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            for (Term child : t.children()) {
                parents.put(child, t);
                stack.push(child);
            }
        }
        return parents;
    }

    public static int size(Term root) {
        int n = 0;
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Term t = stack.pop();
            n++;
            pushChildren(stack, t);
        }
        return n;
    }

    /** Structural equality (names compared literally, constants by value). */
    public static boolean structurallyEqual(Term a, Term b) {
        Deque<Term[]> stack = new ArrayDeque<>();
        stack.push(new Term[] { a, b });
        while (!stack.isEmpty()) {
            Term[] pair = stack.pop();
            Term x = pair[0];
            Term y = pair[1];
            if (x.tag != y.tag) return false;
            switch (x.tag) {
                case VAR:
                    if (!((Term.Var) x).name.equals(((Term.Var) y).name)) return false;
                    break;
                case LAMBDA:
                    if (!((Term.Lambda) x).param.equals(((Term.Lambda) y).param)) return false;
                    break;
                case CON:
                    if (!((Term.Con) x).value.equals(((Term.Con) y).value)) return false;
                    break;
                case BUILTIN:
                    if (!((Term.Builtin) x).name.equals(((Term.Builtin) y).name)) return false;
                    break;
                case CONSTR:
                    if (((Term.Constr) x).index != ((Term.Constr) y).index) return false;
                    break;
                default:
                    break;
            }
            List<Term> xs = x.children();
            List<Term> ys = y.children();
            if (xs.size() != ys.size()) return false;
            for (int i = 0; i < xs.size(); i++) {
                stack.push(new Term[] { xs.get(i), ys.get(i) });
            }
        }
        return true;
    }

    private static void pushChildren(Deque<Term> stack, Term t) {
        List<Term> children = t.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
