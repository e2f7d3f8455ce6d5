package com.uplc.decompiler.term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Prints terms in canonical UPLC text syntax, readable back by the parser.
 */
public final class TermPrinter {

    private TermPrinter() {}

    public static String showText(Term term) {
        StringBuilder sb = new StringBuilder();
        // Items are either a Term still to print or a String fragment.
        Deque<Object> work = new ArrayDeque<>();
        work.push(term);
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof String) {
                sb.append((String) item);
                continue;
            }
            Term t = (Term) item;
            switch (t.tag) {
                case VAR:
                    sb.append("(var ").append(((Term.Var) t).name).append(')');
                    break;
                case LAMBDA: {
                    Term.Lambda lam = (Term.Lambda) t;
                    sb.append("(lam ").append(lam.param).append(' ');
                    work.push(")");
                    work.push(lam.body);
                    break;
                }
                case APPLY: {
                    Term.Apply app = (Term.Apply) t;
                    sb.append('[');
                    work.push("]");
                    work.push(app.arg);
                    work.push(" ");
                    work.push(app.func);
                    break;
                }
                case CON: {
                    Constant c = ((Term.Con) t).value;
                    sb.append("(con ").append(c.type).append(' ').append(c.valueText()).append(')');
                    break;
                }
                case BUILTIN:
                    sb.append("(builtin ").append(((Term.Builtin) t).name).append(')');
                    break;
                case FORCE:
                    sb.append("(force ");
                    work.push(")");
                    work.push(((Term.Force) t).term);
                    break;
                case DELAY:
                    sb.append("(delay ");
                    work.push(")");
                    work.push(((Term.Delay) t).term);
                    break;
                case ERROR:
                    sb.append("(error)");
                    break;
                case CASE: {
                    Term.Case cs = (Term.Case) t;
                    sb.append("(case ");
                    work.push(")");
                    pushSeparated(work, cs.branches);
                    work.push(cs.scrutinee);
                    break;
                }
                case CONSTR: {
                    Term.Constr cr = (Term.Constr) t;
                    sb.append("(constr ").append(cr.index);
                    work.push(")");
                    pushSeparated(work, cr.args);
                    break;
                }
            }
        }
        return sb.toString();
    }

    /** Pushes " t0 t1 ..." so that it pops in order. */
    private static void pushSeparated(Deque<Object> work, List<Term> terms) {
        for (int i = terms.size() - 1; i >= 0; i--) {
            work.push(terms.get(i));
            work.push(" ");
        }
    }
}
