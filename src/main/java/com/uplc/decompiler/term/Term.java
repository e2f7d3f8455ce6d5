package com.uplc.decompiler.term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * UPLC term tree. Nodes are immutable; analyses that need per-node state key it by identity.
 */
public abstract class Term {

    public enum Tag { VAR, LAMBDA, APPLY, CON, BUILTIN, FORCE, DELAY, ERROR, CASE, CONSTR }

    public interface Visitor<R> {
        R visitVar(Var term);
        R visitLambda(Lambda term);
        R visitApply(Apply term);
        R visitCon(Con term);
        R visitBuiltin(Builtin term);
        R visitForce(Force term);
        R visitDelay(Delay term);
        R visitError(Error term);
        R visitCase(Case term);
        R visitConstr(Constr term);
    }

    public final Tag tag;

    private Term(Tag tag) {
        this.tag = tag;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /** Direct subterms in source order. */
    public abstract List<Term> children();

    @Override
    public String toString() {
        return TermPrinter.showText(this);
    }

    // -------------------------
    // Factories
    // -------------------------

    public static Var var(String name) { return new Var(name); }
    public static Lambda lam(String param, Term body) { return new Lambda(param, body); }
    public static Apply apply(Term func, Term arg) { return new Apply(func, arg); }
    public static Con con(Constant value) { return new Con(value); }
    public static Builtin builtin(String name) { return new Builtin(name); }
    public static Force force(Term term) { return new Force(term); }
    public static Delay delay(Term term) { return new Delay(term); }
    public static Error error() { return new Error(); }
    public static Case caseOf(Term scrutinee, List<Term> branches) { return new Case(scrutinee, branches); }
    public static Constr constr(long index, List<Term> args) { return new Constr(index, args); }

    /** Left-folds {@code [f a b c]} into {@code (((f a) b) c)}. */
    public static Term apply(Term func, Term... args) {
        Term result = func;
        for (Term a : args) result = new Apply(result, a);
        return result;
    }

    /** Saturated builtin application, e.g. {@code call("addInteger", x, y)}. */
    public static Term call(String builtin, Term... args) {
        return apply(new Builtin(builtin), args);
    }

    /** {@code let name = value in body}, i.e. an immediately applied lambda. */
    public static Apply let(String name, Term value, Term body) {
        return new Apply(new Lambda(name, body), value);
    }

    // -------------------------
    // Nodes
    // -------------------------

    public static final class Var extends Term {
        public final String name;

        public Var(String name) {
            super(Tag.VAR);
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitVar(this); }

        @Override
        public List<Term> children() { return List.of(); }
    }

    public static final class Lambda extends Term {
        public final String param;
        public final Term body;

        public Lambda(String param, Term body) {
            super(Tag.LAMBDA);
            this.param = Objects.requireNonNull(param, "param");
            this.body = Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitLambda(this); }

        @Override
        public List<Term> children() { return List.of(body); }
    }

    public static final class Apply extends Term {
        public final Term func;
        public final Term arg;

        public Apply(Term func, Term arg) {
            super(Tag.APPLY);
            this.func = Objects.requireNonNull(func, "func");
            this.arg = Objects.requireNonNull(arg, "arg");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitApply(this); }

        @Override
        public List<Term> children() { return List.of(func, arg); }
    }

    public static final class Con extends Term {
        public final Constant value;

        public Con(Constant value) {
            super(Tag.CON);
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCon(this); }

        @Override
        public List<Term> children() { return List.of(); }
    }

    public static final class Builtin extends Term {
        public final String name;

        public Builtin(String name) {
            super(Tag.BUILTIN);
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBuiltin(this); }

        @Override
        public List<Term> children() { return List.of(); }
    }

    public static final class Force extends Term {
        public final Term term;

        public Force(Term term) {
            super(Tag.FORCE);
            this.term = Objects.requireNonNull(term, "term");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitForce(this); }

        @Override
        public List<Term> children() { return List.of(term); }
    }

    public static final class Delay extends Term {
        public final Term term;

        public Delay(Term term) {
            super(Tag.DELAY);
            this.term = Objects.requireNonNull(term, "term");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDelay(this); }

        @Override
        public List<Term> children() { return List.of(term); }
    }

    public static final class Error extends Term {
        public Error() {
            super(Tag.ERROR);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitError(this); }

        @Override
        public List<Term> children() { return List.of(); }
    }

    public static final class Case extends Term {
        public final Term scrutinee;
        public final List<Term> branches;

        public Case(Term scrutinee, List<Term> branches) {
            super(Tag.CASE);
            this.scrutinee = Objects.requireNonNull(scrutinee, "scrutinee");
            this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCase(this); }

        @Override
        public List<Term> children() {
            List<Term> out = new ArrayList<>(branches.size() + 1);
            out.add(scrutinee);
            out.addAll(branches);
            return out;
        }
    }

    public static final class Constr extends Term {
        public final long index;
        public final List<Term> args;

        public Constr(long index, List<Term> args) {
            super(Tag.CONSTR);
            if (index < 0) throw new IllegalArgumentException("constr index must be non-negative: " + index);
            this.index = index;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitConstr(this); }

        @Override
        public List<Term> children() { return args; }
    }
}
