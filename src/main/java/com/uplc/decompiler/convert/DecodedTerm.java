package com.uplc.decompiler.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Term tree as handed over by an external bytecode decoder.
 *
 * Variables are de Bruijn indices (0 = innermost binder), lambdas are anonymous, builtins
 * carry the name the decoder reported and constant payloads are still in whatever shape the
 * decoder produced. {@link DecodedTermConverter} turns this into a {@code Term}.
 */
public abstract class DecodedTerm {

    public enum Kind { APPLICATION, LAMBDA, VARIABLE, CONSTANT, BUILTIN, FORCE, DELAY, ERROR, CASE, CONSTR, UNRECOGNIZED }

    public final Kind kind;

    private DecodedTerm(Kind kind) {
        this.kind = kind;
    }

    public List<DecodedTerm> children() {
        return List.of();
    }

    public static DecodedTerm application(DecodedTerm func, DecodedTerm arg) { return new Application(func, arg); }
    public static DecodedTerm lambda(DecodedTerm body) { return new Lambda(body); }
    public static DecodedTerm variable(int deBruijn) { return new Variable(deBruijn); }
    public static DecodedTerm constant(List<Integer> typeTags, Object payload) { return new Constant(typeTags, payload); }
    public static DecodedTerm builtin(String name) { return new Builtin(name); }
    public static DecodedTerm force(DecodedTerm term) { return new Force(term); }
    public static DecodedTerm delay(DecodedTerm term) { return new Delay(term); }
    public static DecodedTerm error() { return new ErrorNode(); }
    public static DecodedTerm caseOf(DecodedTerm scrutinee, List<DecodedTerm> branches) { return new Case(scrutinee, branches); }
    public static DecodedTerm constr(long index, List<DecodedTerm> fields) { return new Constr(index, fields); }
    public static DecodedTerm unrecognized(String description) { return new Unrecognized(description); }

    /** Builtin by numeric tag, named the way the upstream decoder names it. */
    public static DecodedTerm builtinTag(int tag) {
        String name = BuiltinTags.upstreamName(tag);
        return name == null ? new Unrecognized("builtin tag " + tag) : new Builtin(name);
    }

    public static final class Application extends DecodedTerm {
        public final DecodedTerm func;
        public final DecodedTerm arg;

        Application(DecodedTerm func, DecodedTerm arg) {
            super(Kind.APPLICATION);
            this.func = Objects.requireNonNull(func);
            this.arg = Objects.requireNonNull(arg);
        }

        @Override
        public List<DecodedTerm> children() { return List.of(func, arg); }
    }

    public static final class Lambda extends DecodedTerm {
        public final DecodedTerm body;

        Lambda(DecodedTerm body) {
            super(Kind.LAMBDA);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public List<DecodedTerm> children() { return List.of(body); }
    }

    public static final class Variable extends DecodedTerm {
        public final int deBruijn;

        Variable(int deBruijn) {
            super(Kind.VARIABLE);
            this.deBruijn = deBruijn;
        }
    }

    public static final class Constant extends DecodedTerm {
        /** Flat-encoding type tags, e.g. [5, 0] for a list of integers. */
        public final List<Integer> typeTags;
        public final Object payload;

        Constant(List<Integer> typeTags, Object payload) {
            super(Kind.CONSTANT);
            this.typeTags = List.copyOf(typeTags);
            this.payload = payload;
        }
    }

    public static final class Builtin extends DecodedTerm {
        public final String name;

        Builtin(String name) {
            super(Kind.BUILTIN);
            this.name = Objects.requireNonNull(name);
        }
    }

    public static final class Force extends DecodedTerm {
        public final DecodedTerm term;

        Force(DecodedTerm term) {
            super(Kind.FORCE);
            this.term = Objects.requireNonNull(term);
        }

        @Override
        public List<DecodedTerm> children() { return List.of(term); }
    }

    public static final class Delay extends DecodedTerm {
        public final DecodedTerm term;

        Delay(DecodedTerm term) {
            super(Kind.DELAY);
            this.term = Objects.requireNonNull(term);
        }

        @Override
        public List<DecodedTerm> children() { return List.of(term); }
    }

    public static final class ErrorNode extends DecodedTerm {
        ErrorNode() {
            super(Kind.ERROR);
        }
    }

    public static final class Case extends DecodedTerm {
        public final DecodedTerm scrutinee;
        public final List<DecodedTerm> branches;

        Case(DecodedTerm scrutinee, List<DecodedTerm> branches) {
            super(Kind.CASE);
            this.scrutinee = Objects.requireNonNull(scrutinee);
            this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
        }

        @Override
        public List<DecodedTerm> children() {
            List<DecodedTerm> out = new ArrayList<>(branches.size() + 1);
            out.add(scrutinee);
            out.addAll(branches);
            return out;
        }
    }

    public static final class Constr extends DecodedTerm {
        public final long index;
        public final List<DecodedTerm> fields;

        Constr(long index, List<DecodedTerm> fields) {
            super(Kind.CONSTR);
            this.index = index;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        }

        @Override
        public List<DecodedTerm> children() { return fields; }
    }

    /** A node the adapter could not classify. */
    public static final class Unrecognized extends DecodedTerm {
        public final String description;

        Unrecognized(String description) {
            super(Kind.UNRECOGNIZED);
            this.description = description;
        }
    }
}
