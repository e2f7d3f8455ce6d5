package com.uplc.decompiler.convert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.uplc.debug.Debug;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Term;

/**
 * Converts a decoder's {@link DecodedTerm} tree into a named {@link Term}.
 *
 * Each lambda receives a fresh name from a {@link NameCounter} owned by the call, and de Bruijn
 * index i resolves to the i-th most recently bound name ({@code ?i} when unbound). BLS builtin
 * names are corrected with {@link BuiltinTags#correctName}.
 */
public final class DecodedTermConverter {

    private static final String TAG = "Converter";

    private final ConversionMode mode;

    public DecodedTermConverter() {
        this(ConversionMode.DIAGNOSTIC);
    }

    public DecodedTermConverter(ConversionMode mode) {
        this.mode = mode;
    }

    public ConversionMode getMode() {
        return mode;
    }

    public ConversionResult convert(DecodedTerm root) {
        return new Run().convert(root);
    }

    /** State for a single conversion. */
    private final class Run {
        private final NameCounter names = new NameCounter();
        private final List<String> bindings = new ArrayList<>();
        private int unrecognized;
        private int unbound;

        ConversionResult convert(DecodedTerm root) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(enter(root));
            Term result = null;
            while (!stack.isEmpty()) {
                Frame f = stack.peek();
                if (f.built.size() < f.children.size()) {
                    stack.push(enter(f.children.get(f.built.size())));
                    continue;
                }
                stack.pop();
                Term t = build(f);
                if (f.param != null) bindings.remove(bindings.size() - 1);
                if (stack.isEmpty()) result = t;
                else stack.peek().built.add(t);
            }
            if (unrecognized > 0) {
                Debug.get().w(TAG, "conversion finished with " + unrecognized + " unrecognized node(s)");
            }
            return new ConversionResult(result, unrecognized, unbound);
        }

        private Frame enter(DecodedTerm node) {
            if (node == null) {
                return new Frame(DecodedTerm.unrecognized("null node"), null);
            }
            String param = null;
            if (node.kind == DecodedTerm.Kind.LAMBDA) {
                param = names.next();
                bindings.add(param);
            }
            return new Frame(node, param);
        }

        private Term build(Frame f) {
            DecodedTerm node = f.node;
            List<Term> kids = f.built;
            switch (node.kind) {
                case APPLICATION: return Term.apply(kids.get(0), kids.get(1));
                case LAMBDA: return Term.lam(f.param, kids.get(0));
                case VARIABLE: return variable((DecodedTerm.Variable) node);
                case CONSTANT: return constant((DecodedTerm.Constant) node);
                case BUILTIN: return builtin((DecodedTerm.Builtin) node);
                case FORCE: return Term.force(kids.get(0));
                case DELAY: return Term.delay(kids.get(0));
                case ERROR: return Term.error();
                case CASE: return Term.caseOf(kids.get(0), kids.subList(1, kids.size()));
                case CONSTR: {
                    DecodedTerm.Constr c = (DecodedTerm.Constr) node;
                    if (c.index < 0) return unrecognized("constr with negative index " + c.index, null);
                    return Term.constr(c.index, kids);
                }
                case UNRECOGNIZED:
                default:
                    return unrecognized(describe(node), null);
            }
        }

        private Term variable(DecodedTerm.Variable v) {
            if (v.deBruijn < 0) return unrecognized("variable with negative index " + v.deBruijn, null);
            int slot = bindings.size() - 1 - v.deBruijn;
            if (slot < 0) {
                unbound++;
                Debug.get().d(TAG, "unbound de Bruijn index " + v.deBruijn);
                return Term.var("?" + v.deBruijn);
            }
            return Term.var(bindings.get(slot));
        }

        private Term constant(DecodedTerm.Constant c) {
            try {
                ConstType type = PayloadNormalizer.decodeType(c.typeTags);
                Constant value = PayloadNormalizer.toConstant(type, c.payload);
                return Term.con(value);
            } catch (IllegalArgumentException e) {
                return unrecognized("constant " + c.typeTags + ": " + e.getMessage(), e);
            }
        }

        private Term builtin(DecodedTerm.Builtin b) {
            String name = BuiltinTags.correctName(b.name);
            if (!name.equals(b.name)) {
                Debug.get().d(TAG, "remapped builtin " + b.name + " -> " + name);
            }
            return Term.builtin(name);
        }

        private Term unrecognized(String what, Throwable cause) {
            if (mode == ConversionMode.STRICT) {
                throw new ConversionError("Unrecognized decoded node: " + what, cause);
            }
            unrecognized++;
            Debug.get().w(TAG, "unrecognized decoded node (" + what + "), replaced with error");
            return Term.error();
        }

        private String describe(DecodedTerm node) {
            if (node instanceof DecodedTerm.Unrecognized) return ((DecodedTerm.Unrecognized) node).description;
            return node.kind.name();
        }
    }

    private static final class Frame {
        final DecodedTerm node;
        final String param;
        final List<DecodedTerm> children;
        final List<Term> built = new ArrayList<>();

        Frame(DecodedTerm node, String param) {
            this.node = node;
            this.param = param;
            this.children = node.children();
        }
    }
}
