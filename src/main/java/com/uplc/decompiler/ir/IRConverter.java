package com.uplc.decompiler.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.uplc.debug.Debug;
import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Term;
import com.uplc.decompiler.term.Terms;

/**
 * Lowers a {@link Term} into a single-function {@link IRModule}.
 *
 * The term becomes the body of {@code main}: a {@code return} of its expression, or a
 * {@code fail} when the term is an error. Lambdas turn into nested one-parameter IR lambdas
 * with the same statement treatment for their bodies. Force and delay are dropped.
 */
public final class IRConverter {

    private static final String TAG = "IR";

    public static final String MAIN = "main";

    private static final Map<String, IRExpression.BinaryOp> BINARY_OPS = new HashMap<>();

    static {
        BINARY_OPS.put("addInteger", IRExpression.BinaryOp.ADD);
        BINARY_OPS.put("subtractInteger", IRExpression.BinaryOp.SUB);
        BINARY_OPS.put("multiplyInteger", IRExpression.BinaryOp.MUL);
        BINARY_OPS.put("divideInteger", IRExpression.BinaryOp.DIV);
        BINARY_OPS.put("modInteger", IRExpression.BinaryOp.MOD);
        BINARY_OPS.put("equalsInteger", IRExpression.BinaryOp.EQ);
        BINARY_OPS.put("lessThanInteger", IRExpression.BinaryOp.LT);
        BINARY_OPS.put("lessThanEqualsInteger", IRExpression.BinaryOp.LE);
        BINARY_OPS.put("equalsByteString", IRExpression.BinaryOp.EQ);
        BINARY_OPS.put("lessThanByteString", IRExpression.BinaryOp.LT);
        BINARY_OPS.put("lessThanEqualsByteString", IRExpression.BinaryOp.LE);
        BINARY_OPS.put("equalsString", IRExpression.BinaryOp.EQ);
        BINARY_OPS.put("equalsData", IRExpression.BinaryOp.EQ);
        BINARY_OPS.put("appendByteString", IRExpression.BinaryOp.CONCAT);
        BINARY_OPS.put("appendString", IRExpression.BinaryOp.CONCAT);
    }

    private static final IRType BUILTIN_TYPE = IRType.function(List.of(), IRType.UNKNOWN);

    private IRConverter() {}

    public static IRModule termToIR(Term term) {
        List<IRStatement> body = new Lowering().statements(term);
        IRFunction main = new IRFunction(MAIN, List.of(), IRType.BOOL, body);
        Debug.get().d(TAG, "lowered term into " + main.name + " with " + body.size() + " statement(s)");
        return new IRModule(List.of(), List.of(main), List.of());
    }

    /** Operator for a builtin name, or null when it is lowered as a call. */
    public static IRExpression.BinaryOp binaryOp(String builtin) {
        return builtin == null ? null : BINARY_OPS.get(builtin);
    }

    private enum Shape { LEAF, RETURN, PASS, LAMBDA, BINARY, NOT, AND, OR, CALL, WHEN, CONSTRUCTOR }

    private static final class Frame {
        final Term term;
        final Shape shape;
        final List<Term> children = new ArrayList<>();
        /** Parallel to {@code children}: lower into statements rather than an expression. */
        final List<Boolean> asStatements = new ArrayList<>();
        final List<Object> built = new ArrayList<>();
        IRExpression.BinaryOp op;
        Object leaf;

        Frame(Term term, Shape shape) {
            this.term = term;
            this.shape = shape;
        }

        Frame child(Term t, boolean statements) {
            children.add(t);
            asStatements.add(statements);
            return this;
        }
    }

    private static final class Lowering {

        List<IRStatement> statements(Term root) {
            return castStatements(run(root, true));
        }

        private Object run(Term root, boolean statements) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(enter(root, statements));
            Object result = null;
            while (!stack.isEmpty()) {
                Frame f = stack.peek();
                if (f.built.size() < f.children.size()) {
                    int i = f.built.size();
                    stack.push(enter(f.children.get(i), f.asStatements.get(i)));
                    continue;
                }
                stack.pop();
                Object out = build(f);
                Frame parent = stack.peek();
                if (parent == null) result = out;
                else parent.built.add(out);
            }
            return result;
        }

        private Frame enter(Term term, boolean statements) {
            if (statements) {
                if (Terms.stripForceDelay(term).tag == Term.Tag.ERROR) {
                    Frame f = new Frame(term, Shape.LEAF);
                    f.leaf = List.of(new IRStatement.Fail(null));
                    return f;
                }
                return new Frame(term, Shape.RETURN).child(term, false);
            }

            switch (term.tag) {
                case CON:
                    return leaf(term, literal(((Term.Con) term).value));
                case VAR:
                    return leaf(term, IRExpression.variable(((Term.Var) term).name));
                case BUILTIN:
                    return leaf(term, new IRExpression.Variable(((Term.Builtin) term).name, BUILTIN_TYPE));
                case ERROR:
                    return leaf(term, IRExpression.unit());
                case FORCE:
                    return new Frame(term, Shape.PASS).child(((Term.Force) term).term, false);
                case DELAY:
                    return new Frame(term, Shape.PASS).child(((Term.Delay) term).term, false);
                case LAMBDA:
                    return new Frame(term, Shape.LAMBDA).child(((Term.Lambda) term).body, true);
                case CASE: {
                    Term.Case cs = (Term.Case) term;
                    Frame f = new Frame(term, Shape.WHEN).child(cs.scrutinee, false);
                    for (Term b : cs.branches) f.child(b, true);
                    return f;
                }
                case CONSTR: {
                    Frame f = new Frame(term, Shape.CONSTRUCTOR);
                    for (Term a : ((Term.Constr) term).args) f.child(a, false);
                    return f;
                }
                default:
                    return application(term);
            }
        }

        private Frame application(Term term) {
            Terms.Spine spine = Terms.flattenApp(term);
            String builtin = spine.builtin();
            IRExpression.BinaryOp op = binaryOp(builtin);
            if (op != null && spine.args.size() == 2) {
                Frame f = new Frame(term, Shape.BINARY).child(spine.args.get(0), false).child(spine.args.get(1), false);
                f.op = op;
                return f;
            }
            if ("ifThenElse".equals(builtin) && spine.args.size() == 3) {
                Boolean then = boolConstant(spine.args.get(1));
                Boolean otherwise = boolConstant(spine.args.get(2));
                Term cond = spine.args.get(0);
                if (Boolean.TRUE.equals(then) && Boolean.FALSE.equals(otherwise)) {
                    return new Frame(term, Shape.PASS).child(cond, false);
                }
                if (Boolean.FALSE.equals(then) && Boolean.TRUE.equals(otherwise)) {
                    return new Frame(term, Shape.NOT).child(cond, false);
                }
                if (Boolean.FALSE.equals(otherwise)) {
                    return new Frame(term, Shape.AND).child(cond, false).child(spine.args.get(1), false);
                }
                if (Boolean.TRUE.equals(then)) {
                    return new Frame(term, Shape.OR).child(cond, false).child(spine.args.get(2), false);
                }
            }
            Frame f = new Frame(term, Shape.CALL).child(spine.head, false);
            for (Term a : spine.args) f.child(a, false);
            return f;
        }

        private static Frame leaf(Term term, IRExpression value) {
            Frame f = new Frame(term, Shape.LEAF);
            f.leaf = value;
            return f;
        }

        private Object build(Frame f) {
            List<Object> b = f.built;
            switch (f.shape) {
                case LEAF:
                    return f.leaf;
                case RETURN:
                    return List.of(new IRStatement.Return((IRExpression) b.get(0)));
                case PASS:
                    return b.get(0);
                case LAMBDA: {
                    IRFunction.Parameter p = new IRFunction.Parameter(((Term.Lambda) f.term).param, IRType.UNKNOWN);
                    return new IRExpression.Lambda(List.of(p), castStatements(b.get(0)),
                            IRType.function(List.of(IRType.UNKNOWN), IRType.UNKNOWN));
                }
                case BINARY:
                    return new IRExpression.Binary(f.op, expr(b.get(0)), expr(b.get(1)), resultType(f.op));
                case NOT:
                    return new IRExpression.Unary(IRExpression.UnaryOp.NOT, expr(b.get(0)), IRType.BOOL);
                case AND:
                    return new IRExpression.Binary(IRExpression.BinaryOp.AND, expr(b.get(0)), expr(b.get(1)), IRType.BOOL);
                case OR:
                    return new IRExpression.Binary(IRExpression.BinaryOp.OR, expr(b.get(0)), expr(b.get(1)), IRType.BOOL);
                case CALL: {
                    List<IRExpression> args = new ArrayList<>();
                    for (int i = 1; i < b.size(); i++) args.add(expr(b.get(i)));
                    return new IRExpression.Call(expr(b.get(0)), args, IRType.UNKNOWN);
                }
                case WHEN: {
                    List<IRWhenBranch> branches = new ArrayList<>();
                    for (int i = 1; i < b.size(); i++) {
                        branches.add(new IRWhenBranch(IRPattern.literal(i - 1), null, castStatements(b.get(i))));
                    }
                    return new IRExpression.When(expr(b.get(0)), branches, IRType.UNKNOWN);
                }
                case CONSTRUCTOR: {
                    String name = "Constr" + ((Term.Constr) f.term).index;
                    List<IRExpression> args = new ArrayList<>();
                    for (Object o : b) args.add(expr(o));
                    return new IRExpression.Constructor(name, args, IRType.custom(name));
                }
                default:
                    throw new IllegalStateException("unhandled shape " + f.shape);
            }
        }

        private static IRExpression expr(Object o) {
            return (IRExpression) o;
        }

        @SuppressWarnings("unchecked")
        private static List<IRStatement> castStatements(Object o) {
            return (List<IRStatement>) o;
        }
    }

    private static IRType resultType(IRExpression.BinaryOp op) {
        switch (op) {
            case ADD: case SUB: case MUL: case DIV: case MOD:
                return IRType.INT;
            case CONCAT:
                return IRType.UNKNOWN;
            default:
                return IRType.BOOL;
        }
    }

    private static Boolean boolConstant(Term term) {
        Term t = Terms.stripForceDelay(term);
        if (t.tag != Term.Tag.CON) return null;
        Constant c = ((Term.Con) t).value;
        return c.kind() == ConstType.Kind.BOOL ? c.asBool() : null;
    }

    static IRExpression literal(Constant c) {
        switch (c.kind()) {
            case INTEGER: return new IRExpression.Literal(c.asInteger(), IRType.INT);
            case BOOL: return IRExpression.bool(c.asBool());
            case BYTESTRING: return new IRExpression.Literal(c.asBytes(), IRType.BYTES);
            case STRING: return new IRExpression.Literal(c.asString(), IRType.STRING);
            case UNIT: return IRExpression.unit();
            default: return new IRExpression.Literal(c, IRType.of(c.type));
        }
    }
}
