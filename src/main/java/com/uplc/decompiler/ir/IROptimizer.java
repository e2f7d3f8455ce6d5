package com.uplc.decompiler.ir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.uplc.debug.Debug;

/**
 * Optimization passes over an {@link IRModule}. Every pass returns a new module.
 *
 * Constant folding evaluates binary and unary nodes whose operands are both literals of the
 * same kind. Division or modulo by zero is left unfolded. Dead-code elimination drops the
 * statements after a {@code return} or {@code fail}. Inlining only produces hints.
 */
public final class IROptimizer {

    private static final String TAG = "IR";

    private IROptimizer() {}

    public static IRModule optimize(IRModule module) {
        return optimize(module, OptimizerOptions.defaults());
    }

    public static IRModule optimize(IRModule module, OptimizerOptions options) {
        IRModule out = module;
        if (options.constantFolding()) out = foldConstants(out);
        if (options.deadCodeElimination()) out = eliminateDeadCode(out);
        if (options.inlining()) out = inline(out);
        return out;
    }

    // -------------------------
    // Constant folding
    // -------------------------

    public static IRModule foldConstants(IRModule module) {
        List<IRFunction> functions = new ArrayList<>();
        for (IRFunction f : module.functions) {
            functions.add(f.withBody(IRNodes.rewriteAll(f.body, IROptimizer::foldNode)));
        }
        return module.withFunctions(functions);
    }

    /** Folds one expression tree. */
    public static IRExpression fold(IRExpression expr) {
        return (IRExpression) IRNodes.rewrite(expr, IROptimizer::foldNode);
    }

    private static IRNode foldNode(IRNode node) {
        if (node instanceof IRExpression.Binary) {
            IRExpression.Binary b = (IRExpression.Binary) node;
            if (b.left.kind == IRExpression.Kind.LITERAL && b.right.kind == IRExpression.Kind.LITERAL) {
                IRExpression folded = evaluate(b.op, (IRExpression.Literal) b.left, (IRExpression.Literal) b.right);
                if (folded != null) return folded;
            }
        } else if (node instanceof IRExpression.Unary) {
            IRExpression.Unary u = (IRExpression.Unary) node;
            if (u.operand.kind == IRExpression.Kind.LITERAL) {
                IRExpression folded = evaluate(u.op, (IRExpression.Literal) u.operand);
                if (folded != null) return folded;
            }
        }
        return node;
    }

    /** Folded literal, or null when the operands do not allow folding. */
    static IRExpression evaluate(IRExpression.BinaryOp op, IRExpression.Literal left, IRExpression.Literal right) {
        if (left.value instanceof BigInteger && right.value instanceof BigInteger) {
            BigInteger a = (BigInteger) left.value;
            BigInteger b = (BigInteger) right.value;
            switch (op) {
                case ADD: return integer(a.add(b));
                case SUB: return integer(a.subtract(b));
                case MUL: return integer(a.multiply(b));
                case DIV: return b.signum() == 0 ? null : integer(floorDiv(a, b));
                case MOD: return b.signum() == 0 ? null : integer(floorMod(a, b));
                case EQ: return IRExpression.bool(a.equals(b));
                case NE: return IRExpression.bool(!a.equals(b));
                case LT: return IRExpression.bool(a.compareTo(b) < 0);
                case LE: return IRExpression.bool(a.compareTo(b) <= 0);
                case GT: return IRExpression.bool(a.compareTo(b) > 0);
                case GE: return IRExpression.bool(a.compareTo(b) >= 0);
                default: return null;
            }
        }
        if (left.value instanceof Boolean && right.value instanceof Boolean) {
            boolean a = (Boolean) left.value;
            boolean b = (Boolean) right.value;
            switch (op) {
                case AND: return IRExpression.bool(a && b);
                case OR: return IRExpression.bool(a || b);
                case EQ: return IRExpression.bool(a == b);
                case NE: return IRExpression.bool(a != b);
                default: return null;
            }
        }
        return null;
    }

    static IRExpression evaluate(IRExpression.UnaryOp op, IRExpression.Literal operand) {
        switch (op) {
            case NOT:
                return operand.value instanceof Boolean ? IRExpression.bool(!(Boolean) operand.value) : null;
            case NEGATE:
                return operand.value instanceof BigInteger ? integer(((BigInteger) operand.value).negate()) : null;
            default:
                return null;
        }
    }

    private static IRExpression integer(BigInteger v) {
        return new IRExpression.Literal(v, IRType.INT);
    }

    // divideInteger and modInteger round toward negative infinity.
    private static BigInteger floorDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) return qr[0].subtract(BigInteger.ONE);
        return qr[0];
    }

    private static BigInteger floorMod(BigInteger a, BigInteger b) {
        BigInteger r = a.remainder(b);
        if (r.signum() != 0 && r.signum() != b.signum()) return r.add(b);
        return r;
    }

    // -------------------------
    // Dead code
    // -------------------------

    public static IRModule eliminateDeadCode(IRModule module) {
        List<IRFunction> functions = new ArrayList<>();
        int removed = 0;
        for (IRFunction f : module.functions) {
            List<IRStatement> nested = IRNodes.rewriteAll(f.body, IROptimizer::truncateNested);
            List<IRStatement> body = truncate(nested);
            removed += f.body.size() - body.size();
            functions.add(f.withBody(body));
        }
        if (removed > 0) Debug.get().d(TAG, "removed " + removed + " unreachable top-level statement(s)");
        return module.withFunctions(functions);
    }

    /** Statements up to and including the first return or fail. */
    public static List<IRStatement> truncate(List<IRStatement> statements) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i).isTerminator()) {
                return i == statements.size() - 1 ? statements : new ArrayList<>(statements.subList(0, i + 1));
            }
        }
        return statements;
    }

    private static IRNode truncateNested(IRNode node) {
        if (node instanceof IRExpression.Lambda) {
            IRExpression.Lambda l = (IRExpression.Lambda) node;
            List<IRStatement> body = truncate(l.body);
            return body == l.body ? l : new IRExpression.Lambda(l.params, body, l.type);
        }
        if (node instanceof IRStatement.If) {
            IRStatement.If s = (IRStatement.If) node;
            List<IRStatement> then = truncate(s.thenBranch);
            List<IRStatement> otherwise = truncate(s.elseBranch);
            return then == s.thenBranch && otherwise == s.elseBranch ? s : new IRStatement.If(s.condition, then, otherwise);
        }
        if (node instanceof IRWhenBranch) {
            IRWhenBranch br = (IRWhenBranch) node;
            List<IRStatement> body = truncate(br.body);
            return body == br.body ? br : new IRWhenBranch(br.pattern, br.guard, body);
        }
        return node;
    }

    // -------------------------
    // Inlining
    // -------------------------

    /** Currently leaves the module as is; see {@link #hints(IRModule)}. */
    public static IRModule inline(IRModule module) {
        return module;
    }

    /** A function whose body is a single return is an inlining candidate. */
    public static List<OptimizationHint> hints(IRModule module) {
        List<OptimizationHint> hints = new ArrayList<>();
        for (IRFunction f : module.functions) {
            if (f.body.size() == 1 && f.body.get(0).kind == IRStatement.Kind.RETURN) {
                hints.add(new OptimizationHint(OptimizationHint.Kind.INLINE, f.name, 0.9));
            }
        }
        return hints;
    }
}
