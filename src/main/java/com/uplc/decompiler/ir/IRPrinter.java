package com.uplc.decompiler.ir;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Hex;

/**
 * Text rendering of IR modules, used for inspection. Two-space indentation; nested lambdas and
 * branches open indented blocks.
 */
public final class IRPrinter {

    private IRPrinter() {}

    public static String print(IRModule module) {
        StringBuilder sb = new StringBuilder();
        for (IRModule.Import imp : module.imports) {
            sb.append("use ").append(imp.module);
            if (!imp.items.isEmpty()) sb.append(".{").append(String.join(", ", imp.items)).append('}');
            sb.append('\n');
        }
        if (!module.imports.isEmpty()) sb.append('\n');

        for (IRModule.TypeDefinition t : module.types) {
            sb.append("type ").append(t.name).append(" {\n");
            if (t.isEnum()) {
                for (String v : t.variants) sb.append("  ").append(v).append('\n');
            } else {
                for (IRModule.Field f : t.fields) sb.append("  ").append(f.name).append(": ").append(f.type).append('\n');
            }
            sb.append("}\n\n");
        }

        for (int i = 0; i < module.functions.size(); i++) {
            IRFunction f = module.functions.get(i);
            if (i > 0) sb.append("\n\n");
            sb.append("fn ").append(f.name).append('(');
            for (int p = 0; p < f.params.size(); p++) {
                if (p > 0) sb.append(", ");
                sb.append(f.params.get(p).name).append(": ").append(f.params.get(p).type);
            }
            sb.append(") -> ").append(f.returnType).append(" {");
            render(sb, block(f.body, 1, "\n}"));
        }
        return sb.append('\n').toString();
    }

    public static String expression(IRExpression expr) {
        StringBuilder sb = new StringBuilder();
        Deque<Object> work = new ArrayDeque<>();
        work.push(new Item(expr, 0));
        render(sb, work);
        return sb.toString();
    }

    /** A node awaiting rendering at an indentation level. */
    private static final class Item {
        final IRNode node;
        final int indent;

        Item(IRNode node, int indent) {
            this.node = node;
            this.indent = indent;
        }
    }

    private static Deque<Object> block(List<IRStatement> statements, int indent, String close) {
        Deque<Object> work = new ArrayDeque<>();
        pushBlock(work, statements, indent, close);
        return work;
    }

    /** Pushes each statement on its own line, then {@code close}. */
    private static void pushBlock(Deque<Object> work, List<? extends IRNode> statements, int indent, String close) {
        work.push(close);
        for (int i = statements.size() - 1; i >= 0; i--) {
            work.push(new Item(statements.get(i), indent));
            work.push("\n" + pad(indent));
        }
    }

    private static void pushJoined(Deque<Object> work, List<? extends IRNode> nodes, int indent) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            work.push(new Item(nodes.get(i), indent));
            if (i > 0) work.push(", ");
        }
    }

    private static void render(StringBuilder sb, Deque<Object> work) {
        while (!work.isEmpty()) {
            Object o = work.pop();
            if (o instanceof String) {
                sb.append((String) o);
                continue;
            }
            Item item = (Item) o;
            int k = item.indent;
            IRNode node = item.node;
            if (node instanceof IRStatement) {
                statement(sb, work, (IRStatement) node, k);
            } else if (node instanceof IRWhenBranch) {
                IRWhenBranch br = (IRWhenBranch) node;
                sb.append(br.pattern);
                pushBlock(work, br.body, k + 1, "\n" + pad(k) + "}");
                work.push(" -> {");
                if (br.guard != null) {
                    work.push(new Item(br.guard, k));
                    work.push(" if ");
                }
            } else {
                expression(sb, work, (IRExpression) node, k);
            }
        }
    }

    private static void statement(StringBuilder sb, Deque<Object> work, IRStatement s, int k) {
        switch (s.kind) {
            case LET: {
                IRStatement.Let let = (IRStatement.Let) s;
                sb.append("let ").append(let.name).append(" = ");
                work.push(new Item(let.value, k));
                break;
            }
            case EXPECT: {
                IRStatement.Expect ex = (IRStatement.Expect) s;
                sb.append("expect ").append(ex.pattern).append(" = ");
                work.push(new Item(ex.value, k));
                break;
            }
            case RETURN:
                sb.append("return ");
                work.push(new Item(((IRStatement.Return) s).value, k));
                break;
            case IF: {
                IRStatement.If ifs = (IRStatement.If) s;
                sb.append("if ");
                if (!ifs.elseBranch.isEmpty()) pushBlock(work, ifs.elseBranch, k + 1, "\n" + pad(k) + "}");
                pushBlock(work, ifs.thenBranch, k + 1, "\n" + pad(k) + (ifs.elseBranch.isEmpty() ? "}" : "} else {"));
                work.push(" {");
                work.push(new Item(ifs.condition, k));
                break;
            }
            case WHEN: {
                IRStatement.When w = (IRStatement.When) s;
                pushWhen(sb, work, w.scrutinee, w.branches, k);
                break;
            }
            case EXPRESSION:
                work.push(new Item(((IRStatement.ExpressionStatement) s).value, k));
                break;
            case FAIL: {
                String message = ((IRStatement.Fail) s).message;
                sb.append("fail");
                if (message != null) sb.append(" @").append(Constant.quote(message));
                break;
            }
        }
    }

    private static void pushWhen(StringBuilder sb, Deque<Object> work, IRExpression scrutinee, List<IRWhenBranch> branches, int k) {
        sb.append("when ");
        pushBlock(work, branches, k + 1, "\n" + pad(k) + "}");
        work.push(" is {");
        work.push(new Item(scrutinee, k));
    }

    private static void expression(StringBuilder sb, Deque<Object> work, IRExpression e, int k) {
        switch (e.kind) {
            case LITERAL:
                sb.append(literalText(((IRExpression.Literal) e).value));
                break;
            case VARIABLE:
                sb.append(((IRExpression.Variable) e).name);
                break;
            case BINARY: {
                IRExpression.Binary b = (IRExpression.Binary) e;
                sb.append('(');
                work.push(")");
                work.push(new Item(b.right, k));
                work.push(" " + b.op.symbol + " ");
                work.push(new Item(b.left, k));
                break;
            }
            case UNARY: {
                IRExpression.Unary u = (IRExpression.Unary) e;
                sb.append(u.op.symbol);
                work.push(new Item(u.operand, k));
                break;
            }
            case CALL: {
                IRExpression.Call c = (IRExpression.Call) e;
                boolean wrap = c.func.kind == IRExpression.Kind.LAMBDA;
                work.push(")");
                pushJoined(work, c.args, k);
                work.push(wrap ? ")(" : "(");
                work.push(new Item(c.func, k));
                if (wrap) sb.append('(');
                break;
            }
            case LAMBDA: {
                IRExpression.Lambda l = (IRExpression.Lambda) e;
                sb.append("fn(");
                for (int i = 0; i < l.params.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(l.params.get(i).name);
                }
                sb.append(") {");
                pushBlock(work, l.body, k + 1, "\n" + pad(k) + "}");
                break;
            }
            case CONSTRUCTOR: {
                IRExpression.Constructor c = (IRExpression.Constructor) e;
                sb.append(c.typeName);
                if (!c.args.isEmpty()) {
                    sb.append('(');
                    work.push(")");
                    pushJoined(work, c.args, k);
                }
                break;
            }
            case WHEN: {
                IRExpression.When w = (IRExpression.When) e;
                pushWhen(sb, work, w.scrutinee, w.branches, k);
                break;
            }
        }
    }

    static String literalText(Object value) {
        if (value == null) return "()";
        if (value instanceof BigInteger) return value.toString();
        if (value instanceof Boolean) return ((Boolean) value) ? "True" : "False";
        if (value instanceof byte[]) return "#" + Hex.encode((byte[]) value);
        if (value instanceof String) return Constant.quote((String) value);
        if (value instanceof Constant) return ((Constant) value).valueText();
        return String.valueOf(value);
    }

    private static String pad(int indent) {
        StringBuilder sb = new StringBuilder(indent * 2);
        for (int i = 0; i < indent; i++) sb.append("  ");
        return sb.toString();
    }
}
