import com.uplc.decompiler.ir.IRConverter;
import com.uplc.decompiler.ir.IRExpression;
import com.uplc.decompiler.ir.IRFunction;
import com.uplc.decompiler.ir.IRModule;
import com.uplc.decompiler.ir.IROptimizer;
import com.uplc.decompiler.ir.IRPrinter;
import com.uplc.decompiler.ir.IRStatement;
import com.uplc.decompiler.ir.IRType;
import com.uplc.decompiler.ir.OptimizationHint;
import com.uplc.decompiler.ir.OptimizerOptions;
import com.uplc.decompiler.parser.Parser;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UplcIrTest {

    private static IRExpression returned(IRModule module) {
        IRFunction main = module.function(IRConverter.MAIN);
        assertNotNull(main);
        IRStatement last = main.body.get(main.body.size() - 1);
        assertEquals(IRStatement.Kind.RETURN, last.kind);
        return ((IRStatement.Return) last).value;
    }

    private static IRExpression optimized(String src) {
        return returned(IROptimizer.optimize(IRConverter.termToIR(Parser.parse(src))));
    }

    private static BigInteger intValue(IRExpression e) {
        assertEquals(IRExpression.Kind.LITERAL, e.kind, String.valueOf(e));
        return (BigInteger) ((IRExpression.Literal) e).value;
    }

    @Test
    public void arithmetic_builtins_lower_to_binary_operators() {
        IRExpression e = returned(IRConverter.termToIR(Parser.parse(
                "[(builtin addInteger) (con integer 2) (con integer 3)]")));

        assertEquals(IRExpression.Kind.BINARY, e.kind);
        assertEquals(IRExpression.BinaryOp.ADD, ((IRExpression.Binary) e).op);
        assertEquals(IRType.INT, e.type);
    }

    @Test
    public void constant_arithmetic_is_folded() {
        assertEquals(BigInteger.valueOf(5), intValue(optimized("[(builtin addInteger) (con integer 2) (con integer 3)]")));
        assertEquals(BigInteger.valueOf(20), intValue(optimized(
                "[(builtin multiplyInteger) [(builtin addInteger) (con integer 2) (con integer 3)] (con integer 4)]")));
    }

    @Test
    public void division_rounds_toward_negative_infinity() {
        assertEquals(BigInteger.valueOf(-4), intValue(optimized("[(builtin divideInteger) (con integer -7) (con integer 2)]")));
        assertEquals(BigInteger.valueOf(1), intValue(optimized("[(builtin modInteger) (con integer -7) (con integer 2)]")));
    }

    @Test
    public void division_by_zero_is_left_unfolded() {
        IRExpression e = optimized("[(builtin divideInteger) (con integer 1) (con integer 0)]");
        assertEquals(IRExpression.Kind.BINARY, e.kind);

        IRExpression m = optimized("[(builtin modInteger) (con integer 1) (con integer 0)]");
        assertEquals(IRExpression.Kind.BINARY, m.kind);
    }

    @Test
    public void comparisons_fold_to_booleans() {
        IRExpression e = optimized("[(builtin lessThanInteger) (con integer 1) (con integer 2)]");
        assertEquals(IRExpression.Kind.LITERAL, e.kind);
        assertEquals(Boolean.TRUE, ((IRExpression.Literal) e).value);
    }

    @Test
    public void negated_boolean_shape_folds() {
        IRExpression e = optimized("[(force (builtin ifThenElse)) (con bool True) (con bool False) (con bool True)]");
        assertEquals(IRExpression.Kind.LITERAL, e.kind);
        assertEquals(Boolean.FALSE, ((IRExpression.Literal) e).value);
    }

    @Test
    public void folding_can_be_switched_off() {
        IRModule module = IRConverter.termToIR(Parser.parse("[(builtin addInteger) (con integer 2) (con integer 3)]"));
        IRModule out = IROptimizer.optimize(module, OptimizerOptions.defaults().setConstantFolding(false));
        assertEquals(IRExpression.Kind.BINARY, returned(out).kind);
    }

    @Test
    public void statements_after_a_return_are_dropped() {
        IRFunction f = new IRFunction("main", List.of(), IRType.INT, List.of(
                new IRStatement.Return(IRExpression.literal(BigInteger.ONE, IRType.INT)),
                new IRStatement.Return(IRExpression.literal(BigInteger.TWO, IRType.INT))));
        IRModule module = new IRModule(List.of(), List.of(f), List.of());

        IRModule out = IROptimizer.eliminateDeadCode(module);
        assertEquals(1, out.function("main").body.size());
        assertEquals(BigInteger.ONE, intValue(returned(out)));
    }

    @Test
    public void fail_is_a_terminator() {
        List<IRStatement> body = List.of(
                new IRStatement.Fail("boom"),
                new IRStatement.Return(IRExpression.unit()));
        List<IRStatement> out = IROptimizer.truncate(body);
        assertEquals(1, out.size());
        assertEquals(IRStatement.Kind.FAIL, out.get(0).kind);
    }

    @Test
    public void single_return_functions_are_inlining_candidates() {
        IRModule module = IRConverter.termToIR(Parser.parse("(con integer 1)"));
        List<OptimizationHint> hints = IROptimizer.hints(module);
        assertEquals(1, hints.size());
        assertEquals(IRConverter.MAIN, hints.get(0).target);
    }

    @Test
    public void printer_renders_main_function() {
        String text = IRPrinter.print(IRConverter.termToIR(Parser.parse(
                "(lam x [(builtin addInteger) (var x) (con integer 1)])")));

        assertTrue(text.startsWith("fn main() -> Bool {"), text);
        assertTrue(text.contains("x + 1"), text);
    }
}
