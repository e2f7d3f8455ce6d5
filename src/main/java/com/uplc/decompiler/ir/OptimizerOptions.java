package com.uplc.decompiler.ir;

/**
 * Switches for {@link IROptimizer}. Tail-call optimization is off by default and currently
 * has no pass behind it.
 */
public final class OptimizerOptions {
    private boolean constantFolding = true;
    private boolean deadCodeElimination = true;
    private boolean inlining = true;
    private boolean tailCallOptimization = false;

    public static OptimizerOptions defaults() {
        return new OptimizerOptions();
    }

    public boolean constantFolding() { return constantFolding; }
    public boolean deadCodeElimination() { return deadCodeElimination; }
    public boolean inlining() { return inlining; }
    public boolean tailCallOptimization() { return tailCallOptimization; }

    public OptimizerOptions setConstantFolding(boolean on) { this.constantFolding = on; return this; }
    public OptimizerOptions setDeadCodeElimination(boolean on) { this.deadCodeElimination = on; return this; }
    public OptimizerOptions setInlining(boolean on) { this.inlining = on; return this; }
    public OptimizerOptions setTailCallOptimization(boolean on) { this.tailCallOptimization = on; return this; }
}
