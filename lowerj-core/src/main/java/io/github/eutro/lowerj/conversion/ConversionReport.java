package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.util.Pair;

import java.util.List;

/**
 * The outcome of a run of the {@link ConversionDriver}.
 */
public final class ConversionReport {
    public final ConversionMode mode;
    /**
     * How many patterns were successfully applied.
     */
    public final int rewriteCount;
    /**
     * The operations still illegal when the worklist drained, in program order.
     */
    public final List<Insn> residual;
    /**
     * For each residual operation, the last reason a pattern gave for not applying to it.
     */
    public final List<Pair<Insn, String>> failures;

    public ConversionReport(ConversionMode mode, int rewriteCount, List<Insn> residual, List<Pair<Insn, String>> failures) {
        this.mode = mode;
        this.rewriteCount = rewriteCount;
        this.residual = List.copyOf(residual);
        this.failures = List.copyOf(failures);
    }

    /**
     * Whether the conversion failed: a full conversion left illegal operations behind.
     * A partial conversion never fails.
     *
     * @return Whether the conversion failed.
     */
    public boolean failed() {
        return mode == ConversionMode.FULL && !residual.isEmpty();
    }

    public boolean succeeded() {
        return !failed();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append(mode.name().toLowerCase())
                .append(" conversion: ")
                .append(rewriteCount)
                .append(" rewrites, ")
                .append(residual.size())
                .append(" illegal operations left");
        for (Pair<Insn, String> failure : failures) {
            sb.append("\n  ").append(failure.left).append(": ").append(failure.right);
        }
        return sb.toString();
    }
}
