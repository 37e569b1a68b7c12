package io.github.eutro.lowerj.passes.structural;

import io.github.eutro.lowerj.conversion.ConversionTarget;
import io.github.eutro.lowerj.conversion.RewritePatternSet;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ops.ScfOps;

/**
 * Type conversion of structured control flow: loops, conditionals, and the yields that end their regions.
 */
public class ScfStructuralConversions {
    /**
     * Add the patterns and legality rules.
     * <p>
     * Loops and conditionals are legal once their result types are. A yield is legal once its
     * operand types are, if its parent is a loop or conditional, and always otherwise.
     *
     * @param converter The converter.
     * @param patterns  The set to add the patterns to.
     * @param target    The target to add the legality rules to.
     */
    public static void populate(TypeConverter converter, RewritePatternSet patterns, ConversionTarget target) {
        patterns.add(
                new StructuralConversionPattern(ScfOps.FOR, converter),
                new StructuralConversionPattern(ScfOps.IF, converter),
                new PassThroughPattern(ScfOps.YIELD, converter)
        );
        target.addDynamicallyLegalOp(op -> converter.isLegal(op.getResultTypes()), ScfOps.FOR, ScfOps.IF);
        target.addDynamicallyLegalOp(op -> {
            Insn parent = op.getParentInsn();
            if (parent == null || (parent.op.key != ScfOps.FOR && parent.op.key != ScfOps.IF)) {
                return true;
            }
            return converter.isLegal(op.getOperandTypes());
        }, ScfOps.YIELD);
    }
}
