package io.github.eutro.lowerj.passes.structural;

import io.github.eutro.lowerj.conversion.ConversionPattern;
import io.github.eutro.lowerj.conversion.ConversionRewriter;
import io.github.eutro.lowerj.conversion.ConversionTarget;
import io.github.eutro.lowerj.conversion.RewritePatternSet;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.Callee;
import io.github.eutro.lowerj.ops.FuncSignature;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.types.FunctionType;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Type conversion of function signatures, calls and returns.
 */
public class FuncConversions {
    /**
     * Add the patterns and legality rules. Functions and calls are legal once their signatures
     * are, and returns once their operand types are.
     *
     * @param converter The converter.
     * @param patterns  The set to add the patterns to.
     * @param target    The target to add the legality rules to.
     */
    public static void populate(TypeConverter converter, RewritePatternSet patterns, ConversionTarget target) {
        patterns.add(
                new FuncSignaturePattern(converter),
                new CallPattern(converter),
                new PassThroughPattern(StdOps.RETURN, converter)
        );
        target.addDynamicallyLegalOp(op -> converter.isSignatureLegal(StdOps.FUNC.cast(op.op).arg.type), StdOps.FUNC);
        target.addDynamicallyLegalOp(op -> converter.isSignatureLegal(StdOps.CALL.cast(op.op).arg.type), StdOps.CALL);
        target.addDynamicallyLegalOp(op -> converter.isLegal(op.getOperandTypes()), StdOps.RETURN);
    }

    /**
     * Converts the signature of a function, moving its body into the converted function.
     */
    public static class FuncSignaturePattern extends ConversionPattern {
        public FuncSignaturePattern(TypeConverter converter) {
            super(StdOps.FUNC, converter);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            TypeConverter converter = getTypeConverter();
            assert converter != null;
            FuncSignature sig = StdOps.FUNC.cast(op.op).arg;
            Optional<FunctionType> newType = converter.convertSignature(sig.type);
            if (newType.isEmpty()) {
                return rewriter.notifyMatchFailure(op, "signature has no conversion");
            }
            Insn newFunc = rewriter.insert(StdOps.FUNC.create(sig.withType(newType.get())).insn().withRegions(1));
            rewriter.inlineRegionBefore(op.getRegion(0), newFunc.getRegion(0), null);
            if (!rewriter.convertRegionTypes(newFunc.getRegion(0), converter)) {
                return rewriter.notifyMatchFailure(op, "body argument types have no conversion");
            }
            rewriter.replaceOp(op, Collections.emptyList());
            return true;
        }
    }

    /**
     * Converts the callee type and results of a call.
     */
    public static class CallPattern extends ConversionPattern {
        public CallPattern(TypeConverter converter) {
            super(StdOps.CALL, converter);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            TypeConverter converter = getTypeConverter();
            assert converter != null;
            Callee callee = StdOps.CALL.cast(op.op).arg;
            Optional<FunctionType> newType = converter.convertSignature(callee.type);
            if (newType.isEmpty()) {
                return rewriter.notifyMatchFailure(op, "callee type has no conversion");
            }
            rewriter.replaceOpWithNew(op, StdOps.call(callee.name, newType.get(), operands));
            return true;
        }
    }
}
