package io.github.eutro.lowerj.passes.structural;

import io.github.eutro.lowerj.conversion.ConversionPattern;
import io.github.eutro.lowerj.conversion.ConversionRewriter;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.OpKey;
import io.github.eutro.lowerj.types.Type;

import java.util.List;
import java.util.Optional;

/**
 * Re-emits an operation without regions as is, but with converted operands and result types.
 * <p>
 * Used for terminators and other operations whose legality depends on the types around them,
 * so that the driver materializes their operands.
 */
public class PassThroughPattern extends ConversionPattern {
    public PassThroughPattern(OpKey root, TypeConverter converter) {
        super(root, converter);
    }

    @Override
    public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
        if (!op.getRegions().isEmpty()) {
            return rewriter.notifyMatchFailure(op, "operation owns regions");
        }
        TypeConverter converter = getTypeConverter();
        assert converter != null;
        Optional<List<Type>> resultTypes = converter.convertTypes(op.getResultTypes());
        if (resultTypes.isEmpty()) {
            return rewriter.notifyMatchFailure(op, "result types have no conversion");
        }
        rewriter.replaceOpWithNew(op, new Insn(op.op, operands)
                .returning(resultTypes.get())
                .jumpsTo(op.getSuccessors()));
        return true;
    }
}
