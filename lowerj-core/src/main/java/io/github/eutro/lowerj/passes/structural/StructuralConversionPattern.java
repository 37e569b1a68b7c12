package io.github.eutro.lowerj.passes.structural;

import io.github.eutro.lowerj.conversion.ConversionPattern;
import io.github.eutro.lowerj.conversion.ConversionRewriter;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.OpKey;
import io.github.eutro.lowerj.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts the types of an operation that owns regions.
 * <p>
 * A copy of the operation is made without its regions, with converted operands and result types.
 * The original regions are then moved, not copied, into the copy, so the operations nested in them
 * stay the same operations and keep their place in the worklist. Finally the entry block
 * arguments of each region are converted, and the original operation is replaced by the copy.
 */
public class StructuralConversionPattern extends ConversionPattern {
    /**
     * Computes the new result types of an operation.
     */
    @FunctionalInterface
    public interface ResultTypeComputer {
        /**
         * Compute the new result types.
         *
         * @param op        The operation.
         * @param converter The converter.
         * @return Exactly one type for each result, or empty if they cannot be converted.
         */
        Optional<List<Type>> compute(Insn op, TypeConverter converter);
    }

    /**
     * Converts each result type on its own.
     */
    public static final ResultTypeComputer ONE_TO_ONE = (op, converter) -> {
        List<Type> types = new ArrayList<>();
        for (Type type : op.getResultTypes()) {
            Optional<Type> converted = converter.convertType(type);
            if (converted.isEmpty()) return Optional.empty();
            types.add(converted.get());
        }
        return Optional.of(types);
    };

    private final ResultTypeComputer resultTypes;

    public StructuralConversionPattern(OpKey root, TypeConverter converter, ResultTypeComputer resultTypes) {
        super(root, converter);
        this.resultTypes = resultTypes;
    }

    public StructuralConversionPattern(OpKey root, TypeConverter converter) {
        this(root, converter, ONE_TO_ONE);
    }

    @Override
    public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
        TypeConverter converter = getTypeConverter();
        assert converter != null;
        Optional<List<Type>> newTypes = resultTypes.compute(op, converter);
        if (newTypes.isEmpty() || newTypes.get().size() != op.getResults().size()) {
            return rewriter.notifyMatchFailure(op, "not a 1:1 type conversion");
        }

        Insn newOp = rewriter.cloneWithoutRegions(op);
        for (int i = 0; i < op.getRegions().size(); i++) {
            rewriter.inlineRegionBefore(op.getRegion(i), newOp.getRegion(i), null);
        }
        for (int i = 0; i < newOp.getRegions().size(); i++) {
            if (!rewriter.convertRegionTypes(newOp.getRegion(i), converter)) {
                return rewriter.notifyMatchFailure(op, "could not convert region argument types");
            }
        }
        rewriter.setOperands(newOp, operands);
        List<Var> results = newOp.getResults();
        for (int i = 0; i < results.size(); i++) {
            rewriter.setType(results.get(i), newTypes.get().get(i));
        }
        rewriter.replaceOp(op, results);
        return true;
    }
}
