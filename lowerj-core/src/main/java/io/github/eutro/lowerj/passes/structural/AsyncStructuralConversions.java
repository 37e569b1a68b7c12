package io.github.eutro.lowerj.passes.structural;

import io.github.eutro.lowerj.conversion.ConversionTarget;
import io.github.eutro.lowerj.conversion.RewritePatternSet;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ops.AsyncOps;
import io.github.eutro.lowerj.types.AsyncValueType;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;

import java.util.Optional;

/**
 * Type conversion of the payloads carried by {@code execute}, {@code await} and {@code yield},
 * leaving the asynchronous types themselves in place.
 */
public class AsyncStructuralConversions {
    /**
     * Add the patterns and legality rules, and teach the converter to convert the payload
     * of async values, keeping tokens as they are.
     *
     * @param converter The converter, which is extended.
     * @param patterns  The set to add the patterns to.
     * @param target    The target to add the legality rules to.
     */
    public static void populate(TypeConverter converter, RewritePatternSet patterns, ConversionTarget target) {
        converter.addConversion(type -> type.equals(Types.ASYNC_TOKEN) ? Optional.of(type) : null);
        converter.addConversion(type -> type instanceof AsyncValueType
                ? converter.convertType(((AsyncValueType) type).payload).<Type>map(Types::asyncValue)
                : null);

        patterns.add(
                new StructuralConversionPattern(AsyncOps.EXECUTE, converter),
                new PassThroughPattern(AsyncOps.AWAIT, converter),
                new PassThroughPattern(AsyncOps.YIELD, converter)
        );
        target.addDynamicallyLegalOp(op -> converter.isLegal(op), AsyncOps.EXECUTE, AsyncOps.AWAIT, AsyncOps.YIELD);
    }
}
