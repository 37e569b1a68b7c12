package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.types.FloatType;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.IntegerType;
import io.github.eutro.lowerj.types.PointerType;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;

import java.util.Optional;

/**
 * Converts builtin types to their low-level representation.
 * <p>
 * Integers, floats and low-level types are kept, {@code index} becomes {@code i64}, pointers and
 * function types are converted element-wise, through every layer on top of this converter.
 * Anything else, asynchronous types included, has no conversion unless another rule is layered on top.
 */
public class LowLevelTypeConverter extends TypeConverter {
    public LowLevelTypeConverter() {
        addConversion(type -> type instanceof IntegerType || type instanceof FloatType
                ? Optional.of(type) : null);
        addConversion(type -> type.equals(Types.INDEX) ? Optional.of(Types.I64) : null);
        addConversion(type -> type.equals(Types.LLVM_TOKEN) || type.equals(Types.LLVM_VOID)
                ? Optional.of(type) : null);
        addConversion(type -> type instanceof PointerType
                ? outermost().convertType(((PointerType) type).pointee).<Type>map(Types::pointer) : null);
        addConversion(type -> type instanceof FunctionType
                ? outermost().convertSignature((FunctionType) type).<Type>map(it -> it) : null);
    }
}
