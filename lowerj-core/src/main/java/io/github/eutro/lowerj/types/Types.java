package io.github.eutro.lowerj.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Factories and constants for all the {@link Type}s the IR knows about.
 */
public class Types {
    /**
     * The dialect of builtin types: integers, floats, {@code index} and function types.
     */
    public static final String BUILTIN = "builtin";
    /**
     * The dialect of asynchronous types.
     */
    public static final String ASYNC = "async";
    /**
     * The dialect of low-level target types.
     */
    public static final String LLVM = "llvm";

    public static final IntegerType I1 = new IntegerType(1);
    public static final IntegerType I8 = new IntegerType(8);
    public static final IntegerType I32 = new IntegerType(32);
    public static final IntegerType I64 = new IntegerType(64);
    public static final FloatType F32 = new FloatType(32);
    public static final FloatType F64 = new FloatType(64);
    /**
     * The platform-sized integer type used for loop bounds and induction variables.
     */
    public static final NamedType INDEX = new NamedType(BUILTIN, "index");

    /**
     * A payload-less completion signal.
     */
    public static final NamedType ASYNC_TOKEN = new NamedType(ASYNC, "token");
    /**
     * A join barrier over a number of tokens.
     */
    public static final NamedType ASYNC_GROUP = new NamedType(ASYNC, "group");
    /**
     * The identity of a coroutine.
     */
    public static final NamedType CORO_ID = new NamedType(ASYNC, "coro.id");
    /**
     * The saved state of a coroutine at a suspension point.
     */
    public static final NamedType CORO_STATE = new NamedType(ASYNC, "coro.state");
    /**
     * The handle of a coroutine frame.
     */
    public static final NamedType CORO_HANDLE = new NamedType(ASYNC, "coro.handle");

    /**
     * The low-level token type, produced by coroutine intrinsics.
     */
    public static final NamedType LLVM_TOKEN = new NamedType(LLVM, "token");
    /**
     * The low-level unit type.
     */
    public static final NamedType LLVM_VOID = new NamedType(LLVM, "void");
    /**
     * {@code !llvm.ptr<i8>}: the type every runtime handle is erased to.
     */
    public static final PointerType OPAQUE_PTR = new PointerType(I8);

    /**
     * Get the integer type of the given width.
     *
     * @param width The width in bits.
     * @return The type.
     */
    public static IntegerType integer(int width) {
        switch (width) {
            case 1:
                return I1;
            case 8:
                return I8;
            case 32:
                return I32;
            case 64:
                return I64;
            default:
                return new IntegerType(width);
        }
    }

    /**
     * Get {@code !async.value<payload>}.
     *
     * @param payload The payload type.
     * @return The type.
     */
    public static AsyncValueType asyncValue(Type payload) {
        return new AsyncValueType(payload);
    }

    /**
     * Get {@code !llvm.ptr<pointee>}.
     *
     * @param pointee The pointee type.
     * @return The type.
     */
    public static PointerType pointer(Type pointee) {
        return new PointerType(pointee);
    }

    /**
     * Get the function type from {@code params} to {@code results}.
     *
     * @param params  The parameter types.
     * @param results The result types.
     * @return The type.
     */
    public static FunctionType function(List<Type> params, List<Type> results) {
        return new FunctionType(params, results);
    }

    /**
     * Get the function type from {@code params} to a single result.
     *
     * @param result The result type.
     * @param params The parameter types.
     * @return The type.
     */
    public static FunctionType function(Type result, Type... params) {
        return new FunctionType(Arrays.asList(params), Collections.singletonList(result));
    }

    /**
     * Get the function type from {@code params} to nothing.
     *
     * @param params The parameter types.
     * @return The type.
     */
    public static FunctionType procedure(Type... params) {
        return new FunctionType(Arrays.asList(params), Collections.emptyList());
    }

    /**
     * Whether the type belongs to the asynchronous family.
     *
     * @param type The type.
     * @return Whether it is an async type.
     */
    public static boolean isAsync(Type type) {
        return ASYNC.equals(type.getDialect());
    }
}
