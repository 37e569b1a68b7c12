package io.github.eutro.lowerj.passes.async;

import io.github.eutro.lowerj.conversion.ConversionPattern;
import io.github.eutro.lowerj.conversion.ConversionRewriter;
import io.github.eutro.lowerj.conversion.RewritePatternSet;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.AsyncOps;
import io.github.eutro.lowerj.ops.LlvmOps;
import io.github.eutro.lowerj.ops.OpKey;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.ops.UnaryOpKey;
import io.github.eutro.lowerj.types.AsyncValueType;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

import static io.github.eutro.lowerj.passes.async.AsyncRuntimeApi.Function.*;

/**
 * Lowers the runtime operations to calls into the async runtime.
 */
public class RuntimeLowerings {
    /**
     * Add the patterns.
     *
     * @param converter        Converts async types to their runtime representation.
     * @param payloadConverter Additionally converts payloads to their low-level representation,
     *                         for the operations that touch payload storage.
     * @param api              The runtime functions.
     * @param patterns         The set to add the patterns to.
     */
    public static void populate(TypeConverter converter, TypeConverter payloadConverter,
                                AsyncRuntimeApi api, RewritePatternSet patterns) {
        patterns.add(
                new SetAvailableLowering(converter, api),
                new AwaitLowering(converter, api),
                new AwaitAndResumeLowering(converter, api),
                new ResumeLowering(converter, api),
                new AddToGroupLowering(converter, api),
                new RefCountingLowering(AsyncOps.RUNTIME_ADD_REF, ADD_REF, converter, api),
                new RefCountingLowering(AsyncOps.RUNTIME_DROP_REF, DROP_REF, converter, api),
                new CreateLowering(payloadConverter, api),
                new StoreLowering(payloadConverter, api),
                new LoadLowering(payloadConverter, api)
        );
    }

    private static @Nullable AsyncRuntimeApi.Function pick(Type type,
                                                           AsyncRuntimeApi.Function ifToken,
                                                           AsyncRuntimeApi.Function ifValue,
                                                           @Nullable AsyncRuntimeApi.Function ifGroup) {
        if (type.equals(Types.ASYNC_TOKEN)) return ifToken;
        if (type instanceof AsyncValueType) return ifValue;
        if (type.equals(Types.ASYNC_GROUP)) return ifGroup;
        return null;
    }

    abstract static class RuntimePattern extends ConversionPattern {
        protected final AsyncRuntimeApi api;

        RuntimePattern(OpKey root, TypeConverter converter, AsyncRuntimeApi api) {
            super(root, converter);
            this.api = api;
        }

        protected TypeConverter converter() {
            TypeConverter converter = getTypeConverter();
            assert converter != null;
            return converter;
        }
    }

    /**
     * Creates a token, group or value. The storage size of a value's payload is computed as the
     * address of element one of a null pointer to the payload.
     */
    public static class CreateLowering extends RuntimePattern {
        public CreateLowering(TypeConverter payloadConverter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_CREATE, payloadConverter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            Type type = op.result().getType();
            if (type.equals(Types.ASYNC_TOKEN)) {
                rewriter.replaceOpWithNew(op, api.call(rewriter, CREATE_TOKEN));
                return true;
            }
            if (type.equals(Types.ASYNC_GROUP)) {
                rewriter.replaceOpWithNew(op, api.call(rewriter, CREATE_GROUP));
                return true;
            }
            if (type instanceof AsyncValueType) {
                Optional<Type> stored = converter().convertType(((AsyncValueType) type).payload);
                if (stored.isEmpty()) {
                    return rewriter.notifyMatchFailure(op, "payload type has no low-level representation");
                }
                Type storagePtr = Types.pointer(stored.get());
                Var nullPtr = rewriter.insertResult(LlvmOps.nullPtr(storagePtr));
                Var one = rewriter.insertResult(LlvmOps.constant(1, Types.I32));
                Var end = rewriter.insertResult(LlvmOps.gep(nullPtr, one));
                Var size = rewriter.insertResult(LlvmOps.ptrToInt(end, Types.I32));
                rewriter.replaceOpWithNew(op, api.call(rewriter, CREATE_VALUE, size));
                return true;
            }
            return rewriter.notifyMatchFailure(op, "unsupported async type");
        }
    }

    public static class SetAvailableLowering extends RuntimePattern {
        public SetAvailableLowering(TypeConverter converter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_SET_AVAILABLE, converter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            AsyncRuntimeApi.Function fn = pick(op.getOperands().get(0).getType(), EMPLACE_TOKEN, EMPLACE_VALUE, null);
            if (fn == null) return rewriter.notifyMatchFailure(op, "unsupported async type");
            rewriter.insert(api.call(rewriter, fn, operands.get(0)));
            rewriter.eraseOp(op);
            return true;
        }
    }

    public static class AwaitLowering extends RuntimePattern {
        public AwaitLowering(TypeConverter converter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_AWAIT, converter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            AsyncRuntimeApi.Function fn = pick(op.getOperands().get(0).getType(), AWAIT_TOKEN, AWAIT_VALUE, AWAIT_ALL_IN_GROUP);
            if (fn == null) return rewriter.notifyMatchFailure(op, "unsupported async type");
            rewriter.insert(api.call(rewriter, fn, operands.get(0)));
            rewriter.eraseOp(op);
            return true;
        }
    }

    /**
     * Registers the coroutine handle to be resumed, through the resume trampoline, once the operand is ready.
     */
    public static class AwaitAndResumeLowering extends RuntimePattern {
        public AwaitAndResumeLowering(TypeConverter converter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_AWAIT_AND_RESUME, converter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            AsyncRuntimeApi.Function fn = pick(op.getOperands().get(0).getType(),
                    AWAIT_TOKEN_AND_EXECUTE, AWAIT_VALUE_AND_EXECUTE, AWAIT_ALL_IN_GROUP_AND_EXECUTE);
            if (fn == null) return rewriter.notifyMatchFailure(op, "unsupported async type");
            api.ensureResumeFunction(rewriter);
            Var resumeFn = rewriter.insertResult(LlvmOps.addressOf(AsyncRuntimeApi.RESUME, AsyncRuntimeApi.RESUME_FUNCTION_PTR));
            rewriter.insert(api.call(rewriter, fn, operands.get(0), operands.get(1), resumeFn));
            rewriter.eraseOp(op);
            return true;
        }
    }

    /**
     * Hands the coroutine handle to the runtime, to be resumed through the resume trampoline.
     */
    public static class ResumeLowering extends RuntimePattern {
        public ResumeLowering(TypeConverter converter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_RESUME, converter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            api.ensureResumeFunction(rewriter);
            Var resumeFn = rewriter.insertResult(LlvmOps.addressOf(AsyncRuntimeApi.RESUME, AsyncRuntimeApi.RESUME_FUNCTION_PTR));
            rewriter.insert(api.call(rewriter, EXECUTE, operands.get(0), resumeFn));
            rewriter.eraseOp(op);
            return true;
        }
    }

    /**
     * Stores a payload through the value's storage pointer, reinterpreted as a pointer to the payload type.
     */
    public static class StoreLowering extends RuntimePattern {
        public StoreLowering(TypeConverter payloadConverter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_STORE, payloadConverter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            Optional<Type> stored = converter().convertType(op.getOperands().get(0).getType());
            if (stored.isEmpty()) {
                return rewriter.notifyMatchFailure(op, "failed to convert stored value type to a low-level type");
            }
            Var storage = rewriter.insertResult(api.call(rewriter, GET_VALUE_STORAGE, operands.get(1)));
            Var typed = rewriter.insertResult(LlvmOps.bitcast(storage, Types.pointer(stored.get())));
            rewriter.insert(LlvmOps.store(operands.get(0), typed));
            rewriter.eraseOp(op);
            return true;
        }
    }

    /**
     * Loads a payload through the value's storage pointer, reinterpreted as a pointer to the payload type.
     */
    public static class LoadLowering extends RuntimePattern {
        public LoadLowering(TypeConverter payloadConverter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_LOAD, payloadConverter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            Optional<Type> loaded = converter().convertType(op.result().getType());
            if (loaded.isEmpty()) {
                return rewriter.notifyMatchFailure(op, "failed to convert loaded value type to a low-level type");
            }
            Var storage = rewriter.insertResult(api.call(rewriter, GET_VALUE_STORAGE, operands.get(0)));
            Var typed = rewriter.insertResult(LlvmOps.bitcast(storage, Types.pointer(loaded.get())));
            rewriter.replaceOpWithNew(op, LlvmOps.load(typed, loaded.get()));
            return true;
        }
    }

    public static class AddToGroupLowering extends RuntimePattern {
        public AddToGroupLowering(TypeConverter converter, AsyncRuntimeApi api) {
            super(AsyncOps.RUNTIME_ADD_TO_GROUP, converter, api);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            if (!op.getOperands().get(0).getType().equals(Types.ASYNC_TOKEN)) {
                return rewriter.notifyMatchFailure(op, "only tokens can be added to a group");
            }
            rewriter.replaceOpWithNew(op, api.call(rewriter, ADD_TOKEN_TO_GROUP, operands.get(0), operands.get(1)));
            return true;
        }
    }

    /**
     * Adds or drops references, passing the count as an i32 constant.
     */
    public static class RefCountingLowering extends RuntimePattern {
        private final UnaryOpKey<Integer> key;
        private final AsyncRuntimeApi.Function function;

        public RefCountingLowering(UnaryOpKey<Integer> key, AsyncRuntimeApi.Function function,
                                   TypeConverter converter, AsyncRuntimeApi api) {
            super(key, converter, api);
            this.key = key;
            this.function = function;
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            int count = key.cast(op.op).arg;
            Var countVar = rewriter.insertResult(StdOps.constant(count, Types.I32));
            rewriter.insert(api.call(rewriter, function, operands.get(0), countVar));
            rewriter.eraseOp(op);
            return true;
        }
    }
}
