package io.github.eutro.lowerj.passes.async;

import io.github.eutro.lowerj.conversion.ConversionPattern;
import io.github.eutro.lowerj.conversion.ConversionRewriter;
import io.github.eutro.lowerj.conversion.RewritePatternSet;
import io.github.eutro.lowerj.conversion.TypeConverter;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.AsyncOps;
import io.github.eutro.lowerj.ops.LlvmOps;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.Types;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Lowers the coroutine primitives to low-level coroutine intrinsics and allocator calls.
 */
public class CoroutineLowerings {
    /**
     * The code the suspend intrinsic returns when the coroutine is resumed.
     */
    public static final int RESUME_CODE = 0;
    /**
     * The code the suspend intrinsic returns when the coroutine is destroyed.
     */
    public static final int CLEANUP_CODE = 1;

    public static void populate(TypeConverter converter, AsyncRuntimeApi api, RewritePatternSet patterns) {
        patterns.add(
                new CoroIdLowering(converter),
                new CoroBeginLowering(converter, api),
                new CoroFreeLowering(converter, api),
                new CoroEndLowering(converter),
                new CoroSaveLowering(converter),
                new CoroSuspendLowering(converter)
        );
    }

    /**
     * {@code coro.id} becomes the id intrinsic, with zero alignment and null promise and function pointers.
     */
    public static class CoroIdLowering extends ConversionPattern {
        public CoroIdLowering(TypeConverter converter) {
            super(AsyncOps.CORO_ID, converter);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            Var zero = rewriter.insertResult(LlvmOps.constant(0, Types.I32));
            Var nullPtr = rewriter.insertResult(LlvmOps.nullPtr(Types.OPAQUE_PTR));
            rewriter.replaceOpWithNew(op, LlvmOps.coroId(zero, nullPtr, nullPtr, nullPtr));
            return true;
        }
    }

    /**
     * {@code coro.begin} allocates a frame of the size the size intrinsic gives, then begins the coroutine in it.
     */
    public static class CoroBeginLowering extends ConversionPattern {
        private final AsyncRuntimeApi api;

        public CoroBeginLowering(TypeConverter converter, AsyncRuntimeApi api) {
            super(AsyncOps.CORO_BEGIN, converter);
            this.api = api;
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            FunctionType mallocType = api.ensureMalloc(rewriter);
            Var size = rewriter.insertResult(LlvmOps.coroSize());
            Var mem = rewriter.insertResult(LlvmOps.call(AsyncRuntimeApi.MALLOC, mallocType, size));
            rewriter.replaceOpWithNew(op, LlvmOps.coroBegin(operands.get(0), mem));
            return true;
        }
    }

    /**
     * {@code coro.free} frees the frame memory the free intrinsic gives.
     */
    public static class CoroFreeLowering extends ConversionPattern {
        private final AsyncRuntimeApi api;

        public CoroFreeLowering(TypeConverter converter, AsyncRuntimeApi api) {
            super(AsyncOps.CORO_FREE, converter);
            this.api = api;
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            FunctionType freeType = api.ensureFree(rewriter);
            Var mem = rewriter.insertResult(LlvmOps.coroFree(operands.get(0), operands.get(1)));
            rewriter.insert(LlvmOps.call(AsyncRuntimeApi.FREE, freeType, mem));
            rewriter.eraseOp(op);
            return true;
        }
    }

    /**
     * {@code coro.end} becomes the end intrinsic, outside of any unwind sequence.
     */
    public static class CoroEndLowering extends ConversionPattern {
        public CoroEndLowering(TypeConverter converter) {
            super(AsyncOps.CORO_END, converter);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            Var unwind = rewriter.insertResult(LlvmOps.constant(false, Types.I1));
            rewriter.insert(LlvmOps.coroEnd(operands.get(0), unwind));
            rewriter.eraseOp(op);
            return true;
        }
    }

    public static class CoroSaveLowering extends ConversionPattern {
        public CoroSaveLowering(TypeConverter converter) {
            super(AsyncOps.CORO_SAVE, converter);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            rewriter.replaceOpWithNew(op, LlvmOps.coroSave(operands.get(0)));
            return true;
        }
    }

    /**
     * {@code coro.suspend} becomes the (non-final) suspend intrinsic, and a switch on its
     * sign-extended result code: {@link #RESUME_CODE} to the resume block, {@link #CLEANUP_CODE} to
     * the cleanup block, and anything else to the suspend block.
     */
    public static class CoroSuspendLowering extends ConversionPattern {
        public CoroSuspendLowering(TypeConverter converter) {
            super(AsyncOps.CORO_SUSPEND, converter);
        }

        @Override
        public boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter) {
            List<BasicBlock> successors = op.getSuccessors();
            if (successors.size() != 3) {
                return rewriter.notifyMatchFailure(op, "expected suspend, resume and cleanup successors");
            }
            BasicBlock suspend = successors.get(0);
            BasicBlock resume = successors.get(1);
            BasicBlock cleanup = successors.get(2);

            Var isFinal = rewriter.insertResult(LlvmOps.constant(false, Types.I1));
            Var code = rewriter.insertResult(LlvmOps.coroSuspend(operands.get(0), isFinal));
            Var selector = rewriter.insertResult(LlvmOps.sext(code, Types.I32));
            rewriter.insert(LlvmOps.switchOn(selector, suspend,
                    Arrays.asList(RESUME_CODE, CLEANUP_CODE),
                    Arrays.asList(resume, cleanup)));
            rewriter.replaceOp(op, Collections.emptyList());
            return true;
        }
    }
}
