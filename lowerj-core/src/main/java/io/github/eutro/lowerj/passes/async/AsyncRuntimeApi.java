package io.github.eutro.lowerj.passes.async;

import io.github.eutro.lowerj.conversion.ConversionRewriter;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.LlvmOps;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.PointerType;
import io.github.eutro.lowerj.types.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.github.eutro.lowerj.types.Types.I32;
import static io.github.eutro.lowerj.types.Types.I64;
import static io.github.eutro.lowerj.types.Types.OPAQUE_PTR;

/**
 * The functions the lowered program calls at run time: the async runtime, the allocator,
 * and the coroutine resume trampoline.
 * <p>
 * Declarations are added to a module lazily, through the rewriter of the pattern that first
 * needs them, and at most once.
 */
public final class AsyncRuntimeApi {
    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncRuntimeApi.class);

    /**
     * The type of the resume trampoline: takes a coroutine handle, returns nothing.
     */
    public static final FunctionType RESUME_FUNCTION_TYPE = Types.procedure(OPAQUE_PTR);
    /**
     * The type of a pointer to the resume trampoline, passed to the runtime as a continuation.
     */
    public static final PointerType RESUME_FUNCTION_PTR = Types.pointer(RESUME_FUNCTION_TYPE);

    public static final String MALLOC = "malloc";
    public static final String FREE = "free";
    public static final String RESUME = "__resume";

    /**
     * The async runtime functions, with their lowered types. Every runtime handle is an opaque pointer.
     */
    public enum Function {
        ADD_REF("mlirAsyncRuntimeAddRef", Types.procedure(OPAQUE_PTR, I32)),
        DROP_REF("mlirAsyncRuntimeDropRef", Types.procedure(OPAQUE_PTR, I32)),
        CREATE_TOKEN("mlirAsyncRuntimeCreateToken", Types.function(OPAQUE_PTR)),
        CREATE_VALUE("mlirAsyncRuntimeCreateValue", Types.function(OPAQUE_PTR, I32)),
        CREATE_GROUP("mlirAsyncRuntimeCreateGroup", Types.function(OPAQUE_PTR)),
        EMPLACE_TOKEN("mlirAsyncRuntimeEmplaceToken", Types.procedure(OPAQUE_PTR)),
        EMPLACE_VALUE("mlirAsyncRuntimeEmplaceValue", Types.procedure(OPAQUE_PTR)),
        AWAIT_TOKEN("mlirAsyncRuntimeAwaitToken", Types.procedure(OPAQUE_PTR)),
        AWAIT_VALUE("mlirAsyncRuntimeAwaitValue", Types.procedure(OPAQUE_PTR)),
        AWAIT_ALL_IN_GROUP("mlirAsyncRuntimeAwaitAllInGroup", Types.procedure(OPAQUE_PTR)),
        EXECUTE("mlirAsyncRuntimeExecute", Types.procedure(OPAQUE_PTR, RESUME_FUNCTION_PTR)),
        GET_VALUE_STORAGE("mlirAsyncRuntimeGetValueStorage", Types.function(OPAQUE_PTR, OPAQUE_PTR)),
        ADD_TOKEN_TO_GROUP("mlirAsyncRuntimeAddTokenToGroup", Types.function(I64, OPAQUE_PTR, OPAQUE_PTR)),
        AWAIT_TOKEN_AND_EXECUTE("mlirAsyncRuntimeAwaitTokenAndExecute",
                Types.procedure(OPAQUE_PTR, OPAQUE_PTR, RESUME_FUNCTION_PTR)),
        AWAIT_VALUE_AND_EXECUTE("mlirAsyncRuntimeAwaitValueAndExecute",
                Types.procedure(OPAQUE_PTR, OPAQUE_PTR, RESUME_FUNCTION_PTR)),
        AWAIT_ALL_IN_GROUP_AND_EXECUTE("mlirAsyncRuntimeAwaitAllInGroupAndExecute",
                Types.procedure(OPAQUE_PTR, OPAQUE_PTR, RESUME_FUNCTION_PTR)),
        ;

        public final String symbol;
        public final FunctionType type;

        Function(String symbol, FunctionType type) {
            this.symbol = symbol;
            this.type = type;
        }
    }

    private final Module module;

    public AsyncRuntimeApi(Module module) {
        this.module = module;
    }

    /**
     * Create a detached call to a runtime function, declaring it if it is not yet.
     *
     * @param rewriter The rewriter to declare the function with.
     * @param function The function.
     * @param args     The arguments.
     * @return The call.
     */
    public Insn call(ConversionRewriter rewriter, Function function, Var... args) {
        if (module.lookupSymbol(function.symbol) == null) {
            insertAtModuleEnd(rewriter, StdOps.declare(function.symbol, function.type));
        }
        return StdOps.call(function.symbol, function.type, args);
    }

    /**
     * Declare {@code malloc}, if it is not declared yet.
     *
     * @param rewriter The rewriter to declare it with.
     * @return The type of {@code malloc}.
     */
    public FunctionType ensureMalloc(ConversionRewriter rewriter) {
        FunctionType type = Types.function(OPAQUE_PTR, I64);
        if (module.lookupSymbol(MALLOC) == null) {
            insertAtModuleEnd(rewriter, LlvmOps.declare(MALLOC, type, false));
        }
        return type;
    }

    /**
     * Declare {@code free}, if it is not declared yet.
     *
     * @param rewriter The rewriter to declare it with.
     * @return The type of {@code free}.
     */
    public FunctionType ensureFree(ConversionRewriter rewriter) {
        FunctionType type = Types.procedure(OPAQUE_PTR);
        if (module.lookupSymbol(FREE) == null) {
            insertAtModuleEnd(rewriter, LlvmOps.declare(FREE, type, false));
        }
        return type;
    }

    /**
     * Define the resume trampoline, if it is not defined yet. It resumes the coroutine
     * handle it is given, so that it can be passed to the runtime as a plain function pointer.
     *
     * @param rewriter The rewriter to define it with.
     */
    public void ensureResumeFunction(ConversionRewriter rewriter) {
        if (module.lookupSymbol(RESUME) != null) return;
        Insn resume = LlvmOps.func(RESUME, RESUME_FUNCTION_TYPE, true);
        BasicBlock entry = resume.getRegion(0).getEntryBlock();
        assert entry != null;
        IRBuilder ib = new IRBuilder(entry);
        ib.insert(LlvmOps.coroResume(entry.getArgs().get(0)));
        ib.insert(LlvmOps.ret());
        insertAtModuleEnd(rewriter, resume);
    }

    private void insertAtModuleEnd(ConversionRewriter rewriter, Insn decl) {
        BasicBlock savedBlock = rewriter.getBlock();
        Insn savedAnchor = rewriter.getAnchor();
        rewriter.setInsertionPointToEnd(module.getBlock());
        rewriter.insert(decl);
        rewriter.setInsertionPoint(savedBlock, savedAnchor);
        LOGGER.debug("declared {}", decl.op);
    }
}
