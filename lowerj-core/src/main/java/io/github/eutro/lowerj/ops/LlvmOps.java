package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The low-level target vocabulary: memory, casts, branches and coroutine intrinsics.
 */
public class LlvmOps {
    public static final Dialect DIALECT = new Dialect("llvm");

    /**
     * Defines or declares a function, like {@link StdOps#FUNC}.
     */
    public static final UnaryOpKey<FuncSignature> FUNC = new UnaryOpKey<>(DIALECT, "func");
    public static final UnaryOpKey<Callee> CALL = new UnaryOpKey<>(DIALECT, "call");
    public static final UnaryOpKey<Object> CONSTANT = CommonExts.markPure(new UnaryOpKey<Object>(DIALECT, "constant"));
    public static final SimpleOpKey NULL = CommonExts.markPure(new SimpleOpKey(DIALECT, "null"));
    /**
     * Effect: offsets a pointer (operand 0) by a number of elements (operand 1).
     */
    public static final SimpleOpKey GEP = CommonExts.markPure(new SimpleOpKey(DIALECT, "getelementptr"));
    public static final SimpleOpKey PTR_TO_INT = CommonExts.markPure(new SimpleOpKey(DIALECT, "ptrtoint"));
    public static final SimpleOpKey BITCAST = CommonExts.markPure(new SimpleOpKey(DIALECT, "bitcast"));
    public static final SimpleOpKey SEXT = CommonExts.markPure(new SimpleOpKey(DIALECT, "sext"));
    public static final SimpleOpKey LOAD = new SimpleOpKey(DIALECT, "load");
    /**
     * Effect: stores a value (operand 0) at a pointer (operand 1).
     */
    public static final SimpleOpKey STORE = new SimpleOpKey(DIALECT, "store");
    /**
     * Effect: returns a pointer to the global symbol named by the immediate.
     */
    public static final UnaryOpKey<String> ADDRESS_OF = CommonExts.markPure(new UnaryOpKey<String>(DIALECT, "mlir.addressof", s -> "@" + s));

    /**
     * Control: multi-way branch on an integer. The first successor is the default, and
     * each following successor is taken for the case value at the same position in the immediate.
     */
    public static final UnaryOpKey<List<Integer>> SWITCH = CommonExts.markTerminator(new UnaryOpKey<List<Integer>>(DIALECT, "switch",
            cases -> cases.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"))));
    public static final SimpleOpKey RETURN = CommonExts.markTerminator(new SimpleOpKey(DIALECT, "return"));

    public static final SimpleOpKey CORO_ID = new SimpleOpKey(DIALECT, "intr.coro.id");
    public static final SimpleOpKey CORO_BEGIN = new SimpleOpKey(DIALECT, "intr.coro.begin");
    public static final SimpleOpKey CORO_SIZE = new SimpleOpKey(DIALECT, "intr.coro.size");
    public static final SimpleOpKey CORO_FREE = new SimpleOpKey(DIALECT, "intr.coro.free");
    public static final SimpleOpKey CORO_END = new SimpleOpKey(DIALECT, "intr.coro.end");
    public static final SimpleOpKey CORO_SAVE = new SimpleOpKey(DIALECT, "intr.coro.save");
    /**
     * Effect: suspends at a saved state (operand 0), with an i1 final-suspend flag (operand 1).
     * Returns an i8 code: 0 when resumed, 1 when destroyed, -1 when suspended.
     */
    public static final SimpleOpKey CORO_SUSPEND = new SimpleOpKey(DIALECT, "intr.coro.suspend");
    public static final SimpleOpKey CORO_RESUME = new SimpleOpKey(DIALECT, "intr.coro.resume");

    static {
        FUNC.attachExt(CommonExts.SYMBOL_NAME, op -> FUNC.cast(op).arg.name);
    }

    /**
     * Create a detached function declaration, with no body.
     *
     * @param name      The symbol.
     * @param type      The type.
     * @param isPrivate Whether the function is private to the module.
     * @return The declaration.
     */
    public static Insn declare(String name, FunctionType type, boolean isPrivate) {
        return FUNC.create(new FuncSignature(name, type, isPrivate)).insn().withRegions(1);
    }

    /**
     * Create a detached function definition with an entry block taking the parameters.
     *
     * @param name      The symbol.
     * @param type      The type.
     * @param isPrivate Whether the function is private to the module.
     * @return The function.
     */
    public static Insn func(String name, FunctionType type, boolean isPrivate) {
        Insn insn = declare(name, type, isPrivate);
        insn.getRegion(0).newBlock(type.params.toArray(new Type[0]));
        return insn;
    }

    public static Insn call(String name, FunctionType type, Var... args) {
        return CALL.create(new Callee(name, type)).insn(args).returning(type.results);
    }

    public static Insn constant(Object value, Type type) {
        return CONSTANT.create(value).insn().returning(type);
    }

    public static Insn nullPtr(Type ptrType) {
        return NULL.create().insn().returning(ptrType);
    }

    public static Insn gep(Var ptr, Var offset) {
        return GEP.create().insn(ptr, offset).returning(ptr.getType());
    }

    public static Insn ptrToInt(Var ptr, Type type) {
        return PTR_TO_INT.create().insn(ptr).returning(type);
    }

    public static Insn bitcast(Var value, Type type) {
        return BITCAST.create().insn(value).returning(type);
    }

    public static Insn sext(Var value, Type type) {
        return SEXT.create().insn(value).returning(type);
    }

    public static Insn load(Var ptr, Type type) {
        return LOAD.create().insn(ptr).returning(type);
    }

    public static Insn store(Var value, Var ptr) {
        return STORE.create().insn(value, ptr);
    }

    public static Insn addressOf(String symbol, Type type) {
        return ADDRESS_OF.create(symbol).insn().returning(type);
    }

    /**
     * Create a detached switch.
     *
     * @param selector    The integer to switch on.
     * @param dflt        The block to jump to if no case matches.
     * @param caseValues  The case values.
     * @param caseTargets The block to jump to for each case.
     * @return The switch.
     */
    public static Insn switchOn(Var selector, BasicBlock dflt, List<Integer> caseValues, List<BasicBlock> caseTargets) {
        if (caseValues.size() != caseTargets.size()) {
            throw new IllegalArgumentException("mismatched case values and targets");
        }
        List<BasicBlock> targets = new ArrayList<>();
        targets.add(dflt);
        targets.addAll(caseTargets);
        return SWITCH.create(List.copyOf(caseValues)).insn(selector).jumpsTo(targets);
    }

    public static Insn ret(Var... values) {
        return RETURN.create().insn(values);
    }

    public static Insn coroId(Var align, Var promise, Var coroAddr, Var fnAddrs) {
        return CORO_ID.create().insn(align, promise, coroAddr, fnAddrs).returning(Types.LLVM_TOKEN);
    }

    public static Insn coroBegin(Var id, Var mem) {
        return CORO_BEGIN.create().insn(id, mem).returning(Types.OPAQUE_PTR);
    }

    public static Insn coroSize() {
        return CORO_SIZE.create().insn().returning(Types.I64);
    }

    public static Insn coroFree(Var id, Var handle) {
        return CORO_FREE.create().insn(id, handle).returning(Types.OPAQUE_PTR);
    }

    public static Insn coroEnd(Var handle, Var unwind) {
        return CORO_END.create().insn(handle, unwind).returning(Types.I1);
    }

    public static Insn coroSave(Var handle) {
        return CORO_SAVE.create().insn(handle).returning(Types.LLVM_TOKEN);
    }

    public static Insn coroSuspend(Var state, Var isFinal) {
        return CORO_SUSPEND.create().insn(state, isFinal).returning(Types.I8);
    }

    public static Insn coroResume(Var handle) {
        return CORO_RESUME.create().insn(handle);
    }
}
