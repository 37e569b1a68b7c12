package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.types.AsyncValueType;
import io.github.eutro.lowerj.types.Type;
import io.github.eutro.lowerj.types.Types;

import java.util.ArrayList;
import java.util.List;

/**
 * Asynchronous operations: the high-level {@code execute}/{@code await} construct, the coroutine
 * primitives it is elaborated into, and the runtime operations on tokens, values and groups.
 */
public class AsyncOps {
    public static final Dialect DIALECT = new Dialect("async");

    /**
     * Runs its region asynchronously. The immediate is the number of leading token operands it
     * depends on; the rest are async values whose payloads the region's entry block takes.
     * Results are a token, followed by an async value for each value the body yields.
     */
    public static final UnaryOpKey<Integer> EXECUTE = new UnaryOpKey<>(DIALECT, "execute");
    /**
     * Effect: blocks until its token or value operand is ready, returning the payload of a value.
     */
    public static final SimpleOpKey AWAIT = new SimpleOpKey(DIALECT, "await");
    /**
     * Control: ends the body of an {@link #EXECUTE}, giving the payloads of its values.
     */
    public static final SimpleOpKey YIELD = CommonExts.markTerminator(new SimpleOpKey(DIALECT, "yield"));

    /**
     * Effect: returns the identity of the current coroutine.
     */
    public static final SimpleOpKey CORO_ID = new SimpleOpKey(DIALECT, "coro.id");
    /**
     * Effect: allocates the coroutine frame for an id, returning its handle.
     */
    public static final SimpleOpKey CORO_BEGIN = new SimpleOpKey(DIALECT, "coro.begin");
    /**
     * Effect: releases the frame of (id, handle).
     */
    public static final SimpleOpKey CORO_FREE = new SimpleOpKey(DIALECT, "coro.free");
    /**
     * Effect: marks the end of the coroutine with the given handle.
     */
    public static final SimpleOpKey CORO_END = new SimpleOpKey(DIALECT, "coro.end");
    /**
     * Effect: saves the state of the coroutine with the given handle, for a following suspend.
     */
    public static final SimpleOpKey CORO_SAVE = new SimpleOpKey(DIALECT, "coro.save");
    /**
     * Control: suspends the coroutine at a saved state. Successors are the suspend, resume
     * and cleanup blocks, in that order.
     */
    public static final SimpleOpKey CORO_SUSPEND = CommonExts.markTerminator(new SimpleOpKey(DIALECT, "coro.suspend"));

    /**
     * Effect: creates a token, group or value, determined by the result type.
     */
    public static final SimpleOpKey RUNTIME_CREATE = new SimpleOpKey(DIALECT, "runtime.create");
    /**
     * Effect: marks a token or value as ready.
     */
    public static final SimpleOpKey RUNTIME_SET_AVAILABLE = new SimpleOpKey(DIALECT, "runtime.set_available");
    /**
     * Effect: blocks until a token, value or group is ready.
     */
    public static final SimpleOpKey RUNTIME_AWAIT = new SimpleOpKey(DIALECT, "runtime.await");
    /**
     * Effect: resumes the coroutine handle (operand 1) once a token, value or group (operand 0) is ready.
     */
    public static final SimpleOpKey RUNTIME_AWAIT_AND_RESUME = new SimpleOpKey(DIALECT, "runtime.await_and_resume");
    /**
     * Effect: resumes a coroutine handle on a runtime-managed thread.
     */
    public static final SimpleOpKey RUNTIME_RESUME = new SimpleOpKey(DIALECT, "runtime.resume");
    /**
     * Effect: stores a payload (operand 0) into a value (operand 1).
     */
    public static final SimpleOpKey RUNTIME_STORE = new SimpleOpKey(DIALECT, "runtime.store");
    /**
     * Effect: loads the payload of a value.
     */
    public static final SimpleOpKey RUNTIME_LOAD = new SimpleOpKey(DIALECT, "runtime.load");
    /**
     * Effect: adds a token (operand 0) to a group (operand 1), returning its rank in the group.
     */
    public static final SimpleOpKey RUNTIME_ADD_TO_GROUP = new SimpleOpKey(DIALECT, "runtime.add_to_group");
    /**
     * Effect: increments the reference count of a runtime handle by the immediate.
     */
    public static final UnaryOpKey<Integer> RUNTIME_ADD_REF = new UnaryOpKey<>(DIALECT, "runtime.add_ref");
    /**
     * Effect: decrements the reference count of a runtime handle by the immediate.
     */
    public static final UnaryOpKey<Integer> RUNTIME_DROP_REF = new UnaryOpKey<>(DIALECT, "runtime.drop_ref");

    /**
     * Create a detached execute operation with an entry block for its body.
     *
     * @param dependencies The tokens to wait for.
     * @param operands     The async values whose payloads the body takes.
     * @param resultTypes  The payload types of the values the body yields.
     * @return The operation.
     */
    public static Insn execute(List<Var> dependencies, List<Var> operands, List<Type> resultTypes) {
        List<Var> allOperands = new ArrayList<>(dependencies);
        allOperands.addAll(operands);
        List<Type> results = new ArrayList<>();
        results.add(Types.ASYNC_TOKEN);
        for (Type type : resultTypes) {
            results.add(Types.asyncValue(type));
        }
        Insn insn = EXECUTE.create(dependencies.size()).insn(allOperands).returning(results).withRegions(1);
        List<Type> argTypes = new ArrayList<>();
        for (Var operand : operands) {
            argTypes.add(((AsyncValueType) operand.getType()).payload);
        }
        insn.getRegion(0).newBlock(argTypes.toArray(new Type[0]));
        return insn;
    }

    public static Insn await(Var operand) {
        Insn insn = AWAIT.create().insn(operand);
        if (operand.getType() instanceof AsyncValueType) {
            insn.returning(((AsyncValueType) operand.getType()).payload);
        }
        return insn;
    }

    public static Insn yield(Var... values) {
        return YIELD.create().insn(values);
    }

    public static Insn coroId() {
        return CORO_ID.create().insn().returning(Types.CORO_ID);
    }

    public static Insn coroBegin(Var id) {
        return CORO_BEGIN.create().insn(id).returning(Types.CORO_HANDLE);
    }

    public static Insn coroFree(Var id, Var handle) {
        return CORO_FREE.create().insn(id, handle);
    }

    public static Insn coroEnd(Var handle) {
        return CORO_END.create().insn(handle);
    }

    public static Insn coroSave(Var handle) {
        return CORO_SAVE.create().insn(handle).returning(Types.CORO_STATE);
    }

    public static Insn coroSuspend(Var state, BasicBlock suspend, BasicBlock resume, BasicBlock cleanup) {
        return CORO_SUSPEND.create().insn(state).jumpsTo(suspend, resume, cleanup);
    }

    public static Insn create(Type type) {
        return RUNTIME_CREATE.create().insn().returning(type);
    }

    public static Insn setAvailable(Var operand) {
        return RUNTIME_SET_AVAILABLE.create().insn(operand);
    }

    public static Insn runtimeAwait(Var operand) {
        return RUNTIME_AWAIT.create().insn(operand);
    }

    public static Insn awaitAndResume(Var operand, Var handle) {
        return RUNTIME_AWAIT_AND_RESUME.create().insn(operand, handle);
    }

    public static Insn resume(Var handle) {
        return RUNTIME_RESUME.create().insn(handle);
    }

    public static Insn store(Var value, Var storage) {
        return RUNTIME_STORE.create().insn(value, storage);
    }

    public static Insn load(Var storage) {
        return RUNTIME_LOAD.create().insn(storage)
                .returning(((AsyncValueType) storage.getType()).payload);
    }

    public static Insn addToGroup(Var operand, Var group) {
        return RUNTIME_ADD_TO_GROUP.create().insn(operand, group).returning(Types.INDEX);
    }

    public static Insn addRef(Var operand, int count) {
        return RUNTIME_ADD_REF.create(count).insn(operand);
    }

    public static Insn dropRef(Var operand, int count) {
        return RUNTIME_DROP_REF.create(count).insn(operand);
    }
}
