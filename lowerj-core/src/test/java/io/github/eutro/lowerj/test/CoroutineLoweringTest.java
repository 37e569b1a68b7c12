package io.github.eutro.lowerj.test;

import io.github.eutro.lowerj.conversion.ConversionReport;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Region;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.AsyncOps;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.ops.LlvmOps;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.passes.IRPass;
import io.github.eutro.lowerj.passes.async.AsyncRuntimeApi;
import io.github.eutro.lowerj.passes.async.ConvertAsyncToLowLevel;
import io.github.eutro.lowerj.passes.meta.VerifyIR;
import io.github.eutro.lowerj.types.Types;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CoroutineLoweringTest {
    static final IRPass<Module, ConversionReport> LOWER = VerifyIR.INSTANCE
            .then(ConvertAsyncToLowLevel.INSTANCE);

    /**
     * Where a switch jumps to for a selector value.
     */
    static BasicBlock switchTarget(Insn switchOp, int code) {
        List<Integer> cases = LlvmOps.SWITCH.cast(switchOp.op).arg;
        int i = cases.indexOf(code);
        return switchOp.getSuccessors().get(i + 1);
    }

    @Test
    void testSingleSuspend() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "coro", Types.procedure(Types.CORO_STATE));
        Region body = func.getRegion(0);
        BasicBlock entry = StdOps.entry(func);
        BasicBlock suspend = body.newBlock();
        BasicBlock resume = body.newBlock();
        BasicBlock cleanup = body.newBlock();
        IRBuilder ib = new IRBuilder(entry);
        Insn constant = ib.insert(StdOps.constant(7, Types.I32));
        ib.insert(AsyncOps.coroSuspend(entry.getArgs().get(0), suspend, resume, cleanup));
        for (BasicBlock bb : new BasicBlock[]{suspend, resume, cleanup}) {
            new IRBuilder(bb).insert(StdOps.ret());
        }

        ConversionReport report = LOWER.run(module);
        assertTrue(report.residual.isEmpty(), report::toString);

        assertEquals(0, Utils.countDialect(module, AsyncOps.DIALECT));
        assertTrue(Utils.ofKey(module, BuiltinOps.UNREALIZED_CAST).isEmpty(), module::toString);
        assertEquals(1, Utils.ofKey(module, LlvmOps.SEXT).size());
        List<Insn> switches = Utils.ofKey(module, LlvmOps.SWITCH);
        assertEquals(1, switches.size());
        Insn switchOp = switches.get(0);
        assertEquals(List.of(0, 1), LlvmOps.SWITCH.cast(switchOp.op).arg);
        assertSame(suspend, switchOp.getSuccessors().get(0));
        assertSame(entry, switchOp.getBlock());
        assertSame(switchOp, entry.getTerminator());

        // only the state operand changed, by being converted in place
        assertFalse(constant.isErased());
        assertSame(entry, constant.getBlock());
        Insn intrinsic = Utils.ofKey(module, LlvmOps.CORO_SUSPEND).get(0);
        assertSame(entry.getArgs().get(0), intrinsic.getOperands().get(0));
        assertEquals(Types.LLVM_TOKEN, entry.getArgs().get(0).getType());
        assertSame(intrinsic.result(), Utils.ofKey(module, LlvmOps.SEXT).get(0).getOperands().get(0));

        VerifyIR.INSTANCE.run(module);
    }

    @Test
    void testSuspendBranchCompleteness() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "coro", Types.procedure(Types.CORO_STATE));
        Region body = func.getRegion(0);
        BasicBlock entry = StdOps.entry(func);
        BasicBlock suspend = body.newBlock();
        BasicBlock resume = body.newBlock();
        BasicBlock cleanup = body.newBlock();
        new IRBuilder(entry).insert(AsyncOps.coroSuspend(entry.getArgs().get(0), suspend, resume, cleanup));
        for (BasicBlock bb : new BasicBlock[]{suspend, resume, cleanup}) {
            new IRBuilder(bb).insert(StdOps.ret());
        }
        LOWER.run(module);

        Insn switchOp = Utils.ofKey(module, LlvmOps.SWITCH).get(0);
        assertSame(resume, switchTarget(switchOp, 0));
        assertSame(cleanup, switchTarget(switchOp, 1));
        for (int other : new int[]{-1, 2, 3, Integer.MIN_VALUE, Integer.MAX_VALUE}) {
            assertSame(suspend, switchTarget(switchOp, other));
        }
        // a default and one target per case, nothing else
        List<Integer> cases = LlvmOps.SWITCH.cast(switchOp.op).arg;
        assertEquals(cases.size() + 1, switchOp.getSuccessors().size());
        assertEquals(3, switchOp.getSuccessors().size());
    }

    /**
     * A coroutine taking the full lifecycle: id, begin, save, suspend, and free and end on the way out.
     */
    static Module buildCoroutine() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "coro", Types.function(Types.CORO_HANDLE));
        Region body = func.getRegion(0);
        BasicBlock entry = StdOps.entry(func);
        BasicBlock suspend = body.newBlock();
        BasicBlock resume = body.newBlock();
        BasicBlock cleanup = body.newBlock();

        IRBuilder ib = new IRBuilder(entry);
        Var id = ib.insertResult(AsyncOps.coroId());
        Var handle = ib.insertResult(AsyncOps.coroBegin(id));
        Var state = ib.insertResult(AsyncOps.coroSave(handle));
        ib.insert(AsyncOps.coroSuspend(state, suspend, resume, cleanup));

        ib.setInsertionPointToEnd(suspend);
        ib.insert(AsyncOps.coroEnd(handle));
        ib.insert(StdOps.ret(handle));

        ib.setInsertionPointToEnd(resume);
        ib.insert(Utils.br(cleanup));

        ib.setInsertionPointToEnd(cleanup);
        ib.insert(AsyncOps.coroFree(id, handle));
        ib.insert(Utils.br(suspend));
        return module;
    }

    @Test
    void testCoroutineLifecycle() {
        Module module = buildCoroutine();
        ConversionReport report = LOWER.run(module);
        assertTrue(report.residual.isEmpty(), report::toString);
        assertEquals(0, Utils.countDialect(module, AsyncOps.DIALECT));

        Insn func = module.lookupSymbol("coro");
        assertNotNull(func);
        assertEquals(Types.function(Types.OPAQUE_PTR), StdOps.FUNC.cast(func.op).arg.type);

        Insn id = Utils.ofKey(module, LlvmOps.CORO_ID).get(0);
        Insn zero = id.getOperands().get(0).getDefiningInsn();
        assertNotNull(zero);
        assertEquals(0, LlvmOps.CONSTANT.cast(zero.op).arg);
        for (Var nullArg : id.getOperands().subList(1, 4)) {
            Insn def = nullArg.getDefiningInsn();
            assertNotNull(def);
            assertSame(LlvmOps.NULL, def.op.key);
        }

        Insn begin = Utils.ofKey(module, LlvmOps.CORO_BEGIN).get(0);
        assertSame(id.result(), begin.getOperands().get(0));
        Insn malloc = begin.getOperands().get(1).getDefiningInsn();
        assertNotNull(malloc);
        assertEquals(AsyncRuntimeApi.MALLOC, LlvmOps.CALL.cast(malloc.op).arg.name);
        Insn size = malloc.getOperands().get(0).getDefiningInsn();
        assertNotNull(size);
        assertSame(LlvmOps.CORO_SIZE, size.op.key);

        Insn save = Utils.ofKey(module, LlvmOps.CORO_SAVE).get(0);
        assertSame(begin.result(), save.getOperands().get(0));
        Insn suspend = Utils.ofKey(module, LlvmOps.CORO_SUSPEND).get(0);
        assertSame(save.result(), suspend.getOperands().get(0));

        Insn end = Utils.ofKey(module, LlvmOps.CORO_END).get(0);
        assertSame(begin.result(), end.getOperands().get(0));
        Insn unwind = end.getOperands().get(1).getDefiningInsn();
        assertNotNull(unwind);
        assertEquals(false, LlvmOps.CONSTANT.cast(unwind.op).arg);

        Insn free = Utils.ofKey(module, LlvmOps.CORO_FREE).get(0);
        assertSame(id.result(), free.getOperands().get(0));
        assertSame(begin.result(), free.getOperands().get(1));
        List<Insn> freeCalls = Utils.ofKey(module, LlvmOps.CALL);
        assertTrue(freeCalls.stream().anyMatch(call ->
                LlvmOps.CALL.cast(call.op).arg.name.equals(AsyncRuntimeApi.FREE)
                        && call.getOperands().get(0) == free.result()));

        // the handle is returned as the opaque pointer itself
        Insn ret = Utils.ofKey(module, StdOps.RETURN).get(0);
        assertSame(begin.result(), ret.getOperands().get(0));

        assertNotNull(module.lookupSymbol(AsyncRuntimeApi.MALLOC));
        assertNotNull(module.lookupSymbol(AsyncRuntimeApi.FREE));
        assertTrue(Utils.ofKey(module, BuiltinOps.UNREALIZED_CAST).isEmpty(), module::toString);
        VerifyIR.INSTANCE.run(module);
    }

    @Test
    void testAllocatorDeclaredOnce() {
        Module module = new Module();
        for (int i = 0; i < 3; i++) {
            Insn func = Utils.addFunc(module, "coro" + i, Types.procedure());
            IRBuilder ib = new IRBuilder(StdOps.entry(func));
            Var id = ib.insertResult(AsyncOps.coroId());
            Var handle = ib.insertResult(AsyncOps.coroBegin(id));
            ib.insert(AsyncOps.coroFree(id, handle));
            ib.insert(StdOps.ret());
        }
        ConvertAsyncToLowLevel.STRICT.run(module);

        long mallocs = Utils.ofKey(module, LlvmOps.FUNC).stream()
                .filter(insn -> LlvmOps.FUNC.cast(insn.op).arg.name.equals(AsyncRuntimeApi.MALLOC))
                .count();
        long frees = Utils.ofKey(module, LlvmOps.FUNC).stream()
                .filter(insn -> LlvmOps.FUNC.cast(insn.op).arg.name.equals(AsyncRuntimeApi.FREE))
                .count();
        assertEquals(1, mallocs);
        assertEquals(1, frees);
        assertEquals(3, Utils.ofKey(module, LlvmOps.CORO_BEGIN).size());
    }
}
