package io.github.eutro.lowerj.test;

import io.github.eutro.lowerj.conversion.ConversionReport;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Region;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.AsyncOps;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.passes.async.AsyncRuntimeApi;
import io.github.eutro.lowerj.passes.async.ConvertAsyncToLowLevel;
import io.github.eutro.lowerj.passes.meta.VerifyIR;
import io.github.eutro.lowerj.types.Types;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks that reference counting stays balanced along every path through a lowered suspend point.
 */
public class RefCountBalanceTest {
    /**
     * Builds a coroutine which acquires {@code token} before suspending, and releases it on the
     * suspend path, on the cleanup path, and in each of {@code n} branches after resuming.
     */
    static Module buildModule(int n) {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "f", Types.procedure(
                Types.ASYNC_TOKEN, Types.CORO_HANDLE, Types.I1));
        Region body = func.getRegion(0);
        BasicBlock entry = StdOps.entry(func);
        Var token = entry.getArgs().get(0);
        Var coro = entry.getArgs().get(1);
        Var cond = entry.getArgs().get(2);

        BasicBlock suspend = body.newBlock();
        BasicBlock resume = body.newBlock();
        BasicBlock cleanup = body.newBlock();

        IRBuilder ib = new IRBuilder(entry);
        ib.insert(AsyncOps.addRef(token, 1));
        Var state = ib.insertResult(AsyncOps.coroSave(coro));
        ib.insert(AsyncOps.coroSuspend(state, suspend, resume, cleanup));

        for (BasicBlock exit : new BasicBlock[]{suspend, cleanup}) {
            ib.setInsertionPointToEnd(exit);
            ib.insert(AsyncOps.dropRef(token, 1));
            ib.insert(StdOps.ret());
        }

        // resume dispatches to one of n arms
        List<BasicBlock> arms = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            BasicBlock arm = body.newBlock();
            new IRBuilder(arm).insert(AsyncOps.dropRef(token, 1));
            new IRBuilder(arm).insert(StdOps.ret());
            arms.add(arm);
        }
        BasicBlock dispatch = resume;
        for (int i = 0; i < n - 1; i++) {
            BasicBlock next = body.newBlock();
            new IRBuilder(dispatch).insert(Utils.condBr(cond, arms.get(i), next));
            dispatch = next;
        }
        new IRBuilder(dispatch).insert(Utils.br(arms.get(n - 1)));
        return module;
    }

    static int refDelta(Insn insn, Var token) {
        if (insn.op.key != StdOps.CALL) return 0;
        String callee = StdOps.CALL.cast(insn.op).arg.name;
        int sign;
        if (callee.equals(AsyncRuntimeApi.Function.ADD_REF.symbol)) {
            sign = 1;
        } else if (callee.equals(AsyncRuntimeApi.Function.DROP_REF.symbol)) {
            sign = -1;
        } else {
            return 0;
        }
        assertSame(token, insn.getOperands().get(0));
        Insn count = insn.getOperands().get(1).getDefiningInsn();
        assertNotNull(count);
        return sign * (Integer) StdOps.CONSTANT.cast(count.op).arg;
    }

    static int checkPaths(BasicBlock bb, Var token, int balance) {
        for (Insn insn : bb.getInsns()) {
            balance += refDelta(insn, token);
        }
        Insn terminator = bb.getTerminator();
        assertNotNull(terminator);
        List<BasicBlock> successors = terminator.getSuccessors();
        if (successors.isEmpty()) {
            assertEquals(0, balance, () -> "unbalanced at exit " + bb.toTargetString());
            return 1;
        }
        int paths = 0;
        for (BasicBlock succ : successors) {
            paths += checkPaths(succ, token, balance);
        }
        return paths;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 8})
    void testBalancedAfterSuspend(int n) {
        Module module = buildModule(n);
        ConversionReport report = ConvertAsyncToLowLevel.STRICT.run(module);
        assertTrue(report.succeeded());
        VerifyIR.INSTANCE.run(module);

        Insn func = module.lookupSymbol("f");
        assertNotNull(func);
        BasicBlock entry = StdOps.entry(func);
        Var token = entry.getArgs().get(0);

        long adds = Utils.callsTo(module, AsyncRuntimeApi.Function.ADD_REF.symbol).size();
        long drops = Utils.callsTo(module, AsyncRuntimeApi.Function.DROP_REF.symbol).size();
        assertEquals(1, adds);
        assertEquals(n + 2, drops);
        // one exit per arm, plus suspend and cleanup
        assertEquals(n + 2, checkPaths(entry, token, 0));
    }
}
