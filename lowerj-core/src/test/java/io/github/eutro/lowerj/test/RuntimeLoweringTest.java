package io.github.eutro.lowerj.test;

import io.github.eutro.lowerj.conversion.ConversionReport;
import io.github.eutro.lowerj.conversion.LegalizationException;
import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.AsyncOps;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.ops.LlvmOps;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.passes.async.AsyncRuntimeApi;
import io.github.eutro.lowerj.passes.async.ConvertAsyncToLowLevel;
import io.github.eutro.lowerj.passes.meta.VerifyIR;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.Types;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static io.github.eutro.lowerj.passes.async.AsyncRuntimeApi.Function.*;
import static org.junit.jupiter.api.Assertions.*;

public class RuntimeLoweringTest {
    static Insn only(List<Insn> insns) {
        assertEquals(1, insns.size(), insns::toString);
        return insns.get(0);
    }

    static Insn def(Var var) {
        Insn def = var.getDefiningInsn();
        assertNotNull(def, var::toString);
        return def;
    }

    static long declarations(Module module, String symbol) {
        return Utils.ofKey(module, StdOps.FUNC).stream()
                .filter(insn -> StdOps.FUNC.cast(insn.op).arg.name.equals(symbol))
                .count();
    }

    @Test
    void testCreateValueSize() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "f", Types.procedure());
        IRBuilder ib = new IRBuilder(StdOps.entry(func));
        Var value = ib.insertResult(AsyncOps.create(Types.asyncValue(Types.INDEX)));
        ib.insert(AsyncOps.setAvailable(value));
        ib.insert(StdOps.ret());

        ConversionReport report = ConvertAsyncToLowLevel.INSTANCE.run(module);
        assertTrue(report.residual.isEmpty(), report::toString);

        Insn create = only(Utils.callsTo(module, CREATE_VALUE.symbol));
        Insn ptrToInt = def(create.getOperands().get(0));
        assertSame(LlvmOps.PTR_TO_INT, ptrToInt.op.key);
        assertEquals(Types.I32, ptrToInt.result().getType());
        Insn gep = def(ptrToInt.getOperands().get(0));
        assertSame(LlvmOps.GEP, gep.op.key);
        Insn nullPtr = def(gep.getOperands().get(0));
        assertSame(LlvmOps.NULL, nullPtr.op.key);
        // index payloads are stored as i64
        assertEquals(Types.pointer(Types.I64), nullPtr.result().getType());
        Insn one = def(gep.getOperands().get(1));
        assertEquals(1, LlvmOps.CONSTANT.cast(one.op).arg);

        Insn emplace = only(Utils.callsTo(module, EMPLACE_VALUE.symbol));
        assertSame(create.result(), emplace.getOperands().get(0));
        assertEquals(1, declarations(module, CREATE_VALUE.symbol));
        assertEquals(CREATE_VALUE.type, StdOps.FUNC.cast(module.lookupSymbol(CREATE_VALUE.symbol).op).arg.type);
        VerifyIR.INSTANCE.run(module);
    }

    @Test
    void testTokensAndGroups() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "f", Types.function(Types.INDEX));
        IRBuilder ib = new IRBuilder(StdOps.entry(func));
        Var token = ib.insertResult(AsyncOps.create(Types.ASYNC_TOKEN));
        Var group = ib.insertResult(AsyncOps.create(Types.ASYNC_GROUP));
        Var rank = ib.insertResult(AsyncOps.addToGroup(token, group));
        ib.insert(AsyncOps.setAvailable(token));
        ib.insert(AsyncOps.runtimeAwait(token));
        ib.insert(AsyncOps.runtimeAwait(group));
        ib.insert(StdOps.ret(rank));

        ConversionReport report = ConvertAsyncToLowLevel.STRICT.run(module);
        assertEquals(0, Utils.countDialect(module, AsyncOps.DIALECT));
        assertTrue(report.rewriteCount >= 6);

        Insn createToken = only(Utils.callsTo(module, CREATE_TOKEN.symbol));
        Insn createGroup = only(Utils.callsTo(module, CREATE_GROUP.symbol));
        Insn add = only(Utils.callsTo(module, ADD_TOKEN_TO_GROUP.symbol));
        assertEquals(Arrays.asList(createToken.result(), createGroup.result()), add.getOperands());
        assertEquals(Types.I64, add.result().getType());
        assertSame(createToken.result(), only(Utils.callsTo(module, EMPLACE_TOKEN.symbol)).getOperands().get(0));
        assertSame(createToken.result(), only(Utils.callsTo(module, AWAIT_TOKEN.symbol)).getOperands().get(0));
        assertSame(createGroup.result(), only(Utils.callsTo(module, AWAIT_ALL_IN_GROUP.symbol)).getOperands().get(0));

        // the rank is still returned as an index
        Insn ret = only(Utils.ofKey(module, StdOps.RETURN));
        Insn cast = def(ret.getOperands().get(0));
        assertTrue(BuiltinOps.isMaterialization(cast));
        assertSame(add.result(), cast.getOperands().get(0));
        assertEquals(Types.INDEX, cast.result().getType());
        VerifyIR.INSTANCE.run(module);
    }

    @Test
    void testStoreAndLoad() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "f", Types.function(Types.I32));
        IRBuilder ib = new IRBuilder(StdOps.entry(func));
        Var value = ib.insertResult(AsyncOps.create(Types.asyncValue(Types.I32)));
        Var five = ib.insertResult(StdOps.constant(5, Types.I32));
        ib.insert(AsyncOps.store(five, value));
        Var loaded = ib.insertResult(AsyncOps.load(value));
        ib.insert(StdOps.ret(loaded));

        ConversionReport report = ConvertAsyncToLowLevel.STRICT.run(module);
        assertTrue(report.succeeded());

        Insn create = only(Utils.callsTo(module, CREATE_VALUE.symbol));
        List<Insn> storages = Utils.callsTo(module, GET_VALUE_STORAGE.symbol);
        assertEquals(2, storages.size());
        for (Insn storage : storages) {
            assertSame(create.result(), storage.getOperands().get(0));
        }
        assertEquals(1, declarations(module, GET_VALUE_STORAGE.symbol));

        Insn store = only(Utils.ofKey(module, LlvmOps.STORE));
        assertSame(five, store.getOperands().get(0));
        Insn storeCast = def(store.getOperands().get(1));
        assertSame(LlvmOps.BITCAST, storeCast.op.key);
        assertEquals(Types.pointer(Types.I32), storeCast.result().getType());
        assertSame(storages.get(0).result(), storeCast.getOperands().get(0));

        Insn load = only(Utils.ofKey(module, LlvmOps.LOAD));
        assertEquals(Types.I32, load.result().getType());
        Insn loadCast = def(load.getOperands().get(0));
        assertSame(LlvmOps.BITCAST, loadCast.op.key);
        assertSame(storages.get(1).result(), loadCast.getOperands().get(0));

        assertSame(load.result(), only(Utils.ofKey(module, StdOps.RETURN)).getOperands().get(0));
        assertTrue(Utils.ofKey(module, BuiltinOps.UNREALIZED_CAST).isEmpty(), module::toString);
        VerifyIR.INSTANCE.run(module);
    }

    @Test
    void testResumeTrampoline() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "f", Types.procedure(
                Types.ASYNC_TOKEN, Types.asyncValue(Types.I32), Types.ASYNC_GROUP, Types.CORO_HANDLE));
        BasicBlock entry = StdOps.entry(func);
        List<Var> args = entry.getArgs();
        IRBuilder ib = new IRBuilder(entry);
        Var handle = args.get(3);
        for (int i = 0; i < 3; i++) {
            ib.insert(AsyncOps.awaitAndResume(args.get(i), handle));
        }
        ib.insert(AsyncOps.resume(handle));
        ib.insert(StdOps.ret());

        ConvertAsyncToLowLevel.STRICT.run(module);

        List<Insn> trampolines = Utils.ofKey(module, LlvmOps.FUNC).stream()
                .filter(insn -> LlvmOps.FUNC.cast(insn.op).arg.name.equals(AsyncRuntimeApi.RESUME))
                .collect(Collectors.toList());
        Insn trampoline = only(trampolines);
        assertTrue(LlvmOps.FUNC.cast(trampoline.op).arg.isPrivate);
        BasicBlock body = trampoline.getRegion(0).getEntryBlock();
        assertNotNull(body);
        assertEquals(2, body.getInsns().size());
        Insn resume = body.getInsns().get(0);
        assertSame(LlvmOps.CORO_RESUME, resume.op.key);
        assertSame(body.getArgs().get(0), resume.getOperands().get(0));
        assertSame(LlvmOps.RETURN, body.getInsns().get(1).op.key);

        AsyncRuntimeApi.Function[] expected = {
                AWAIT_TOKEN_AND_EXECUTE,
                AWAIT_VALUE_AND_EXECUTE,
                AWAIT_ALL_IN_GROUP_AND_EXECUTE,
        };
        for (int i = 0; i < expected.length; i++) {
            Insn call = only(Utils.callsTo(module, expected[i].symbol));
            assertSame(args.get(i), call.getOperands().get(0));
            assertSame(handle, call.getOperands().get(1));
            Insn fnPtr = def(call.getOperands().get(2));
            assertEquals(AsyncRuntimeApi.RESUME, LlvmOps.ADDRESS_OF.cast(fnPtr.op).arg);
            assertEquals(AsyncRuntimeApi.RESUME_FUNCTION_PTR, fnPtr.result().getType());
        }
        Insn execute = only(Utils.callsTo(module, EXECUTE.symbol));
        assertSame(handle, execute.getOperands().get(0));
        assertSame(LlvmOps.ADDRESS_OF, def(execute.getOperands().get(1)).op.key);
        VerifyIR.INSTANCE.run(module);
    }

    @Test
    void testOnlyTokensJoinGroups() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "f", Types.procedure(Types.asyncValue(Types.I32), Types.ASYNC_GROUP));
        BasicBlock entry = StdOps.entry(func);
        IRBuilder ib = new IRBuilder(entry);
        Insn add = ib.insert(AsyncOps.addToGroup(entry.getArgs().get(0), entry.getArgs().get(1)));
        ib.insert(StdOps.ret());

        ConversionReport report = ConvertAsyncToLowLevel.INSTANCE.run(module);
        assertEquals(Arrays.asList(add), report.residual);
        assertTrue(report.failures.get(0).right.contains("only tokens can be added to a group"));
        assertTrue(Utils.callsTo(module, ADD_TOKEN_TO_GROUP.symbol).isEmpty());
        assertNull(module.lookupSymbol(ADD_TOKEN_TO_GROUP.symbol));
    }

    @Test
    void testStrictFailsOnResidue() {
        Module module = new Module();
        Insn func = Utils.addFunc(module, "f", Types.procedure(Types.asyncValue(Types.I32), Types.ASYNC_GROUP));
        BasicBlock entry = StdOps.entry(func);
        IRBuilder ib = new IRBuilder(entry);
        ib.insert(AsyncOps.addToGroup(entry.getArgs().get(0), entry.getArgs().get(1)));
        ib.insert(StdOps.ret());

        LegalizationException e = assertThrows(LegalizationException.class,
                () -> ConvertAsyncToLowLevel.STRICT.run(module));
        assertNotNull(e.getReport());
        assertEquals(1, e.getReport().residual.size());
    }

    @Test
    void testDeclarationsAtMostOnce() {
        Module module = new Module();
        for (int i = 0; i < 3; i++) {
            Insn func = Utils.addFunc(module, "f" + i, Types.procedure(Types.ASYNC_TOKEN));
            BasicBlock entry = StdOps.entry(func);
            IRBuilder ib = new IRBuilder(entry);
            ib.insert(AsyncOps.runtimeAwait(entry.getArgs().get(0)));
            ib.insert(AsyncOps.addRef(entry.getArgs().get(0), 1));
            ib.insert(StdOps.ret());
        }
        ConvertAsyncToLowLevel.STRICT.run(module);
        assertEquals(1, declarations(module, AWAIT_TOKEN.symbol));
        assertEquals(1, declarations(module, ADD_REF.symbol));
        assertEquals(0, declarations(module, DROP_REF.symbol));
        assertEquals(3, Utils.callsTo(module, AWAIT_TOKEN.symbol).size());

        FunctionType awaitType = StdOps.FUNC.cast(module.lookupSymbol(AWAIT_TOKEN.symbol).op).arg.type;
        assertEquals(Types.procedure(Types.OPAQUE_PTR), awaitType);

        ConversionReport again = ConvertAsyncToLowLevel.STRICT.run(module);
        assertEquals(0, again.rewriteCount);
        assertEquals(1, declarations(module, AWAIT_TOKEN.symbol));
    }
}
