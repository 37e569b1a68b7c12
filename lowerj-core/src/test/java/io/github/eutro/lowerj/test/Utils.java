package io.github.eutro.lowerj.test;

import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.IRBuilder;
import io.github.eutro.lowerj.ir.IRUtils;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.Dialect;
import io.github.eutro.lowerj.ops.OpKey;
import io.github.eutro.lowerj.ops.SimpleOpKey;
import io.github.eutro.lowerj.ops.StdOps;
import io.github.eutro.lowerj.types.FunctionType;
import io.github.eutro.lowerj.types.Type;

import java.util.List;
import java.util.stream.Collectors;

public class Utils {
    public static final Dialect TEST = new Dialect("test");
    /**
     * Produces a value of its result type out of nowhere.
     */
    public static final SimpleOpKey PRODUCE = new SimpleOpKey(TEST, "produce");
    /**
     * Uses its operands for nothing.
     */
    public static final SimpleOpKey CONSUME = new SimpleOpKey(TEST, "consume");

    public static Insn produce(Type type) {
        return PRODUCE.create().insn().returning(type);
    }

    public static Insn consume(Var... operands) {
        return CONSUME.create().insn(operands);
    }

    public static Insn br(BasicBlock target) {
        return StdOps.BR.create().insn().jumpsTo(target);
    }

    public static Insn condBr(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return StdOps.COND_BR.create().insn(cond).jumpsTo(ifTrue, ifFalse);
    }

    public static Insn addFunc(Module module, String name, FunctionType type) {
        return new IRBuilder(module.getBlock()).insert(StdOps.func(name, type));
    }

    public static List<Insn> ofKey(Module module, OpKey key) {
        return IRUtils.collect(module).stream()
                .filter(insn -> insn.op.key == key)
                .collect(Collectors.toList());
    }

    public static List<Insn> callsTo(Module module, String symbol) {
        return ofKey(module, StdOps.CALL).stream()
                .filter(insn -> StdOps.CALL.cast(insn.op).arg.name.equals(symbol))
                .collect(Collectors.toList());
    }

    public static long countDialect(Module module, Dialect dialect) {
        return IRUtils.collect(module).stream()
                .filter(insn -> insn.op.key.dialect == dialect)
                .count();
    }
}
