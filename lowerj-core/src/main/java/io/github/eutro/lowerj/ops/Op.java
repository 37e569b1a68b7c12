package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.ext.DelegatingExtHolder;
import io.github.eutro.lowerj.ext.ExtContainer;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;

import java.util.Arrays;
import java.util.List;

/**
 * An operation, an {@link OpKey operation key} together with any immediates.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    /**
     * Construct an operation with the given key.
     *
     * @param key The key.
     */
    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Construct a detached operation instance of this, applied to the given operands.
     *
     * @param operands The operands.
     * @return The operation instance.
     */
    public Insn insn(Var... operands) {
        return new Insn(this, Arrays.asList(operands));
    }

    /**
     * Construct a detached operation instance of this, applied to the given operands.
     *
     * @param operands The operands.
     * @return The operation instance.
     */
    public Insn insn(List<Var> operands) {
        return new Insn(this, operands);
    }
}
