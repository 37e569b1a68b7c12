package io.github.eutro.lowerj.ext;

import io.github.eutro.lowerj.ir.BasicBlock;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Module;
import io.github.eutro.lowerj.ir.Region;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.Op;
import io.github.eutro.lowerj.ops.OpKey;
import io.github.eutro.lowerj.util.F;

/**
 * The {@link Ext}s that every part of the IR understands.
 */
public class CommonExts {
    /**
     * Attached to an {@link Insn}. The block the operation is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    /**
     * Attached to a {@link BasicBlock}. The region the block is in.
     */
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    /**
     * Attached to a {@link Region}. The module, if this is the body of one.
     */
    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");

    /**
     * Attached to a {@link Var} that is an operation result. The operation that defines it.
     */
    public static final Ext<Insn> DEFINED_AT = Ext.create(Insn.class, "DEFINED_AT");
    /**
     * Attached to a {@link Var} that is a block argument. The block it is an argument of.
     */
    public static final Ext<BasicBlock> ARGUMENT_OF = Ext.create(BasicBlock.class, "ARGUMENT_OF");

    /**
     * Attached to an {@link OpKey}. Whether operations of this kind end a block.
     */
    public static final Ext<Boolean> IS_TERMINATOR = Ext.create(Boolean.class, "IS_TERMINATOR");
    /**
     * Attached to an {@link OpKey}, {@link Op} or {@link Insn}.
     * Whether the operation has no observable side effects.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");
    /**
     * Attached to an {@link OpKey}. Extracts the symbol an operation of this kind defines.
     */
    public static final Ext<F<Op, String>> SYMBOL_NAME = Ext.create(F.class, "SYMBOL_NAME");

    /**
     * Attached to an {@link Insn}. Set on casts that the conversion driver inserted to bridge
     * a converted value and a user that expects its old type.
     */
    public static final Ext<Boolean> IS_MATERIALIZATION = Ext.create(Boolean.class, "IS_MATERIALIZATION");
    /**
     * Attached to an {@link Insn}. Set once the operation has been erased from the IR.
     */
    public static final Ext<Boolean> ERASED = Ext.create(Boolean.class, "ERASED");

    /**
     * Mark an op kind as a terminator, by attaching {@link #IS_TERMINATOR} {@code = true} to it.
     *
     * @param t   The op key.
     * @param <T> The type of the key.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markTerminator(T t) {
        t.attachExt(IS_TERMINATOR, true);
        return t;
    }

    /**
     * Mark something as pure, by attaching {@link #IS_PURE} {@code = true} to it.
     *
     * @param t   The thing to mark as pure.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
