package io.github.eutro.lowerj.ir;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ext.ExtHolder;
import io.github.eutro.lowerj.ops.Op;
import io.github.eutro.lowerj.util.F;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A module: the top level of the IR, a single block of symbol-defining operations
 * such as functions and function declarations.
 */
public final class Module extends ExtHolder {
    /**
     * The body of the module. It has exactly one block, and its operations have no parent operation.
     */
    public final Region body = new Region(null);

    /**
     * Construct an empty module.
     */
    public Module() {
        body.attachExt(CommonExts.OWNING_MODULE, this);
        body.newBlock();
    }

    /**
     * Get the single block of the module body.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return body.blocks.get(0);
    }

    /**
     * Get the module-level operations.
     *
     * @return The operations.
     */
    public List<Insn> getInsns() {
        return getBlock().getInsns();
    }

    /**
     * Find the module-level operation defining the given symbol.
     *
     * @param name The symbol name.
     * @return The operation, or null if there is none.
     */
    public @Nullable Insn lookupSymbol(String name) {
        for (Insn insn : getInsns()) {
            F<Op, String> getter = insn.getNullable(CommonExts.SYMBOL_NAME);
            if (getter != null && name.equals(getter.apply(insn.op))) {
                return insn;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }
}
