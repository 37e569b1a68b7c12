package io.github.eutro.lowerj.ir;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ext.ExtHolder;
import io.github.eutro.lowerj.ext.TrackedList;
import io.github.eutro.lowerj.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A region: a nested sub-program owned by an {@link Insn operation}, made of {@link BasicBlock blocks}.
 * <p>
 * The first block is the entry block, whose arguments are bound by the owning operation.
 */
public final class Region extends ExtHolder {
    private final @Nullable Insn parent;

    /**
     * The blocks of this region. The first is the entry block.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            if (elt.getRegion() != null) {
                throw new IllegalStateException("block is already in a region");
            }
            elt.attachExt(CommonExts.OWNING_REGION, Region.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_REGION);
        }
    };

    Region(@Nullable Insn parent) {
        this.parent = parent;
    }

    /**
     * Get the operation owning this region.
     *
     * @return The operation, or null if this is the body of a {@link Module}.
     */
    public @Nullable Insn getParentInsn() {
        return parent;
    }

    /**
     * Get the module this is the body of.
     *
     * @return The module, or null if this region belongs to an operation.
     */
    public @Nullable Module getModule() {
        return getNullable(CommonExts.OWNING_MODULE);
    }

    /**
     * Get the entry block of this region.
     *
     * @return The entry block, or null if the region is empty.
     */
    public @Nullable BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Create a block at the end of this region.
     *
     * @param argTypes The types of the block arguments.
     * @return The new block.
     */
    public BasicBlock newBlock(Type... argTypes) {
        BasicBlock bb = new BasicBlock(argTypes);
        blocks.add(bb);
        return bb;
    }

    /**
     * Whether this region has no blocks.
     *
     * @return Whether this region is empty.
     */
    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{\n");
        for (BasicBlock block : blocks) {
            sb.append(block);
        }
        return sb.append("}").toString();
    }
}
