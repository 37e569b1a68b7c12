package io.github.eutro.lowerj.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * An IR, or operation, builder, which encapsulates a position in a block
 * where operations are being inserted.
 * <p>
 * The position is either the end of the block, or just before an anchor
 * operation in the block.
 */
public class IRBuilder {
    private BasicBlock bb;
    private @Nullable Insn anchor;

    /**
     * Construct an operation builder, inserting at the end of a block.
     *
     * @param bb The block.
     */
    public IRBuilder(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Construct an operation builder, inserting before an operation.
     *
     * @param anchor The operation, which must be in a block.
     */
    public IRBuilder(Insn anchor) {
        setInsertionPointBefore(anchor);
    }

    /**
     * Get the block this builder is inserting into.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Get the operation this builder is inserting before.
     *
     * @return The anchor, or null if inserting at the end of the block.
     */
    public @Nullable Insn getAnchor() {
        return anchor;
    }

    /**
     * Move the insertion point, typically back to one saved with {@link #getBlock()} and {@link #getAnchor()}.
     *
     * @param bb     The block.
     * @param anchor The operation in {@code bb} to insert before, or null to insert at the end.
     */
    public void setInsertionPoint(BasicBlock bb, @Nullable Insn anchor) {
        this.bb = bb;
        this.anchor = anchor;
    }

    /**
     * Insert at the end of a block from now on.
     *
     * @param bb The block.
     */
    public void setInsertionPointToEnd(BasicBlock bb) {
        this.bb = bb;
        this.anchor = null;
    }

    /**
     * Insert at the start of a block from now on.
     *
     * @param bb The block.
     */
    public void setInsertionPointToStart(BasicBlock bb) {
        this.bb = bb;
        List<Insn> insns = bb.getInsns();
        this.anchor = insns.isEmpty() ? null : insns.get(0);
    }

    /**
     * Insert just before an operation from now on.
     *
     * @param insn The operation, which must be in a block.
     */
    public void setInsertionPointBefore(Insn insn) {
        this.bb = Objects.requireNonNull(insn.getBlock(), "operation is not in a block");
        this.anchor = insn;
    }

    /**
     * Insert just after an operation from now on.
     *
     * @param insn The operation, which must be in a block.
     */
    public void setInsertionPointAfter(Insn insn) {
        this.bb = Objects.requireNonNull(insn.getBlock(), "operation is not in a block");
        List<Insn> insns = bb.getInsns();
        int i = insns.indexOf(insn);
        this.anchor = i + 1 < insns.size() ? insns.get(i + 1) : null;
    }

    /**
     * Insert a detached operation at the insertion point.
     *
     * @param insn The operation.
     * @return The same operation.
     */
    public Insn insert(Insn insn) {
        List<Insn> insns = bb.getInsns();
        if (anchor == null) {
            insns.add(insn);
        } else {
            int i = insns.indexOf(anchor);
            if (i < 0) {
                throw new IllegalStateException("insertion anchor " + anchor.op + " has left its block");
            }
            insns.add(i, insn);
        }
        return insn;
    }

    /**
     * Insert an operation with exactly one result, and return that result.
     *
     * @param insn The operation.
     * @return Its result.
     */
    public Var insertResult(Insn insn) {
        return insert(insn).result();
    }
}
