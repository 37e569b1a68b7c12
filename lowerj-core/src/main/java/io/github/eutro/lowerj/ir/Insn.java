package io.github.eutro.lowerj.ir;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ext.DelegatingExtHolder;
import io.github.eutro.lowerj.ext.Ext;
import io.github.eutro.lowerj.ext.ExtContainer;
import io.github.eutro.lowerj.ext.TrackedList;
import io.github.eutro.lowerj.ops.Op;
import io.github.eutro.lowerj.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An operation: an {@link Op} applied to operands, producing typed results,
 * possibly owning nested {@link Region regions} and jumping to successor blocks.
 * <p>
 * Results, regions and successors are fixed while the operation is detached,
 * using {@link #returning(List)}, {@link #withRegions(int)} and {@link #jumpsTo(BasicBlock...)}.
 * Once inserted into a block, only its operands may change.
 */
public final class Insn extends DelegatingExtHolder {
    /**
     * Whether operations record the stack trace of their construction, for debugging
     * where an illegal operation came from.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("LOWERJ_TRACK_INSN_CREATIONS") != null;

    /**
     * Where this operation was created, if {@link #TRACK_INSN_CREATIONS} is set.
     */
    public final @Nullable Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    /**
     * The kind and immediates of this operation.
     */
    public final Op op;

    private final List<Var> operands = new TrackedList<Var>(new ArrayList<>()) {
        @Override
        protected void onAdded(Var elt) {
            Objects.requireNonNull(elt, "operand").addUse(Insn.this);
        }

        @Override
        protected void onRemoved(Var elt) {
            elt.removeUse(Insn.this);
        }
    };
    private final List<Var> results = new ArrayList<>();
    private final List<Region> regions = new ArrayList<>();
    private final List<BasicBlock> successors = new ArrayList<>();

    /**
     * Construct a detached operation.
     *
     * @param op       The operation.
     * @param operands The operands.
     */
    public Insn(Op op, List<Var> operands) {
        this.op = op;
        this.operands.addAll(operands);
    }

    private void checkDetached() {
        if (block != null) {
            throw new IllegalStateException("operation " + op + " is already in a block");
        }
    }

    /**
     * Give this operation results of the given types.
     *
     * @param types The result types.
     * @return This.
     */
    public Insn returning(List<Type> types) {
        checkDetached();
        for (Type type : types) {
            Var var = new Var("", type);
            var.attachExt(CommonExts.DEFINED_AT, this);
            results.add(var);
        }
        return this;
    }

    /**
     * Give this operation results of the given types.
     *
     * @param types The result types.
     * @return This.
     */
    public Insn returning(Type... types) {
        return returning(Arrays.asList(types));
    }

    /**
     * Give this operation {@code n} new, empty regions.
     *
     * @param n The number of regions.
     * @return This.
     */
    public Insn withRegions(int n) {
        checkDetached();
        for (int i = 0; i < n; i++) {
            regions.add(new Region(this));
        }
        return this;
    }

    /**
     * Set the successors of this operation.
     *
     * @param targets The successor blocks.
     * @return This.
     */
    public Insn jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    /**
     * Set the successors of this operation.
     *
     * @param targets The successor blocks.
     * @return This.
     */
    public Insn jumpsTo(List<BasicBlock> targets) {
        checkDetached();
        successors.clear();
        successors.addAll(targets);
        return this;
    }

    /**
     * Get the operands of this operation. The list may be modified, keeping use lists up to date.
     *
     * @return The operands.
     */
    public List<Var> getOperands() {
        return operands;
    }

    /**
     * Get the types of the operands.
     *
     * @return The operand types.
     */
    public List<Type> getOperandTypes() {
        return operands.stream().map(Var::getType).collect(Collectors.toList());
    }

    /**
     * Get the results of this operation.
     *
     * @return An unmodifiable view of the results.
     */
    public List<Var> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * Get the types of the results.
     *
     * @return The result types.
     */
    public List<Type> getResultTypes() {
        return results.stream().map(Var::getType).collect(Collectors.toList());
    }

    /**
     * Get the only result of this operation.
     *
     * @return The result.
     * @throws IllegalStateException If this does not have exactly one result.
     */
    public Var result() {
        if (results.size() != 1) {
            throw new IllegalStateException(op + " has " + results.size() + " results");
        }
        return results.get(0);
    }

    /**
     * Get the regions of this operation.
     *
     * @return An unmodifiable view of the regions.
     */
    public List<Region> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    /**
     * Get a region of this operation.
     *
     * @param i The index.
     * @return The region.
     */
    public Region getRegion(int i) {
        return regions.get(i);
    }

    /**
     * Get the successors of this operation.
     *
     * @return An unmodifiable view of the successors.
     */
    public List<BasicBlock> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    /**
     * Get the block this operation is in.
     *
     * @return The block, or null if detached.
     */
    public @Nullable BasicBlock getBlock() {
        return block;
    }

    /**
     * Get the operation whose region this operation is nested in.
     *
     * @return The parent operation, or null for detached and module-level operations.
     */
    public @Nullable Insn getParentInsn() {
        if (block == null) return null;
        Region region = block.getRegion();
        return region == null ? null : region.getParentInsn();
    }

    /**
     * Whether this operation ends a block.
     *
     * @return Whether this is a terminator.
     */
    public boolean isTerminator() {
        return getExt(CommonExts.IS_TERMINATOR).orElse(false);
    }

    /**
     * Whether this operation has been {@link #erase() erased}.
     *
     * @return Whether this is erased.
     */
    public boolean isErased() {
        return getExt(CommonExts.ERASED).orElse(false);
    }

    /**
     * Remove this operation, and everything nested in it, from the IR.
     * <p>
     * The results of this operation must not have any users left, other
     * than operations nested in this one.
     *
     * @throws IllegalStateException If a result is still used.
     */
    public void erase() {
        List<Insn> nested = new ArrayList<>();
        IRUtils.walk(this, nested::add);
        Set<Insn> nestedSet = Collections.newSetFromMap(new IdentityHashMap<>());
        nestedSet.addAll(nested);
        for (Insn insn : nested) {
            for (Var result : insn.results) {
                for (Insn use : result.getUses()) {
                    if (!nestedSet.contains(use)) {
                        throw new IllegalStateException("erasing " + insn.op + " whose result is still used by " + use.op);
                    }
                }
            }
        }
        if (block != null) {
            block.getInsns().remove(this);
        }
        for (Insn insn : nested) {
            insn.operands.clear();
            insn.attachExt(CommonExts.ERASED, true);
        }
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!results.isEmpty()) {
            sb.append(results.stream().map(Var::toString).collect(Collectors.joining(", ")))
                    .append(" = ");
        }
        sb.append(op);
        for (Var operand : operands) {
            sb.append(' ').append(operand);
        }
        if (!successors.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : successors) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        if (!regions.isEmpty()) {
            sb.append(" (").append(regions.size()).append(" regions)");
        }
        return sb.toString();
    }

    // exts
    private BasicBlock block = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) block;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            block = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            block = null;
            return;
        }
        super.removeExt(ext);
    }
}
