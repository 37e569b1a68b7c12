package io.github.eutro.lowerj.ir;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ext.Ext;
import io.github.eutro.lowerj.ext.ExtHolder;
import io.github.eutro.lowerj.ext.TrackedList;
import io.github.eutro.lowerj.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A basic block: typed arguments, followed by a list of {@link Insn operations},
 * the last of which is its terminator.
 */
public final class BasicBlock extends ExtHolder {
    private final List<Var> args = new ArrayList<>();
    private final List<Insn> insns = new TrackedList<Insn>(new ArrayList<>()) {
        @Override
        protected void onAdded(Insn elt) {
            if (elt.getBlock() != null) {
                throw new IllegalStateException(elt.op + " is already in a block");
            }
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Insn elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    /**
     * Construct a detached block with arguments of the given types.
     *
     * @param argTypes The argument types.
     */
    public BasicBlock(Type... argTypes) {
        for (Type argType : argTypes) {
            addArgument(argType);
        }
    }

    /**
     * Add an argument to the end of the argument list.
     *
     * @param type The type of the argument.
     * @return The argument.
     */
    public Var addArgument(Type type) {
        Var arg = new Var("arg", type);
        arg.attachExt(CommonExts.ARGUMENT_OF, this);
        args.add(arg);
        return arg;
    }

    /**
     * Get the arguments of this block.
     *
     * @return An unmodifiable view of the arguments.
     */
    public List<Var> getArgs() {
        return Collections.unmodifiableList(args);
    }

    /**
     * Get the types of the arguments of this block.
     *
     * @return The argument types.
     */
    public List<Type> getArgTypes() {
        return args.stream().map(Var::getType).collect(Collectors.toList());
    }

    /**
     * Get the operations of this block. The list may be modified, keeping ownership up to date.
     *
     * @return The operations.
     */
    public List<Insn> getInsns() {
        return insns;
    }

    /**
     * Get the terminator of this block.
     *
     * @return The last operation, if it is a terminator, otherwise null.
     */
    public @Nullable Insn getTerminator() {
        if (insns.isEmpty()) return null;
        Insn last = insns.get(insns.size() - 1);
        return last.isTerminator() ? last : null;
    }

    /**
     * Get the region this block is in.
     *
     * @return The region, or null if detached.
     */
    public @Nullable Region getRegion() {
        return region;
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return String.format("^%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString());
        if (!args.isEmpty()) {
            sb.append(args.stream().map(Var::toString).collect(Collectors.joining(", ", "(", ")")));
        }
        sb.append(":\n");
        for (Insn insn : insns) {
            sb.append("  ").append(insn).append('\n');
        }
        return sb.toString();
    }

    // exts
    private Region region = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            return (T) region;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_REGION) {
            region = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            region = null;
            return;
        }
        super.removeExt(ext);
    }
}
