package io.github.eutro.lowerj.ir;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ext.Ext;
import io.github.eutro.lowerj.ext.ExtHolder;
import io.github.eutro.lowerj.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * A value: either the result of an {@link Insn operation} or the argument of a {@link BasicBlock block}.
 * <p>
 * A value has exactly one type, at most one producer, and any number of users.
 * The users are tracked eagerly: every operand slot that refers to this value
 * appears once in {@link #getUses()}.
 */
public final class Var extends ExtHolder {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    /**
     * A name hint, for debugging. May be empty.
     */
    public final String name;
    private final int id = ID_COUNTER.getAndIncrement();
    private Type type;
    private final List<Insn> uses = new ArrayList<>();

    Var(String name, Type type) {
        this.name = name;
        this.type = Objects.requireNonNull(type);
    }

    /**
     * Get the type of this value.
     *
     * @return The type.
     */
    public Type getType() {
        return type;
    }

    /**
     * Set the type of this value in place.
     * <p>
     * This does not update any users; during a conversion go through
     * {@link io.github.eutro.lowerj.conversion.ConversionRewriter} so that the change
     * can be undone and materialized.
     *
     * @param type The new type.
     */
    public void setType(Type type) {
        this.type = Objects.requireNonNull(type);
    }

    /**
     * Get the operations using this value, once per operand slot.
     *
     * @return An unmodifiable view of the uses.
     */
    public List<Insn> getUses() {
        return Collections.unmodifiableList(uses);
    }

    /**
     * Whether any operation uses this value.
     *
     * @return Whether this has uses.
     */
    public boolean hasUses() {
        return !uses.isEmpty();
    }

    void addUse(Insn insn) {
        uses.add(insn);
    }

    void removeUse(Insn insn) {
        uses.remove(insn);
    }

    /**
     * Make every operand slot that refers to this refer to {@code replacement} instead.
     *
     * @param replacement The replacement value.
     */
    public void replaceAllUsesWith(Var replacement) {
        replaceUsesWithIf(replacement, $ -> true);
    }

    /**
     * Make every operand slot of the users accepted by {@code filter} that refers
     * to this refer to {@code replacement} instead.
     *
     * @param replacement The replacement value.
     * @param filter      Which users to rewrite.
     */
    public void replaceUsesWithIf(Var replacement, Predicate<Insn> filter) {
        if (replacement == this) return;
        for (Insn user : new ArrayList<>(new LinkedHashSet<>(uses))) {
            if (!filter.test(user)) continue;
            List<Var> operands = user.getOperands();
            for (int i = 0; i < operands.size(); i++) {
                if (operands.get(i) == this) {
                    operands.set(i, replacement);
                }
            }
        }
    }

    /**
     * Get the operation this is a result of.
     *
     * @return The operation, or null if this is a block argument.
     */
    public @Nullable Insn getDefiningInsn() {
        return definedAt;
    }

    /**
     * Get the block this is an argument of.
     *
     * @return The block, or null if this is an operation result.
     */
    public @Nullable BasicBlock getOwningBlock() {
        return argumentOf;
    }

    @Override
    public String toString() {
        return "%" + (name.isEmpty() ? "v" : name) + "." + id + ": " + type;
    }

    // exts
    private Insn definedAt = null;
    private BasicBlock argumentOf = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.DEFINED_AT) {
            return (T) definedAt;
        }
        if (ext == CommonExts.ARGUMENT_OF) {
            return (T) argumentOf;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.DEFINED_AT) {
            definedAt = (Insn) value;
            return;
        }
        if (ext == CommonExts.ARGUMENT_OF) {
            argumentOf = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.DEFINED_AT) {
            definedAt = null;
            return;
        }
        if (ext == CommonExts.ARGUMENT_OF) {
            argumentOf = null;
            return;
        }
        super.removeExt(ext);
    }
}
