package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ops.BuiltinOps;
import io.github.eutro.lowerj.ops.Dialect;
import io.github.eutro.lowerj.ops.OpKey;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Decides which operations are legal at the end of a conversion.
 * <p>
 * Declarations are checked in order: first for the operation's whole family, then for its
 * kind, either statically or by a predicate over the operation. An operation with no declaration
 * is legal or illegal depending on the {@link ConversionMode}. Casts inserted by the driver
 * are always legal.
 */
public class ConversionTarget {
    private final Map<Dialect, Boolean> dialects = new HashMap<>();
    private final Map<OpKey, Boolean> ops = new HashMap<>();
    private final Map<OpKey, Predicate<Insn>> dynamic = new HashMap<>();

    public ConversionTarget addLegalDialect(Dialect... dialects) {
        for (Dialect dialect : dialects) {
            this.dialects.put(dialect, true);
        }
        return this;
    }

    public ConversionTarget addIllegalDialect(Dialect... dialects) {
        for (Dialect dialect : dialects) {
            this.dialects.put(dialect, false);
        }
        return this;
    }

    public ConversionTarget addLegalOp(OpKey... keys) {
        for (OpKey key : keys) {
            ops.put(key, true);
            dynamic.remove(key);
        }
        return this;
    }

    public ConversionTarget addIllegalOp(OpKey... keys) {
        for (OpKey key : keys) {
            ops.put(key, false);
            dynamic.remove(key);
        }
        return this;
    }

    /**
     * Declare operations of the given kinds legal exactly when {@code predicate} accepts them.
     *
     * @param predicate The predicate.
     * @param keys      The kinds.
     * @return This.
     */
    public ConversionTarget addDynamicallyLegalOp(Predicate<Insn> predicate, OpKey... keys) {
        for (OpKey key : keys) {
            ops.remove(key);
            dynamic.put(key, predicate);
        }
        return this;
    }

    /**
     * Get the declared legality of an operation.
     *
     * @param insn The operation.
     * @return Whether the operation is legal, or null if nothing declares it either way.
     */
    public @Nullable Boolean getDeclaredLegality(Insn insn) {
        if (BuiltinOps.isMaterialization(insn)) return true;
        OpKey key = insn.op.key;
        Boolean byDialect = dialects.get(key.dialect);
        if (byDialect != null) return byDialect;
        Boolean byKind = ops.get(key);
        if (byKind != null) return byKind;
        Predicate<Insn> predicate = dynamic.get(key);
        if (predicate != null) return predicate.test(insn);
        return null;
    }

    /**
     * Whether an operation is legal.
     *
     * @param insn The operation.
     * @param mode The mode, which decides operations with no declaration.
     * @return Whether it is legal.
     */
    public boolean isLegal(Insn insn, ConversionMode mode) {
        Boolean declared = getDeclaredLegality(insn);
        if (declared != null) return declared;
        return mode == ConversionMode.PARTIAL;
    }
}
