package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.ops.OpKey;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A rewrite of operations of one kind.
 * <p>
 * A pattern either succeeds, having replaced or erased the operation through the rewriter,
 * or fails, in which case everything it did through the rewriter is undone.
 */
public abstract class ConversionPattern {
    /**
     * The kind of operation this pattern rewrites.
     */
    protected final OpKey root;
    /**
     * The converter operands are converted with before being passed to the pattern,
     * or null to pass them unchanged.
     */
    protected final @Nullable TypeConverter typeConverter;

    protected ConversionPattern(OpKey root, @Nullable TypeConverter typeConverter) {
        this.root = root;
        this.typeConverter = typeConverter;
    }

    public OpKey getRoot() {
        return root;
    }

    public @Nullable TypeConverter getTypeConverter() {
        return typeConverter;
    }

    /**
     * Rewrite an operation.
     *
     * @param op       The operation.
     * @param operands Its operands, converted with the {@link #typeConverter}.
     * @param rewriter The rewriter to make all changes with, positioned before {@code op}.
     * @return Whether the rewrite succeeded.
     */
    public abstract boolean matchAndRewrite(Insn op, List<Var> operands, ConversionRewriter rewriter);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + root + ")";
    }
}
