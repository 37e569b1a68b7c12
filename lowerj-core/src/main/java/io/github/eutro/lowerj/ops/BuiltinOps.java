package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.ext.CommonExts;
import io.github.eutro.lowerj.ir.Insn;
import io.github.eutro.lowerj.ir.Var;
import io.github.eutro.lowerj.types.Type;

/**
 * Operations that belong to no particular source or target vocabulary.
 */
public class BuiltinOps {
    public static final Dialect DIALECT = new Dialect("builtin");

    /**
     * Effect: reinterprets its operand as its result type, with no defined runtime meaning.
     * <p>
     * The conversion driver uses these to bridge values whose type has been converted and users
     * which have not been yet, see {@link CommonExts#IS_MATERIALIZATION}.
     */
    public static final SimpleOpKey UNREALIZED_CAST = CommonExts.markPure(new SimpleOpKey(DIALECT, "unrealized_cast"));

    /**
     * Create a detached cast of {@code value} to {@code type}.
     *
     * @param value The value.
     * @param type  The type to cast to.
     * @return The cast operation.
     */
    public static Insn cast(Var value, Type type) {
        return UNREALIZED_CAST.create().insn(value).returning(type);
    }

    /**
     * Whether {@code insn} is a cast inserted by the conversion driver.
     *
     * @param insn The operation.
     * @return Whether it is a materialization.
     */
    public static boolean isMaterialization(Insn insn) {
        return insn.op.key == UNREALIZED_CAST && insn.getExtOr(CommonExts.IS_MATERIALIZATION, false);
    }
}
