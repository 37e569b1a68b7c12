package io.github.eutro.lowerj.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An operation key whose operations carry exactly one immediate.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    /**
     * Create a key with a custom immediate printer.
     *
     * @param dialect The family.
     * @param name    The name of the kind.
     * @param printer Formats the immediate for display.
     */
    public UnaryOpKey(Dialect dialect, String name, Function<T, String> printer) {
        super(dialect, name);
        this.printer = printer;
    }

    /**
     * Create a key whose immediates display with {@link Object#toString()}.
     *
     * @param dialect The family.
     * @param name    The name of the kind.
     */
    public UnaryOpKey(Dialect dialect, String name) {
        this(dialect, name, Objects::toString);
    }

    /**
     * An operation of this key.
     */
    public class UnaryOp extends Op {
        /**
         * The immediate.
         */
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    /**
     * Cast {@code val} to an operation of this key, if it is one.
     *
     * @param val The operation.
     * @return The cast operation, or null.
     */
    public @Nullable UnaryOp checkNullable(Op val) {
        if (val.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) val;
            return ret;
        }
        return null;
    }

    /**
     * Get the immediate of {@code val}, if it is an operation of this key.
     *
     * @param val The operation.
     * @return The immediate, or null.
     */
    public @Nullable T argNullable(Op val) {
        UnaryOp op = checkNullable(val);
        return op == null ? null : op.arg;
    }

    /**
     * Cast {@code val} to an operation of this key, if it is one.
     *
     * @param val The operation.
     * @return The cast operation.
     */
    public Optional<UnaryOp> check(Op val) {
        return Optional.ofNullable(checkNullable(val));
    }

    /**
     * Cast {@code val} to an operation of this key.
     *
     * @param val The operation.
     * @return The cast operation.
     * @throws ClassCastException If it is not an operation of this key.
     */
    public UnaryOp cast(Op val) {
        return check(val).orElseThrow(() -> new ClassCastException(val + " is not " + this));
    }

    /**
     * Create an operation of this key.
     *
     * @param arg The immediate, which must not be null.
     * @return The operation.
     */
    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}
