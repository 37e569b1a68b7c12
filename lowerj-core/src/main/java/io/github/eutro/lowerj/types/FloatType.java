package io.github.eutro.lowerj.types;

/**
 * An IEEE floating point type, {@code f32} or {@code f64}.
 */
public final class FloatType extends Type {
    /**
     * The width in bits.
     */
    public final int width;

    FloatType(int width) {
        if (width != 32 && width != 64) throw new IllegalArgumentException("unsupported float width: " + width);
        this.width = width;
    }

    @Override
    public String getDialect() {
        return Types.BUILTIN;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FloatType && ((FloatType) o).width == width;
    }

    @Override
    public int hashCode() {
        return 31 + width;
    }

    @Override
    public String toString() {
        return "f" + width;
    }
}
