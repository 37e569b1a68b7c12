package io.github.eutro.lowerj.types;

/**
 * A signless integer type of a given bit width.
 */
public final class IntegerType extends Type {
    /**
     * The width in bits.
     */
    public final int width;

    IntegerType(int width) {
        if (width <= 0) throw new IllegalArgumentException("width must be positive: " + width);
        this.width = width;
    }

    @Override
    public String getDialect() {
        return Types.BUILTIN;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntegerType && ((IntegerType) o).width == width;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(width);
    }

    @Override
    public String toString() {
        return "i" + width;
    }
}
