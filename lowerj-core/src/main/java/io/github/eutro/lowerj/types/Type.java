package io.github.eutro.lowerj.types;

/**
 * The type of a {@link io.github.eutro.lowerj.ir.Var value}.
 * <p>
 * Types are opaque tags compared structurally: two types are the same exactly if
 * they are {@link #equals(Object) equal}. Every type belongs to a family, named by
 * its {@link #getDialect() dialect}.
 */
public abstract class Type {
    /**
     * Get the name of the family this type belongs to.
     *
     * @return The dialect name.
     */
    public abstract String getDialect();

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
