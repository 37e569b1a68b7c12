package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.types.FunctionType;

import java.util.Objects;

/**
 * The immediate of a function definition or declaration: its symbol, type and visibility.
 */
public final class FuncSignature {
    public final String name;
    public final FunctionType type;
    public final boolean isPrivate;

    public FuncSignature(String name, FunctionType type, boolean isPrivate) {
        this.name = name;
        this.type = type;
        this.isPrivate = isPrivate;
    }

    /**
     * Get a signature with the same name and visibility, but a different type.
     *
     * @param type The new type.
     * @return The signature.
     */
    public FuncSignature withType(FunctionType type) {
        return new FuncSignature(name, type, isPrivate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FuncSignature that = (FuncSignature) o;
        return isPrivate == that.isPrivate && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, isPrivate);
    }

    @Override
    public String toString() {
        return (isPrivate ? "private " : "") + "@" + name + " " + type;
    }
}
