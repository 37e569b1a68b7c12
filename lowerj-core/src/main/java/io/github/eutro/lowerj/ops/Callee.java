package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.types.FunctionType;

import java.util.Objects;

/**
 * The immediate of a direct call: the symbol called, and the type it is called at.
 */
public final class Callee {
    public final String name;
    public final FunctionType type;

    public Callee(String name, FunctionType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Callee callee = (Callee) o;
        return name.equals(callee.name) && type.equals(callee.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "@" + name + " " + type;
    }
}
