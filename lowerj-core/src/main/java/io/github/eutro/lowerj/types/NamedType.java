package io.github.eutro.lowerj.types;

import java.util.Objects;

/**
 * A parameterless type identified only by its dialect and name,
 * such as {@code !async.token} or {@code !llvm.void}.
 */
public final class NamedType extends Type {
    private final String dialect;
    /**
     * The name of the type within its dialect.
     */
    public final String name;

    NamedType(String dialect, String name) {
        this.dialect = dialect;
        this.name = name;
    }

    @Override
    public String getDialect() {
        return dialect;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedType)) return false;
        NamedType that = (NamedType) o;
        return dialect.equals(that.dialect) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialect, name);
    }

    @Override
    public String toString() {
        return Types.BUILTIN.equals(dialect) ? name : "!" + dialect + "." + name;
    }
}
