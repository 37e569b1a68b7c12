package io.github.eutro.lowerj.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The type of a function: its parameter types and result types.
 * A function without results returns nothing.
 */
public final class FunctionType extends Type {
    /**
     * The parameter types.
     */
    public final List<Type> params;
    /**
     * The result types.
     */
    public final List<Type> results;

    FunctionType(List<Type> params, List<Type> results) {
        this.params = List.copyOf(params);
        this.results = List.copyOf(results);
    }

    @Override
    public String getDialect() {
        return Types.BUILTIN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return params.equals(that.params) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, results);
    }

    @Override
    public String toString() {
        String ps = params.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
        if (results.size() == 1 && !(results.get(0) instanceof FunctionType)) {
            return ps + " -> " + results.get(0);
        }
        return ps + " -> " + results.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
