package io.github.eutro.lowerj.types;

/**
 * {@code !async.value<T>}: a single-slot future holding a payload of type {@code T}.
 */
public final class AsyncValueType extends Type {
    /**
     * The payload type.
     */
    public final Type payload;

    AsyncValueType(Type payload) {
        this.payload = payload;
    }

    @Override
    public String getDialect() {
        return Types.ASYNC;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AsyncValueType && ((AsyncValueType) o).payload.equals(payload);
    }

    @Override
    public int hashCode() {
        return 7 * payload.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "!async.value<" + payload + ">";
    }
}
