package io.github.eutro.lowerj.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value can be attached to an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, so iteration over the exts of a container
 * is stable within one program execution.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * Classes cannot name generic types, so {@code type} only has to be a superclass
     * of the real type of the ext; it is kept for debugging.
     *
     * @param type The most specific superclass of the type of the ext.
     * @param name The name of the ext.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the class this ext was {@link #create(Class, String) created} with.
     *
     * @return The class.
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the value of this ext in the given container.
     *
     * @param ec The container.
     * @return The value, if present.
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
