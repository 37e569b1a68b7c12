package io.github.eutro.lowerj.ext;

import io.github.eutro.lowerj.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that {@link Ext}s can be attached to.
 * See the {@link io.github.eutro.lowerj.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} under {@code ext}, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext}, or null if it is not attached.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext}, if attached.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value of {@code ext}, throwing if it is not attached.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is not attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Ext " + ext.getName() + " not present on " + this);
    }

    /**
     * Get the value of {@code ext}, or a default.
     *
     * @param ext The ext.
     * @param dflt The default.
     * @param <T> The type of the ext.
     * @return The value, or {@code dflt} if it is not attached.
     */
    default <T> T getExtOr(Ext<T> ext, T dflt) {
        T nullable = getNullable(ext);
        return nullable == null ? dflt : nullable;
    }

    /**
     * Get the value of {@code ext}, running {@code pass} on {@code o} to compute it if absent.
     *
     * @param ext  The ext.
     * @param o    The object to run the pass on.
     * @param pass The pass that attaches the ext.
     * @param <T>  The type of the ext.
     * @param <O>  The type the pass operates on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T extV = getNullable(ext);
        if (extV != null) return extV;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
