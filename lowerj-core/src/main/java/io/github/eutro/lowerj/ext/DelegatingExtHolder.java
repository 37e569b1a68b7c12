package io.github.eutro.lowerj.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another container for exts it does not have.
 * <p>
 * Operations use this to inherit the exts of their {@link io.github.eutro.lowerj.ops.OpKey key}.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to fall back to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
