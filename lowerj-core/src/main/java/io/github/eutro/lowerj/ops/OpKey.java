package io.github.eutro.lowerj.ops;

import io.github.eutro.lowerj.ext.ExtHolder;

/**
 * An operation key, the kind of an operation without any immediates.
 */
public abstract class OpKey extends ExtHolder {
    /**
     * The family this kind belongs to.
     */
    public final Dialect dialect;
    /**
     * The full name of the kind, {@code dialect.name}.
     */
    public final String mnemonic;

    /**
     * Create a key in the given family.
     *
     * @param dialect The family.
     * @param name    The name of the kind within the family.
     */
    protected OpKey(Dialect dialect, String name) {
        this.dialect = dialect;
        this.mnemonic = dialect.name + "." + name;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
