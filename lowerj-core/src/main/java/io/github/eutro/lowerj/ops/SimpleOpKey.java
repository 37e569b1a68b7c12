package io.github.eutro.lowerj.ops;

/**
 * An operation key without immediates, which has exactly one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    /**
     * Create a key in the given family.
     *
     * @param dialect The family.
     * @param name    The name of the kind.
     */
    public SimpleOpKey(Dialect dialect, String name) {
        super(dialect, name);
    }

    /**
     * Get the only operation of this key.
     *
     * @return The operation.
     */
    public Op create() {
        return op;
    }
}
