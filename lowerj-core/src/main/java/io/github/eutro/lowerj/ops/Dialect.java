package io.github.eutro.lowerj.ops;

/**
 * A family of operation kinds, such as every {@code async} operation.
 * <p>
 * Legality can be declared for a whole family at once, see
 * {@link io.github.eutro.lowerj.conversion.ConversionTarget}.
 */
public final class Dialect {
    /**
     * The name of the family, used as the prefix of its operations' mnemonics.
     */
    public final String name;

    /**
     * Create a dialect with the given name.
     *
     * @param name The name.
     */
    public Dialect(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
