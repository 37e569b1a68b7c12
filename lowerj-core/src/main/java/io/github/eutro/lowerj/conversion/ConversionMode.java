package io.github.eutro.lowerj.conversion;

/**
 * How strictly a conversion treats operations that nothing declares the legality of.
 */
public enum ConversionMode {
    /**
     * Every operation must end up legal. Undeclared operations are illegal,
     * and any illegal operation left over fails the conversion.
     */
    FULL,
    /**
     * Only operations declared illegal are converted. Undeclared operations are legal, and
     * illegal operations that could not be converted are reported, but do not fail the conversion.
     */
    PARTIAL,
}
