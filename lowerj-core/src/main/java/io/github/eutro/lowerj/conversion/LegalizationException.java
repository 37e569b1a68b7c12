package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ir.Insn;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when illegal operations are left over where they are not allowed to be,
 * or when a conversion does not terminate.
 */
public class LegalizationException extends RuntimeException {
    private final @Nullable ConversionReport report;

    /**
     * Construct an exception for a conversion that left illegal operations behind.
     * <p>
     * If operations track their creations, the creation of each operation is attached as suppressed.
     *
     * @param report The report of the conversion.
     */
    public LegalizationException(ConversionReport report) {
        super(report.toString());
        this.report = report;
        for (Insn insn : report.residual) {
            if (insn.created != null) {
                addSuppressed(insn.created);
            }
        }
    }

    public LegalizationException(String message) {
        super(message);
        this.report = null;
    }

    /**
     * Get the report of the failed conversion.
     *
     * @return The report, or null if the conversion did not finish.
     */
    public @Nullable ConversionReport getReport() {
        return report;
    }
}
