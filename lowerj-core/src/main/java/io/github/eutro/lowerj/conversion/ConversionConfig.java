package io.github.eutro.lowerj.conversion;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for a single run of the {@link ConversionDriver}.
 */
public final class ConversionConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionConfig.class);
    private static final int FALLBACK_MAX_REWRITES = 1_000_000;

    /**
     * The default rewrite budget, overridden by the {@code LOWERJ_MAX_REWRITES} environment variable.
     */
    public static final int DEFAULT_MAX_REWRITES = parseMaxRewrites(System.getenv("LOWERJ_MAX_REWRITES"));

    /**
     * Parse a rewrite budget setting. Missing, malformed and non-positive values give the fallback budget.
     *
     * @param value The setting, or null if it is not set.
     * @return The budget.
     */
    public static int parseMaxRewrites(@Nullable String value) {
        if (value == null) return FALLBACK_MAX_REWRITES;
        try {
            int budget = Integer.parseInt(value.trim());
            if (budget > 0) return budget;
        } catch (NumberFormatException e) {
            LOGGER.warn("LOWERJ_MAX_REWRITES is not a number: {}", value, e);
            return FALLBACK_MAX_REWRITES;
        }
        LOGGER.warn("LOWERJ_MAX_REWRITES must be positive, was {}", value);
        return FALLBACK_MAX_REWRITES;
    }

    public static final ConversionConfig FULL = new ConversionConfig(ConversionMode.FULL, true, DEFAULT_MAX_REWRITES);
    public static final ConversionConfig PARTIAL = new ConversionConfig(ConversionMode.PARTIAL, true, DEFAULT_MAX_REWRITES);

    public final ConversionMode mode;
    /**
     * Whether to fold and remove redundant casts once the worklist is drained.
     */
    public final boolean reconcileMaterializations;
    /**
     * How many rewrites may be applied before the run is considered not to terminate.
     */
    public final int maxRewrites;

    private ConversionConfig(ConversionMode mode, boolean reconcileMaterializations, int maxRewrites) {
        this.mode = mode;
        this.reconcileMaterializations = reconcileMaterializations;
        this.maxRewrites = maxRewrites;
    }

    public ConversionConfig withMode(ConversionMode mode) {
        return new ConversionConfig(mode, reconcileMaterializations, maxRewrites);
    }

    public ConversionConfig withReconcileMaterializations(boolean reconcileMaterializations) {
        return new ConversionConfig(mode, reconcileMaterializations, maxRewrites);
    }

    public ConversionConfig withMaxRewrites(int maxRewrites) {
        return new ConversionConfig(mode, reconcileMaterializations, maxRewrites);
    }
}
