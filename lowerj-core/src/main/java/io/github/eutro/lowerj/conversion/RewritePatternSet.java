package io.github.eutro.lowerj.conversion;

import io.github.eutro.lowerj.ops.OpKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered collection of {@link ConversionPattern}s, grouped by the kind they rewrite.
 */
public class RewritePatternSet {
    private final Map<OpKey, List<ConversionPattern>> byRoot = new LinkedHashMap<>();
    private int size = 0;

    public RewritePatternSet add(ConversionPattern... patterns) {
        for (ConversionPattern pattern : patterns) {
            byRoot.computeIfAbsent(pattern.getRoot(), $ -> new ArrayList<>()).add(pattern);
            size++;
        }
        return this;
    }

    /**
     * Get the patterns rewriting a kind, in the order they were added.
     *
     * @param key The kind.
     * @return The patterns.
     */
    public List<ConversionPattern> get(OpKey key) {
        return Collections.unmodifiableList(byRoot.getOrDefault(key, Collections.emptyList()));
    }

    public int size() {
        return size;
    }
}
