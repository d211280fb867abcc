package fr.lapetina.orchestrator.cache;

import java.util.Collection;
import java.util.Map;

/**
 * Rough usefulness of a cached value, judged from its shape.
 */
public enum QualityRating {
    EXCELLENT,
    GOOD,
    POOR;

    /**
     * Strings are rated by length, maps and collections by entry count, anything else is GOOD.
     */
    public static QualityRating rate(Object value) {
        if (value instanceof CharSequence text) {
            return bySize(text.length(), 1000, 100);
        }
        if (value instanceof Map<?, ?> map) {
            return bySize(map.size(), 10, 3);
        }
        if (value instanceof Collection<?> collection) {
            return bySize(collection.size(), 10, 3);
        }
        return GOOD;
    }

    private static QualityRating bySize(int size, int excellentAbove, int goodAbove) {
        if (size > excellentAbove) {
            return EXCELLENT;
        }
        return size > goodAbove ? GOOD : POOR;
    }
}
