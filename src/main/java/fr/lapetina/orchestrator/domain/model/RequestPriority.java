package fr.lapetina.orchestrator.domain.model;

import java.util.Locale;

/**
 * Request priority. The weight orders the task queue; higher runs first.
 */
public enum RequestPriority {
    LOW(1),
    NORMAL(10),
    HIGH(50),
    CRITICAL(100);

    private final int defaultWeight;

    RequestPriority(int defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public int getDefaultWeight() {
        return defaultWeight;
    }

    public static RequestPriority fromName(String name) {
        if (name == null || name.isBlank()) {
            return NORMAL;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
