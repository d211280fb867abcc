package fr.lapetina.orchestrator.admission;

import java.util.Locale;

/**
 * Service level of a requester. Each rate-limit rule defines one limit per tier.
 */
public enum UserTier {
    ANONYMOUS,
    AUTHENTICATED,
    PREMIUM,
    ENTERPRISE;

    /**
     * Resolves a tier by name, defaulting to {@link #ANONYMOUS} when absent.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static UserTier fromName(String name) {
        if (name == null || name.isBlank()) {
            return ANONYMOUS;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
