package fr.lapetina.orchestrator.domain.model;

import java.util.Locale;

/**
 * The provider an instance belongs to.
 */
public enum ProviderFamily {
    OPENAI,
    OPENROUTER,
    ANTHROPIC,
    COHERE,
    LOCAL;

    /**
     * Resolves a provider from its configuration name ({@code openai}, {@code local}, ...).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ProviderFamily fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown provider: " + name, e);
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
