package fr.lapetina.orchestrator.domain.strategy;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The closed set of instance selection strategies.
 */
public enum SelectionStrategyType {
    ROUND_ROBIN("round-robin"),
    WEIGHTED_ROUND_ROBIN("weighted-round-robin"),
    LEAST_CONNECTIONS("least-connections"),
    LEAST_RESPONSE_TIME("least-response-time"),
    COST_OPTIMIZED("cost-optimized"),
    ADAPTIVE("adaptive");

    private final String configName;

    SelectionStrategyType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a strategy from its configuration name. Accepts {@code least-connections},
     * {@code least_connections} and {@code LEAST_CONNECTIONS}.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SelectionStrategyType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (SelectionStrategyType type : values()) {
                if (type.configName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown selection strategy: " + name + ", expected one of "
                + Arrays.stream(values()).map(SelectionStrategyType::getConfigName).collect(Collectors.joining(", ")));
    }
}
