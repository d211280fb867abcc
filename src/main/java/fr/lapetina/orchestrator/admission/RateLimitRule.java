package fr.lapetina.orchestrator.admission;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A rate-limit rule: which endpoints it covers and the limit per tier.
 * Lower {@code priority} wins when several rules match.
 *
 * @param id       unique rule id
 * @param name     display name
 * @param pattern  endpoint glob ({@code /api/ai/*}) or substring
 * @param limits   one limit per tier
 * @param priority resolution order, also divides adaptive limits
 * @param enabled  disabled rules never match
 * @param metadata descriptive information
 */
public record RateLimitRule(
        String id,
        String name,
        String pattern,
        Map<UserTier, TierLimit> limits,
        int priority,
        boolean enabled,
        RuleMetadata metadata
) {
    private static final Map<String, Pattern> COMPILED_GLOBS = new ConcurrentHashMap<>();

    public RateLimitRule {
        Objects.requireNonNull(id, "Rule ID is required");
        Objects.requireNonNull(pattern, "Pattern is required");
        Objects.requireNonNull(limits, "Limits are required");
        for (UserTier tier : UserTier.values()) {
            if (!limits.containsKey(tier)) {
                throw new IllegalArgumentException("Rule " + id + " has no limit for tier " + tier);
            }
        }
        if (priority < 1) {
            throw new IllegalArgumentException("Rule priority must be positive: " + priority);
        }
        limits = Map.copyOf(new EnumMap<>(limits));
        if (name == null) {
            name = id;
        }
        if (metadata == null) {
            metadata = RuleMetadata.EMPTY;
        }
        COMPILED_GLOBS.computeIfAbsent(pattern, RateLimitRule::toRegex);
    }

    /**
     * Whether the rule covers the endpoint, either as a substring or as a glob over the whole path.
     */
    public boolean matches(String endpoint) {
        if (endpoint == null) {
            return false;
        }
        if (endpoint.contains(pattern)) {
            return true;
        }
        return COMPILED_GLOBS.computeIfAbsent(pattern, RateLimitRule::toRegex).matcher(endpoint).matches();
    }

    public TierLimit limitFor(UserTier tier) {
        return limits.get(tier);
    }

    /**
     * Length of the literal part of the pattern; longer means more specific.
     */
    int specificity() {
        return pattern.replace("*", "").length();
    }

    private static Pattern toRegex(String glob) {
        return Pattern.compile(Arrays.stream(glob.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*")));
    }

    /**
     * Descriptive rule information.
     */
    public record RuleMetadata(
            String description,
            double costPerRequest,
            boolean computeIntensive,
            String model
    ) {
        public static final RuleMetadata EMPTY = new RuleMetadata(null, 0.0, false, null);
    }
}
