package fr.lapetina.orchestrator.domain.model;

/**
 * Provider-side quota of an instance. An instance with a non-positive
 * per-minute quota is never selected.
 */
public record QuotaLimits(
        int requestsPerMinute,
        long unitsPerMinute,
        long dailyLimit
) {
    public static final QuotaLimits UNLIMITED = new QuotaLimits(Integer.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE);

    public boolean isUsable() {
        return requestsPerMinute > 0 && unitsPerMinute > 0;
    }
}
