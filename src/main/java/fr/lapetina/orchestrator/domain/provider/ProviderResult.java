package fr.lapetina.orchestrator.domain.provider;

/**
 * Result of one provider call.
 *
 * @param result        provider output (text, vector, map...)
 * @param unitsConsumed tokens or units billed
 * @param cost          monetary cost of the call
 * @param instanceId    instance that served the call
 */
public record ProviderResult(
        Object result,
        long unitsConsumed,
        double cost,
        String instanceId
) implements CostBearing {

    public static ProviderResult of(Object result, long unitsConsumed, double cost) {
        return new ProviderResult(result, unitsConsumed, cost, null);
    }

    public ProviderResult withInstanceId(String id) {
        return new ProviderResult(result, unitsConsumed, cost, id);
    }
}
