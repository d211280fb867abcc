package fr.lapetina.orchestrator.domain.provider;

/**
 * A value that knows what it cost to produce.
 * The response cache reads it to account for the cost saved by hits.
 */
public interface CostBearing {

    double cost();

    long unitsConsumed();
}
