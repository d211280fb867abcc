package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Thrown when a task names a dependency that does not exist or has not completed.
 */
public final class UnsatisfiedDependencyException extends OrchestrationException {

    private final String dependencyId;

    public UnsatisfiedDependencyException(String dependencyId, String detail) {
        super(ErrorType.DEPENDENCY_ERROR, "Dependency " + dependencyId + " " + detail);
        this.dependencyId = dependencyId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
