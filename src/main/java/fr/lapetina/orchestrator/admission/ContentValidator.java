package fr.lapetina.orchestrator.admission;

import java.util.Optional;

/**
 * Content and media checks run before rate limiting. The checks themselves live outside
 * the orchestrator; this is only the seam.
 */
@FunctionalInterface
public interface ContentValidator {

    /**
     * @return a rejection message, or empty when the content is acceptable
     */
    Optional<String> validate(String endpoint, String identity, Object content);
}
