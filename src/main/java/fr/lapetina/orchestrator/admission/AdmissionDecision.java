package fr.lapetina.orchestrator.admission;

import java.time.Instant;

/**
 * Result of an admission check.
 *
 * @param allowed           whether the request may proceed
 * @param limit             requests allowed per window, {@link Long#MAX_VALUE} when unlimited
 * @param remaining         requests left in the current window
 * @param resetTime         when the window frees up
 * @param retryAfterSeconds seconds to wait before retrying, only set on denial
 * @param warning           set when the check failed open or the requester is close to a block
 * @param reason            only set on denial
 * @param ruleId            rule that decided, {@code null} when no rule matched
 */
public record AdmissionDecision(
        boolean allowed,
        long limit,
        long remaining,
        Instant resetTime,
        Long retryAfterSeconds,
        String warning,
        DenialReason reason,
        String ruleId
) {
    public static final long UNLIMITED = Long.MAX_VALUE;

    /**
     * Decision when no rule covers the endpoint.
     */
    public static AdmissionDecision unlimited(Instant now) {
        return new AdmissionDecision(true, UNLIMITED, UNLIMITED, now, null, null, null, null);
    }

    /**
     * Decision when the check itself failed; the request proceeds.
     */
    public static AdmissionDecision failOpen(Instant now, String warning) {
        return new AdmissionDecision(true, UNLIMITED, UNLIMITED, now, null, warning, null, null);
    }

    public static AdmissionDecision rejected(Instant now, String message) {
        return new AdmissionDecision(false, 0, 0, now, null, message, DenialReason.CONTENT_REJECTED, null);
    }
}
