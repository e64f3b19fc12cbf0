package space.ketterling.airsense.ratelimit;

/**
 * Thrown at the request boundary when a client is denied admission.
 */
public class RateLimitExceededException extends RuntimeException {
    private final AdmissionDecision decision;

    public RateLimitExceededException(AdmissionDecision decision) {
        super(decision.reason());
        this.decision = decision;
    }

    public AdmissionDecision decision() {
        return decision;
    }
}
