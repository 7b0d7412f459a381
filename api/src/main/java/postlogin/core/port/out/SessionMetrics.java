package postlogin.core.port.out;

/**
 * Port interface for recording session lifecycle metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface SessionMetrics {

    /**
     * Record a session initiation.
     *
     * @param businessUnit resolved business unit, or null if resolution failed
     * @param outcome "success" or the lower-case error code
     */
    void recordInitiation(String businessUnit, String outcome);

    /**
     * Record a renewal attempt.
     *
     * @param outcome "success" or the lower-case error code
     */
    void recordRenewal(String outcome);

    /**
     * Record a call to the external verifier.
     *
     * @param verdict "valid", "expired" or "unavailable"
     * @param durationMs call duration in milliseconds
     */
    void recordVerification(String verdict, long durationMs);

    /**
     * Record a session store operation timeout.
     *
     * @param repository repository name
     * @param operation operation name
     */
    void recordStoreTimeout(String repository, String operation);
}
