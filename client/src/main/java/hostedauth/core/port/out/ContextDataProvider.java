package hostedauth.core.port.out;

import java.util.Optional;

/**
 * Outbound port that collects device and risk context for the provider's
 * advanced security checks.
 */
public interface ContextDataProvider {

    /**
     * Collect an encoded context payload.
     *
     * @param username   the current user, or empty string if unknown
     * @param userPoolId the user pool, or empty string if unknown
     * @param clientId   the application client ID
     * @return the opaque payload, or empty when nothing was collected
     */
    Optional<String> collect(String username, String userPoolId, String clientId);
}
