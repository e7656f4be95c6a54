package hostedauth.core.port.out;

import hostedauth.core.model.flow.RedirectReason;
import hostedauth.core.model.flow.ResponseType;

/**
 * Port interface for recording flow metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface FlowMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a redirect to the hosted UI.
     *
     * @param reason why the user agent was redirected
     */
    void recordRedirect(RedirectReason reason);

    /**
     * Record a session resolved from a callback.
     *
     * @param responseType the response type the callback was parsed as
     */
    void recordSessionResolved(ResponseType responseType);

    /**
     * Record a session returned from cache without network activity.
     */
    void recordCacheHit();

    /**
     * Record the outcome of a refresh grant.
     *
     * @param success true if new tokens were stored
     */
    void recordRefresh(boolean success);

    /**
     * Record a failure delivered to the caller.
     *
     * @param errorType the failure's error type
     */
    void recordFailure(String errorType);
}
