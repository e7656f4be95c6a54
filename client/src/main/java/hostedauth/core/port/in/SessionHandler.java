package hostedauth.core.port.in;

import hostedauth.core.model.session.AuthSession;

/**
 * Caller-supplied callbacks for flow outcomes.
 *
 * <p>When registered, failures go to {@link #onFailure} instead of failing
 * the returned {@code Uni}.
 */
public interface SessionHandler {

    void onSuccess(AuthSession session);

    /**
     * Called with the failure of a flow operation.
     *
     * @param error usually a {@link hostedauth.core.model.error.HostedAuthException};
     *              transport errors are passed through unchanged
     */
    void onFailure(Throwable error);

    /**
     * Called after the user agent was sent to the hosted UI.
     *
     * @param uri the launched URL
     */
    default void onRedirect(String uri) {}
}
