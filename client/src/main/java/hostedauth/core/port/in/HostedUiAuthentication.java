package hostedauth.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import hostedauth.core.model.flow.ResponseParameters;
import hostedauth.core.model.flow.ResponseType;
import hostedauth.core.model.session.AuthSession;

/**
 * Inbound port for the hosted UI sign-in flow.
 *
 * <p>Asynchronous operations emit {@code Optional.of(session)} on success and
 * {@code Optional.empty()} when the user agent was redirected to the hosted
 * UI. Failures fail the {@code Uni}, unless a {@link SessionHandler} is
 * registered, in which case the handler receives them and the {@code Uni}
 * emits {@code Optional.empty()}.
 */
public interface HostedUiAuthentication {

    /**
     * Return a usable session, refreshing or redirecting to sign-in when needed.
     *
     * @return the session, or empty if the user agent was redirected
     */
    Uni<Optional<AuthSession>> getSession();

    /**
     * Parse the URL the provider redirected back to and resolve a session from it.
     *
     * @param callbackUrl the full redirect URL including query or fragment
     * @return the resolved session
     */
    Uni<Optional<AuthSession>> parseCallbackResponse(String callbackUrl);

    /**
     * Build a session from already parsed response fields and cache it.
     *
     * @param parameters the response fields
     * @return the resolved session
     * @throws hostedauth.core.model.error.CallbackParseException if the fields carry an error
     */
    AuthSession resolveSession(ResponseParameters parameters);

    /**
     * Exchange a refresh token for new ID and access tokens.
     *
     * @param refreshToken the refresh credential
     * @return the refreshed session
     */
    Uni<Optional<AuthSession>> refreshSession(String refreshToken);

    /**
     * Clear the session and cache for the current user and open the sign-out page.
     */
    void signOut();

    /**
     * Check whether the held or the cached session is valid.
     */
    boolean isUserSignedIn();

    /**
     * The sign-in URL, generating the CSRF state if none is set.
     */
    String getSignInUrl();

    String getSignOutUrl();

    /**
     * The last signed-in user recorded in storage.
     */
    Optional<String> getCurrentUser();

    ResponseType getResponseType();

    void useCodeGrantFlow();

    void useImplicitFlow();

    void setIdentityProvider(String identityProvider);

    void setSessionHandler(SessionHandler handler);
}
