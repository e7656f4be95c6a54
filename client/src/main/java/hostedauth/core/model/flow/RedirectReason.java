package hostedauth.core.model.flow;

/**
 * Why the flow sent the user agent to the hosted UI.
 */
public enum RedirectReason {
    /** Nobody is signed in. */
    NO_SESSION,
    /** The cached session was granted different scopes than configured. */
    SCOPE_MISMATCH,
    /** The session expired and there is no refresh token to renew it. */
    NO_REFRESH_TOKEN,
    /** The token endpoint rejected the refresh token. */
    REFRESH_REJECTED,
    /** The user signed out. */
    SIGN_OUT
}
