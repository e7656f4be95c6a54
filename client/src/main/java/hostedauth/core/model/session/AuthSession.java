package hostedauth.core.model.session;

import java.time.Instant;

import hostedauth.core.model.token.RefreshToken;
import hostedauth.core.model.token.Token;
import hostedauth.core.model.token.TokenScopes;

/**
 * The signed-in user's tokens as held by a flow.
 *
 * <p>A session is owned by exactly one flow service. Absence of a token is
 * represented by an empty {@link Token} or {@link RefreshToken}, never by null.
 *
 * <p>Not thread-safe on its own; the owning flow guards mutation.
 */
public final class AuthSession {

    private Token idToken;
    private Token accessToken;
    private RefreshToken refreshToken;
    private TokenScopes scopes;
    private String state;

    public AuthSession(Token idToken, Token accessToken, RefreshToken refreshToken, TokenScopes scopes) {
        this.idToken = idToken == null ? Token.empty() : idToken;
        this.accessToken = accessToken == null ? Token.empty() : accessToken;
        this.refreshToken = refreshToken == null ? RefreshToken.empty() : refreshToken;
        this.scopes = scopes == null ? TokenScopes.empty() : scopes;
    }

    /**
     * A session with no tokens and no scopes.
     */
    public static AuthSession empty() {
        return empty(TokenScopes.empty());
    }

    /**
     * A session with no tokens carrying the given scopes.
     */
    public static AuthSession empty(TokenScopes scopes) {
        return new AuthSession(Token.empty(), Token.empty(), RefreshToken.empty(), scopes);
    }

    /**
     * Check if both the ID and access tokens are present and unexpired now.
     */
    public boolean isValid() {
        return isValid(Instant.now());
    }

    /**
     * Check if both the ID and access tokens are present and expire strictly after {@code now}.
     *
     * @param now the reference time
     */
    public boolean isValid(Instant now) {
        return idToken.isUnexpiredAt(now) && accessToken.isUnexpiredAt(now);
    }

    public Token getIdToken() {
        return idToken;
    }

    public void setIdToken(Token idToken) {
        this.idToken = idToken == null ? Token.empty() : idToken;
    }

    public Token getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(Token accessToken) {
        this.accessToken = accessToken == null ? Token.empty() : accessToken;
    }

    public RefreshToken getRefreshToken() {
        return refreshToken;
    }

    public void setRefreshToken(RefreshToken refreshToken) {
        this.refreshToken = refreshToken == null ? RefreshToken.empty() : refreshToken;
    }

    public TokenScopes getScopes() {
        return scopes;
    }

    public void setTokenScopes(TokenScopes scopes) {
        this.scopes = scopes == null ? TokenScopes.empty() : scopes;
    }

    /**
     * The CSRF state returned with the callback that produced this session.
     */
    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return "AuthSession[idToken=" + idToken + ", accessToken=" + accessToken + ", refreshToken=" + refreshToken
                + ", scopes=" + scopes.toSpaceDelimited() + "]";
    }
}
