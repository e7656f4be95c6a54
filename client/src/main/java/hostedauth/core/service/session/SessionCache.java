package hostedauth.core.service.session;

import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import hostedauth.core.model.error.SessionCacheException;
import hostedauth.core.model.session.AuthSession;
import hostedauth.core.model.token.RefreshToken;
import hostedauth.core.model.token.Token;
import hostedauth.core.model.token.TokenScopes;
import hostedauth.core.port.out.KeyValueStorage;
import hostedauth.core.port.out.TokenDecoder;

/**
 * Maps a (client, user) identity to cached tokens in key/value storage.
 *
 * <p>Key layout:
 * <pre>
 * {prefix}.{clientId}.LastAuthUser
 * {prefix}.{clientId}.{username}.idToken
 * {prefix}.{clientId}.{username}.accessToken
 * {prefix}.{clientId}.{username}.refreshToken
 * {prefix}.{clientId}.{username}.tokenScopesString
 * </pre>
 */
public class SessionCache {

    private static final Logger LOG = Logger.getLogger(SessionCache.class);

    static final String LAST_AUTH_USER = "LastAuthUser";
    static final String ID_TOKEN = "idToken";
    static final String ACCESS_TOKEN = "accessToken";
    static final String REFRESH_TOKEN = "refreshToken";
    static final String TOKEN_SCOPES = "tokenScopesString";

    private final KeyValueStorage storage;
    private final TokenDecoder decoder;
    private final String keyPrefix;

    public SessionCache(KeyValueStorage storage, TokenDecoder decoder, String keyPrefix) {
        this.storage = storage;
        this.decoder = decoder;
        this.keyPrefix = keyPrefix;
    }

    /**
     * Load the cached session of a user.
     *
     * <p>Never throws. Missing fields become empty tokens; a storage failure
     * is logged and yields an empty session.
     *
     * @param clientId application client ID
     * @param username the user, may be null
     * @return the cached session, or an empty session
     */
    public AuthSession load(String clientId, String username) {
        if (username == null || username.isBlank()) {
            return AuthSession.empty();
        }

        try {
            var idToken = Token.of(read(userKey(clientId, username, ID_TOKEN)), decoder::decode);
            var accessToken = Token.of(read(userKey(clientId, username, ACCESS_TOKEN)), decoder::decode);
            var refreshToken = RefreshToken.of(read(userKey(clientId, username, REFRESH_TOKEN)));
            var scopes = TokenScopes.fromSpaceDelimited(read(userKey(clientId, username, TOKEN_SCOPES)));
            return new AuthSession(idToken, accessToken, refreshToken, scopes);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to read cached tokens for user %s, treating as signed out", username);
            return AuthSession.empty();
        }
    }

    /**
     * Write a session's tokens and scopes under its user.
     *
     * <p>The user is taken from the access token's subject claim and becomes
     * the client's last signed-in user.
     *
     * @param clientId application client ID
     * @param session  the session to cache
     * @return the username the session was stored under
     * @throws SessionCacheException if the access token has no subject or storage fails
     */
    public String save(String clientId, AuthSession session) {
        final var username = session.getAccessToken()
                .subject()
                .orElseThrow(() -> new SessionCacheException("Access token has no subject to cache the session under"));

        try {
            storage.set(userKey(clientId, username, ID_TOKEN), session.getIdToken().raw().orElse(null));
            storage.set(userKey(clientId, username, ACCESS_TOKEN), session.getAccessToken().raw().orElse(null));
            storage.set(userKey(clientId, username, REFRESH_TOKEN), session.getRefreshToken().raw());
            storage.set(lastUserKey(clientId), username);
            storage.set(userKey(clientId, username, TOKEN_SCOPES), session.getScopes().toSpaceDelimited());
        } catch (RuntimeException e) {
            throw new SessionCacheException("Failed to cache tokens for user " + username, e);
        }

        LOG.debugf("Cached session for user %s", username);
        return username;
    }

    /**
     * Remove every cached field of a user and the last-user pointer.
     *
     * <p>Idempotent. With a null username only the last-user pointer is removed.
     *
     * @param clientId application client ID
     * @param username the user, may be null
     */
    public void clear(String clientId, String username) {
        if (username != null && !username.isBlank()) {
            for (String field : List.of(ID_TOKEN, ACCESS_TOKEN, REFRESH_TOKEN, TOKEN_SCOPES)) {
                storage.remove(userKey(clientId, username, field));
            }
        }
        storage.remove(lastUserKey(clientId));
        LOG.debugf("Cleared cached session for user %s", username);
    }

    /**
     * Read the last signed-in user of a client.
     *
     * @param clientId application client ID
     * @return the username, or empty if nobody signed in
     */
    public Optional<String> lastUser(String clientId) {
        try {
            return storage.get(lastUserKey(clientId)).filter(u -> !u.isBlank());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to read last signed-in user for client %s", clientId);
            return Optional.empty();
        }
    }

    private String read(String key) {
        return storage.get(key).orElse(null);
    }

    String lastUserKey(String clientId) {
        return keyPrefix + "." + clientId + "." + LAST_AUTH_USER;
    }

    String userKey(String clientId, String username, String field) {
        return keyPrefix + "." + clientId + "." + username + "." + field;
    }
}
