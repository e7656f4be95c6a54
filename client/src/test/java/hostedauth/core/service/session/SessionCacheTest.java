package hostedauth.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import hostedauth.TestTokens;
import hostedauth.adapter.out.auth.Jose4jTokenDecoder;
import hostedauth.adapter.out.storage.memory.InMemoryKeyValueStorage;
import hostedauth.core.model.error.SessionCacheException;
import hostedauth.core.model.session.AuthSession;
import hostedauth.core.model.token.RefreshToken;
import hostedauth.core.model.token.Token;
import hostedauth.core.model.token.TokenScopes;
import hostedauth.core.port.out.KeyValueStorage;

@DisplayName("SessionCache")
class SessionCacheTest {

    private static final String CLIENT_ID = "client-123";
    private static final Instant EXPIRES = Instant.parse("2030-01-01T01:00:00Z");

    private final Jose4jTokenDecoder decoder = new Jose4jTokenDecoder();
    private InMemoryKeyValueStorage storage;
    private SessionCache cache;

    @BeforeEach
    void setUp() {
        storage = new InMemoryKeyValueStorage();
        cache = new SessionCache(storage, decoder, "Provider");
    }

    private AuthSession session(String username, String refreshToken) {
        return new AuthSession(
                Token.of(TestTokens.idToken("id-" + username, EXPIRES), decoder::decode),
                Token.of(TestTokens.accessToken(username, EXPIRES), decoder::decode),
                RefreshToken.of(refreshToken),
                TokenScopes.of("openid", "email"));
    }

    @Nested
    @DisplayName("save")
    class Save {

        @Test
        @DisplayName("should write every field under the access token's user")
        void shouldWriteEveryField() {
            var session = session("alice", "r-1");

            var username = cache.save(CLIENT_ID, session);

            assertEquals("alice", username);
            assertEquals(Optional.of("alice"), storage.get("Provider.client-123.LastAuthUser"));
            assertEquals(session.getIdToken().raw(), storage.get("Provider.client-123.alice.idToken"));
            assertEquals(session.getAccessToken().raw(), storage.get("Provider.client-123.alice.accessToken"));
            assertEquals(Optional.of("r-1"), storage.get("Provider.client-123.alice.refreshToken"));
            assertEquals(Optional.of("openid email"), storage.get("Provider.client-123.alice.tokenScopesString"));
        }

        @Test
        @DisplayName("should remove fields that are empty instead of writing placeholders")
        void shouldRemoveEmptyFields() {
            cache.save(CLIENT_ID, session("alice", "r-1"));

            cache.save(CLIENT_ID, session("alice", null));

            assertFalse(storage.get("Provider.client-123.alice.refreshToken").isPresent());
        }

        @Test
        @DisplayName("should fail when the access token has no owner")
        void shouldFailWithoutOwner() {
            var session = new AuthSession(
                    Token.empty(),
                    Token.of(TestTokens.anonymousToken(EXPIRES), decoder::decode),
                    RefreshToken.empty(),
                    TokenScopes.empty());

            assertThrows(SessionCacheException.class, () -> cache.save(CLIENT_ID, session));
            assertEquals(0, storage.size());
        }

        @Test
        @DisplayName("should wrap storage failures")
        void shouldWrapStorageFailures() {
            var failing = mock(KeyValueStorage.class);
            doThrow(new IllegalStateException("disk full")).when(failing).set(anyString(), anyString());
            var failingCache = new SessionCache(failing, decoder, "Provider");

            var error = assertThrows(SessionCacheException.class, () -> failingCache.save(CLIENT_ID, session("alice", "r")));

            assertInstanceOf(IllegalStateException.class, error.getCause());
        }
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("should read back a saved session")
        void shouldReadBackSavedSession() {
            var saved = session("alice", "r-1");
            cache.save(CLIENT_ID, saved);

            var loaded = cache.load(CLIENT_ID, "alice");

            assertEquals(saved.getIdToken(), loaded.getIdToken());
            assertEquals(saved.getAccessToken(), loaded.getAccessToken());
            assertEquals(RefreshToken.of("r-1"), loaded.getRefreshToken());
            assertEquals(TokenScopes.of("email", "openid"), loaded.getScopes());
            assertEquals(Optional.of(EXPIRES), loaded.getAccessToken().expiration());
        }

        @Test
        @DisplayName("should return an empty session for an unknown or missing user")
        void shouldReturnEmptyForUnknownUser() {
            assertFalse(cache.load(CLIENT_ID, "nobody").getAccessToken().isPresent());
            assertFalse(cache.load(CLIENT_ID, null).getAccessToken().isPresent());
        }

        @Test
        @DisplayName("should return an empty session when storage fails")
        void shouldReturnEmptyWhenStorageFails() {
            var failing = mock(KeyValueStorage.class);
            when(failing.get(anyString())).thenThrow(new IllegalStateException("unreadable"));

            var loaded = new SessionCache(failing, decoder, "Provider").load(CLIENT_ID, "alice");

            assertFalse(loaded.getIdToken().isPresent());
            assertTrue(loaded.getScopes().isEmpty());
        }
    }

    @Nested
    @DisplayName("clear")
    class Clear {

        @Test
        @DisplayName("should remove every field and the last user")
        void shouldRemoveEverything() {
            cache.save(CLIENT_ID, session("alice", "r-1"));

            cache.clear(CLIENT_ID, "alice");

            assertEquals(0, storage.size());
            assertEquals(Optional.empty(), cache.lastUser(CLIENT_ID));
        }

        @Test
        @DisplayName("should be idempotent and tolerate a missing user")
        void shouldBeIdempotent() {
            cache.clear(CLIENT_ID, "alice");
            cache.clear(CLIENT_ID, null);

            assertEquals(0, storage.size());
        }

        @Test
        @DisplayName("should leave other users of the same client untouched")
        void shouldLeaveOtherUsers() {
            cache.save(CLIENT_ID, session("alice", "r-1"));
            cache.save(CLIENT_ID, session("bob", "r-2"));

            cache.clear(CLIENT_ID, "bob");

            assertEquals(Optional.empty(), cache.lastUser(CLIENT_ID));
            assertEquals(Optional.empty(), storage.get(cache.userKey(CLIENT_ID, "bob", SessionCache.ACCESS_TOKEN)));
            assertEquals(RefreshToken.of("r-1"), cache.load(CLIENT_ID, "alice").getRefreshToken());
            assertEquals(4, storage.size());
        }

        @Test
        @DisplayName("should leave other clients untouched")
        void shouldLeaveOtherClients() {
            cache.save(CLIENT_ID, session("alice", "r-1"));
            cache.save("other-client", session("alice", "r-2"));

            cache.clear(CLIENT_ID, "alice");

            assertEquals(Optional.of("alice"), cache.lastUser("other-client"));
            assertEquals(RefreshToken.of("r-2"), cache.load("other-client", "alice").getRefreshToken());
        }
    }

    @Test
    @DisplayName("should build keys from prefix, client and user")
    void shouldBuildKeys() {
        var custom = new SessionCache(storage, decoder, "MyApp");

        assertEquals("MyApp.c.LastAuthUser", custom.lastUserKey("c"));
        assertEquals("MyApp.c.u.idToken", custom.userKey("c", "u", SessionCache.ID_TOKEN));
    }
}
