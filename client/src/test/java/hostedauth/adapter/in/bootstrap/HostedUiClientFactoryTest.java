package hostedauth.adapter.in.bootstrap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import hostedauth.adapter.out.launcher.LoggingUriLauncher;
import hostedauth.adapter.out.storage.memory.InMemoryKeyValueStorage;
import hostedauth.core.config.HostedUiConfig;
import hostedauth.core.model.error.ConfigurationException;
import hostedauth.core.model.error.ScopeTypeException;
import hostedauth.core.model.flow.ResponseType;

@DisplayName("HostedUiClientFactory")
class HostedUiClientFactoryTest {

    private Vertx vertx;
    private SimpleMeterRegistry registry;
    private HostedUiClientFactory factory;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        registry = new SimpleMeterRegistry();
        factory = new HostedUiClientFactory(vertx, registry, new LoggingUriLauncher(), null);
    }

    @AfterEach
    void tearDown() {
        factory.close();
        vertx.close().await().indefinitely();
    }

    private static HostedUiConfig config(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .withMapping(HostedUiConfig.class)
                .build()
                .getConfigMapping(HostedUiConfig.class);
    }

    @Nested
    @DisplayName("loadConfig")
    class LoadConfig {

        @Test
        @DisplayName("should read microprofile-config.properties and apply defaults")
        void shouldLoadDefaultSources() {
            var config = HostedUiClientFactory.loadConfig();

            assertEquals(Optional.of("test-client"), config.clientId());
            assertEquals(Optional.of("auth.example.com"), config.domain());
            assertEquals(Optional.of(List.of("openid", "email", "profile")), config.scopes());
            assertEquals("token", config.responseType());
            assertFalse(config.contextDataCollection());
            assertFalse(config.stateValidation());
            assertEquals("memory", config.storage().provider());
            assertEquals("Provider", config.storage().keyPrefix());
            assertEquals(Optional.empty(), config.storage().file().path());
            assertEquals(Duration.ofSeconds(10), config.tokenEndpoint().timeout());
            assertTrue(config.metrics().enabled());
        }
    }

    @Nested
    @DisplayName("toOptions")
    class ToOptions {

        @Test
        @DisplayName("should map settings onto flow options")
        void shouldMapSettings() {
            var options = HostedUiClientFactory.toOptions(config(Map.of(
                    "hostedauth.client-id", "c1",
                    "hostedauth.domain", "login.example.org",
                    "hostedauth.redirect-uri-sign-in", "https://app/in",
                    "hostedauth.redirect-uri-sign-out", "https://app/out",
                    "hostedauth.scopes", "openid,phone",
                    "hostedauth.response-type", "code",
                    "hostedauth.identity-provider", "Google",
                    "hostedauth.state-validation", "true")));

            assertEquals("c1", options.clientId());
            assertEquals(List.of("openid", "phone"), options.scopes());
            assertEquals(ResponseType.AUTHORIZATION_CODE, options.responseType());
            assertEquals("Google", options.identityProvider());
            assertTrue(options.stateValidation());
        }

        @Test
        @DisplayName("should reject missing required settings")
        void shouldRejectMissingSettings() {
            var config = config(Map.of("hostedauth.domain", "login.example.org"));

            assertThrows(ConfigurationException.class, () -> HostedUiClientFactory.toOptions(config));
        }

        @Test
        @DisplayName("should reject a missing scope list")
        void shouldRejectMissingScopes() {
            var config = config(Map.of(
                    "hostedauth.client-id", "c1",
                    "hostedauth.domain", "login.example.org",
                    "hostedauth.redirect-uri-sign-in", "https://app/in",
                    "hostedauth.redirect-uri-sign-out", "https://app/out"));

            assertThrows(ScopeTypeException.class, () -> HostedUiClientFactory.toOptions(config));
        }

        @Test
        @DisplayName("should reject an unknown response type")
        void shouldRejectUnknownResponseType() {
            var config = config(Map.of(
                    "hostedauth.client-id", "c1",
                    "hostedauth.domain", "login.example.org",
                    "hostedauth.redirect-uri-sign-in", "https://app/in",
                    "hostedauth.redirect-uri-sign-out", "https://app/out",
                    "hostedauth.scopes", "openid",
                    "hostedauth.response-type", "hybrid"));

            assertThrows(ConfigurationException.class, () -> HostedUiClientFactory.toOptions(config));
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should wire a signed-out flow over discovered storage")
        void shouldCreateFromConfig() {
            var service = factory.create(HostedUiClientFactory.loadConfig());

            assertEquals("test-client", service.getClientId());
            assertFalse(service.isUserSignedIn());
            assertTrue(service.getSignInUrl().startsWith("https://auth.example.com/oauth2/authorize?"));
            assertTrue(service.getSignInUrl().contains("&scope=openid%20email%20profile"));
        }

        @Test
        @DisplayName("should record metrics when a registry is supplied")
        void shouldRecordMetrics() {
            var storage = new InMemoryKeyValueStorage();
            var service = factory.create(HostedUiClientFactory.loadConfig(), storage);

            var result = service.getSession().await().indefinitely();

            assertTrue(result.isEmpty());
            assertEquals(1.0, registry.get("hostedauth.flow.redirects")
                    .tag("reason", "no_session")
                    .counter()
                    .count());
        }
    }
}
