package hostedauth.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for a hosted UI client.
 *
 * <p>Configuration prefix: {@code hostedauth}
 *
 * <p>Required settings are declared optional here so that a missing value
 * surfaces as a {@link hostedauth.core.model.error.ConfigurationException}
 * when the flow is built, not as a config loading error.
 */
@ConfigMapping(prefix = "hostedauth")
public interface HostedUiConfig {

    /**
     * Application client ID registered with the user pool.
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * Hosted UI domain, without scheme (e.g. {@code auth.example.com}).
     */
    Optional<String> domain();

    /**
     * Redirect URI the provider returns to after sign-in.
     */
    @WithName("redirect-uri-sign-in")
    Optional<String> redirectUriSignIn();

    /**
     * Redirect URI the provider returns to after sign-out.
     */
    @WithName("redirect-uri-sign-out")
    Optional<String> redirectUriSignOut();

    /**
     * Scopes to request. Comma-separated in property files.
     */
    Optional<List<String>> scopes();

    /**
     * Pre-selected identity provider, skipping the provider chooser.
     */
    @WithName("identity-provider")
    Optional<String> identityProvider();

    /**
     * User pool ID handed to the context data provider.
     */
    @WithName("user-pool-id")
    Optional<String> userPoolId();

    /**
     * Response type: {@code token} (implicit) or {@code code}.
     *
     * @return response type (default: token)
     */
    @WithName("response-type")
    @WithDefault("token")
    String responseType();

    /**
     * Attach device and risk context to sign-in URLs when a provider is available.
     *
     * @return true to collect (default: false)
     */
    @WithName("context-data-collection")
    @WithDefault("false")
    boolean contextDataCollection();

    /**
     * Reject callbacks whose state does not match the outstanding sign-in state.
     *
     * @return true to validate (default: false)
     */
    @WithName("state-validation")
    @WithDefault("false")
    boolean stateValidation();

    /**
     * Token storage configuration.
     */
    StorageConfig storage();

    /**
     * Token endpoint configuration.
     */
    @WithName("token-endpoint")
    TokenEndpointConfig tokenEndpoint();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Token storage settings.
     */
    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: memory, file, or custom SPI name.
         *
         * @return Provider name (default: memory)
         */
        @WithDefault("memory")
        String provider();

        /**
         * First segment of every storage key.
         *
         * @return Key prefix (default: Provider)
         */
        @WithName("key-prefix")
        @WithDefault("Provider")
        String keyPrefix();

        /**
         * File storage settings.
         */
        FileConfig file();
    }

    /**
     * File storage settings.
     */
    interface FileConfig {

        /**
         * Properties file holding cached tokens. The file provider is
         * unavailable when unset.
         */
        Optional<String> path();
    }

    /**
     * Token endpoint settings.
     */
    interface TokenEndpointConfig {

        /**
         * HTTP timeout for token endpoint requests.
         *
         * @return Timeout duration (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration timeout();
    }

    /**
     * Metrics settings.
     */
    interface MetricsConfig {

        /**
         * Record flow metrics when a meter registry is supplied.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
