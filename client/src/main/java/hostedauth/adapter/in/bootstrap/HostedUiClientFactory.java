package hostedauth.adapter.in.bootstrap;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import hostedauth.adapter.out.auth.Jose4jTokenDecoder;
import hostedauth.adapter.out.http.VertxTokenEndpointClient;
import hostedauth.adapter.out.launcher.DesktopUriLauncher;
import hostedauth.adapter.out.launcher.LoggingUriLauncher;
import hostedauth.adapter.out.telemetry.MicrometerFlowMetrics;
import hostedauth.adapter.out.telemetry.NoopFlowMetrics;
import hostedauth.core.config.HostedUiConfig;
import hostedauth.core.model.flow.FlowOptions;
import hostedauth.core.model.flow.ResponseType;
import hostedauth.core.port.out.ContextDataProvider;
import hostedauth.core.port.out.FlowMetrics;
import hostedauth.core.port.out.KeyValueStorage;
import hostedauth.core.port.out.UriLauncher;
import hostedauth.core.service.flow.HostedUiFlowService;
import hostedauth.core.service.session.SessionCache;
import hostedauth.core.service.session.StateGenerator;
import hostedauth.core.service.storage.TokenStorageProviderRegistry;

/**
 * Wires a {@link HostedUiFlowService} from {@link HostedUiConfig}.
 *
 * <p>Closing the factory closes the token endpoint clients it created and,
 * when it created its own Vert.x instance, that instance too.
 */
public class HostedUiClientFactory implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(HostedUiClientFactory.class);

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final MeterRegistry meterRegistry;
    private final UriLauncher launcher;
    private final ContextDataProvider contextDataProvider;
    private final Clock clock;
    private final List<VertxTokenEndpointClient> clients = new ArrayList<>();

    /**
     * Factory with its own Vert.x instance, no metrics, and the system browser
     * (or a logging launcher on headless hosts).
     */
    public HostedUiClientFactory() {
        this(
                Vertx.vertx(),
                true,
                null,
                DesktopUriLauncher.isSupported() ? new DesktopUriLauncher() : new LoggingUriLauncher(),
                null,
                Clock.systemUTC());
    }

    /**
     * @param vertx               Vert.x instance used for token endpoint calls, not closed by this factory
     * @param meterRegistry       registry for flow metrics, or null to disable them
     * @param launcher            opens hosted UI pages
     * @param contextDataProvider risk context collector, or null
     */
    public HostedUiClientFactory(
            Vertx vertx, MeterRegistry meterRegistry, UriLauncher launcher, ContextDataProvider contextDataProvider) {
        this(vertx, false, meterRegistry, launcher, contextDataProvider, Clock.systemUTC());
    }

    HostedUiClientFactory(
            Vertx vertx,
            boolean ownsVertx,
            MeterRegistry meterRegistry,
            UriLauncher launcher,
            ContextDataProvider contextDataProvider,
            Clock clock) {
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.meterRegistry = meterRegistry;
        this.launcher = launcher;
        this.contextDataProvider = contextDataProvider;
        this.clock = clock;
    }

    /**
     * Load settings from the default config sources: system properties,
     * environment variables and {@code META-INF/microprofile-config.properties}.
     *
     * @return the mapped settings
     */
    public static HostedUiConfig loadConfig() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(HostedUiConfig.class)
                .build();
        return config.getConfigMapping(HostedUiConfig.class);
    }

    /**
     * Convert settings into validated flow options.
     *
     * @throws hostedauth.core.model.error.ConfigurationException if a required setting is missing
     * @throws hostedauth.core.model.error.ScopeTypeException if scopes are missing or malformed
     */
    public static FlowOptions toOptions(HostedUiConfig config) {
        return new FlowOptions(
                config.clientId().orElse(null),
                config.domain().orElse(null),
                config.redirectUriSignIn().orElse(null),
                config.redirectUriSignOut().orElse(null),
                config.scopes().orElse(null),
                config.identityProvider().orElse(null),
                config.userPoolId().orElse(null),
                ResponseType.fromConfig(config.responseType()),
                config.contextDataCollection(),
                config.stateValidation());
    }

    /**
     * Create a flow from the default config sources.
     */
    public HostedUiFlowService create() {
        return create(loadConfig());
    }

    /**
     * Create a flow using the storage provider selected by configuration.
     */
    public HostedUiFlowService create(HostedUiConfig config) {
        final var options = toOptions(config);
        final var storage = TokenStorageProviderRegistry.discover(config.storage()).getStorage();
        return create(config, options, storage);
    }

    /**
     * Create a flow over caller-supplied storage.
     */
    public HostedUiFlowService create(HostedUiConfig config, KeyValueStorage storage) {
        return create(config, toOptions(config), storage);
    }

    private HostedUiFlowService create(HostedUiConfig config, FlowOptions options, KeyValueStorage storage) {
        final var decoder = new Jose4jTokenDecoder();
        final var cache = new SessionCache(storage, decoder, config.storage().keyPrefix());
        final var tokenEndpoint = new VertxTokenEndpointClient(vertx, config.tokenEndpoint().timeout());
        synchronized (clients) {
            clients.add(tokenEndpoint);
        }

        LOG.infof(
                "Creating hosted UI client %s for %s (response type %s)",
                options.clientId(),
                options.domain(),
                options.responseType().wireValue());

        return new HostedUiFlowService(
                options,
                cache,
                tokenEndpoint,
                decoder,
                launcher,
                contextDataProvider,
                new StateGenerator(),
                metrics(config),
                clock);
    }

    private FlowMetrics metrics(HostedUiConfig config) {
        if (meterRegistry == null || !config.metrics().enabled()) {
            return NoopFlowMetrics.INSTANCE;
        }
        return new MicrometerFlowMetrics(meterRegistry, true);
    }

    @Override
    public void close() {
        synchronized (clients) {
            clients.forEach(VertxTokenEndpointClient::close);
            clients.clear();
        }
        if (ownsVertx) {
            vertx.closeAndAwait();
        }
    }
}
