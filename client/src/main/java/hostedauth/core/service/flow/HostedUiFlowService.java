package hostedauth.core.service.flow;

import java.time.Clock;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import hostedauth.core.model.error.CallbackParseException;
import hostedauth.core.model.error.HostedAuthException;
import hostedauth.core.model.error.RefreshTypeException;
import hostedauth.core.model.error.TokenRefreshException;
import hostedauth.core.model.flow.FlowOptions;
import hostedauth.core.model.flow.GrantType;
import hostedauth.core.model.flow.RedirectReason;
import hostedauth.core.model.flow.ResponseParameters;
import hostedauth.core.model.flow.ResponseType;
import hostedauth.core.model.flow.TokenEndpointRequest;
import hostedauth.core.model.flow.TokenEndpointResponse;
import hostedauth.core.model.session.AuthSession;
import hostedauth.core.model.token.RefreshToken;
import hostedauth.core.model.token.Token;
import hostedauth.core.model.token.TokenScopes;
import hostedauth.core.port.in.HostedUiAuthentication;
import hostedauth.core.port.in.SessionHandler;
import hostedauth.core.port.out.ContextDataProvider;
import hostedauth.core.port.out.FlowMetrics;
import hostedauth.core.port.out.TokenDecoder;
import hostedauth.core.port.out.TokenEndpointClient;
import hostedauth.core.port.out.UriLauncher;
import hostedauth.core.service.session.SessionCache;
import hostedauth.core.service.session.StateGenerator;

/**
 * Drives the hosted UI sign-in flow for one client.
 *
 * <p>On {@link #getSession()} the held session is returned while valid.
 * Otherwise the cached session is reloaded and:
 * <ol>
 *   <li>if nobody is signed in, the user agent is sent to sign-in</li>
 *   <li>if its scopes differ from the configured scopes, it is discarded and
 *       the user agent is sent to sign-in</li>
 *   <li>if it is valid, it is returned</li>
 *   <li>if it has no refresh token, the user agent is sent to sign-in</li>
 *   <li>otherwise it is refreshed at the token endpoint</li>
 * </ol>
 *
 * <p>After a redirect the host application resumes the flow by passing the
 * URL the provider redirected back to into {@link #parseCallbackResponse(String)}.
 *
 * <p>Each instance owns its session. Held state is guarded by the instance
 * monitor because token endpoint responses complete on another thread.
 */
public class HostedUiFlowService implements HostedUiAuthentication {

    private static final Logger LOG = Logger.getLogger(HostedUiFlowService.class);

    private final FlowOptions options;
    private final TokenScopes configuredScopes;
    private final SessionCache cache;
    private final TokenEndpointClient tokenEndpoint;
    private final TokenDecoder decoder;
    private final UriLauncher launcher;
    private final ContextDataProvider contextDataProvider;
    private final StateGenerator stateGenerator;
    private final FlowMetrics metrics;
    private final Clock clock;
    private final HostedUiUrlBuilder urls;
    private final CallbackResponseParser parser = new CallbackResponseParser();

    private ResponseType responseType;
    private String identityProvider;
    private String state;
    private String username;
    private AuthSession session;
    private SessionHandler handler;

    /**
     * Create the flow and restore the last signed-in user's cached session.
     *
     * @param options             client settings, already validated
     * @param cache               token cache
     * @param tokenEndpoint       token endpoint transport
     * @param decoder             JWT claims decoder
     * @param launcher            opens hosted UI pages
     * @param contextDataProvider risk context collector, or null when unavailable
     * @param stateGenerator      CSRF state source
     * @param metrics             flow metrics
     * @param clock               time source for validity checks
     */
    public HostedUiFlowService(
            FlowOptions options,
            SessionCache cache,
            TokenEndpointClient tokenEndpoint,
            TokenDecoder decoder,
            UriLauncher launcher,
            ContextDataProvider contextDataProvider,
            StateGenerator stateGenerator,
            FlowMetrics metrics,
            Clock clock) {
        this.options = options;
        this.configuredScopes = options.tokenScopes();
        this.cache = cache;
        this.tokenEndpoint = tokenEndpoint;
        this.decoder = decoder;
        this.launcher = launcher;
        this.contextDataProvider = contextDataProvider;
        this.stateGenerator = stateGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.urls = new HostedUiUrlBuilder(options);
        this.responseType = options.responseType();
        this.identityProvider = options.identityProvider();

        this.username = cache.lastUser(options.clientId()).orElse(null);
        var cached = cache.load(options.clientId(), username);
        this.session = configuredScopes.matches(cached.getScopes()) ? cached : AuthSession.empty(configuredScopes);

        LOG.debugf(
                "Hosted UI flow created for client %s (response type %s, last user %s)",
                options.clientId(),
                responseType.wireValue(),
                username);
    }

    @Override
    public Uni<Optional<AuthSession>> getSession() {
        return Uni.createFrom().deferred(this::resolveCurrentSession);
    }

    private Uni<Optional<AuthSession>> resolveCurrentSession() {
        final var now = clock.instant();
        final var held = getSignInUserSession();
        if (held.isValid(now)) {
            metrics.recordCacheHit();
            return succeed(held);
        }

        final AuthSession cached = getCachedSession();

        if (!cached.getAccessToken().isPresent() && !cached.getRefreshToken().isUsable()) {
            replaceSession(AuthSession.empty(configuredScopes));
            return redirectToSignIn(RedirectReason.NO_SESSION);
        }

        if (!configuredScopes.matches(cached.getScopes())) {
            LOG.debugf(
                    "Cached scopes [%s] differ from configured scopes [%s]",
                    cached.getScopes().toSpaceDelimited(),
                    configuredScopes.toSpaceDelimited());
            replaceSession(AuthSession.empty(configuredScopes));
            return redirectToSignIn(RedirectReason.SCOPE_MISMATCH);
        }

        replaceSession(cached);

        if (cached.isValid(now)) {
            metrics.recordCacheHit();
            return succeed(cached);
        }

        final var refreshToken = cached.getRefreshToken();
        if (!refreshToken.isUsable()) {
            return redirectToSignIn(RedirectReason.NO_REFRESH_TOKEN);
        }

        return deliver(refresh(refreshToken.raw()));
    }

    @Override
    public Uni<Optional<AuthSession>> parseCallbackResponse(String callbackUrl) {
        return deliver(Uni.createFrom().deferred(() -> {
            final var type = getResponseType();
            final Uni<ResponseParameters> parameters = type == ResponseType.IMPLICIT
                    ? Uni.createFrom().item(parseImplicitResponse(callbackUrl))
                    : exchangeAuthorizationCode(callbackUrl);
            return parameters.map(this::resolveSession).invoke(resolved -> metrics.recordSessionResolved(type));
        }));
    }

    private ResponseParameters parseImplicitResponse(String callbackUrl) {
        final var parameters = parser.parseFragment(callbackUrl);
        checkCallback(parameters);
        return parameters;
    }

    private Uni<ResponseParameters> exchangeAuthorizationCode(String callbackUrl) {
        final var parameters = parser.parseQuery(callbackUrl);
        checkCallback(parameters);

        final var code = parameters.get(ResponseParameters.CODE)
                .filter(c -> !c.isBlank())
                .orElseThrow(() -> new CallbackParseException("Authorization code callback has no code"));
        final var callbackState = parameters.get(ResponseParameters.STATE).orElse(null);

        LOG.debugf("Exchanging authorization code for client %s", options.clientId());
        return tokenEndpoint
                .exchange(grant(GrantType.AUTHORIZATION_CODE, code))
                .map(response -> response.toParameters().with(ResponseParameters.STATE, callbackState));
    }

    private void checkCallback(ResponseParameters parameters) {
        rejectError(parameters);
        if (!options.stateValidation()) {
            return;
        }
        final var expected = getState();
        final var actual = parameters.get(ResponseParameters.STATE).orElse(null);
        if (expected == null || !expected.equals(actual)) {
            throw new CallbackParseException("Callback state does not match the outstanding sign-in request");
        }
    }

    @Override
    public AuthSession resolveSession(ResponseParameters parameters) {
        rejectError(parameters);

        final var resolved = new AuthSession(
                Token.of(parameters.get(ResponseParameters.ID_TOKEN).orElse(null), decoder::decode),
                Token.of(parameters.get(ResponseParameters.ACCESS_TOKEN).orElse(null), decoder::decode),
                RefreshToken.of(parameters.get(ResponseParameters.REFRESH_TOKEN).orElse(null)),
                configuredScopes);
        resolved.setState(parameters.get(ResponseParameters.STATE).orElse(null));

        synchronized (this) {
            username = cache.save(options.clientId(), resolved);
            session = resolved;
        }

        LOG.infof("Resolved hosted UI session for user %s", username);
        return resolved;
    }

    private static void rejectError(ResponseParameters parameters) {
        if (parameters.hasError()) {
            final var error = parameters.get(ResponseParameters.ERROR).orElse("");
            final var description = parameters.get(ResponseParameters.ERROR_DESCRIPTION)
                    .map(d -> ": " + d)
                    .orElse("");
            throw new CallbackParseException("Provider returned error " + error + description, error);
        }
    }

    @Override
    public Uni<Optional<AuthSession>> refreshSession(String refreshToken) {
        return deliver(refresh(refreshToken));
    }

    private Uni<AuthSession> refresh(String refreshToken) {
        if (getResponseType() == ResponseType.IMPLICIT) {
            return Uni.createFrom().failure(new RefreshTypeException());
        }

        return Uni.createFrom()
                .deferred(() -> tokenEndpoint.exchange(grant(GrantType.REFRESH_TOKEN, refreshToken)))
                // cache writes and the sign-in launch block, so keep them off the transport thread
                .emitOn(Infrastructure.getDefaultWorkerPool())
                .map(this::applyRefresh);
    }

    private AuthSession applyRefresh(TokenEndpointResponse response) {
        if (response.hasError()) {
            metrics.recordRefresh(false);
            final var error = response.error().orElse("");
            LOG.warnf("Refresh rejected for user %s: %s", getUsername(), error);
            redirectToSignIn(RedirectReason.REFRESH_REJECTED);
            throw new TokenRefreshException(error);
        }

        synchronized (this) {
            final var refreshed = new AuthSession(
                    response.idToken().map(raw -> Token.of(raw, decoder::decode)).orElse(session.getIdToken()),
                    response.accessToken()
                            .map(raw -> Token.of(raw, decoder::decode))
                            .orElse(session.getAccessToken()),
                    session.getRefreshToken(),
                    session.getScopes());
            refreshed.setState(session.getState());

            username = cache.save(options.clientId(), refreshed);
            session = refreshed;
        }

        metrics.recordRefresh(true);
        LOG.debugf("Refreshed tokens for user %s", getUsername());
        return getSignInUserSession();
    }

    private TokenEndpointRequest grant(GrantType grantType, String credential) {
        return new TokenEndpointRequest(
                urls.tokenUrl(), grantType, credential, options.clientId(), urls.redirectUriSignIn());
    }

    @Override
    public void signOut() {
        final var url = getSignOutUrl();
        synchronized (this) {
            session = AuthSession.empty();
            cache.clear(options.clientId(), username);
            LOG.infof("Signed out user %s", username);
            username = null;
        }
        launch(url, RedirectReason.SIGN_OUT);
    }

    @Override
    public boolean isUserSignedIn() {
        final var now = clock.instant();
        return getSignInUserSession().isValid(now) || getCachedSession().isValid(now);
    }

    @Override
    public synchronized String getSignInUrl() {
        if (state == null) {
            state = stateGenerator.generate();
        }
        return urls.signInUrl(responseType, state, configuredScopes, identityProvider, collectContextData());
    }

    private String collectContextData() {
        if (!options.contextDataCollection() || contextDataProvider == null) {
            return null;
        }
        return contextDataProvider
                .collect(
                        username == null ? "" : username,
                        options.userPoolId() == null ? "" : options.userPoolId(),
                        options.clientId())
                .orElse(null);
    }

    @Override
    public String getSignOutUrl() {
        return urls.signOutUrl();
    }

    /**
     * The token endpoint URL used for code and refresh grants.
     */
    public String getTokenUrl() {
        return urls.tokenUrl();
    }

    @Override
    public Optional<String> getCurrentUser() {
        return cache.lastUser(options.clientId());
    }

    /**
     * Load the current user's session from cache without touching the held session.
     */
    public synchronized AuthSession getCachedSession() {
        return cache.load(options.clientId(), username);
    }

    public synchronized AuthSession getSignInUserSession() {
        return session;
    }

    private synchronized void replaceSession(AuthSession replacement) {
        session = replacement;
    }

    private Uni<Optional<AuthSession>> redirectToSignIn(RedirectReason reason) {
        launch(getSignInUrl(), reason);
        return Uni.createFrom().item(Optional.empty());
    }

    private void launch(String url, RedirectReason reason) {
        LOG.debugf("Sending user agent to hosted UI (%s)", reason);
        launcher.launch(url);
        metrics.recordRedirect(reason);
        final var current = getSessionHandler();
        if (current != null) {
            current.onRedirect(url);
        }
    }

    private Uni<Optional<AuthSession>> succeed(AuthSession resolved) {
        notifySuccess(resolved);
        return Uni.createFrom().item(Optional.of(resolved));
    }

    private Uni<Optional<AuthSession>> deliver(Uni<AuthSession> work) {
        return work.map(Optional::of)
                .onFailure()
                .recoverWithUni(this::routeFailure)
                .invoke(result -> result.ifPresent(this::notifySuccess));
    }

    private void notifySuccess(AuthSession resolved) {
        final var current = getSessionHandler();
        if (current != null) {
            current.onSuccess(resolved);
        }
    }

    private Uni<Optional<AuthSession>> routeFailure(Throwable error) {
        metrics.recordFailure(
                error instanceof HostedAuthException hosted ? hosted.errorType() : error.getClass().getSimpleName());
        final var current = getSessionHandler();
        if (current != null) {
            LOG.debugf("Routing flow failure to session handler: %s", error.getMessage());
            current.onFailure(error);
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().failure(error);
    }

    @Override
    public synchronized ResponseType getResponseType() {
        return responseType;
    }

    @Override
    public synchronized void useCodeGrantFlow() {
        responseType = ResponseType.AUTHORIZATION_CODE;
    }

    @Override
    public synchronized void useImplicitFlow() {
        responseType = ResponseType.IMPLICIT;
    }

    @Override
    public synchronized void setIdentityProvider(String identityProvider) {
        this.identityProvider = identityProvider;
    }

    public synchronized String getIdentityProvider() {
        return identityProvider;
    }

    /**
     * The CSRF state sent with the next sign-in URL, or null if none was generated yet.
     */
    public synchronized String getState() {
        return state;
    }

    public synchronized void setState(String state) {
        this.state = state;
    }

    public synchronized String getUsername() {
        return username;
    }

    public synchronized void setUsername(String username) {
        this.username = username;
    }

    @Override
    public synchronized void setSessionHandler(SessionHandler handler) {
        this.handler = handler;
    }

    private synchronized SessionHandler getSessionHandler() {
        return handler;
    }

    public String getClientId() {
        return options.clientId();
    }

    public String getDomain() {
        return options.domain();
    }
}
