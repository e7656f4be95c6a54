package hostedauth.adapter.out.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import hostedauth.core.model.error.TokenEndpointException;
import hostedauth.core.model.flow.TokenEndpointRequest;
import hostedauth.core.model.flow.TokenEndpointResponse;
import hostedauth.core.port.out.TokenEndpointClient;

/**
 * Token endpoint client using the Vert.x web client.
 *
 * <p>Grants are posted as {@code application/x-www-form-urlencoded}. A JSON
 * body carrying {@code error} is returned as a response whatever the status,
 * since the provider answers rejected grants with 400. Any other non-2xx
 * status, an unreadable body or a transport failure fails with
 * {@link TokenEndpointException}.
 */
public class VertxTokenEndpointClient implements TokenEndpointClient, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(VertxTokenEndpointClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public VertxTokenEndpointClient(Vertx vertx, Duration timeout) {
        this.webClient = WebClient.create(vertx);
        this.timeout = timeout;
    }

    @Override
    public Uni<TokenEndpointResponse> exchange(TokenEndpointRequest request) {
        LOG.debugf("Posting %s grant to %s", request.grantType().wireValue(), request.tokenEndpoint());

        return webClient
                .postAbs(request.tokenEndpoint())
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(buildFormBody(request)))
                .map(this::parseTokenResponse)
                .onFailure(error -> !(error instanceof TokenEndpointException))
                .transform(error -> {
                    LOG.warnf(error, "Token endpoint request to %s failed", request.tokenEndpoint());
                    return new TokenEndpointException("Token endpoint request failed: " + error.getMessage(), error);
                });
    }

    static String buildFormBody(TokenEndpointRequest request) {
        return request.formFields().entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private TokenEndpointResponse parseTokenResponse(HttpResponse<Buffer> response) {
        final var status = response.statusCode();
        final var body = response.bodyAsString();
        final var json = parseJson(body);

        if (json.isPresent() && json.get().getString("error") != null) {
            LOG.debugf("Token endpoint returned error %s (status %d)", json.get().getString("error"), status);
            return toResponse(json.get());
        }
        if (status < 200 || status >= 300) {
            LOG.warnf("Token endpoint returned status %d", status);
            throw new TokenEndpointException("Token endpoint returned status " + status, status, body);
        }
        return toResponse(json.orElseThrow(
                () -> new TokenEndpointException("Token endpoint returned a body that is not JSON", status, body)));
    }

    private static Optional<JsonObject> parseJson(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new JsonObject(body));
        } catch (DecodeException e) {
            LOG.debugf("Token endpoint body is not a JSON object: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private static TokenEndpointResponse toResponse(JsonObject json) {
        return new TokenEndpointResponse(
                Optional.ofNullable(json.getString("id_token")),
                Optional.ofNullable(json.getString("access_token")),
                Optional.ofNullable(json.getString("refresh_token")),
                Optional.ofNullable(json.getString("error")),
                Optional.ofNullable(json.getString("error_description")));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        webClient.close();
    }
}
