package hostedauth.core.port.out;

import io.smallrye.mutiny.Uni;

import hostedauth.core.model.flow.TokenEndpointRequest;
import hostedauth.core.model.flow.TokenEndpointResponse;

/**
 * Outbound port for grants sent to the hosted UI token endpoint.
 */
public interface TokenEndpointClient {

    /**
     * POST a grant as a form-encoded body.
     *
     * <p>A 2xx response is returned as-is, including one whose body carries an
     * {@code error} field. Anything else fails with
     * {@link hostedauth.core.model.error.TokenEndpointException}.
     *
     * @param request the grant
     * @return the parsed response body
     */
    Uni<TokenEndpointResponse> exchange(TokenEndpointRequest request);
}
