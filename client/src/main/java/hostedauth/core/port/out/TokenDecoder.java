package hostedauth.core.port.out;

import hostedauth.core.model.token.TokenClaims;

/**
 * Outbound port that extracts claims from a compact JWT.
 *
 * <p>Implementations must not verify signatures and must not throw: an
 * unreadable token yields {@link TokenClaims#none()}.
 */
public interface TokenDecoder {

    TokenClaims decode(String rawToken);
}
