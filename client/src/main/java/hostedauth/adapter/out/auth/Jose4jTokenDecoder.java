package hostedauth.adapter.out.auth;

import java.time.Instant;

import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import hostedauth.core.model.token.TokenClaims;
import hostedauth.core.port.out.TokenDecoder;

/**
 * Reads JWT claims with jose4j without verifying the signature.
 *
 * <p>Tokens arrive directly from the provider over TLS and are only
 * inspected locally for expiry and owner; resource servers still verify
 * them. The owner is the {@code username} claim when present, otherwise
 * {@code sub}.
 */
public class Jose4jTokenDecoder implements TokenDecoder {

    private static final Logger LOG = Logger.getLogger(Jose4jTokenDecoder.class);

    static final String USERNAME_CLAIM = "username";

    private final JwtConsumer consumer = new JwtConsumerBuilder()
            .setSkipSignatureVerification()
            .setSkipAllValidators()
            .setDisableRequireSignature()
            .setSkipAllDefaultValidators()
            .build();

    @Override
    public TokenClaims decode(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return TokenClaims.none();
        }
        try {
            return toTokenClaims(consumer.processToClaims(rawToken));
        } catch (InvalidJwtException e) {
            LOG.debugf("Token is not a readable JWT: %s", e.getMessage());
            return TokenClaims.none();
        }
    }

    private TokenClaims toTokenClaims(JwtClaims claims) {
        Instant expiresAt = null;
        String subject = null;
        try {
            final var expiration = claims.getExpirationTime();
            if (expiration != null) {
                expiresAt = Instant.ofEpochSecond(expiration.getValue());
            }
        } catch (MalformedClaimException e) {
            LOG.debugf("Ignoring malformed exp claim: %s", e.getMessage());
        }
        try {
            subject = claims.getStringClaimValue(USERNAME_CLAIM);
            if (subject == null || subject.isBlank()) {
                subject = claims.getSubject();
            }
        } catch (MalformedClaimException e) {
            LOG.debugf("Ignoring malformed subject claim: %s", e.getMessage());
        }
        return new TokenClaims(expiresAt, subject);
    }
}
