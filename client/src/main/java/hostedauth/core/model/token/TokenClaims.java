package hostedauth.core.model.token;

import java.time.Instant;
import java.util.Optional;

/**
 * The claims of a token that the flow relies on.
 *
 * @param expiresAt expiration time (exp claim), or null when absent
 * @param subject   the user the token was issued to, or null when absent
 */
public record TokenClaims(Instant expiresAt, String subject) {

    private static final TokenClaims NONE = new TokenClaims(null, null);

    /**
     * Claims of a token that carries nothing usable.
     */
    public static TokenClaims none() {
        return NONE;
    }

    public Optional<Instant> expiration() {
        return Optional.ofNullable(expiresAt);
    }

    public Optional<String> subjectClaim() {
        return Optional.ofNullable(subject).filter(s -> !s.isBlank());
    }
}
