package hostedauth.core.model.token;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An identity or access token issued by the hosted UI.
 *
 * <p>Wraps the signed token string. Expiration and subject are decoded on
 * first access through the decoder supplied at construction; signatures are
 * never verified here. A token without a raw value is always expired.
 */
public final class Token {

    private static final Token EMPTY = new Token(null, raw -> TokenClaims.none());

    private final String raw;
    private final Function<String, TokenClaims> decoder;
    private volatile TokenClaims claims;

    private Token(String raw, Function<String, TokenClaims> decoder) {
        this.raw = raw;
        this.decoder = decoder;
    }

    /**
     * A token with no value.
     */
    public static Token empty() {
        return EMPTY;
    }

    /**
     * Wrap a raw token string.
     *
     * @param raw     the compact token, may be null or blank
     * @param decoder turns the raw string into claims
     * @return the token, or {@link #empty()} when raw is null or blank
     */
    public static Token of(String raw, Function<String, TokenClaims> decoder) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        return new Token(raw, Objects.requireNonNull(decoder, "decoder"));
    }

    public Optional<String> raw() {
        return Optional.ofNullable(raw);
    }

    public boolean isPresent() {
        return raw != null;
    }

    public Optional<Instant> expiration() {
        return claims().expiration();
    }

    public Optional<String> subject() {
        return claims().subjectClaim();
    }

    /**
     * Check whether the token is still usable at the given instant.
     *
     * @param now the reference time
     * @return true if present and its expiration is strictly after {@code now}
     */
    public boolean isUnexpiredAt(Instant now) {
        return isPresent() && expiration().map(exp -> exp.isAfter(now)).orElse(false);
    }

    private TokenClaims claims() {
        var decoded = claims;
        if (decoded == null) {
            decoded = raw == null ? null : decoder.apply(raw);
            if (decoded == null) {
                decoded = TokenClaims.none();
            }
            claims = decoded;
        }
        return decoded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Token other && Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(raw);
    }

    @Override
    public String toString() {
        return raw == null ? "Token[empty]" : "Token[present]";
    }
}
