package hostedauth;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

/**
 * Signed JWTs for tests. The signature is never checked by the library.
 */
public final class TestTokens {

    private static final HmacKey KEY =
            new HmacKey("test-signing-key-0123456789abcdef".getBytes(StandardCharsets.UTF_8));

    private TestTokens() {}

    /**
     * An access token carrying both {@code username} and {@code sub}.
     */
    public static String accessToken(String username, Instant expiresAt) {
        var claims = baseClaims(expiresAt);
        claims.setSubject("sub-" + username);
        claims.setClaim("username", username);
        claims.setClaim("token_use", "access");
        return sign(claims);
    }

    /**
     * An ID token carrying only {@code sub}.
     */
    public static String idToken(String subject, Instant expiresAt) {
        var claims = baseClaims(expiresAt);
        claims.setSubject(subject);
        claims.setClaim("token_use", "id");
        return sign(claims);
    }

    /**
     * A token with no owner claims at all.
     */
    public static String anonymousToken(Instant expiresAt) {
        return sign(baseClaims(expiresAt));
    }

    private static JwtClaims baseClaims(Instant expiresAt) {
        var claims = new JwtClaims();
        claims.setIssuer("https://auth.example.com");
        claims.setIssuedAt(NumericDate.fromSeconds(expiresAt.getEpochSecond() - 3600));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        return claims;
    }

    private static String sign(JwtClaims claims) {
        var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setKey(KEY);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign test token", e);
        }
    }
}
