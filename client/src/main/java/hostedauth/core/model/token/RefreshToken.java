package hostedauth.core.model.token;

import java.util.Optional;

/**
 * Opaque refresh credential. Has no expiration of its own.
 *
 * @param raw the credential, or null when none was issued
 */
public record RefreshToken(String raw) {

    private static final RefreshToken EMPTY = new RefreshToken(null);

    public static RefreshToken empty() {
        return EMPTY;
    }

    public static RefreshToken of(String raw) {
        return raw == null ? EMPTY : new RefreshToken(raw);
    }

    /**
     * Check if the credential can be used for a refresh grant.
     *
     * @return true if present and non-empty
     */
    public boolean isUsable() {
        return raw != null && !raw.isEmpty();
    }

    public Optional<String> value() {
        return Optional.ofNullable(raw);
    }

    @Override
    public String toString() {
        return isUsable() ? "RefreshToken[present]" : "RefreshToken[empty]";
    }
}
