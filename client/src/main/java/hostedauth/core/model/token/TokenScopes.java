package hostedauth.core.model.token;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of OAuth2 scopes.
 *
 * <p>Two instances are equal when they hold the same scopes, regardless of
 * order. Insertion order is kept only so the space-delimited form is stable.
 *
 * @param scopes the scope names
 */
public record TokenScopes(Set<String> scopes) {

    private static final String DELIMITER = " ";
    private static final TokenScopes EMPTY = new TokenScopes(Set.of());

    public TokenScopes {
        scopes = scopes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    }

    public static TokenScopes empty() {
        return EMPTY;
    }

    public static TokenScopes of(Collection<String> scopes) {
        return scopes == null ? EMPTY : new TokenScopes(new LinkedHashSet<>(scopes));
    }

    public static TokenScopes of(String... scopes) {
        return of(Arrays.asList(scopes));
    }

    /**
     * Parse the space-delimited form used in storage and on the wire.
     *
     * @param value the delimited scopes, may be null or blank
     * @return the parsed scopes
     */
    public static TokenScopes fromSpaceDelimited(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }
        return of(Arrays.stream(value.split(DELIMITER)).filter(s -> !s.isEmpty()).toList());
    }

    public String toSpaceDelimited() {
        return String.join(DELIMITER, scopes);
    }

    public List<String> asList() {
        return List.copyOf(scopes);
    }

    public boolean isEmpty() {
        return scopes.isEmpty();
    }

    /**
     * Check whether two scope sets grant exactly the same permissions.
     *
     * @param other the scopes to compare with
     * @return true if both sets have the same size and members
     */
    public boolean matches(TokenScopes other) {
        if (other == null || scopes.size() != other.scopes.size()) {
            return false;
        }
        return scopes.containsAll(other.scopes);
    }
}
