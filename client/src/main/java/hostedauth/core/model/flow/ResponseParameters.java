package hostedauth.core.model.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value fields of a provider response.
 *
 * <p>Produced from a callback URL's fragment or query, or from a token
 * endpoint response body.
 *
 * @param values the fields in the order they were received
 */
public record ResponseParameters(Map<String, String> values) {

    public static final String ID_TOKEN = "id_token";
    public static final String ACCESS_TOKEN = "access_token";
    public static final String REFRESH_TOKEN = "refresh_token";
    public static final String STATE = "state";
    public static final String CODE = "code";
    public static final String ERROR = "error";
    public static final String ERROR_DESCRIPTION = "error_description";

    public ResponseParameters {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ResponseParameters empty() {
        return new ResponseParameters(Map.of());
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean hasError() {
        return has(ERROR);
    }

    /**
     * Copy with one field added or replaced; a null value removes the field.
     */
    public ResponseParameters with(String key, String value) {
        var copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new ResponseParameters(copy);
    }
}
