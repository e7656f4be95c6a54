package hostedauth.core.service.flow;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

import org.jboss.logging.Logger;

import hostedauth.core.model.error.CallbackParseException;
import hostedauth.core.model.flow.ResponseParameters;

/**
 * Splits a provider redirect URL into its response fields.
 *
 * <p>Implicit grants carry tokens in the fragment, code grants carry the code
 * in the query. Values are percent-decoded; a literal {@code +} is kept as is
 * rather than read as a space, since refresh tokens and base64 values carry it
 * unescaped. A pair without {@code =} maps to an empty value.
 */
public class CallbackResponseParser {

    private static final Logger LOG = Logger.getLogger(CallbackResponseParser.class);

    /**
     * Parse the fragment of an implicit grant redirect.
     *
     * @param callbackUrl the redirect URL
     * @return the fragment fields
     * @throws CallbackParseException if the URL has no fragment
     */
    public ResponseParameters parseFragment(String callbackUrl) {
        if (callbackUrl == null) {
            throw new CallbackParseException("Callback URL is required");
        }
        int hash = callbackUrl.indexOf('#');
        if (hash < 0) {
            throw new CallbackParseException("Implicit grant callback has no fragment");
        }
        return parsePairs(callbackUrl.substring(hash + 1));
    }

    /**
     * Parse the query of an authorization code redirect.
     *
     * <p>Anything from the first {@code #} on is dropped first; some social
     * identity providers append a fragment to the code redirect.
     *
     * @param callbackUrl the redirect URL
     * @return the query fields
     * @throws CallbackParseException if the URL has no query
     */
    public ResponseParameters parseQuery(String callbackUrl) {
        if (callbackUrl == null) {
            throw new CallbackParseException("Callback URL is required");
        }
        var response = callbackUrl;
        int hash = response.indexOf('#');
        if (hash >= 0) {
            response = response.substring(0, hash);
        }
        int question = response.indexOf('?');
        if (question < 0) {
            throw new CallbackParseException("Authorization code callback has no query");
        }
        return parsePairs(response.substring(question + 1));
    }

    static ResponseParameters parsePairs(String encoded) {
        var values = new LinkedHashMap<String, String>();
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            values.put(decode(key), decode(value));
        }
        return new ResponseParameters(values);
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Keeping undecodable callback value as-is: %s", e.getMessage());
            return value;
        }
    }
}
