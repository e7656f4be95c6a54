package hostedauth.core.service.session;

import java.security.SecureRandom;

/**
 * Generate the CSRF state sent with sign-in requests.
 *
 * <p>States are 32 characters drawn from {@code [0-9a-zA-Z]}.
 */
public class StateGenerator {

    static final int STATE_LENGTH = 32;
    static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Generate a new state value.
     *
     * @return a 32-character alphanumeric string
     */
    public String generate() {
        var builder = new StringBuilder(STATE_LENGTH);
        for (int i = 0; i < STATE_LENGTH; i++) {
            builder.append(ALPHABET.charAt(SECURE_RANDOM.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }
}
