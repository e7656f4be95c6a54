package hostedauth.core.model.error;

/**
 * A required flow setting is missing or malformed.
 */
public class ConfigurationException extends HostedAuthException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "configuration";
    }
}
