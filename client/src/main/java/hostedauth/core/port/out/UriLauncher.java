package hostedauth.core.port.out;

/**
 * Outbound port that sends the user agent to a hosted UI page.
 *
 * <p>Fire-and-forget: once launched, the outcome is only observed when the
 * provider redirects back and the callback is parsed.
 */
public interface UriLauncher {

    void launch(String uri);
}
