package hostedauth.adapter.out.launcher;

import org.jboss.logging.Logger;

import hostedauth.core.port.out.UriLauncher;

/**
 * Logs hosted UI URLs instead of opening them.
 *
 * <p>For headless hosts that navigate through {@code SessionHandler.onRedirect}.
 */
public class LoggingUriLauncher implements UriLauncher {

    private static final Logger LOG = Logger.getLogger(LoggingUriLauncher.class);

    @Override
    public void launch(String uri) {
        LOG.infof("Open this URL to continue: %s", uri);
    }
}
