package hostedauth.adapter.out.launcher;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;

import org.jboss.logging.Logger;

import hostedauth.core.port.out.UriLauncher;

/**
 * Opens hosted UI URLs in the system browser.
 *
 * <p>Falls back to logging the URL when no desktop browser is available.
 */
public class DesktopUriLauncher implements UriLauncher {

    private static final Logger LOG = Logger.getLogger(DesktopUriLauncher.class);

    private final UriLauncher fallback;

    public DesktopUriLauncher() {
        this(new LoggingUriLauncher());
    }

    DesktopUriLauncher(UriLauncher fallback) {
        this.fallback = fallback;
    }

    /**
     * Check whether a desktop browser can be opened from this process.
     */
    public static boolean isSupported() {
        return Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE);
    }

    @Override
    public void launch(String uri) {
        if (!isSupported()) {
            fallback.launch(uri);
            return;
        }
        try {
            Desktop.getDesktop().browse(URI.create(uri));
        } catch (IOException | IllegalArgumentException | UnsupportedOperationException e) {
            LOG.warnf(e, "Could not open browser");
            fallback.launch(uri);
        }
    }
}
