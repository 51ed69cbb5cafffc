package org.lolmark.cli.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * Opens a written document in the user's browser.
 * <p>
 * Opening is best-effort: when no desktop browser is available or the launch fails,
 * a warning is logged and the run continues.
 */
public class BrowserLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(BrowserLauncher.class);

    /**
     * Opens a URI with whatever the platform offers.
     */
    @FunctionalInterface
    public interface UriOpener {
        /**
         * @param uri The URI to open.
         * @throws IOException if the browser could not be started.
         */
        void open(URI uri) throws IOException;
    }

    private final UriOpener opener;

    /**
     * Creates a launcher backed by {@link Desktop#browse(URI)}, if the platform supports it.
     */
    public BrowserLauncher() {
        this(desktopOpener());
    }

    /**
     * @param opener The opener to use, or {@code null} if none is available.
     */
    public BrowserLauncher(UriOpener opener) {
        this.opener = opener;
    }

    /**
     * Opens the file in the browser.
     * @param file The file to open.
     * @return true if the browser was started.
     */
    public boolean open(Path file) {
        if (opener == null) {
            LOG.warn("No desktop browser available, open {} manually", file);
            return false;
        }
        URI uri = file.toAbsolutePath().toUri();
        try {
            opener.open(uri);
            LOG.debug("Opened {} in browser", uri);
            return true;
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            LOG.warn("Could not open {} in browser: {}", uri, e.getMessage());
            return false;
        }
    }

    private static UriOpener desktopOpener() {
        if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            return uri -> Desktop.getDesktop().browse(uri);
        }
        return null;
    }
}
