package org.lolmark.cli.io;

import org.lolmark.junit.extensions.logging.AllowLog;
import org.lolmark.junit.extensions.logging.LogLevel;
import org.lolmark.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

/**
 * Tests {@link BrowserLauncher} against a mocked {@link BrowserLauncher.UriOpener}.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class BrowserLauncherTest {

    @Mock
    private BrowserLauncher.UriOpener opener;

    @Test
    void testOpensAbsoluteFileUri() throws Exception {
        Path file = Path.of("page.html");

        boolean opened = new BrowserLauncher(opener).open(file);

        assertThat(opened).isTrue();
        verify(opener).open(file.toAbsolutePath().toUri());
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Could not open .* in browser: no display")
    void testFailureToOpenIsLoggedNotThrown() throws Exception {
        Path file = Path.of("page.html");
        doThrow(new IOException("no display")).when(opener).open(file.toAbsolutePath().toUri());

        assertThat(new BrowserLauncher(opener).open(file)).isFalse();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "No desktop browser available, open .* manually")
    void testMissingBrowserIsLogged() {
        assertThat(new BrowserLauncher((BrowserLauncher.UriOpener) null).open(Path.of("page.html"))).isFalse();
    }
}
