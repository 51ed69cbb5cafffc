package org.lolmark.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the rules of {@link LogWatchExtension} let expected events through.
 * Each test would fail in {@code afterEach} if its rule did not apply.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogWatchExtensionTest {

    private static final Logger LOG = LoggerFactory.getLogger(LogWatchExtensionTest.class);

    @Test
    void testInfoIsNotWatchedByDefault() {
        LOG.info("informational message");
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "expected warning \\d+")
    void testAllowedWarningPasses() {
        LOG.warn("expected warning {}", 42);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "first")
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*LogWatchExtensionTest", messagePattern = "second")
    void testRepeatedAllowances() {
        LOG.warn("first");
        LOG.error("second");
    }

    @Test
    @FailOnLog(level = LogLevel.ERROR)
    void testRaisedThresholdIgnoresWarnings() {
        LOG.warn("below the threshold");
    }

    @Test
    @FailOnLog(disabled = true)
    void testDisabledWatchIgnoresErrors() {
        LOG.error("not watched");
    }
}
