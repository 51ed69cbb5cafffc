package org.lolmark.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.lolmark.junit.extensions.logging.AllowLog;
import org.lolmark.junit.extensions.logging.LogLevel;
import org.lolmark.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests how {@link LoggingConfigurator} applies the logging block of the configuration.
 * The logback state is restored after every test.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String SAMPLE_LOGGER = "org.lolmark.sample";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(SAMPLE_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void testAppliesDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging {
                  default-level = ERROR
                  levels { "org.lolmark.sample" = DEBUG }
                }
                """));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    /**
     * Verifies that configure is idempotent until reset.
     */
    @Test
    void testSecondCallHasNoEffect() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.lolmark.sample\" = DEBUG }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.lolmark.sample\" = ERROR }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void testMissingLoggingBlockLeavesLevelsUntouched() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isNull();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level 'LOUD'.*")
    void testUnknownLevelIsIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.lolmark.sample\" = LOUD }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isNull();
    }

    @Test
    void testFormatSelectsAppender() {
        assertThat(LoggingConfigurator.appenderFor("json")).isEqualTo(LoggingConfigurator.JSON_APPENDER);
        assertThat(LoggingConfigurator.appenderFor("JSON")).isEqualTo("STDOUT");
        assertThat(LoggingConfigurator.appenderFor("PLAIN")).isEqualTo("STDOUT_PLAIN");
        assertThat(LoggingConfigurator.appenderFor("anything else")).isEqualTo(LoggingConfigurator.PLAIN_APPENDER);
    }
}
