package org.opencraft.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.opencraft.junit.extensions.logging.ExpectLog;
import org.opencraft.junit.extensions.logging.LogLevel;
import org.opencraft.junit.extensions.logging.LogWatchExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Only the PLAIN format is exercised: switching to JSON reloads logback.xml, which resets the
 * logger context for every test that runs afterwards.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.opencraft.config.test";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """));

        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY))
            .isEqualTo(LoggingConfigurator.PLAIN_APPENDER);
    }

    @Test
    void configure_shouldSetDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels {
                "org.opencraft.config.test" = "DEBUG"
              }
            }
            """));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_invalidDefaultLevel_shouldFallBackToInfo() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"LOUD\""));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.opencraft.config.test'")
    void configure_unknownLoggerLevel_shouldBeIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging.levels {
              "org.opencraft.config.test" = "LOUD"
            }
            """));

        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isNull();
    }

    @Test
    void configure_calledTwice_shouldApplyOnlyTheFirstConfiguration() {
        final Config first = ConfigFactory.parseString("logging.levels { \"org.opencraft.config.test\" = \"DEBUG\" }");
        final Config second = ConfigFactory.parseString("logging.levels { \"org.opencraft.config.test\" = \"ERROR\" }");

        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_withoutLoggingSection_shouldLeaveLevelsUntouched() {
        LoggingConfigurator.configure(ConfigFactory.parseString("bootstrap.play-type = \"Server\""));

        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isNull();
    }
}
