package org.texpreview.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class LoggingConfiguratorTest {

    private static final String LOGGER_NAME = "org.texpreview.test.sample";

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        ((Logger) LoggerFactory.getLogger(LOGGER_NAME)).setLevel(null);
    }

    @Test
    @Tag("unit")
    void formatSelectsAppender() {
        assertThat(LoggingConfigurator.appenderFor("JSON")).isEqualTo(LoggingConfigurator.JSON_APPENDER);
        assertThat(LoggingConfigurator.appenderFor("json")).isEqualTo(LoggingConfigurator.JSON_APPENDER);
        assertThat(LoggingConfigurator.appenderFor("PLAIN")).isEqualTo(LoggingConfigurator.PLAIN_APPENDER);
        assertThat(LoggingConfigurator.appenderFor("anything")).isEqualTo(LoggingConfigurator.PLAIN_APPENDER);
    }

    @Test
    @Tag("unit")
    void appliesPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + LOGGER_NAME + "\" = \"DEBUG\" }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @Tag("unit")
    void secondCallIsIgnoredUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + LOGGER_NAME + "\" = \"DEBUG\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + LOGGER_NAME + "\" = \"ERROR\" }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + LOGGER_NAME + "\" = \"ERROR\" }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @Tag("unit")
    void missingSectionLeavesLevelsUntouched() {
        LoggingConfigurator.configure(ConfigFactory.parseString("other { key = 1 }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isNull();
    }
}
