package io.wafgate.standalone.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreDefaultConfiguration() throws Exception {
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    @Test
    void jsonFormatUsesJsonEncoder() {
        LogbackConfigurator.configure("json", "WARN");

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        ConsoleAppender<?> appender = (ConsoleAppender<?>) root.getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(root.getLevel()).isEqualTo(Level.WARN);
        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    void textFormatPrintsRequestId() {
        LogbackConfigurator.configure("TEXT", "debug");

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        ConsoleAppender<?> appender = (ConsoleAppender<?>) root.getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern()).contains("%X{requestId:-}");
        assertThat(context.getLogger("org.eclipse.jetty").getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void unknownLevelFallsBackToInfo() {
        LogbackConfigurator.configure("text", "chatty");

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void unknownFormatRejected() {
        assertThatThrownBy(() -> LogbackConfigurator.configure("xml", "INFO"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected json or text");
    }
}
