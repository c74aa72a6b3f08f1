package io.wafgate.standalone.gateway;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup from {@code logging.format} and
 * {@code logging.level}.
 *
 * <p>
 * JSON mode uses Logback's {@link JsonEncoder}, which carries the MDC (and so
 * the request id) as a field. Text mode prints the request id in brackets
 * after the thread name.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} [%thread] [%X{requestId:-}] %-5level %logger{36} - %msg%n";
    static final String APPENDER_NAME = "STDOUT";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appender and level.
     *
     * @param format {@code json} or {@code text} (case-insensitive)
     * @param level  root level; unknown names fall back to INFO
     * @throws IllegalArgumentException for any other format
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Encoder<ILoggingEvent> encoder = encoderFor(format, context);

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.INFO));
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder);
        appender.start();
        root.addAppender(appender);

        context.getLogger("org.eclipse.jetty").setLevel(Level.WARN);
        context.getLogger("io.javalin").setLevel(Level.INFO);
    }

    static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        String normalized = format == null ? "text" : format.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "json": {
                JsonEncoder json = new JsonEncoder();
                json.setContext(context);
                json.start();
                return json;
            }
            case "text": {
                PatternLayoutEncoder text = new PatternLayoutEncoder();
                text.setContext(context);
                text.setPattern(TEXT_PATTERN);
                text.start();
                return text;
            }
            default:
                throw new IllegalArgumentException("Unknown logging format '" + format + "': expected json or text");
        }
    }
}
