package io.lambdabridge.lambda;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup, applied once at cold start from {@code logging.format} and
 * {@code logging.level}.
 *
 * <p>
 * JSON mode uses Logback's built-in {@link JsonEncoder} (timestamp, level, thread, logger,
 * message and MDC fields, one object per line, which the function runtime's log service
 * indexes). Text mode uses a pattern that shows the MDC request ids.
 */
public final class LogbackConfigurator {

    /** Appender name installed on the root logger. */
    static final String APPENDER_NAME = "STDOUT";

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} %-5level [%X{awsRequestId:-}] [%X{requestId:-}] %logger{36} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Reconfigures the root logger. Does nothing when SLF4J is bound to something other than
     * Logback.
     *
     * @param format "json" for structured output, anything else for text
     * @param level  root level (TRACE, DEBUG, INFO, WARN, ERROR, OFF), INFO when unrecognized
     * @return {@code true} if Logback was configured
     */
    public static boolean configure(String format, String level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return false;
        }
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(level, Level.INFO));

        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder(context, format));
        appender.start();
        rootLogger.addAppender(appender);
        return true;
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
