package io.routeweave.standalone.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.routeweave.standalone.config.RouteWeaveConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of a {@link RouteWeaveConfig} to
 * Logback once the configuration is loaded.
 *
 * <p>
 * The root logger gets a single console appender, encoded as JSON
 * ({@code json}) or with {@link #TEXT_PATTERN} ({@code text}). Server and
 * pool internals start from {@link #DEFAULT_LOGGER_LEVELS}; entries of
 * {@code logging.loggers} override those and set any other logger.
 */
public final class LogbackConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LogbackConfigurator.class);

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    static final Map<String, String> DEFAULT_LOGGER_LEVELS =
            Map.of("org.eclipse.jetty", "WARN", "io.javalin", "INFO", "com.zaxxer.hikari", "WARN");

    private LogbackConfigurator() {
        // utility class
    }

    public static void configure(RouteWeaveConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        root.setLevel(Level.toLevel(config.loggingLevel(), Level.INFO));
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDOUT");
        appender.setEncoder(encoder(context, config.loggingFormat()));
        appender.start();
        root.addAppender(appender);

        Map<String, String> levels = new LinkedHashMap<>(DEFAULT_LOGGER_LEVELS);
        levels.putAll(config.loggingLoggers());
        levels.forEach((name, value) -> {
            Level level = Level.toLevel(value, null);
            if (level == null) {
                LOG.warn("Ignoring unknown level '{}' for logger {}", value, name);
                return;
            }
            context.getLogger(name).setLevel(level);
        });
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder pattern = new PatternLayoutEncoder();
        pattern.setContext(context);
        pattern.setPattern(TEXT_PATTERN);
        pattern.start();
        return pattern;
    }
}
