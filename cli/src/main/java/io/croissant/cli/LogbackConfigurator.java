package io.croissant.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.croissant.cli.config.CliConfig;
import org.slf4j.LoggerFactory;

/**
 * Routes every log line of the tool to standard error.
 *
 * <p>
 * Standard output belongs to {@code load}, which prints one JSON record per line, so that
 * {@code croissant load ... > records.jsonl} captures records only. Validation issues, progress
 * and failures are logs. With {@code logging.format: json} each log line is a JSON object as
 * well.
 */
final class LogbackConfigurator {

    /** Single-threaded tool: no thread name, short logger name. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{0} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /** Replaces the root appender; format and level come from {@code logging.*} of the configuration. */
    static void configure(CliConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.toLevel(config.loggingLevel(), Level.INFO));

        ConsoleAppender<ILoggingEvent> stderr = new ConsoleAppender<>();
        stderr.setContext(context);
        stderr.setName(APPENDER_NAME);
        stderr.setTarget("System.err");
        stderr.setEncoder(encoder(context, config.loggingFormat()));
        stderr.start();
        root.addAppender(stderr);

        // Schema validator internals.
        context.getLogger("com.networknt").setLevel(Level.WARN);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
