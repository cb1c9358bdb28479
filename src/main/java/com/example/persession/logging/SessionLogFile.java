package com.example.persession.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Process-wide log output for the library: a size-rotated debug log in the temp
 * directory plus a console appender that shows errors only, or everything when
 * verbose output is requested.
 *
 * The appenders are attached once per process to the {@code com.example.persession}
 * logger. Later calls only change the console threshold, so the most recently
 * constructed session decides console verbosity.
 */
public final class SessionLogFile {
    private static final Logger log = LoggerFactory.getLogger(SessionLogFile.class);

    static final String LOGGER_NAME = "com.example.persession";
    static final String LOG_FILE_NAME = "persession.log";
    static final long MAX_FILE_SIZE = 512_000;
    static final int BACKUP_COUNT = 5;
    private static final String FILE_APPENDER = "PERSESSION_FILE";
    private static final String PATTERN = "%d{dd/MM/yyyy HH:mm:ss} - %logger - %-5level - %msg%n";

    private static ThresholdFilter consoleFilter;
    private static Level consoleLevel;
    private static boolean unsupportedReported;

    private SessionLogFile() {
    }

    public static Path logFilePath() {
        return Paths.get(System.getProperty("java.io.tmpdir"), LOG_FILE_NAME);
    }

    /**
     * Installs the appenders if needed and sets the console threshold.
     */
    public static synchronized void init(boolean verbose) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            if (!unsupportedReported) {
                unsupportedReported = true;
                log.warn("SLF4J is not bound to Logback ({}), session log file not configured",
                        factory.getClass().getName());
            }
            return;
        }
        LoggerContext context = (LoggerContext) factory;
        // A logging system reset (e.g. Spring Boot startup) detaches the appenders
        if (consoleFilter == null || context.getLogger(LOGGER_NAME).getAppender(FILE_APPENDER) == null) {
            install(context);
        }
        consoleLevel = verbose ? Level.DEBUG : Level.ERROR;
        consoleFilter.setLevel(consoleLevel.levelStr);
        if (verbose) {
            log.debug("debug logs can also be found at \"{}\"", logFilePath());
        }
    }

    static synchronized Level consoleLevel() {
        return consoleLevel;
    }

    private static void install(LoggerContext context) {
        PatternLayoutEncoder fileEncoder = encoder(context);
        RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
        fileAppender.setContext(context);
        fileAppender.setName(FILE_APPENDER);
        fileAppender.setFile(logFilePath().toString());

        FixedWindowRollingPolicy rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(fileAppender);
        rollingPolicy.setFileNamePattern(logFilePath() + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(BACKUP_COUNT);
        rollingPolicy.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(new FileSize(MAX_FILE_SIZE));
        triggeringPolicy.start();

        fileAppender.setEncoder(fileEncoder);
        fileAppender.setRollingPolicy(rollingPolicy);
        fileAppender.setTriggeringPolicy(triggeringPolicy);
        fileAppender.start();

        ThresholdFilter filter = new ThresholdFilter();
        filter.setLevel(Level.ERROR.levelStr);
        filter.start();

        ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
        consoleAppender.setContext(context);
        consoleAppender.setName("PERSESSION_CONSOLE");
        consoleAppender.setEncoder(encoder(context));
        consoleAppender.addFilter(filter);
        consoleAppender.start();

        ch.qos.logback.classic.Logger logger = context.getLogger(LOGGER_NAME);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
        logger.addAppender(fileAppender);
        logger.addAppender(consoleAppender);
        consoleFilter = filter;
    }

    private static PatternLayoutEncoder encoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();
        return encoder;
    }
}
