package com.example.persession.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class SessionLogFileTest {

    private Logger libraryLogger() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(SessionLogFile.LOGGER_NAME);
    }

    @Test
    void installsFileAndConsoleAppendersOnce() {
        SessionLogFile.init(false);
        SessionLogFile.init(false);

        Logger logger = libraryLogger();
        assertThat(logger.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(logger.isAdditive()).isFalse();
        assertThat(logger.iteratorForAppenders()).toIterable().hasSize(2);
        assertThat(SessionLogFile.logFilePath().getFileName().toString()).isEqualTo("persession.log");
    }

    @Test
    void verboseFlagControlsConsoleThreshold() {
        SessionLogFile.init(true);
        assertThat(SessionLogFile.consoleLevel()).isEqualTo(Level.DEBUG);

        SessionLogFile.init(false);
        assertThat(SessionLogFile.consoleLevel()).isEqualTo(Level.ERROR);
    }
}
