package com.ivamare.topicbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.util.Locale;
import java.util.Map;

/**
 * Applies the {@code LOG_LEVEL} verbosity to the {@code com.ivamare.topicbus} loggers.
 *
 * <p>Accepted values are unknown, fatal, error, warn, info and debug. Unset
 * means warn; any other value means debug.
 */
public class TopicBusLogging implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(TopicBusLogging.class);

    public static final String LOGGER_NAME = "com.ivamare.topicbus";
    public static final String LOG_LEVEL_VARIABLE = "LOG_LEVEL";

    private static final Map<String, LogLevel> LEVELS = Map.of(
        "unknown", LogLevel.OFF,
        "fatal", LogLevel.FATAL,
        "error", LogLevel.ERROR,
        "warn", LogLevel.WARN,
        "info", LogLevel.INFO,
        "debug", LogLevel.DEBUG
    );

    private final LoggingSystem loggingSystem;
    private final String configuredLevel;

    public TopicBusLogging(LoggingSystem loggingSystem, String configuredLevel) {
        this.loggingSystem = loggingSystem;
        this.configuredLevel = configuredLevel;
    }

    /**
     * Map a verbosity name to a log level.
     *
     * @param value verbosity name (nullable)
     * @return log level
     */
    public static LogLevel resolve(String value) {
        if (value == null || value.isBlank()) {
            return LogLevel.WARN;
        }
        return LEVELS.getOrDefault(value.trim().toLowerCase(Locale.ROOT), LogLevel.DEBUG);
    }

    @Override
    public void afterPropertiesSet() {
        LogLevel level = resolve(configuredLevel);
        loggingSystem.setLogLevel(LOGGER_NAME, level);
        log.debug("Topic bus log level set to {}", level);
    }

    public LogLevel level() {
        return resolve(configuredLevel);
    }
}
