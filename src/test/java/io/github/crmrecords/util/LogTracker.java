package io.github.crmrecords.util;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.LoggerFactory;

/**
 * Collects the log events of one class so that unit tests can assert on log messages.
 * Call {@link #detach()} when done to restore the logger.
 */
public class LogTracker extends AppenderBase<ILoggingEvent> {

    final List<ILoggingEvent> events = new CopyOnWriteArrayList<>();

    final Logger logger;

    final Level originalLevel;

    LogTracker(Logger logger) {
        this.logger = logger;
        this.originalLevel = logger.getLevel();
    }

    @Override
    protected void append(ILoggingEvent event) {
        events.add(event);
    }

    /**
     * Formatted messages logged at the level, in logging order
     */
    public List<String> getMessages(Level level) {
        return events.stream().filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    public void detach() {
        logger.detachAppender(this);
        logger.setLevel(originalLevel);
        stop();
    }

    public static LogTracker getInstance(Class<?> loggerClass, Level level) {
        var logger = (Logger) LoggerFactory.getLogger(loggerClass);
        var tracker = new LogTracker(logger);
        logger.setLevel(level);
        logger.addAppender(tracker);
        tracker.start();
        return tracker;
    }

    public static LogTracker getInstance(Class<?> loggerClass) {
        return getInstance(loggerClass, Level.DEBUG);
    }
}
