package org.timebox.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.FormattedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

/**
 * Thin facade over log4j2 that keeps the caller's location in log records.
 */
public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    public void warn(String message, Throwable t, Object... params) {
        log(Level.WARN, message, t, params);
    }

    public void info(String message, Object... params) {
        log(Level.INFO, message, params);
    }

    public void debug(String message, Object... params) {
        log(Level.DEBUG, message, params);
    }

    private void log(Level level, String message, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, message, params);
    }

    private void log(Level level, String message, Throwable t, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, new FormattedMessage(message, params), t);
    }
}
