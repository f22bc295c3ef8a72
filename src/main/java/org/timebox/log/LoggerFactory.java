package org.timebox.log;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.spi.ExtendedLogger;

public final class LoggerFactory {

    private LoggerFactory() {
    }

    /**
     * Returns {@link Logger} named after the given class, or after its closest named enclosing class
     * for anonymous ones.
     */
    public static Logger getLogger(Class<?> clazz) {
        Class<?> namedClass = clazz;
        while (namedClass.isAnonymousClass()) {
            namedClass = namedClass.getEnclosingClass();
        }

        return new Logger((ExtendedLogger) LogManager.getLogger(namedClass));
    }
}
