package tether.core.log;

import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

/**
 * A {@link TestLog} that writes every message through a {@link Logger}, prefixed with its level.
 */
public final class LoggerTestLog implements TestLog {
    private final Logger logger;

    private LoggerTestLog(Logger logger) {
        ObjectChecker.assertNonNull(logger);
        this.logger = logger;
    }

    public static LoggerTestLog forClass(Class<?> logClass) {
        return new LoggerTestLog(Logger.forClass(logClass));
    }

    @Override
    public void sendErrorMessage(String message) {
        this.logger.log("ERROR " + message);
    }

    @Override
    public void sendErrorMessage(String message, Throwable cause) {
        ObjectChecker.assertNonNull(cause);
        this.logger.log("ERROR " + message, cause);
    }

    @Override
    public void sendWarningMessage(String message) {
        this.logger.log("WARNING " + message);
    }

    @Override
    public void sendDebugMessage(String message) {
        this.logger.log("DEBUG " + message);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { logger: " + this.logger + " }";
    }
}
