package tether.core.util;

import java.io.PrintStream;

/**
 * A simple logging utility that can be either enabled or disabled globally.
 *
 * Loggers always write to the stderr stream the process started with. Log lines are never mistaken for console
 * output captured from a running test, and never interleave with the reports written to stdout.
 */
public final class Logger {
    private static final PrintStream OUT = System.err;
    private static volatile boolean globalEnabled = true;
    private final String className;
    private boolean enabled = true;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    /**
     * Returns true iff loggers are globally enabled.
     *
     * @return whether logging is globally enabled.
     */
    public static boolean isGlobalEnabled() {
        return globalEnabled;
    }

    /**
     * Disables this logger only.
     */
    public void disable() {
        this.enabled = false;
    }

    /**
     * Enables this logger only.
     */
    public void enable() {
        this.enabled = true;
    }

    /**
     * Logs the specified message if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled && this.enabled) {
            OUT.println(this.className + ": " + message);
        }
    }

    /**
     * Logs the specified message followed by the stack trace of the given throwable, if logging is enabled.
     *
     * @param message The message to log.
     * @param throwable The cause to print.
     */
    public void log(String message, Throwable throwable) {
        if (globalEnabled && this.enabled) {
            OUT.println(this.className + ": " + message);
            throwable.printStackTrace(OUT);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled (global): " + globalEnabled + ", enabled (local): " + this.enabled + " }";
    }
}
