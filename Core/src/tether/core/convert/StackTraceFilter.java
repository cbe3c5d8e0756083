package tether.core.convert;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;

/**
 * Removes the frames of the test framework and of reflective invocation from a stack trace, leaving the frames a
 * reader of a failure cares about.
 */
public final class StackTraceFilter {
    private static final String[] FILTERED_FRAME_PREFIXES = new String[] {
            "org.junit.",
            "junit.framework.",
            "java.lang.reflect.",
            "jdk.internal.reflect.",
            "sun.reflect.",
            "tether.core.execution."
    };
    private static final String FRAME_MARKER = "at ";

    private StackTraceFilter() {}

    /**
     * Returns the given stack trace with the filtered frames removed. Lines that are not frames ("Caused by: ...",
     * "... 12 more") are kept. Lines are joined with '\n' and the result has no trailing line separator.
     *
     * @param stackTrace The stack trace, possibly null.
     * @return the filtered stack trace, or null if the stack trace was null.
     */
    public static String filter(String stackTrace) {
        if (stackTrace == null) {
            return null;
        }

        StringBuilder filtered = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new StringReader(stackTrace))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (isFilteredFrame(line)) {
                    continue;
                }
                if (filtered.length() > 0) {
                    filtered.append('\n');
                }
                filtered.append(line);
            }
        } catch (IOException e) {
            // A StringReader never fails.
            throw new UncheckedIOException(e);
        }
        return filtered.toString();
    }

    private static boolean isFilteredFrame(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith(FRAME_MARKER)) {
            return false;
        }
        String frame = stripLoaderAndModule(trimmed.substring(FRAME_MARKER.length()));
        for (String prefix : FILTERED_FRAME_PREFIXES) {
            if (frame.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strips the class loader and module names that prefix a frame's class name ("app//", "java.base/",
     * "module@1.0/"). Class names never hold a '/', so everything up to the last one before the source location
     * is a prefix.
     */
    private static String stripLoaderAndModule(String frame) {
        int locationStart = frame.indexOf('(');
        String qualifiedMethod = (locationStart < 0) ? frame : frame.substring(0, locationStart);
        int lastSlash = qualifiedMethod.lastIndexOf('/');
        return (lastSlash < 0) ? frame : frame.substring(lastSlash + 1);
    }
}
