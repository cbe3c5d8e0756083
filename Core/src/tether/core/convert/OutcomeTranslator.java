package tether.core.convert;

import tether.core.model.ResultState;
import tether.core.model.TestOutcome;

import java.util.regex.Pattern;

/**
 * Stateless translations from the framework's vocabulary to the external runner's.
 */
public final class OutcomeTranslator {
    private static final String LF = "\n";
    private static final String CR = "\r";
    private static final String CRLF = "\r\n";

    /**
     * A caret annotation line ("  ----^") together with the separators around it. The preceding separator is kept.
     */
    private static final Pattern CARET_LINE = Pattern.compile("(\r\n|\n|\r) *-*\\^(?:\r\n|\n|\r)");

    private OutcomeTranslator() {}

    /**
     * Maps a result state to the external outcome. Any state without an entry maps to {@link TestOutcome#NONE}.
     *
     * @param state The result state.
     * @return the outcome.
     */
    public static TestOutcome outcomeOf(ResultState state) {
        if (state == null) {
            return TestOutcome.NONE;
        }
        switch (state) {
            case SUCCESS:
                return TestOutcome.PASSED;
            case FAILURE:
            case ERROR:
            case NOT_RUNNABLE:
                return TestOutcome.FAILED;
            case IGNORED:
            case SKIPPED:
                return TestOutcome.SKIPPED;
            case CANCELLED:
            case INCONCLUSIVE:
                return TestOutcome.NONE;
        }
        return TestOutcome.NONE;
    }

    /**
     * Returns the message to report as a result's error message.
     *
     * Interactive hosts render messages in a proportional font, where the caret lines that point into a preceding
     * line of an assertion message no longer line up. For failures and inconclusive results reported to such a
     * host, every caret line is removed. The message is otherwise returned unchanged.
     *
     * @param message The message, possibly null.
     * @param state The state of the result the message belongs to.
     * @param interactiveHost Whether results are reported to an interactive host.
     * @return the message, or null if the message was null.
     */
    public static String normalizeMessage(String message, ResultState state, boolean interactiveHost) {
        if (message == null) {
            return null;
        }
        if (interactiveHost && (state == ResultState.FAILURE || state == ResultState.INCONCLUSIVE)) {
            return CARET_LINE.matcher(message).replaceAll("$1");
        }
        return message;
    }

    /**
     * Normalizes a chunk of captured console output before it is forwarded as a message.
     *
     * The run of line endings at the end of the chunk is removed, except that a run of exactly two identical line
     * endings (LF LF, CR CR or CRLF CRLF) keeps one of them. Line breaks inside the chunk are left alone.
     *
     * @param text The output chunk.
     * @return the normalized chunk.
     */
    public static String normalizeOutputChunk(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        int end = text.length();
        int count = 0;
        String first = null;
        boolean identical = true;
        String ending;
        while ((ending = trailingLineEnding(text, end)) != null) {
            if (first == null) {
                first = ending;
            } else if (!first.equals(ending)) {
                identical = false;
            }
            end -= ending.length();
            count++;
        }

        if (count == 2 && identical) {
            return text.substring(0, end) + first;
        }
        return text.substring(0, end);
    }

    private static String trailingLineEnding(String text, int end) {
        if (end >= 2 && text.startsWith(CRLF, end - 2)) {
            return CRLF;
        }
        if (end >= 1 && text.charAt(end - 1) == '\n') {
            return LF;
        }
        if (end >= 1 && text.charAt(end - 1) == '\r') {
            return CR;
        }
        return null;
    }
}
