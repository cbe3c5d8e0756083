package tether.core.model;

import com.google.gson.JsonObject;
import tether.core.util.ObjectChecker;

import java.time.Duration;

/**
 * The result of a finished test in the vocabulary of the external runner.
 *
 * {@link TestRunResult#durationTicks}: the duration in ticks, where one tick is 100 nanoseconds.
 * {@link TestRunResult#errorMessage}: the normalized message, possibly null.
 * {@link TestRunResult#errorStackTrace}: the filtered stack trace, possibly null.
 * {@link TestRunResult#computerName}: the name of the machine that ran the test.
 */
public final class TestRunResult {
    public static final long TICKS_PER_SECOND = 10_000_000L;
    private static final long NANOS_PER_TICK = 100L;
    public final TestCaseDescriptor testCase;
    public final String displayName;
    public final TestOutcome outcome;
    public final long durationTicks;
    public final String errorMessage;
    public final String errorStackTrace;
    public final String computerName;

    private TestRunResult(TestCaseDescriptor testCase, TestOutcome outcome, long durationTicks, String errorMessage, String errorStackTrace, String computerName) {
        this.testCase = testCase;
        this.displayName = testCase.displayName;
        this.outcome = outcome;
        this.durationTicks = durationTicks;
        this.errorMessage = errorMessage;
        this.errorStackTrace = errorStackTrace;
        this.computerName = computerName;
    }

    public Duration getDuration() {
        return Duration.ofNanos(this.durationTicks * NANOS_PER_TICK);
    }

    /**
     * Converts the result to a JSON object that embeds the test case it belongs to.
     *
     * @return the JSON object.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.add("test_case", this.testCase.toJson());
        json.addProperty("display_name", this.displayName);
        json.addProperty("outcome", this.outcome.name());
        json.addProperty("duration_ticks", this.durationTicks);
        json.addProperty("computer_name", this.computerName);
        if (this.errorMessage != null) {
            json.addProperty("error_message", this.errorMessage);
        }
        if (this.errorStackTrace != null) {
            json.addProperty("error_stack_trace", this.errorStackTrace);
        }
        return json;
    }

    public String toJsonString() {
        return toJson().toString();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { test: " + this.testCase.fullyQualifiedName + ", outcome: " + this.outcome + ", ticks: " + this.durationTicks + " }";
    }

    public static final class Builder {
        private TestCaseDescriptor testCase;
        private TestOutcome outcome;
        private Long durationTicks;
        private String errorMessage;
        private String errorStackTrace;
        private String computerName;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder testCase(TestCaseDescriptor testCase) {
            this.testCase = testCase;
            return this;
        }

        public Builder outcome(TestOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder durationTicks(long durationTicks) {
            ObjectChecker.assertNonNegative(durationTicks);
            this.durationTicks = durationTicks;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder errorStackTrace(String errorStackTrace) {
            this.errorStackTrace = errorStackTrace;
            return this;
        }

        public Builder computerName(String computerName) {
            this.computerName = computerName;
            return this;
        }

        public TestRunResult build() {
            ObjectChecker.assertNonNull(this.testCase, this.outcome, this.durationTicks, this.computerName);
            return new TestRunResult(this.testCase, this.outcome, this.durationTicks, this.errorMessage, this.errorStackTrace, this.computerName);
        }
    }
}
