package tether.core.model;

import tether.core.util.ObjectChecker;

/**
 * The outcome of a finished test before it is translated for the external runner.
 *
 * {@link RawOutcome#uniqueName}: the unique name of the test that finished.
 * {@link RawOutcome#state}: the state the test finished in.
 * {@link RawOutcome#message}: the failure, skip or pass message, possibly null.
 * {@link RawOutcome#stackTrace}: the stack trace of the failure, possibly null.
 * {@link RawOutcome#elapsedSeconds}: the time the test took to run, in seconds.
 */
public final class RawOutcome {
    public final String uniqueName;
    public final ResultState state;
    public final String message;
    public final String stackTrace;
    public final double elapsedSeconds;

    private RawOutcome(String uniqueName, ResultState state, String message, String stackTrace, double elapsedSeconds) {
        this.uniqueName = uniqueName;
        this.state = state;
        this.message = message;
        this.stackTrace = stackTrace;
        this.elapsedSeconds = elapsedSeconds;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { unique name: " + this.uniqueName + ", state: " + this.state + ", elapsed: " + this.elapsedSeconds + "s }";
    }

    public static final class Builder {
        private String uniqueName;
        private ResultState state;
        private String message;
        private String stackTrace;
        private double elapsedSeconds = 0;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder uniqueName(String uniqueName) {
            this.uniqueName = uniqueName;
            return this;
        }

        public Builder state(ResultState state) {
            this.state = state;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder stackTrace(String stackTrace) {
            this.stackTrace = stackTrace;
            return this;
        }

        public Builder elapsedSeconds(double elapsedSeconds) {
            if (elapsedSeconds < 0) {
                throw new IllegalArgumentException("elapsedSeconds must be non-negative but was: " + elapsedSeconds);
            }
            this.elapsedSeconds = elapsedSeconds;
            return this;
        }

        public RawOutcome build() {
            ObjectChecker.assertNonNull(this.uniqueName, this.state);
            return new RawOutcome(this.uniqueName, this.state, this.message, this.stackTrace, this.elapsedSeconds);
        }
    }
}
