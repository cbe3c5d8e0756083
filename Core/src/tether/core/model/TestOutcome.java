package tether.core.model;

/**
 * The outcome of a test in the vocabulary of the external runner.
 */
public enum TestOutcome {
    PASSED,
    FAILED,
    SKIPPED,
    NONE
}
