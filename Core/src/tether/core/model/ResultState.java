package tether.core.model;

/**
 * The state a test finished in, as reported by the framework side of the bridge.
 */
public enum ResultState {
    SUCCESS,
    FAILURE,
    ERROR,
    CANCELLED,
    INCONCLUSIVE,
    NOT_RUNNABLE,
    SKIPPED,
    IGNORED
}
