package tether.core.log;

/**
 * The channel through which the bridge reports problems and progress to whoever hosts it.
 */
public interface TestLog {

    /**
     * Reports an error.
     *
     * @param message The error message.
     */
    public void sendErrorMessage(String message);

    /**
     * Reports an error caused by the given throwable.
     *
     * @param message The error message.
     * @param cause The cause.
     */
    public void sendErrorMessage(String message, Throwable cause);

    public void sendWarningMessage(String message);

    /**
     * Reports a diagnostic message that is only of interest when debugging the bridge itself.
     *
     * @param message The diagnostic message.
     */
    public void sendDebugMessage(String message);
}
