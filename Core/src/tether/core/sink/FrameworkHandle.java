package tether.core.sink;

import tether.core.model.TestCaseDescriptor;
import tether.core.model.TestOutcome;
import tether.core.model.TestRunResult;

/**
 * The external runner's handle for the progress and results of a test run.
 *
 * For every test that runs the handle sees {@link FrameworkHandle#recordStart(TestCaseDescriptor)}, then
 * {@link FrameworkHandle#recordEnd(TestCaseDescriptor, TestOutcome)}, then
 * {@link FrameworkHandle#recordResult(TestRunResult)}. Messages may arrive at any time in between.
 */
public interface FrameworkHandle {

    public void recordStart(TestCaseDescriptor testCase);

    public void recordEnd(TestCaseDescriptor testCase, TestOutcome outcome);

    public void recordResult(TestRunResult result);

    /**
     * Forwards a message, such as a line of console output written by a running test.
     *
     * @param level The level of the message.
     * @param message The message text.
     */
    public void sendMessage(MessageLevel level, String message);
}
