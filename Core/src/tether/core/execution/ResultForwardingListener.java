package tether.core.execution;

import org.junit.Ignore;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;
import tether.core.convert.OutcomeTranslator;
import tether.core.convert.TestConverter;
import tether.core.exception.AssemblyLoadException;
import tether.core.log.TestLog;
import tether.core.model.RawOutcome;
import tether.core.model.ResultState;
import tether.core.model.TestCaseDescriptor;
import tether.core.model.TestIdentity;
import tether.core.model.TestOutcome;
import tether.core.model.TestRunResult;
import tether.core.sink.FrameworkHandle;
import tether.core.sink.MessageLevel;
import tether.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A JUnit {@link RunListener} that translates the callbacks of a run into the external runner's vocabulary and
 * forwards them to a {@link FrameworkHandle}.
 *
 * JUnit reports a test's failure separately from its end, so the state of every started test is held until the
 * test finishes:
 *
 * an assertion failure is a {@link ResultState#FAILURE}, any other throwable an {@link ResultState#ERROR}, a
 * failure of JUnit's "initializationError" pseudo-test {@link ResultState#NOT_RUNNABLE}, a failed assumption
 * {@link ResultState#INCONCLUSIVE}, and an ignored test {@link ResultState#IGNORED}. Tests still unfinished when the
 * run ends are reported as {@link ResultState#CANCELLED}.
 */
@RunListener.ThreadSafe
public final class ResultForwardingListener extends RunListener {
    private static final String INITIALIZATION_ERROR = "initializationError";
    private final TestConverter converter;
    private final FrameworkHandle handle;
    private final TestLog testLog;
    private final Map<Description, RunningTest> runningTests = new HashMap<>();

    private ResultForwardingListener(TestConverter converter, FrameworkHandle handle, TestLog testLog) {
        ObjectChecker.assertNonNull(converter, handle, testLog);
        this.converter = converter;
        this.handle = handle;
        this.testLog = testLog;
    }

    public static ResultForwardingListener forwardingTo(TestConverter converter, FrameworkHandle handle, TestLog testLog) {
        return new ResultForwardingListener(converter, handle, testLog);
    }

    @Override
    public synchronized void testStarted(Description description) {
        TestCaseDescriptor testCase = convert(description);
        if (testCase == null) {
            return;
        }
        this.handle.recordStart(testCase);
        this.runningTests.put(description, new RunningTest(testCase, System.nanoTime()));
    }

    @Override
    public synchronized void testFailure(Failure failure) {
        Description description = failure.getDescription();
        RunningTest runningTest = this.runningTests.get(description);
        if (runningTest == null) {
            // Failures of a whole class, such as a failing @BeforeClass, are not attached to any started test.
            this.testLog.sendErrorMessage("Failure outside of a test in " + description.getDisplayName() + ": " + failure.getMessage());
            this.handle.sendMessage(MessageLevel.ERROR, failure.getTestHeader() + ": " + failure.getMessage());
            return;
        }
        runningTest.fail(stateOf(failure), failure.getMessage(), failure.getTrace());
    }

    @Override
    public synchronized void testAssumptionFailure(Failure failure) {
        RunningTest runningTest = this.runningTests.get(failure.getDescription());
        if (runningTest != null) {
            runningTest.fail(ResultState.INCONCLUSIVE, failure.getMessage(), null);
        }
    }

    @Override
    public synchronized void testIgnored(Description description) {
        TestCaseDescriptor testCase = convert(description);
        if (testCase == null) {
            return;
        }
        Ignore ignore = description.getAnnotation(Ignore.class);
        String reason = (ignore == null || ignore.value().isEmpty()) ? null : ignore.value();

        RunningTest ignoredTest = new RunningTest(testCase, System.nanoTime());
        ignoredTest.fail(ResultState.IGNORED, reason, null);
        report(description, ignoredTest);
    }

    @Override
    public synchronized void testFinished(Description description) {
        RunningTest runningTest = this.runningTests.remove(description);
        if (runningTest == null) {
            this.testLog.sendWarningMessage("Finished test was never started: " + description.getDisplayName());
            return;
        }
        report(description, runningTest);
    }

    @Override
    public synchronized void testRunFinished(Result result) {
        List<Description> unfinished = new ArrayList<>(this.runningTests.keySet());
        for (Description description : unfinished) {
            RunningTest runningTest = this.runningTests.remove(description);
            runningTest.fail(ResultState.CANCELLED, "Test run stopped before the test finished", null);
            report(description, runningTest);
        }
    }

    /**
     * Forwards a chunk of console output written during the run.
     *
     * @param level The level to forward the output at.
     * @param text The output chunk.
     */
    public synchronized void testOutput(MessageLevel level, String text) {
        String message = OutcomeTranslator.normalizeOutputChunk(text);
        if (message != null && !message.isEmpty()) {
            this.handle.sendMessage(level, message);
        }
    }

    private TestCaseDescriptor convert(Description description) {
        try {
            return this.converter.convertTestCase(TestIdentity.fromDescription(description));
        } catch (AssemblyLoadException | RuntimeException e) {
            this.testLog.sendErrorMessage("Exception converting " + description.getDisplayName(), e);
            return null;
        }
    }

    private void report(Description description, RunningTest test) {
        double elapsedSeconds = (System.nanoTime() - test.startNanos) / 1_000_000_000.0;
        RawOutcome outcome = RawOutcome.Builder.newBuilder()
                .uniqueName(description.getDisplayName())
                .state(test.state)
                .message(test.message)
                .stackTrace(test.stackTrace)
                .elapsedSeconds(elapsedSeconds)
                .build();

        TestOutcome testOutcome = OutcomeTranslator.outcomeOf(outcome.state);
        this.handle.recordEnd(test.testCase, testOutcome);

        TestRunResult result = this.converter.convertTestResult(outcome);
        if (result != null) {
            this.handle.recordResult(result);
        }
    }

    private static ResultState stateOf(Failure failure) {
        if (INITIALIZATION_ERROR.equals(failure.getDescription().getMethodName())) {
            return ResultState.NOT_RUNNABLE;
        }
        return (failure.getException() instanceof AssertionError) ? ResultState.FAILURE : ResultState.ERROR;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { running: " + this.runningTests.size() + " }";
    }

    private static final class RunningTest {
        private final TestCaseDescriptor testCase;
        private final long startNanos;
        private ResultState state = ResultState.SUCCESS;
        private String message;
        private String stackTrace;

        private RunningTest(TestCaseDescriptor testCase, long startNanos) {
            this.testCase = testCase;
            this.startNanos = startNanos;
        }

        /**
         * Records the first failure only; JUnit may report several failures for one test.
         */
        private void fail(ResultState state, String message, String stackTrace) {
            if (this.state != ResultState.SUCCESS) {
                return;
            }
            this.state = state;
            this.message = message;
            this.stackTrace = stackTrace;
        }
    }
}
