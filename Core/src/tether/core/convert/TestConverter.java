package tether.core.convert;

import tether.core.exception.AssemblyLoadException;
import tether.core.host.MachineIdentity;
import tether.core.log.TestLog;
import tether.core.model.NavigationData;
import tether.core.model.RawOutcome;
import tether.core.model.TestCaseDescriptor;
import tether.core.model.TestIdentity;
import tether.core.model.TestOutcome;
import tether.core.model.TestRunResult;
import tether.core.navigation.NavigationDataProvider;
import tether.core.navigation.SourceNavigator;
import tether.core.util.ObjectChecker;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts the tests of one assembly into {@link TestCaseDescriptor}s for the external runner and translates their
 * outcomes into {@link TestRunResult}s.
 *
 * Every test case is converted at most once: the descriptor is cached under the test's unique name and every later
 * conversion or result for that name uses the cached descriptor. The cache is never evicted, so a converter must
 * not outlive the assembly load it was created for.
 *
 * This class is not thread-safe.
 */
public final class TestConverter {
    private final TestLog testLog;
    private final String sourceAssembly;
    private final String executorUri;
    private final SourceNavigator navigator;
    private final MachineIdentity machineIdentity;
    private final boolean interactiveHost;
    private final Map<String, TestCaseDescriptor> testCaseMap = new HashMap<>();

    private TestConverter(TestLog testLog, String sourceAssembly, String executorUri, SourceNavigator navigator, MachineIdentity machineIdentity, boolean interactiveHost) {
        this.testLog = testLog;
        this.sourceAssembly = sourceAssembly;
        this.executorUri = executorUri;
        this.navigator = navigator;
        this.machineIdentity = machineIdentity;
        this.interactiveHost = interactiveHost;
    }

    /**
     * Converts a leaf test into its descriptor, returning the cached descriptor if the test was converted before.
     *
     * A new descriptor is given the source location reported by the navigator, or no location if the navigator
     * finds none. The navigator is consulted once per unique name.
     *
     * @param test The test to convert.
     * @return the descriptor.
     * @throws IllegalArgumentException If the test is a suite rather than a test case.
     * @throws AssemblyLoadException If the assembly's metadata cannot be read.
     */
    public TestCaseDescriptor convertTestCase(TestIdentity test) throws AssemblyLoadException {
        ObjectChecker.assertNonNull(test);
        if (test.isSuite) {
            throw new IllegalArgumentException("The argument must be a test case but was a suite: " + test.uniqueName);
        }

        TestCaseDescriptor cached = this.testCaseMap.get(test.uniqueName);
        if (cached != null) {
            return cached;
        }

        TestCaseDescriptor testCase = makeTestCase(test);
        this.testCaseMap.put(test.uniqueName, testCase);
        return testCase;
    }

    /**
     * Returns the descriptor cached under the given unique name, or null and an error report if there is none.
     *
     * @param uniqueName The unique name of the test.
     * @return the descriptor, or null.
     */
    public TestCaseDescriptor getCachedTestCase(String uniqueName) {
        TestCaseDescriptor testCase = this.testCaseMap.get(uniqueName);
        if (testCase == null) {
            this.testLog.sendErrorMessage("Test " + uniqueName + " not found in cache");
        }
        return testCase;
    }

    /**
     * Translates the outcome of a finished test into a result for the external runner.
     *
     * Passed and failed results that took no measurable time are reported with a duration of one tick, since the
     * external runner treats a zero duration as "not run".
     *
     * @param outcome The outcome of the test.
     * @return the result, or null if the test was never converted.
     */
    public TestRunResult convertTestResult(RawOutcome outcome) {
        ObjectChecker.assertNonNull(outcome);
        TestCaseDescriptor testCase = getCachedTestCase(outcome.uniqueName);
        if (testCase == null) {
            return null;
        }

        TestOutcome testOutcome = OutcomeTranslator.outcomeOf(outcome.state);
        long durationTicks = Math.round(outcome.elapsedSeconds * TestRunResult.TICKS_PER_SECOND);
        if (durationTicks == 0 && (testOutcome == TestOutcome.PASSED || testOutcome == TestOutcome.FAILED)) {
            durationTicks = 1;
        }

        TestRunResult.Builder result = TestRunResult.Builder.newBuilder()
                .testCase(testCase)
                .outcome(testOutcome)
                .durationTicks(durationTicks)
                .computerName(this.machineIdentity.getComputerName());

        if (outcome.message != null) {
            result.errorMessage(OutcomeTranslator.normalizeMessage(outcome.message, outcome.state, this.interactiveHost));
        }
        if (outcome.stackTrace != null && !outcome.stackTrace.isEmpty()) {
            result.errorStackTrace(StackTraceFilter.filter(outcome.stackTrace));
        }
        return result.build();
    }

    /**
     * Returns the number of test cases converted so far.
     *
     * @return the number of cached descriptors.
     */
    public int getNumConvertedTestCases() {
        return this.testCaseMap.size();
    }

    private TestCaseDescriptor makeTestCase(TestIdentity test) throws AssemblyLoadException {
        NavigationData navigationData = this.navigator.getNavigationData(test.className, test.methodName);
        if (!navigationData.isValid) {
            this.testLog.sendDebugMessage("No source location found for " + test.fullName);
        }

        return TestCaseDescriptor.Builder.newBuilder()
                .displayName(test.displayName)
                .fullyQualifiedName(test.fullName)
                .source(this.sourceAssembly)
                .executorUri(this.executorUri)
                .location(navigationData)
                .traits(test.traits)
                .build();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { source: " + this.sourceAssembly + ", cached: " + this.testCaseMap.size() + (this.interactiveHost ? ", [interactive]" : "") + " }";
    }

    public static final class Builder {
        private TestLog testLog;
        private String sourceAssembly;
        private String executorUri;
        private SourceNavigator navigator;
        private MachineIdentity machineIdentity;
        private boolean interactiveHost = false;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder testLog(TestLog testLog) {
            this.testLog = testLog;
            return this;
        }

        public Builder sourceAssembly(String sourceAssembly) {
            this.sourceAssembly = sourceAssembly;
            return this;
        }

        public Builder executorUri(String executorUri) {
            this.executorUri = executorUri;
            return this;
        }

        public Builder navigator(SourceNavigator navigator) {
            this.navigator = navigator;
            return this;
        }

        public Builder machineIdentity(MachineIdentity machineIdentity) {
            this.machineIdentity = machineIdentity;
            return this;
        }

        public Builder interactiveHost(boolean interactiveHost) {
            this.interactiveHost = interactiveHost;
            return this;
        }

        /**
         * Builds the converter. If no navigator was given, a {@link NavigationDataProvider} over the source assembly
         * is used.
         *
         * @return the converter.
         */
        public TestConverter build() {
            ObjectChecker.assertNonNull(this.testLog, this.sourceAssembly, this.executorUri, this.machineIdentity);
            SourceNavigator sourceNavigator = (this.navigator == null)
                    ? NavigationDataProvider.forAssembly(this.sourceAssembly)
                    : this.navigator;
            return new TestConverter(this.testLog, this.sourceAssembly, this.executorUri, sourceNavigator, this.machineIdentity, this.interactiveHost);
        }
    }
}
