package tether.core.execution;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import tether.core.config.AdapterConfig;
import tether.core.config.AdapterContext;
import tether.core.execution.fixture.ExecutionFixture;
import tether.core.helper.RecordingFrameworkHandle;
import tether.core.helper.RecordingTestLog;
import tether.core.model.TestOutcome;
import tether.core.model.TestRunResult;
import tether.core.sink.MessageLevel;

import java.io.File;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

public class TestExecutorTest {
    private static final String FIXTURE = ExecutionFixture.class.getName();
    private RecordingTestLog testLog;
    private RecordingFrameworkHandle handle;
    private String testClasses;

    @Before
    public void setup() throws URISyntaxException {
        this.testLog = new RecordingTestLog();
        this.handle = new RecordingFrameworkHandle();
        this.testClasses = Paths.get(ExecutionFixture.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
    }

    @Test
    public void testPassingCase() {
        runFixture();

        TestRunResult result = this.handle.resultFor(FIXTURE + ".passingCase");
        Assert.assertEquals(TestOutcome.PASSED, result.outcome);
        assertThat(result.durationTicks, greaterThanOrEqualTo(1L));
        Assert.assertEquals("test-machine", result.computerName);
        Assert.assertNull(result.errorMessage);
        Assert.assertEquals("ExecutionFixture.java", new File(result.testCase.codeFilePath).getName());
    }

    @Test
    public void testEventsAreReportedInOrder() {
        runFixture();

        int start = this.handle.events.indexOf("start:" + FIXTURE + ".passingCase");
        int end = this.handle.events.indexOf("end:" + FIXTURE + ".passingCase:PASSED");
        int result = this.handle.events.indexOf("result:" + FIXTURE + ".passingCase:PASSED");
        Assert.assertTrue(start >= 0);
        Assert.assertTrue(start < end);
        Assert.assertEquals(end + 1, result);
    }

    @Test
    public void testFailingCase() {
        runFixture();

        TestRunResult result = this.handle.resultFor(FIXTURE + ".failingCase");
        Assert.assertEquals(TestOutcome.FAILED, result.outcome);
        assertThat(result.errorMessage, containsString("expected"));
        assertThat(result.errorStackTrace, containsString("ExecutionFixture.failingCase"));
        assertThat(result.errorStackTrace, not(containsString("at org.junit.")));
    }

    @Test
    public void testErroringCase() {
        runFixture();

        TestRunResult result = this.handle.resultFor(FIXTURE + ".erroringCase");
        Assert.assertEquals(TestOutcome.FAILED, result.outcome);
        Assert.assertEquals("boom", result.errorMessage);
        assertThat(result.errorStackTrace, startsWith("java.lang.IllegalStateException: boom"));
    }

    @Test
    public void testAssumptionFailureHasNoOutcome() {
        runFixture();

        TestRunResult result = this.handle.resultFor(FIXTURE + ".assumptionCase");
        Assert.assertEquals(TestOutcome.NONE, result.outcome);
        assertThat(result.errorMessage, startsWith("not applicable here"));
    }

    @Test
    public void testIgnoredCase() {
        runFixture();

        TestRunResult result = this.handle.resultFor(FIXTURE + ".ignoredCase");
        Assert.assertEquals(TestOutcome.SKIPPED, result.outcome);
        Assert.assertEquals("not ready", result.errorMessage);
        Assert.assertEquals(-1, this.handle.events.indexOf("start:" + FIXTURE + ".ignoredCase"));
    }

    @Test
    public void testEveryCaseHasOneResult() {
        runFixture();

        Assert.assertEquals(6, this.handle.results.size());
        Assert.assertTrue(this.testLog.errors.isEmpty());
    }

    @Test
    public void testConsoleOutputIsForwarded() {
        runFixture();

        int stdout = this.handle.messages.indexOf(ExecutionFixture.STDOUT_LINE);
        Assert.assertTrue(stdout >= 0);
        Assert.assertEquals(MessageLevel.INFORMATIONAL, this.handle.messageLevels.get(stdout));

        int stderr = this.handle.messages.indexOf(ExecutionFixture.STDERR_LINE);
        Assert.assertTrue(stderr >= 0);
        Assert.assertEquals(MessageLevel.WARNING, this.handle.messageLevels.get(stderr));
    }

    @Test
    public void testConsoleStreamsAreRestored() {
        PrintStream out = System.out;
        PrintStream err = System.err;
        runFixture();

        Assert.assertSame(out, System.out);
        Assert.assertSame(err, System.err);
    }

    @Test
    public void testMissingAssemblyIsSkipped() {
        String missing = new File(this.testClasses, "does-not-exist").getPath();
        int numRun = executor().runTests(Arrays.asList(missing, this.testClasses), this.handle);

        Assert.assertEquals(1, numRun);
        Assert.assertEquals(1, this.testLog.errors.size());
        Assert.assertEquals(6, this.handle.results.size());
    }

    private void runFixture() {
        Assert.assertEquals(1, executor().runTests(Collections.singletonList(this.testClasses), this.handle));
    }

    private TestExecutor executor() {
        AdapterConfig config = AdapterConfig.Builder.newBuilder().setTestClassMatcher("ExecutionFixture\\.class").build();
        return TestExecutor.withContext(AdapterContext.of(config, this.testLog, () -> "test-machine"));
    }
}
