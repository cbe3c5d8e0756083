package tether.core.execution;

import org.junit.runner.Description;
import org.junit.runner.JUnitCore;
import org.junit.runner.Result;
import tether.core.config.AdapterContext;
import tether.core.convert.TestConverter;
import tether.core.discovery.TestAssembly;
import tether.core.exception.AssemblyLoadException;
import tether.core.model.TestIdentity;
import tether.core.sink.FrameworkHandle;
import tether.core.sink.MessageLevel;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs the test cases of compiled assemblies with JUnit and reports every start, end, result and line of console
 * output to a {@link FrameworkHandle}.
 *
 * While an assembly's tests run, {@link System#out} and {@link System#err} are replaced so that whatever the tests
 * print is forwarded to the handle as informational and warning messages respectively. The original streams are
 * restored once the assembly is done.
 */
public final class TestExecutor {
    private static final Logger LOGGER = Logger.forClass(TestExecutor.class);
    private final AdapterContext context;

    private TestExecutor(AdapterContext context) {
        ObjectChecker.assertNonNull(context);
        this.context = context;
    }

    public static TestExecutor withContext(AdapterContext context) {
        return new TestExecutor(context);
    }

    /**
     * Runs the tests of every given assembly, one assembly at a time.
     *
     * @param sources The paths of the assemblies.
     * @param handle The handle to report to.
     * @return the number of assemblies whose tests were run.
     */
    public int runTests(List<String> sources, FrameworkHandle handle) {
        ObjectChecker.assertNonNull(sources, handle);
        LOGGER.log("Running tests in " + sources.size() + " assembly(s).");

        int numRun = 0;
        for (String source : sources) {
            this.context.testLog.sendDebugMessage("Processing " + source);
            try (TestAssembly assembly = TestAssembly.load(source, this.context.config.testClassMatcher)) {
                if (assembly.getTestClasses().isEmpty()) {
                    this.context.testLog.sendDebugMessage("No test classes found in " + source);
                    continue;
                }
                TestConverter converter = this.context.newConverter(source);
                int cases = convertTestCases(assembly.getDescription(), converter);
                this.context.testLog.sendDebugMessage("Running " + cases + " test cases in " + source);
                runAssembly(assembly, converter, handle);
                numRun++;
            } catch (AssemblyLoadException e) {
                this.context.testLog.sendErrorMessage("Unable to load assembly " + source, e);
            } catch (IOException e) {
                this.context.testLog.sendWarningMessage("Unable to release assembly " + source + ": " + e.getMessage());
            }
        }

        LOGGER.log("Ran the tests of " + numRun + " assembly(s).");
        return numRun;
    }

    private void runAssembly(TestAssembly assembly, TestConverter converter, FrameworkHandle handle) {
        ResultForwardingListener listener = ResultForwardingListener.forwardingTo(converter, handle, this.context.testLog);
        JUnitCore core = new JUnitCore();
        core.addListener(listener);

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        PrintStream capturedOut = captureStream(listener, MessageLevel.INFORMATIONAL);
        PrintStream capturedErr = captureStream(listener, MessageLevel.WARNING);

        // Test classes resolve their dependencies through the context class loader.
        Thread currentThread = Thread.currentThread();
        ClassLoader originalLoader = currentThread.getContextClassLoader();

        Result result;
        System.setOut(capturedOut);
        System.setErr(capturedErr);
        currentThread.setContextClassLoader(assembly.getClassLoader());
        try {
            result = core.run(assembly.toRequest());
        } finally {
            currentThread.setContextClassLoader(originalLoader);
            capturedOut.flush();
            capturedErr.flush();
            System.setOut(originalOut);
            System.setErr(originalErr);
        }

        LOGGER.log("Finished " + assembly.path + ": " + result.getRunCount() + " run, " + result.getFailureCount() + " failed, " + result.getIgnoreCount() + " ignored.");
    }

    /**
     * Converts every leaf test under the given description up front, so that results reported later always find
     * their test case in the converter's cache.
     */
    private int convertTestCases(Description description, TestConverter converter) throws AssemblyLoadException {
        if (description.isSuite()) {
            int cases = 0;
            for (Description child : description.getChildren()) {
                cases += convertTestCases(child, converter);
            }
            return cases;
        }

        try {
            converter.convertTestCase(TestIdentity.fromDescription(description));
            return 1;
        } catch (RuntimeException e) {
            this.context.testLog.sendErrorMessage("Exception converting " + description.getDisplayName(), e);
            return 0;
        }
    }

    private static PrintStream captureStream(ResultForwardingListener listener, MessageLevel level) {
        try {
            return new PrintStream(new ForwardingOutputStream(listener, level), true, StandardCharsets.UTF_8.name());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException("UTF-8 is not supported.", e);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { context: " + this.context + " }";
    }
}
