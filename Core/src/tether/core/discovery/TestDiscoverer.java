package tether.core.discovery;

import org.junit.runner.Description;
import tether.core.config.AdapterContext;
import tether.core.convert.TestConverter;
import tether.core.exception.AssemblyLoadException;
import tether.core.model.TestCaseDescriptor;
import tether.core.model.TestIdentity;
import tether.core.sink.DiscoverySink;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.IOException;
import java.util.List;

/**
 * Discovers the test cases of compiled assemblies and sends each of them, converted, to a {@link DiscoverySink}.
 *
 * Assemblies are processed one at a time, each with a converter of its own. An assembly that cannot be loaded is
 * reported and skipped; a test case that cannot be converted is reported and skipped.
 */
public final class TestDiscoverer {
    private static final Logger LOGGER = Logger.forClass(TestDiscoverer.class);
    private final AdapterContext context;

    private TestDiscoverer(AdapterContext context) {
        ObjectChecker.assertNonNull(context);
        this.context = context;
    }

    public static TestDiscoverer withContext(AdapterContext context) {
        return new TestDiscoverer(context);
    }

    /**
     * Discovers the test cases of every given assembly.
     *
     * @param sources The paths of the assemblies.
     * @param sink The sink to send the test cases to.
     * @return the total number of test cases sent to the sink.
     */
    public int discoverTests(List<String> sources, DiscoverySink sink) {
        ObjectChecker.assertNonNull(sources, sink);
        LOGGER.log("Discovering tests in " + sources.size() + " assembly(s).");

        int total = 0;
        for (String source : sources) {
            this.context.testLog.sendDebugMessage("Processing " + source);
            try (TestAssembly assembly = TestAssembly.load(source, this.context.config.testClassMatcher)) {
                if (assembly.getTestClasses().isEmpty()) {
                    this.context.testLog.sendDebugMessage("No test classes found in " + source);
                    continue;
                }
                TestConverter converter = this.context.newConverter(source);
                int cases = processTestCases(assembly.getDescription(), sink, converter);
                this.context.testLog.sendDebugMessage("Discovered " + cases + " test cases in " + source);
                total += cases;
            } catch (AssemblyLoadException e) {
                this.context.testLog.sendErrorMessage("Unable to load assembly " + source, e);
            } catch (IOException e) {
                this.context.testLog.sendWarningMessage("Unable to release assembly " + source + ": " + e.getMessage());
            }
        }

        LOGGER.log("Discovered " + total + " test case(s).");
        return total;
    }

    /**
     * Converts every leaf test under the given description and sends it to the sink, in traversal order. A leaf
     * that fails to convert is reported and does not count.
     *
     * @return the number of test cases sent.
     * @throws AssemblyLoadException If the assembly's metadata cannot be read.
     */
    private int processTestCases(Description description, DiscoverySink sink, TestConverter converter) throws AssemblyLoadException {
        if (description.isSuite()) {
            int cases = 0;
            for (Description child : description.getChildren()) {
                cases += processTestCases(child, sink, converter);
            }
            return cases;
        }

        try {
            TestCaseDescriptor testCase = converter.convertTestCase(TestIdentity.fromDescription(description));
            sink.sendTestCase(testCase);
            return 1;
        } catch (RuntimeException e) {
            this.context.testLog.sendErrorMessage("Exception converting " + description.getDisplayName(), e);
            return 0;
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { context: " + this.context + " }";
    }
}
