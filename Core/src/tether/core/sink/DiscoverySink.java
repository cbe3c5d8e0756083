package tether.core.sink;

import tether.core.model.TestCaseDescriptor;

/**
 * Receives the test cases found during discovery.
 */
@FunctionalInterface
public interface DiscoverySink {

    public void sendTestCase(TestCaseDescriptor testCase);
}
