package tether.core.discovery;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import tether.core.config.AdapterConfig;
import tether.core.config.AdapterContext;
import tether.core.discovery.fixture.CategorizedFixture;
import tether.core.discovery.fixture.FastCategory;
import tether.core.discovery.fixture.ParameterizedFixture;
import tether.core.discovery.fixture.SampleSuiteFixture;
import tether.core.discovery.fixture.SlowCategory;
import tether.core.helper.RecordingFrameworkHandle;
import tether.core.helper.RecordingTestLog;
import tether.core.model.TestCaseDescriptor;
import tether.core.model.Trait;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

public class TestDiscovererTest {
    private static final String FIXTURE = SampleSuiteFixture.class.getName();
    private static final String FIXTURE_DIR = "tether/core/discovery/fixture/";
    private RecordingTestLog testLog;
    private RecordingFrameworkHandle sink;
    private String testClasses;

    @Before
    public void setup() throws URISyntaxException {
        this.testLog = new RecordingTestLog();
        this.sink = new RecordingFrameworkHandle();
        this.testClasses = Paths.get(SampleSuiteFixture.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
    }

    @Test
    public void testDiscoverTests() {
        int discovered = discovererMatching(".*SuiteFixture\\.class").discoverTests(Collections.singletonList(this.testClasses), this.sink);

        // The abstract fixture matches too, but only contributes through its concrete subclass.
        Assert.assertEquals(3, discovered);
        Assert.assertEquals(3, this.sink.testCases.size());
        Assert.assertTrue(this.testLog.errors.isEmpty());

        TestCaseDescriptor first = this.sink.testCaseFor(FIXTURE + ".firstCase");
        Assert.assertEquals("firstCase", first.displayName);
        Assert.assertEquals(this.testClasses, first.source);
        Assert.assertEquals(AdapterConfig.DEFAULT_EXECUTOR_URI, first.executorUri);
        Assert.assertEquals(FIXTURE_DIR + "SampleSuiteFixture.java", first.codeFilePath);
        Assert.assertEquals(10, first.lineNumber);
        Assert.assertTrue(first.traits.isEmpty());

        TestCaseDescriptor second = this.sink.testCaseFor(FIXTURE + ".secondCase");
        Assert.assertEquals(15, second.lineNumber);

        TestCaseDescriptor inherited = this.sink.testCaseFor(FIXTURE + ".inheritedCase");
        Assert.assertEquals(FIXTURE_DIR + "AbstractSuiteFixture.java", inherited.codeFilePath);
        Assert.assertEquals(10, inherited.lineNumber);
    }

    @Test
    public void testParameterizedCasesAreLocated() {
        String fixture = ParameterizedFixture.class.getName();
        int discovered = discovererMatching("ParameterizedFixture\\.class").discoverTests(Collections.singletonList(this.testClasses), this.sink);

        Assert.assertEquals(2, discovered);
        Assert.assertTrue(this.testLog.errors.isEmpty());
        for (String parameters : Arrays.asList("[value 1]", "[value 2]")) {
            TestCaseDescriptor testCase = this.sink.testCaseFor(fixture + ".isPositive" + parameters);
            Assert.assertEquals("isPositive" + parameters, testCase.displayName);
            Assert.assertEquals(FIXTURE_DIR + "ParameterizedFixture.java", testCase.codeFilePath);
            Assert.assertEquals(26, testCase.lineNumber);
        }
        Assert.assertNotEquals(this.sink.testCaseFor(fixture + ".isPositive[value 1]").id, this.sink.testCaseFor(fixture + ".isPositive[value 2]").id);
    }

    @Test
    public void testCategoriesBecomeTraits() {
        String fixture = CategorizedFixture.class.getName();
        int discovered = discovererMatching("CategorizedFixture\\.class").discoverTests(Collections.singletonList(this.testClasses), this.sink);

        Assert.assertEquals(2, discovered);
        Assert.assertEquals(Collections.singletonList(Trait.category(FastCategory.class)), this.sink.testCaseFor(fixture + ".classCategoryOnly").traits);
        Assert.assertEquals(Arrays.asList(Trait.category(FastCategory.class), Trait.category(SlowCategory.class)), this.sink.testCaseFor(fixture + ".methodCategories").traits);
    }

    @Test
    public void testIdentifiersAreDistinctAndStable() {
        TestDiscoverer discoverer = discovererMatching("SampleSuiteFixture\\.class");
        discoverer.discoverTests(Collections.singletonList(this.testClasses), this.sink);
        RecordingFrameworkHandle secondSink = new RecordingFrameworkHandle();
        discoverer.discoverTests(Collections.singletonList(this.testClasses), secondSink);

        Set<Object> ids = new HashSet<>();
        for (TestCaseDescriptor testCase : this.sink.testCases) {
            ids.add(testCase.id);
            Assert.assertEquals(testCase.id, secondSink.testCaseFor(testCase.fullyQualifiedName).id);
        }
        Assert.assertEquals(this.sink.testCases.size(), ids.size());
    }

    @Test
    public void testMissingAssemblyIsSkipped() {
        String missing = new File(this.testClasses, "does-not-exist").getPath();
        int discovered = discovererMatching("SampleSuiteFixture\\.class").discoverTests(Arrays.asList(missing, this.testClasses), this.sink);

        Assert.assertEquals(3, discovered);
        Assert.assertEquals(1, this.testLog.errors.size());
        assertThat(this.testLog.errors.get(0), containsString(missing));
    }

    @Test
    public void testNoMatchingClasses() {
        int discovered = discovererMatching("NoSuchFixture\\.class").discoverTests(Collections.singletonList(this.testClasses), this.sink);

        Assert.assertEquals(0, discovered);
        Assert.assertTrue(this.sink.testCases.isEmpty());
        Assert.assertTrue(this.testLog.errors.isEmpty());
    }

    private TestDiscoverer discovererMatching(String matcher) {
        AdapterConfig config = AdapterConfig.Builder.newBuilder().setTestClassMatcher(matcher).build();
        return TestDiscoverer.withContext(AdapterContext.of(config, this.testLog, () -> "test-machine"));
    }
}
