package tether.core.navigation;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import tether.core.exception.AssemblyLoadException;
import tether.core.helper.AssertHelper;
import tether.core.helper.InMemoryMetadataReader;
import tether.core.model.NavigationData;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static tether.core.helper.InMemoryMetadataReader.points;

public class NavigationDataProviderTest {
    private static final String ASSEMBLY = "/builds/fixtures/target/test-classes";
    private static final String BASE = "com.example.BaseFixture";
    private static final String DERIVED = "com.example.DerivedFixture";
    private static final String ASYNC = "com.example.AsyncFixture";
    private static final String STATE_MACHINE = "com.example.AsyncFixture$AsyncTestStateMachine";
    private static final String BASE_DOC = "com/example/BaseFixture.java";
    private static final String DERIVED_DOC = "com/example/DerivedFixture.java";
    private static final String ASYNC_DOC = "com/example/AsyncFixture.java";
    private static final int HIDDEN = SequencePoint.HIDDEN_LINE;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final InMemoryMetadataReader reader = new InMemoryMetadataReader()
            .withType(BASE, "java.lang.Object",
                    MethodDefinition.method("<init>", points(BASE_DOC, 5)),
                    MethodDefinition.method("testInBase", points(BASE_DOC, 9, 10)))
            .withType(DERIVED, BASE,
                    MethodDefinition.method("<init>", points(DERIVED_DOC, 3)),
                    MethodDefinition.bridge("testInDerived", points(DERIVED_DOC, 40)),
                    MethodDefinition.method("testInDerived", points(DERIVED_DOC, 8)),
                    MethodDefinition.method("testWithHiddenPrologue", points(DERIVED_DOC, HIDDEN, HIDDEN, 14, 15)),
                    MethodDefinition.method("testAllHidden", points(DERIVED_DOC, HIDDEN, HIDDEN)),
                    MethodDefinition.method("testWithoutLines", Collections.emptyList()))
            .withType(ASYNC, "java.lang.Object",
                    MethodDefinition.asyncMethod("testAsync", STATE_MACHINE, points(ASYNC_DOC, 11)),
                    MethodDefinition.asyncMethod("testMissingStateMachine", "com.example.Gone", points(ASYNC_DOC, 20)))
            .withType(STATE_MACHINE, "java.lang.Object",
                    MethodDefinition.method("moveNext", points(ASYNC_DOC, HIDDEN, 13, 14)));

    private final NavigationDataProvider provider = NavigationDataProvider.withReader(ASSEMBLY, this.reader, Collections.emptyList());

    @Test
    public void testDeclaredMethod() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.at(BASE_DOC, 9), this.provider.getNavigationData(BASE, "testInBase"));
    }

    @Test
    public void testInheritedMethodResolvesToBaseClass() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.at(BASE_DOC, 9), this.provider.getNavigationData(DERIVED, "testInBase"));
    }

    @Test
    public void testBridgeMethodIsSkipped() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.at(DERIVED_DOC, 8), this.provider.getNavigationData(DERIVED, "testInDerived"));
    }

    @Test
    public void testAsyncMethodResolvesToContinuation() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.at(ASYNC_DOC, 13), this.provider.getNavigationData(ASYNC, "testAsync"));
    }

    @Test
    public void testAsyncMethodWithMissingStateMachine() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.INVALID, this.provider.getNavigationData(ASYNC, "testMissingStateMachine"));
    }

    @Test
    public void testHiddenSequencePointsAreSkipped() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.at(DERIVED_DOC, 14), this.provider.getNavigationData(DERIVED, "testWithHiddenPrologue"));
    }

    @Test
    public void testAllHiddenSequencePoints() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.INVALID, this.provider.getNavigationData(DERIVED, "testAllHidden"));
    }

    @Test
    public void testMethodWithoutSequencePoints() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.INVALID, this.provider.getNavigationData(DERIVED, "testWithoutLines"));
    }

    @Test
    public void testUnknownClassAndMethod() throws AssemblyLoadException {
        Assert.assertEquals(NavigationData.INVALID, this.provider.getNavigationData("com.example.Unknown", "testInBase"));
        Assert.assertEquals(NavigationData.INVALID, this.provider.getNavigationData(DERIVED, "testUnknown"));
        Assert.assertEquals(NavigationData.INVALID, this.provider.getNavigationData(null, "testInBase"));
        Assert.assertEquals(NavigationData.INVALID, this.provider.getNavigationData(DERIVED, null));
    }

    @Test
    public void testNestedTypeNameSeparators() throws AssemblyLoadException {
        NavigationData expected = NavigationData.at(ASYNC_DOC, 13);
        Assert.assertEquals(expected, this.provider.getNavigationData("com.example.AsyncFixture+AsyncTestStateMachine", "moveNext"));
        Assert.assertEquals(expected, this.provider.getNavigationData("com/example/AsyncFixture$AsyncTestStateMachine", "moveNext"));
    }

    @Test
    public void testResolutionIsDeterministic() throws AssemblyLoadException {
        NavigationData first = this.provider.getNavigationData(DERIVED, "testWithHiddenPrologue");
        NavigationData second = this.provider.getNavigationData(DERIVED, "testWithHiddenPrologue");
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void testTypeIndexIsBuiltOnce() throws AssemblyLoadException {
        Assert.assertEquals(0, this.reader.reads);
        this.provider.getNavigationData(BASE, "testInBase");
        this.provider.getNavigationData(DERIVED, "testInBase");
        this.provider.getNavigationData("com.example.Unknown", "testInBase");
        Assert.assertEquals(1, this.reader.reads);
        Assert.assertEquals(4, this.provider.getTypeIndex().size());
    }

    @Test
    public void testCyclicSuperTypesTerminate() throws AssemblyLoadException {
        InMemoryMetadataReader cyclic = new InMemoryMetadataReader()
                .withType("com.example.A", "com.example.B", MethodDefinition.method("other", points("com/example/A.java", 1)))
                .withType("com.example.B", "com.example.A", MethodDefinition.method("another", points("com/example/B.java", 1)));
        NavigationDataProvider provider = NavigationDataProvider.withReader(ASSEMBLY, cyclic, Collections.emptyList());

        Assert.assertEquals(NavigationData.INVALID, provider.getNavigationData("com.example.A", "testMissing"));
    }

    @Test
    public void testSuperTypeOutsideAssembly() throws AssemblyLoadException {
        InMemoryMetadataReader partial = new InMemoryMetadataReader()
                .withType("com.example.C", "org.external.Base", MethodDefinition.method("other", points("com/example/C.java", 1)));
        NavigationDataProvider provider = NavigationDataProvider.withReader(ASSEMBLY, partial, Collections.emptyList());

        Assert.assertEquals(NavigationData.INVALID, provider.getNavigationData("com.example.C", "testInherited"));
    }

    @Test
    public void testLoadFailurePropagatesOnEveryCall() {
        MetadataReader failing = assemblyPath -> {
            throw new AssemblyLoadException("Assembly does not exist: " + assemblyPath);
        };
        NavigationDataProvider provider = NavigationDataProvider.withReader(ASSEMBLY, failing, Collections.emptyList());

        AssertHelper.assertThrows(AssemblyLoadException.class, () -> provider.getNavigationData(BASE, "testInBase"));
        AssertHelper.assertThrows(AssemblyLoadException.class, () -> provider.getNavigationData(BASE, "testInBase"));
    }

    @Test
    public void testDocumentIsResolvedAgainstSourceRoots() throws AssemblyLoadException, IOException {
        File emptyRoot = this.folder.newFolder("empty");
        File sourceRoot = this.folder.newFolder("src");
        File document = new File(sourceRoot, BASE_DOC);
        Assert.assertTrue(document.getParentFile().mkdirs());
        Assert.assertTrue(document.createNewFile());

        NavigationDataProvider provider = NavigationDataProvider.withReader(ASSEMBLY, this.reader, Arrays.asList(emptyRoot.toPath(), sourceRoot.toPath()));

        NavigationData navigationData = provider.getNavigationData(DERIVED, "testInBase");
        Path expected = document.toPath().toAbsolutePath().normalize();
        Assert.assertEquals(expected.toString(), navigationData.filePath);
        Assert.assertEquals(9, navigationData.lineNumber);

        // Documents missing from every root keep their relative path.
        Assert.assertEquals(DERIVED_DOC, provider.getNavigationData(DERIVED, "testInDerived").filePath);
    }
}
