package tether.core.model;

import org.junit.experimental.categories.Category;
import org.junit.runner.Description;
import tether.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The identity of a test as the framework reports it.
 *
 * {@link TestIdentity#uniqueName}: the name that uniquely identifies the test within one assembly load.
 * {@link TestIdentity#fullName}: the fully qualified name of the test.
 * {@link TestIdentity#displayName}: the short, human-readable name of the test.
 * {@link TestIdentity#className}: the binary name of the class the framework reports the test under.
 * {@link TestIdentity#methodName}: the name of the declared test method, without any parameter suffix.
 * {@link TestIdentity#traits}: the traits of the test, empty for suites.
 * {@link TestIdentity#isSuite}: whether this identity is a suite node rather than a leaf test case.
 */
public final class TestIdentity {
    public final String uniqueName;
    public final String fullName;
    public final String displayName;
    public final String className;
    public final String methodName;
    public final List<Trait> traits;
    public final boolean isSuite;

    private TestIdentity(String uniqueName, String fullName, String displayName, String className, String methodName, List<Trait> traits, boolean isSuite) {
        ObjectChecker.assertNonNull(uniqueName, fullName, displayName, traits);
        this.uniqueName = uniqueName;
        this.fullName = fullName;
        this.displayName = displayName;
        this.className = className;
        this.methodName = methodName;
        this.traits = Collections.unmodifiableList(new ArrayList<>(traits));
        this.isSuite = isSuite;
    }

    /**
     * Returns the identity of a single test case.
     */
    public static TestIdentity testCase(String uniqueName, String fullName, String displayName, String className, String methodName) {
        return testCase(uniqueName, fullName, displayName, className, methodName, Collections.emptyList());
    }

    /**
     * Returns the identity of a single test case carrying the given traits.
     */
    public static TestIdentity testCase(String uniqueName, String fullName, String displayName, String className, String methodName, List<Trait> traits) {
        ObjectChecker.assertNonNull(className, methodName);
        return new TestIdentity(uniqueName, fullName, displayName, className, methodName, traits, false);
    }

    /**
     * Returns the identity of a suite node, which groups other tests and is never converted itself.
     */
    public static TestIdentity suite(String uniqueName, String fullName, String displayName) {
        return new TestIdentity(uniqueName, fullName, displayName, null, null, Collections.emptyList(), true);
    }

    /**
     * Derives the identity of the given JUnit description.
     *
     * The display name of a JUnit description ("method(pkg.Class)") is used as the unique name. Leaf descriptions
     * that carry no method name (some custom runners produce them) fall back to the display name as the method.
     *
     * Parameterized runners report one test per parameter set under names such as "testAdd[0]". Those names are
     * kept as the full and display names, while {@link TestIdentity#methodName} is the declared method "testAdd" so
     * that the test can be located in the source. The JUnit categories of the test class and of the method become
     * {@link Trait#CATEGORY} traits.
     *
     * @param description The JUnit description.
     * @return the identity.
     */
    public static TestIdentity fromDescription(Description description) {
        ObjectChecker.assertNonNull(description);
        String uniqueName = description.getDisplayName();
        if (description.isSuite()) {
            return suite(uniqueName, uniqueName, uniqueName);
        }

        String className = description.getClassName();
        String testName = description.getMethodName() == null ? uniqueName : description.getMethodName();
        return testCase(uniqueName, className + "." + testName, testName, className, declaredMethodName(testName), categoryTraitsOf(description));
    }

    private static String declaredMethodName(String testName) {
        int parameterStart = testName.indexOf('[');
        return (parameterStart > 0 && testName.endsWith("]")) ? testName.substring(0, parameterStart) : testName;
    }

    private static List<Trait> categoryTraitsOf(Description description) {
        Set<Trait> traits = new LinkedHashSet<>();
        Class<?> testClass = description.getTestClass();
        if (testClass != null) {
            addCategories(testClass.getAnnotation(Category.class), traits);
        }
        addCategories(description.getAnnotation(Category.class), traits);
        return new ArrayList<>(traits);
    }

    private static void addCategories(Category category, Set<Trait> traits) {
        if (category != null) {
            for (Class<?> categoryClass : category.value()) {
                traits.add(Trait.category(categoryClass));
            }
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { unique name: " + this.uniqueName + (this.isSuite ? ", [suite]" : ", [case]") + " }";
    }
}
