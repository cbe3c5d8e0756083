package tether.core.discovery;

import org.junit.runner.Description;
import org.junit.runner.Request;
import tether.core.exception.AssemblyLoadException;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The test classes of one compiled assembly, loaded into a class loader of their own.
 *
 * The class loader delegates to the context class loader of the thread that loaded the assembly, which is expected
 * to provide the test framework and the assembly's dependencies. Closing the assembly closes its class loader.
 */
public final class TestAssembly implements Closeable {
    private static final Logger LOGGER = Logger.forClass(TestAssembly.class);
    public final String path;
    private final URLClassLoader classLoader;
    private final List<Class<?>> testClasses;

    private TestAssembly(String path, URLClassLoader classLoader, List<Class<?>> testClasses) {
        this.path = path;
        this.classLoader = classLoader;
        this.testClasses = Collections.unmodifiableList(testClasses);
    }

    /**
     * Loads every concrete class of the assembly whose class file name matches the given pattern.
     *
     * @param path The path of a class directory or jar.
     * @param testClassMatcher The pattern class file names must match.
     * @return the loaded assembly.
     * @throws AssemblyLoadException If the assembly cannot be read or one of its test classes cannot be loaded.
     */
    public static TestAssembly load(String path, Pattern testClassMatcher) throws AssemblyLoadException {
        ObjectChecker.assertNonNull(path, testClassMatcher);
        List<String> classNames = TestClassScanner.findTestClassNames(path, testClassMatcher);

        URLClassLoader classLoader;
        try {
            classLoader = new URLClassLoader(new URL[]{ new File(path).toURI().toURL() }, Thread.currentThread().getContextClassLoader());
        } catch (MalformedURLException e) {
            throw new AssemblyLoadException("Invalid assembly path " + path, e);
        }

        List<Class<?>> testClasses = new ArrayList<>();
        try {
            for (String className : classNames) {
                Class<?> testClass = classLoader.loadClass(className);
                if (testClass.isInterface() || Modifier.isAbstract(testClass.getModifiers())) {
                    LOGGER.log("Skipping abstract class " + className);
                    continue;
                }
                testClasses.add(testClass);
            }
        } catch (ClassNotFoundException | LinkageError e) {
            closeQuietly(classLoader);
            throw new AssemblyLoadException("Unable to load test classes of " + path + ": " + e, e);
        }

        LOGGER.log("Loaded " + testClasses.size() + " test class(es) from " + path);
        return new TestAssembly(path, classLoader, testClasses);
    }

    public List<Class<?>> getTestClasses() {
        return this.testClasses;
    }

    public ClassLoader getClassLoader() {
        return this.classLoader;
    }

    /**
     * Returns the JUnit request that runs every test class of the assembly.
     *
     * @return the request.
     */
    public Request toRequest() {
        return Request.classes(this.testClasses.toArray(new Class<?>[0]));
    }

    /**
     * Returns the root of the JUnit description tree of the assembly's test classes.
     *
     * @return the root description.
     */
    public Description getDescription() {
        return toRequest().getRunner().getDescription();
    }

    @Override
    public void close() throws IOException {
        this.classLoader.close();
    }

    private static void closeQuietly(URLClassLoader classLoader) {
        try {
            classLoader.close();
        } catch (IOException e) {
            LOGGER.log("Unable to close class loader: " + e.getMessage());
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { path: " + this.path + ", contains " + this.testClasses.size() + " class(es) }";
    }
}
