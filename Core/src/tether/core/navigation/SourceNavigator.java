package tether.core.navigation;

import tether.core.exception.AssemblyLoadException;
import tether.core.model.NavigationData;

/**
 * Resolves a test method to the source location where it begins.
 */
public interface SourceNavigator {

    /**
     * Returns the source location of the given test method.
     *
     * @param className The class the test is reported under.
     * @param methodName The test method name.
     * @return the location, or {@link NavigationData#INVALID} if none could be found.
     * @throws AssemblyLoadException If the metadata of the assembly cannot be read.
     */
    public NavigationData getNavigationData(String className, String methodName) throws AssemblyLoadException;
}
