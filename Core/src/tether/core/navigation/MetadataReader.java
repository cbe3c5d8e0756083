package tether.core.navigation;

import tether.core.exception.AssemblyLoadException;

import java.util.List;

/**
 * Reads the type definitions of a compiled assembly together with their debug information.
 */
@FunctionalInterface
public interface MetadataReader {

    /**
     * Reads every type defined in the assembly at the given path.
     *
     * @param assemblyPath The path of the assembly.
     * @return all the defined types.
     * @throws AssemblyLoadException If the assembly or its debug information cannot be read.
     */
    public List<TypeDefinition> readTypes(String assemblyPath) throws AssemblyLoadException;
}
