package tether.core.navigation;

import tether.core.exception.AssemblyLoadException;
import tether.core.model.NavigationData;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves a test's class and method name to the source file and line where the test begins.
 *
 * The types of the assembly are read once, on the first request, and kept for the lifetime of this provider. The
 * assembly is assumed not to change during that time. After the index is built every request is answered from
 * memory and is a pure function of its arguments.
 *
 * The class a test is reported under may be a subclass of the one declaring the test method, so the lookup walks
 * up the super type chain until the method is found or {@code java.lang.Object} is reached. Methods compiled into
 * an async state machine are followed to the state machine's continuation method, where their real line
 * information lives.
 *
 * A load failure is the only error this class raises. Every other miss yields {@link NavigationData#INVALID}.
 */
public final class NavigationDataProvider implements SourceNavigator {
    private static final Logger LOGGER = Logger.forClass(NavigationDataProvider.class);
    private static final String ROOT_TYPE = "java.lang.Object";
    private final String assemblyPath;
    private final MetadataReader metadataReader;
    private final List<Path> sourceRoots;
    private TypeIndex typeIndex;

    private NavigationDataProvider(String assemblyPath, MetadataReader metadataReader, List<Path> sourceRoots) {
        ObjectChecker.assertNonNull(assemblyPath, metadataReader, sourceRoots);
        this.assemblyPath = assemblyPath;
        this.metadataReader = metadataReader;
        this.sourceRoots = Collections.unmodifiableList(new ArrayList<>(sourceRoots));
    }

    /**
     * Constructs a provider over the class files of the given assembly. Document paths are reported relative to
     * the source root ("pkg/dir/File.java").
     *
     * @param assemblyPath The path of a class directory, jar or class file.
     * @return the provider.
     */
    public static NavigationDataProvider forAssembly(String assemblyPath) {
        return new NavigationDataProvider(assemblyPath, new ClassFileMetadataReader(), Collections.emptyList());
    }

    /**
     * Constructs a provider over the class files of the given assembly which reports the absolute path of a
     * document when it is found under one of the given source roots.
     *
     * @param assemblyPath The path of a class directory, jar or class file.
     * @param sourceRoots The source roots, searched in order.
     * @return the provider.
     */
    public static NavigationDataProvider forAssembly(String assemblyPath, List<Path> sourceRoots) {
        return new NavigationDataProvider(assemblyPath, new ClassFileMetadataReader(), sourceRoots);
    }

    /**
     * Constructs a provider that reads the assembly's types using the given reader.
     */
    public static NavigationDataProvider withReader(String assemblyPath, MetadataReader metadataReader, List<Path> sourceRoots) {
        return new NavigationDataProvider(assemblyPath, metadataReader, sourceRoots);
    }

    @Override
    public NavigationData getNavigationData(String className, String methodName) throws AssemblyLoadException {
        TypeIndex index = getTypeIndex();
        if (className == null || methodName == null) {
            return NavigationData.INVALID;
        }

        MethodDefinition declaredMethod = findMethod(index, className, methodName);
        if (declaredMethod == null) {
            return NavigationData.INVALID;
        }

        MethodDefinition effectiveMethod = StateMachineRedirect.effectiveMethod(index, declaredMethod);
        if (effectiveMethod == null) {
            return NavigationData.INVALID;
        }

        SequencePoint sequencePoint = firstUnhiddenSequencePoint(effectiveMethod);
        if (sequencePoint == null) {
            return NavigationData.INVALID;
        }
        return NavigationData.at(resolveDocumentPath(sequencePoint.documentPath), sequencePoint.startLine);
    }

    /**
     * Returns the type index of the assembly, reading the assembly if this is the first call.
     *
     * @return the index.
     * @throws AssemblyLoadException If the assembly cannot be read.
     */
    public synchronized TypeIndex getTypeIndex() throws AssemblyLoadException {
        if (this.typeIndex == null) {
            LOGGER.log("Indexing types of " + this.assemblyPath);
            this.typeIndex = TypeIndex.of(this.metadataReader.readTypes(this.assemblyPath));
            LOGGER.log("Indexed " + this.typeIndex.size() + " type(s) of " + this.assemblyPath);
        }
        return this.typeIndex;
    }

    private static MethodDefinition findMethod(TypeIndex index, String className, String methodName) {
        TypeDefinition type = index.find(className);

        // Each step moves to a distinct indexed type unless the metadata is cyclic, so the bound is never reached
        // on well-formed input.
        for (int step = 0; type != null && step <= index.size(); step++) {
            MethodDefinition method = type.findDeclaredMethod(methodName);
            if (method != null) {
                return method;
            }
            if (type.superName == null || ROOT_TYPE.equals(type.superName)) {
                return null;
            }
            type = index.find(type.superName);
        }
        return null;
    }

    private static SequencePoint firstUnhiddenSequencePoint(MethodDefinition method) {
        for (SequencePoint sequencePoint : method.sequencePoints) {
            if (!sequencePoint.isHidden() && sequencePoint.startLine > 0) {
                return sequencePoint;
            }
        }
        return null;
    }

    private String resolveDocumentPath(String documentPath) {
        for (Path sourceRoot : this.sourceRoots) {
            try {
                Path candidate = sourceRoot.resolve(documentPath);
                if (Files.isRegularFile(candidate)) {
                    return candidate.toAbsolutePath().normalize().toString();
                }
            } catch (InvalidPathException e) {
                LOGGER.log("Skipping source root " + sourceRoot + " for unresolvable document " + documentPath);
            }
        }
        return documentPath;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { assembly: " + this.assemblyPath + (this.typeIndex == null ? ", [not indexed]" : ", types: " + this.typeIndex.size()) + " }";
    }
}
