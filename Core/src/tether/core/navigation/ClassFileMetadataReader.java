package tether.core.navigation;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.AnnotationNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.LineNumberNode;
import org.objectweb.asm.tree.MethodNode;
import tether.core.exception.AssemblyLoadException;
import tether.core.util.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads type definitions out of compiled class files using ASM.
 *
 * An assembly is either a directory holding class files in package subdirectories, a jar file, or a single class
 * file. Line information comes from each method's LineNumberTable and the class's SourceFile attribute; the
 * document path of a sequence point is the source file name prefixed with the package directory
 * ("pkg/dir/File.java").
 *
 * The class file format has no hidden line marker, and ASM's ClassReader drops LineNumberTable entries for line 0,
 * so every sequence point read from a class file is visible.
 */
public final class ClassFileMetadataReader implements MetadataReader {
    private static final Logger LOGGER = Logger.forClass(ClassFileMetadataReader.class);
    private static final String CLASS_SUFFIX = ".class";
    private static final String STATE_MACHINE_MARKER = "AsyncStateMachine";

    @Override
    public List<TypeDefinition> readTypes(String assemblyPath) throws AssemblyLoadException {
        if (assemblyPath == null) {
            throw new NullPointerException("assemblyPath must be non-null.");
        }
        Path path = Paths.get(assemblyPath);
        if (!Files.exists(path)) {
            throw new AssemblyLoadException("Assembly does not exist: " + assemblyPath);
        }

        List<TypeDefinition> types;
        if (Files.isDirectory(path)) {
            types = readDirectory(path);
        } else if (path.getFileName().toString().endsWith(CLASS_SUFFIX)) {
            types = Collections.singletonList(readClassFile(path));
        } else {
            types = readJar(path);
        }
        LOGGER.log("Read " + types.size() + " type(s) from " + assemblyPath);
        return types;
    }

    private static List<TypeDefinition> readDirectory(Path directory) throws AssemblyLoadException {
        List<Path> classFiles;
        try (Stream<Path> paths = Files.walk(directory)) {
            classFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(ClassFileMetadataReader::isTypeClassFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new AssemblyLoadException("Unable to list class files under " + directory, e);
        }

        List<TypeDefinition> types = new ArrayList<>();
        for (Path classFile : classFiles) {
            types.add(readClassFile(classFile));
        }
        return types;
    }

    private static TypeDefinition readClassFile(Path classFile) throws AssemblyLoadException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(classFile);
        } catch (IOException e) {
            throw new AssemblyLoadException("Unable to read class file " + classFile, e);
        }
        return parse(bytes, classFile.toString());
    }

    private static List<TypeDefinition> readJar(Path jarPath) throws AssemblyLoadException {
        List<TypeDefinition> types = new ArrayList<>();
        try (JarFile jar = new JarFile(jarPath.toFile())) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (entry.isDirectory() || entry.getName().startsWith("META-INF/") || !isTypeClassFile(entry.getName())) {
                    continue;
                }
                try (InputStream stream = jar.getInputStream(entry)) {
                    types.add(parse(stream.readAllBytes(), jarPath + "!" + entry.getName()));
                }
            }
        } catch (IOException e) {
            throw new AssemblyLoadException("Unable to read jar " + jarPath, e);
        }
        return types;
    }

    private static boolean isTypeClassFile(Path path) {
        return isTypeClassFile(path.getFileName().toString());
    }

    private static boolean isTypeClassFile(String name) {
        return name.endsWith(CLASS_SUFFIX) && !name.endsWith("module-info.class") && !name.endsWith("package-info.class");
    }

    private static TypeDefinition parse(byte[] bytes, String origin) throws AssemblyLoadException {
        ClassNode classNode = new ClassNode();
        try {
            new ClassReader(bytes).accept(classNode, ClassReader.SKIP_FRAMES);
        } catch (RuntimeException e) {
            // ASM signals malformed or unsupported class files with unchecked exceptions.
            throw new AssemblyLoadException("Malformed class file " + origin + ": " + e, e);
        }
        return toTypeDefinition(classNode);
    }

    private static TypeDefinition toTypeDefinition(ClassNode classNode) {
        String documentPath = documentPathOf(classNode);

        List<MethodDefinition> methods = new ArrayList<>();
        for (MethodNode methodNode : classNode.methods) {
            List<SequencePoint> sequencePoints = documentPath == null
                    ? Collections.emptyList()
                    : sequencePointsOf(methodNode, documentPath);
            String stateMachineType = stateMachineTypeOf(methodNode);

            if ((methodNode.access & Opcodes.ACC_BRIDGE) != 0) {
                methods.add(MethodDefinition.bridge(methodNode.name, sequencePoints));
            } else if (stateMachineType != null) {
                methods.add(MethodDefinition.asyncMethod(methodNode.name, stateMachineType, sequencePoints));
            } else {
                methods.add(MethodDefinition.method(methodNode.name, sequencePoints));
            }
        }

        String superName = classNode.superName == null ? null : Type.getObjectType(classNode.superName).getClassName();
        return new TypeDefinition(Type.getObjectType(classNode.name).getClassName(), superName, methods);
    }

    private static String documentPathOf(ClassNode classNode) {
        if (classNode.sourceFile == null) {
            return null;
        }
        int lastSlash = classNode.name.lastIndexOf('/');
        return lastSlash < 0 ? classNode.sourceFile : classNode.name.substring(0, lastSlash + 1) + classNode.sourceFile;
    }

    private static List<SequencePoint> sequencePointsOf(MethodNode methodNode, String documentPath) {
        List<SequencePoint> sequencePoints = new ArrayList<>();
        for (AbstractInsnNode instruction : methodNode.instructions) {
            if (instruction instanceof LineNumberNode) {
                sequencePoints.add(new SequencePoint(documentPath, ((LineNumberNode) instruction).line));
            }
        }
        return sequencePoints;
    }

    private static String stateMachineTypeOf(MethodNode methodNode) {
        String type = stateMachineTypeOf(methodNode.visibleAnnotations);
        return type != null ? type : stateMachineTypeOf(methodNode.invisibleAnnotations);
    }

    private static String stateMachineTypeOf(List<AnnotationNode> annotations) {
        if (annotations == null) {
            return null;
        }
        for (AnnotationNode annotation : annotations) {
            if (!STATE_MACHINE_MARKER.equals(simpleNameOf(Type.getType(annotation.desc))) || annotation.values == null) {
                continue;
            }
            // Annotation values alternate between element name and element value.
            for (int i = 0; i + 1 < annotation.values.size(); i += 2) {
                if ("value".equals(annotation.values.get(i)) && annotation.values.get(i + 1) instanceof Type) {
                    return ((Type) annotation.values.get(i + 1)).getClassName();
                }
            }
        }
        return null;
    }

    private static String simpleNameOf(Type type) {
        String className = type.getClassName();
        int cut = Math.max(className.lastIndexOf('.'), className.lastIndexOf('$'));
        return className.substring(cut + 1);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
